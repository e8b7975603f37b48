package com.vaultconfig.spring;

import com.vaultconfig.CredentialMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the vaultconfig Spring Boot starter.
 *
 * <pre>
 * vaultconfig:
 *   vault-name: my-vault
 *   key-convention: single-dash
 *   credential:
 *     mode: auto
 *     probe-timeout: 5s
 *   secret-names: []
 *   timeout: 10s
 *   max-retries: 2
 *   enabled: true
 * </pre>
 */
@ConfigurationProperties(prefix = VaultConfigProperties.PREFIX)
public class VaultConfigProperties {

    public static final String PREFIX = "vaultconfig";

    private boolean enabled = true;
    private String vaultName;
    private String vaultUrl;
    private KeyConvention keyConvention = KeyConvention.SINGLE_DASH;
    private final Credential credential = new Credential();
    private List<String> secretNames = new ArrayList<>();
    private Duration timeout = Duration.ofSeconds(10);
    private int maxRetries = 2;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getVaultName() { return vaultName; }
    public void setVaultName(String vaultName) { this.vaultName = vaultName; }

    public String getVaultUrl() { return vaultUrl; }
    public void setVaultUrl(String vaultUrl) { this.vaultUrl = vaultUrl; }

    public KeyConvention getKeyConvention() { return keyConvention; }
    public void setKeyConvention(KeyConvention keyConvention) { this.keyConvention = keyConvention; }

    public Credential getCredential() { return credential; }

    public List<String> getSecretNames() { return secretNames; }
    public void setSecretNames(List<String> secretNames) { this.secretNames = secretNames; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public static class Credential {
        private CredentialMode mode = CredentialMode.AUTO;
        private String managedIdentityClientId;
        private Duration probeTimeout = Duration.ofSeconds(5);

        public CredentialMode getMode() { return mode; }
        public void setMode(CredentialMode mode) { this.mode = mode; }

        public String getManagedIdentityClientId() { return managedIdentityClientId; }
        public void setManagedIdentityClientId(String clientId) { this.managedIdentityClientId = clientId; }

        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
    }

    /**
     * How secret names are nested in the vault.
     */
    public enum KeyConvention {
        /** {@code Secrets-ConnectionString} is exposed as {@code Secrets.ConnectionString}. */
        SINGLE_DASH,
        /** {@code Secrets--ConnectionString} is exposed as {@code Secrets.ConnectionString}. */
        DOUBLE_DASH
    }
}
