package com.vaultconfig.spring;

import com.vaultconfig.AuthenticationRejectedException;
import com.vaultconfig.Credential;
import com.vaultconfig.CredentialUnavailableException;
import com.vaultconfig.KeyNameMapper;
import com.vaultconfig.KeyTranslationAmbiguousException;
import com.vaultconfig.SecretNotFoundException;
import com.vaultconfig.SecretStore;
import com.vaultconfig.SecretStoreFactory;
import com.vaultconfig.VaultClientOptions;
import com.vaultconfig.VaultConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for VaultConfigEnvironmentPostProcessor covering:
 * - secrets added ahead of every other property source
 * - property binding for credential mode, key convention and client options
 * - startup failures for each loader error
 */
@DisplayName("VaultConfigEnvironmentPostProcessor")
class VaultConfigEnvironmentPostProcessorTest {

    private final Map<String, Object> properties = new HashMap<>();
    private final Map<String, String> vault = new LinkedHashMap<>();
    private StandardEnvironment environment;

    private String requestedUrl;
    private Credential usedCredential;
    private VaultClientOptions usedOptions;

    private final SecretStoreFactory factory = (url, credential, options) -> {
        requestedUrl = url;
        usedCredential = credential;
        usedOptions = options;
        return new SecretStore() {
            @Override
            public Map<String, String> listSecrets() {
                return vault;
            }

            @Override
            public String getSecret(String name) throws VaultConfigException {
                String value = vault.get(name);
                if (value == null) {
                    throw new SecretNotFoundException(name);
                }
                return value;
            }

            @Override
            public String location() {
                return url;
            }
        };
    };

    @BeforeEach
    void setUp() {
        environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(new MapPropertySource("test", properties));
        properties.put("vaultconfig.vault-name", "my-vault");
        properties.put("vaultconfig.credential.mode", "service-principal");
        properties.put("AZURE_TENANT_ID", "tenant");
        properties.put("AZURE_CLIENT_ID", "client");
        properties.put("AZURE_CLIENT_SECRET", "secret");
        vault.put("Secrets-ConnectionString", "Server=db;User=u;Password=p;");
    }

    private void run() {
        new VaultConfigEnvironmentPostProcessor(factory, timeout -> false)
                .postProcessEnvironment(environment, new SpringApplication());
    }

    @Test
    @DisplayName("adds vault secrets ahead of all other sources")
    void addsSecretsFirst() {
        properties.put("secrets.connectionstring", "local");

        run();

        assertThat(environment.getPropertySources().iterator().next().getName())
                .isEqualTo(VaultConfigPropertySource.NAME);
        assertThat(environment.getProperty("secrets.connectionstring")).isEqualTo("Server=db;User=u;Password=p;");
        assertThat(requestedUrl).isEqualTo("https://my-vault.vault.azure.net/");
        assertThat(usedCredential).isEqualTo(Credential.servicePrincipal("tenant", "client", "secret"));
    }

    @Test
    @DisplayName("local keys the vault does not provide are still visible")
    void localKeysRemain() {
        properties.put("secrets.other", "local");

        run();

        assertThat(environment.getProperty("secrets.other")).isEqualTo("local");
    }

    @Test
    @DisplayName("double dash convention also maps to dotted keys")
    void doubleDash() {
        properties.put("vaultconfig.key-convention", "double-dash");
        vault.clear();
        vault.put("Secrets--ConnectionString--JDBC", "jdbc:sqlserver://db");

        run();

        assertThat(environment.getProperty("secrets.connectionstring.jdbc")).isEqualTo("jdbc:sqlserver://db");
    }

    @Test
    @DisplayName("binds client options")
    void clientOptions() {
        properties.put("vaultconfig.timeout", "3s");
        properties.put("vaultconfig.max-retries", "0");

        run();

        assertThat(usedOptions.getTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(usedOptions.getMaxRetries()).isZero();
    }

    @Test
    @DisplayName("an explicit URL wins over the vault name")
    void explicitUrl() {
        properties.put("vaultconfig.vault-url", "https://other.vault.azure.net/");

        run();

        assertThat(requestedUrl).isEqualTo("https://other.vault.azure.net/");
    }

    @Test
    @DisplayName("does nothing when disabled")
    void disabled() {
        properties.put("vaultconfig.enabled", "false");

        run();

        assertThat(environment.getPropertySources().contains(VaultConfigPropertySource.NAME)).isFalse();
        assertThat(requestedUrl).isNull();
    }

    @Test
    @DisplayName("fails startup when no vault is configured")
    void noVault() {
        properties.remove("vaultconfig.vault-name");

        assertThatThrownBy(this::run)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("vaultconfig.vault-name");
    }

    @Test
    @DisplayName("fails startup when no credential is available")
    void noCredential() {
        properties.put("vaultconfig.credential.mode", "auto");
        properties.remove("AZURE_CLIENT_SECRET");

        assertThatThrownBy(this::run)
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(CredentialUnavailableException.class);
        assertThat(requestedUrl).isNull();
    }

    @Test
    @DisplayName("fails startup when a named secret is missing")
    void namedSecretMissing() {
        properties.put("vaultconfig.secret-names[0]", "Secrets-Missing");

        assertThatThrownBy(this::run)
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(SecretNotFoundException.class);
    }

    @Test
    @DisplayName("fails startup when two secrets map to the same key")
    void ambiguousKeys() {
        vault.put("secrets-connectionstring", "other");

        assertThatThrownBy(this::run)
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(KeyTranslationAmbiguousException.class);
    }

    @Test
    @DisplayName("fails startup when the vault refuses the credential")
    void rejected() {
        VaultConfigEnvironmentPostProcessor processor = new VaultConfigEnvironmentPostProcessor(
                (url, credential, options) -> new SecretStore() {
                    @Override
                    public Map<String, String> listSecrets() throws VaultConfigException {
                        throw new AuthenticationRejectedException("denied", null);
                    }

                    @Override
                    public String getSecret(String name) throws VaultConfigException {
                        throw new AuthenticationRejectedException("denied", null);
                    }

                    @Override
                    public String location() {
                        return url;
                    }
                },
                timeout -> false);

        assertThatThrownBy(() -> processor.postProcessEnvironment(environment, new SpringApplication()))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(AuthenticationRejectedException.class);
    }

    @Test
    @DisplayName("runs once per environment")
    void idempotent() {
        run();
        requestedUrl = null;

        run();

        assertThat(requestedUrl).isNull();
    }

    @Test
    @DisplayName("maps key conventions to delimiters")
    void mappers() {
        KeyNameMapper single = VaultConfigEnvironmentPostProcessor.mapperFor(VaultConfigProperties.KeyConvention.SINGLE_DASH);
        KeyNameMapper dbl = VaultConfigEnvironmentPostProcessor.mapperFor(VaultConfigProperties.KeyConvention.DOUBLE_DASH);

        assertThat(single.getRemoteDelimiter()).isEqualTo("-");
        assertThat(dbl.getRemoteDelimiter()).isEqualTo("--");
        assertThat(dbl.getLocalDelimiter()).isEqualTo(".");
    }
}
