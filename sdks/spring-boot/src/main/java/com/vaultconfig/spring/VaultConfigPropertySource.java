package com.vaultconfig.spring;

import org.springframework.core.env.EnumerablePropertySource;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Spring PropertySource backed by secrets loaded from the vault. Names are the translated
 * local keys, e.g. {@code Secrets.ConnectionString}, and are matched case-insensitively so
 * that {@code ${secrets.connectionstring}} resolves too.
 */
public class VaultConfigPropertySource extends EnumerablePropertySource<Map<String, String>> {

    public static final String NAME = "vaultconfig";

    private final Map<String, String> secrets;
    private final String vaultUrl;

    public VaultConfigPropertySource(String vaultUrl, Map<String, String> secrets) {
        super(NAME, secrets);
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(secrets);
        this.secrets = Collections.unmodifiableMap(copy);
        this.vaultUrl = vaultUrl;
    }

    public String getVaultUrl() {
        return vaultUrl;
    }

    @Override
    public String[] getPropertyNames() {
        return secrets.keySet().toArray(new String[0]);
    }

    @Override
    public Object getProperty(String name) {
        return secrets.get(name);
    }

    @Override
    public boolean containsProperty(String name) {
        return secrets.containsKey(name);
    }
}
