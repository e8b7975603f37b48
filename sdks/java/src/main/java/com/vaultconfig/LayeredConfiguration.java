package com.vaultconfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Immutable merge of local configuration and vault secrets. Later layers win, and the
 * vault layer is always applied last. Keys are compared case-insensitively.
 *
 * <pre>{@code
 * LayeredConfiguration config = LayeredConfiguration.builder()
 *     .addLocal(LocalSources.classpath("application.properties"))
 *     .addVault(secrets)
 *     .build();
 * String connectionString = config.get("Secrets:ConnectionString").orElseThrow();
 * }</pre>
 */
public final class LayeredConfiguration {

    private static final Logger LOG = Logger.getLogger(LayeredConfiguration.class.getName());

    private final Map<String, String> values;
    private final Set<String> vaultKeys;

    private LayeredConfiguration(Map<String, String> values, Set<String> vaultKeys) {
        this.values = values;
        this.vaultKeys = vaultKeys;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Look up a key. Absence is not an error.
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * @return true if the value for {@code key} came from the vault
     */
    public boolean isFromVault(String key) {
        return vaultKeys.contains(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Set<String> vaultKeys() {
        return vaultKeys;
    }

    public Map<String, String> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public static final class Builder {
        private final List<Map<String, String>> local = new ArrayList<>();
        private Map<String, String> vault = Collections.emptyMap();

        /**
         * Add a local layer. Layers added later override earlier ones.
         */
        public Builder addLocal(Map<String, String> source) {
            local.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder addLocal(Properties properties) {
            Map<String, String> source = new TreeMap<>();
            for (String name : properties.stringPropertyNames()) {
                source.put(name, properties.getProperty(name));
            }
            return addLocal(source);
        }

        /**
         * Add environment variables, translating {@code __} to {@code :}. Variables that would
         * not translate cleanly are left out.
         */
        public Builder addEnvironment(Map<String, String> environment) {
            Map<String, String> source = new TreeMap<>();
            for (Map.Entry<String, String> entry : environment.entrySet()) {
                try {
                    source.put(KeyNameMapper.ENVIRONMENT.toLocal(entry.getKey()), entry.getValue());
                } catch (KeyTranslationAmbiguousException e) {
                    LOG.fine("[vaultconfig] Keeping untranslated environment variable " + entry.getKey()
                            + ": " + e.getMessage());
                    source.put(entry.getKey(), entry.getValue());
                }
            }
            return addLocal(source);
        }

        /**
         * Set the vault layer, which takes precedence over every local layer.
         */
        public Builder addVault(Map<String, String> secrets) {
            this.vault = Objects.requireNonNull(secrets, "secrets");
            return this;
        }

        public LayeredConfiguration build() {
            Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (Map<String, String> layer : local) {
                putAll(merged, layer);
            }
            putAll(merged, vault);
            Set<String> vaultKeys = Collections.newSetFromMap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));
            vaultKeys.addAll(vault.keySet());
            return new LayeredConfiguration(
                    Collections.unmodifiableMap(merged), Collections.unmodifiableSet(vaultKeys));
        }

        private static void putAll(Map<String, String> target, Map<String, String> layer) {
            for (Map.Entry<String, String> entry : layer.entrySet()) {
                if (entry.getValue() != null) {
                    // Remove first so the key keeps the casing of the winning layer.
                    target.remove(entry.getKey());
                    target.put(entry.getKey(), entry.getValue());
                }
            }
        }
    }
}
