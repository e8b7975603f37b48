package com.vaultconfig;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads secrets from a {@link SecretStore} and renames them to local hierarchical keys.
 */
public final class SecretLoader {

    private SecretLoader() {
    }

    /**
     * Load every secret in the store.
     *
     * @throws KeyTranslationAmbiguousException if two remote names map to the same local key
     */
    public static Map<String, String> loadAll(SecretStore store, KeyNameMapper mapper) throws VaultConfigException {
        return translate(store.listSecrets(), mapper);
    }

    /**
     * Load only the named secrets, each of which must exist.
     *
     * @throws SecretNotFoundException if one of the names is absent from the store
     */
    public static Map<String, String> loadNamed(SecretStore store, KeyNameMapper mapper, Collection<String> names)
            throws VaultConfigException {
        Map<String, String> remote = new LinkedHashMap<>();
        for (String name : names) {
            remote.put(name, store.getSecret(name));
        }
        return translate(remote, mapper);
    }

    private static Map<String, String> translate(Map<String, String> remote, KeyNameMapper mapper)
            throws KeyTranslationAmbiguousException {
        // Case-insensitive so that keys differing only in case count as a collision too.
        Map<String, String> originOf = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Map<String, String> local = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : remote.entrySet()) {
            String key = mapper.toLocal(entry.getKey());
            String previous = originOf.putIfAbsent(key, entry.getKey());
            if (previous != null) {
                throw new KeyTranslationAmbiguousException(
                        "Remote names '" + previous + "' and '" + entry.getKey() + "' both map to '" + key + "'");
            }
            local.put(key, entry.getValue());
        }
        return Collections.unmodifiableMap(local);
    }
}
