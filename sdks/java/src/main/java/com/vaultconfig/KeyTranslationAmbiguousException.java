package com.vaultconfig;

/**
 * A key cannot be translated between the remote and local naming conventions without
 * losing the one-to-one mapping.
 */
public class KeyTranslationAmbiguousException extends VaultConfigException {

    public KeyTranslationAmbiguousException(String message) {
        super(message);
    }
}
