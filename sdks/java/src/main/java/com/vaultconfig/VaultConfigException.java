package com.vaultconfig;

/**
 * Base exception for failures while resolving a credential or loading secrets.
 * Every subclass is fatal to startup.
 */
public class VaultConfigException extends Exception {

    public VaultConfigException(String message) {
        super(message);
    }

    public VaultConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
