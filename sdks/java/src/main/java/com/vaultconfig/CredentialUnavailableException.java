package com.vaultconfig;

/**
 * Neither a managed identity nor a service principal could be found.
 */
public class CredentialUnavailableException extends VaultConfigException {

    public CredentialUnavailableException(String message) {
        super(message);
    }

    public CredentialUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
