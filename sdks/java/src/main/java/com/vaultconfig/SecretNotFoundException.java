package com.vaultconfig;

/**
 * An explicitly requested secret does not exist in the vault.
 */
public class SecretNotFoundException extends VaultConfigException {

    private final String secretName;

    public SecretNotFoundException(String secretName) {
        super("Secret not found: " + secretName);
        this.secretName = secretName;
    }

    public SecretNotFoundException(String secretName, Throwable cause) {
        super("Secret not found: " + secretName, cause);
        this.secretName = secretName;
    }

    public String getSecretName() {
        return secretName;
    }
}
