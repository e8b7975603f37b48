package com.vaultconfig;

/**
 * The credential was refused, either by the token endpoint or by the vault's access policy.
 */
public class AuthenticationRejectedException extends VaultConfigException {

    public AuthenticationRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
