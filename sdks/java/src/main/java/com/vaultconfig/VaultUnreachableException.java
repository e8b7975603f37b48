package com.vaultconfig;

/**
 * The vault could not be reached: DNS, I/O, timeout, or a server error that outlived the client retries.
 */
public class VaultUnreachableException extends VaultConfigException {

    public VaultUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
