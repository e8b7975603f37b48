package com.vaultconfig.example.user;

/**
 * The database could not be reached with the configured connection string.
 */
public class DatabaseConnectionFailedException extends RuntimeException {

    public DatabaseConnectionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
