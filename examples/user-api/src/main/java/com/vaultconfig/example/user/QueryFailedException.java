package com.vaultconfig.example.user;

public class QueryFailedException extends RuntimeException {

    public QueryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
