package com.vaultconfig.example.user;

/**
 * Response body of {@code GET /api/User}.
 */
public class UserResult {

    private final String connectionString;
    private final String result;

    public UserResult(String connectionString, String result) {
        this.connectionString = connectionString;
        this.result = result;
    }

    public String getConnectionString() {
        return connectionString;
    }

    /**
     * @return the principal reported by the database
     */
    public String getResult() {
        return result;
    }
}
