package com.vaultconfig.example.user;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Objects;

/**
 * Opens a connection and asks the server which principal it authenticated.
 * Each call borrows and returns its own connection.
 */
public class ConnectionProbe {

    public static final String DEFAULT_QUERY = "SELECT SYSTEM_USER";

    private final JdbcTemplate jdbcTemplate;
    private final String query;

    public ConnectionProbe(JdbcTemplate jdbcTemplate, String query) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
        this.query = Objects.requireNonNull(query, "query");
    }

    /**
     * @throws DatabaseConnectionFailedException if no connection could be opened
     * @throws QueryFailedException if the query itself failed
     */
    public String currentPrincipal() {
        try {
            return jdbcTemplate.queryForObject(query, String.class);
        } catch (CannotGetJdbcConnectionException e) {
            throw new DatabaseConnectionFailedException("Could not open a database connection", e);
        } catch (DataAccessException e) {
            throw new QueryFailedException("Query '" + query + "' failed", e);
        }
    }
}
