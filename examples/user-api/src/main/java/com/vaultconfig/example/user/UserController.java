package com.vaultconfig.example.user;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Returns the connection string together with the user the database sees.
 * The connection string is echoed for demonstration only.
 */
@RestController
@RequestMapping("/api/User")
public class UserController {

    private final String connectionString;
    private final ConnectionProbe probe;

    public UserController(SecretsSettings settings, ConnectionProbe probe) {
        this.connectionString = settings.getConnectionString();
        this.probe = probe;
    }

    @GetMapping
    public UserResult get() {
        return new UserResult(connectionString, probe.currentPrincipal());
    }
}
