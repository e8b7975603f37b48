package com.vaultconfig.example.user;

import com.vaultconfig.spring.VaultConfigPropertySource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end: connection string from the (fake) vault, principal from the (mocked) database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("GET /api/User")
class UserControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SecretsSettings settings;

    @Autowired
    private VaultConfigPropertySource vaultSecrets;

    @MockBean
    private DataSource dataSource;

    @MockBean
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("returns the connection string and the database user")
    void returnsConnectionStringAndUser() throws Exception {
        when(jdbcTemplate.queryForObject(ConnectionProbe.DEFAULT_QUERY, String.class)).thenReturn("u");

        mockMvc.perform(get("/api/User"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connectionString").value(FakeVaultStoreFactory.CONNECTION_STRING))
                .andExpect(jsonPath("$.result").value("u"));
    }

    @Test
    @DisplayName("the connection string comes from the vault")
    void settingsFromVault() {
        assertThat(settings.getConnectionString()).isEqualTo(FakeVaultStoreFactory.CONNECTION_STRING);
        assertThat(vaultSecrets.getPropertyNames()).containsExactly("Secrets.ConnectionString");
        assertThat(vaultSecrets.getVaultUrl()).isEqualTo(FakeVaultStoreFactory.HEALTHY_VAULT);
    }

    @Test
    @DisplayName("database failures propagate to the framework")
    void databaseFailure() {
        when(jdbcTemplate.queryForObject(ConnectionProbe.DEFAULT_QUERY, String.class))
                .thenThrow(new CannotGetJdbcConnectionException("Connection refused"));

        assertThatThrownBy(() -> mockMvc.perform(get("/api/User")))
                .hasCauseInstanceOf(DatabaseConnectionFailedException.class);
    }
}
