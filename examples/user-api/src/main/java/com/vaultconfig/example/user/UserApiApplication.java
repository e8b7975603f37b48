package com.vaultconfig.example.user;

import com.vaultconfig.spring.VaultConfigPropertySource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.logging.Logger;

/**
 * Reads the database connection string from Key Vault and serves {@code GET /api/User}.
 */
@SpringBootApplication
public class UserApiApplication {

    private static final Logger LOG = Logger.getLogger(UserApiApplication.class.getName());

    public static void main(String[] args) {
        SpringApplication.run(UserApiApplication.class, args);
    }

    @Bean
    public SecretsSettings secretsSettings(Environment environment) {
        return SecretsSettings.from(environment);
    }

    @Bean
    public DataSource dataSource(SecretsSettings settings) {
        return DataSourceBuilder.create().url(settings.getConnectionString()).build();
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public ConnectionProbe connectionProbe(JdbcTemplate jdbcTemplate,
                                           @Value("${user-api.principal-query:" + ConnectionProbe.DEFAULT_QUERY + "}")
                                           String principalQuery) {
        return new ConnectionProbe(jdbcTemplate, principalQuery);
    }

    @Bean
    public ApplicationRunner logVaultProperties(ObjectProvider<VaultConfigPropertySource> vaultSecrets) {
        return args -> vaultSecrets.ifAvailable(source -> {
            for (String name : source.getPropertyNames()) {
                LOG.info("Property from Key Vault: " + name);
            }
        });
    }
}
