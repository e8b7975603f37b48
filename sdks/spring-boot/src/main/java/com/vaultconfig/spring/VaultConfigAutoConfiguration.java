package com.vaultconfig.spring;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.PropertySource;

/**
 * Auto-configuration for the vaultconfig Spring Boot starter.
 * Publishes the property source registered by {@link VaultConfigEnvironmentPostProcessor}
 * so that application code can see which properties came from the vault.
 */
@AutoConfiguration
@EnableConfigurationProperties(VaultConfigProperties.class)
@ConditionalOnProperty(prefix = VaultConfigProperties.PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
public class VaultConfigAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public VaultConfigPropertySource vaultConfigPropertySource(ConfigurableEnvironment environment) {
        PropertySource<?> source = environment.getPropertySources().get(VaultConfigPropertySource.NAME);
        if (!(source instanceof VaultConfigPropertySource)) {
            throw new IllegalStateException("Vault secrets were not loaded into the environment");
        }
        return (VaultConfigPropertySource) source;
    }
}
