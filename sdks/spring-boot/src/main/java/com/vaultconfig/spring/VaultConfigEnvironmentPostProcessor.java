package com.vaultconfig.spring;

import com.vaultconfig.AmbientIdentityProbe;
import com.vaultconfig.AzureKeyVaultSecretStoreFactory;
import com.vaultconfig.Credential;
import com.vaultconfig.CredentialResolver;
import com.vaultconfig.KeyNameMapper;
import com.vaultconfig.SecretLoader;
import com.vaultconfig.SecretStore;
import com.vaultconfig.SecretStoreFactory;
import com.vaultconfig.VaultClientOptions;
import com.vaultconfig.VaultConfig;
import com.vaultconfig.VaultConfigException;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.config.ConfigDataEnvironmentPostProcessor;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.io.support.SpringFactoriesLoader;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Loads vault secrets into the {@link ConfigurableEnvironment} right after Spring Boot has read
 * {@code application.properties}, before any bean or web server exists. Vault values take
 * precedence over every other property source. A failure aborts startup.
 *
 * <p>The {@link SecretStoreFactory} is looked up in {@code META-INF/spring.factories}; the
 * highest-precedence entry wins, and Azure Key Vault is used when there is none.
 */
public class VaultConfigEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    private static final Logger LOG = Logger.getLogger(VaultConfigEnvironmentPostProcessor.class.getName());

    public static final int ORDER = ConfigDataEnvironmentPostProcessor.ORDER + 1;

    private final SecretStoreFactory storeFactory;
    private final AmbientIdentityProbe probe;

    public VaultConfigEnvironmentPostProcessor() {
        this(null, null);
    }

    VaultConfigEnvironmentPostProcessor(SecretStoreFactory storeFactory, AmbientIdentityProbe probe) {
        this.storeFactory = storeFactory;
        this.probe = probe;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        if (environment.getPropertySources().contains(VaultConfigPropertySource.NAME)) {
            return;
        }
        VaultConfigProperties props = Binder.get(environment)
                .bind(VaultConfigProperties.PREFIX, VaultConfigProperties.class)
                .orElseGet(VaultConfigProperties::new);
        if (!props.isEnabled()) {
            LOG.fine("[vaultconfig] Disabled, not loading secrets");
            return;
        }

        String vaultUrl = vaultUrl(props);
        CredentialResolver.Builder resolver = CredentialResolver.builder()
                .mode(props.getCredential().getMode())
                .managedIdentityClientId(props.getCredential().getManagedIdentityClientId())
                .probeTimeout(props.getCredential().getProbeTimeout())
                .environment(environment::getProperty);
        if (probe != null) {
            resolver.probe(probe);
        }

        try {
            Credential credential = resolver.build().resolve();
            SecretStore store = storeFactory(application).create(
                    vaultUrl, credential, new VaultClientOptions(props.getTimeout(), props.getMaxRetries()));
            KeyNameMapper mapper = mapperFor(props.getKeyConvention());
            Map<String, String> secrets = props.getSecretNames().isEmpty()
                    ? SecretLoader.loadAll(store, mapper)
                    : SecretLoader.loadNamed(store, mapper, props.getSecretNames());

            environment.getPropertySources().addFirst(new VaultConfigPropertySource(store.location(), secrets));
            LOG.info("[vaultconfig] Loaded " + secrets.size() + " secrets from '" + store.location() + "'");
            LOG.fine(() -> "[vaultconfig] Properties from vault: " + secrets.keySet());
        } catch (VaultConfigException e) {
            throw new IllegalStateException("Failed to load secrets from " + vaultUrl + ": " + e.getMessage(), e);
        }
    }

    static KeyNameMapper mapperFor(VaultConfigProperties.KeyConvention convention) {
        switch (convention) {
            case DOUBLE_DASH:
                return new KeyNameMapper("--", ".");
            case SINGLE_DASH:
            default:
                return KeyNameMapper.SINGLE_DASH;
        }
    }

    private static String vaultUrl(VaultConfigProperties props) {
        if (props.getVaultUrl() != null && !props.getVaultUrl().isBlank()) {
            return props.getVaultUrl().trim();
        }
        if (props.getVaultName() != null && !props.getVaultName().isBlank()) {
            return VaultConfig.vaultUrlFor(props.getVaultName());
        }
        throw new IllegalStateException("vaultconfig is enabled but neither "
                + VaultConfigProperties.PREFIX + ".vault-url nor " + VaultConfigProperties.PREFIX
                + ".vault-name is set");
    }

    private SecretStoreFactory storeFactory(SpringApplication application) {
        if (storeFactory != null) {
            return storeFactory;
        }
        ClassLoader classLoader = application != null ? application.getClassLoader() : getClass().getClassLoader();
        List<SecretStoreFactory> factories = SpringFactoriesLoader.loadFactories(SecretStoreFactory.class, classLoader);
        return factories.isEmpty() ? new AzureKeyVaultSecretStoreFactory() : factories.get(0);
    }
}
