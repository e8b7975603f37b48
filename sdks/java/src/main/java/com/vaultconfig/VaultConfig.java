package com.vaultconfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads Azure Key Vault secrets and merges them over local configuration.
 *
 * <pre>{@code
 * LayeredConfiguration config = VaultConfig.builder()
 *     .vaultName("my-vault")
 *     .keyNameMapper(KeyNameMapper.DOUBLE_DASH)
 *     .localSource(LocalSources.classpath("appsettings.properties"))
 *     .environment(System.getenv())
 *     .build()
 *     .load();
 *
 * String connectionString = config.get("Secrets:ConnectionString").orElseThrow();
 * }</pre>
 *
 * Loading happens once, synchronously. The result is immutable and can be shared between threads.
 */
public final class VaultConfig {

    private static final Logger LOG = Logger.getLogger(VaultConfig.class.getName());

    /** Local key holding the vault name when none is given to the builder. */
    public static final String VAULT_NAME_KEY = "KeyVaultName";

    private static final String VAULT_DOMAIN = "vault.azure.net";

    private final String vaultUrl;
    private final String vaultName;
    private final KeyNameMapper keyNameMapper;
    private final List<Map<String, String>> localSources;
    private final Map<String, String> environment;
    private final Collection<String> secretNames;
    private final CredentialResolver credentialResolver;
    private final CredentialMode credentialMode;
    private final AmbientIdentityProbe ambientProbe;
    private final SecretStoreFactory storeFactory;
    private final VaultClientOptions clientOptions;

    private VaultConfig(Builder builder) {
        this.vaultUrl = builder.vaultUrl;
        this.vaultName = builder.vaultName;
        this.keyNameMapper = builder.keyNameMapper != null ? builder.keyNameMapper : KeyNameMapper.DOUBLE_DASH;
        this.localSources = List.copyOf(builder.localSources);
        this.environment = builder.environment;
        this.secretNames = builder.secretNames != null ? List.copyOf(builder.secretNames) : List.of();
        this.credentialResolver = builder.credentialResolver;
        this.credentialMode = builder.credentialMode;
        this.ambientProbe = builder.ambientProbe;
        this.storeFactory = builder.storeFactory != null ? builder.storeFactory : new AzureKeyVaultSecretStoreFactory();
        this.clientOptions = builder.clientOptions != null ? builder.clientOptions : VaultClientOptions.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve the credential, fetch the secrets and merge them over the local sources.
     *
     * @throws VaultConfigException on any failure; nothing is returned partially loaded
     */
    public LayeredConfiguration load() throws VaultConfigException {
        LayeredConfiguration.Builder layers = LayeredConfiguration.builder();
        localSources.forEach(layers::addLocal);
        if (environment != null) {
            layers.addEnvironment(environment);
        }
        LayeredConfiguration local = layers.build();

        String url = resolveVaultUrl(local);
        Credential credential = credentialResolverFor(local).resolve();
        SecretStore store = storeFactory.create(url, credential, clientOptions);

        Map<String, String> secrets = secretNames.isEmpty()
                ? SecretLoader.loadAll(store, keyNameMapper)
                : SecretLoader.loadNamed(store, keyNameMapper, secretNames);
        LOG.info("[vaultconfig] Loaded " + secrets.size() + " secrets from '" + store.location() + "'");
        LOG.fine(() -> "[vaultconfig] Keys from vault: " + secrets.keySet());

        return layers.addVault(secrets).build();
    }

    /**
     * Without an explicit resolver the {@code AZURE_*} settings are read from the merged local
     * sources, so they may come from a local-only file as well as from the environment.
     */
    private CredentialResolver credentialResolverFor(LayeredConfiguration local) {
        if (credentialResolver != null) {
            return credentialResolver;
        }
        Map<String, String> process = environment != null ? environment : System.getenv();
        return CredentialResolver.builder()
                .mode(credentialMode)
                .probe(ambientProbe)
                .environment(key -> local.get(key).orElseGet(() -> process.get(key)))
                .build();
    }

    private String resolveVaultUrl(LayeredConfiguration local) throws VaultConfigException {
        if (vaultUrl != null) {
            return vaultUrl;
        }
        String name = vaultName != null ? vaultName : local.get(VAULT_NAME_KEY).orElse(null);
        if (name == null || name.isBlank()) {
            throw new VaultConfigException(
                    "No vault configured: set a vault URL or name, or the local key " + VAULT_NAME_KEY);
        }
        return vaultUrlFor(name);
    }

    /**
     * {@code my-vault} becomes {@code https://my-vault.vault.azure.net/}.
     */
    public static String vaultUrlFor(String vaultName) {
        Objects.requireNonNull(vaultName, "vaultName");
        return "https://" + vaultName.trim() + "." + VAULT_DOMAIN + "/";
    }

    public static final class Builder {
        private String vaultUrl;
        private String vaultName;
        private KeyNameMapper keyNameMapper;
        private final List<Map<String, String>> localSources = new ArrayList<>();
        private Map<String, String> environment;
        private Collection<String> secretNames;
        private CredentialResolver credentialResolver;
        private CredentialMode credentialMode;
        private AmbientIdentityProbe ambientProbe;
        private SecretStoreFactory storeFactory;
        private VaultClientOptions clientOptions;

        public Builder vaultUrl(String vaultUrl) { this.vaultUrl = vaultUrl; return this; }
        public Builder vaultName(String vaultName) { this.vaultName = vaultName; return this; }
        public Builder keyNameMapper(KeyNameMapper keyNameMapper) { this.keyNameMapper = keyNameMapper; return this; }
        public Builder environment(Map<String, String> environment) { this.environment = environment; return this; }
        public Builder secretNames(Collection<String> secretNames) { this.secretNames = secretNames; return this; }
        public Builder credentialResolver(CredentialResolver resolver) { this.credentialResolver = resolver; return this; }
        public Builder credentialMode(CredentialMode credentialMode) { this.credentialMode = credentialMode; return this; }
        public Builder ambientProbe(AmbientIdentityProbe ambientProbe) { this.ambientProbe = ambientProbe; return this; }
        public Builder storeFactory(SecretStoreFactory storeFactory) { this.storeFactory = storeFactory; return this; }
        public Builder clientOptions(VaultClientOptions clientOptions) { this.clientOptions = clientOptions; return this; }

        /**
         * Add a local source. Sources added later override earlier ones; environment
         * variables override all of them.
         */
        public Builder localSource(Map<String, String> source) {
            localSources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public VaultConfig build() {
            return new VaultConfig(this);
        }
    }
}
