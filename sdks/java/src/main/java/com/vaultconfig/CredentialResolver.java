package com.vaultconfig;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Picks the identity used to talk to the vault.
 *
 * <p>In {@link CredentialMode#AUTO} the managed identity endpoint is probed with a bounded
 * timeout; if it does not answer, a service principal is read from the environment:
 * <ul>
 *   <li>{@code AZURE_TENANT_ID}, {@code AZURE_CLIENT_ID} and {@code AZURE_CLIENT_SECRET}, or</li>
 *   <li>{@code AzureServicesAuthConnectionString} of the form
 *       {@code RunAs=App;AppId=<id>;TenantId=<tenant>;AppKey=<secret>}.</li>
 * </ul>
 *
 * <pre>{@code
 * Credential credential = CredentialResolver.builder()
 *     .environment(System::getenv)
 *     .build()
 *     .resolve();
 * }</pre>
 */
public final class CredentialResolver {

    private static final Logger LOG = Logger.getLogger(CredentialResolver.class.getName());

    public static final String TENANT_ID = "AZURE_TENANT_ID";
    public static final String CLIENT_ID = "AZURE_CLIENT_ID";
    public static final String CLIENT_SECRET = "AZURE_CLIENT_SECRET";
    public static final String AUTH_CONNECTION_STRING = "AzureServicesAuthConnectionString";

    private static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final CredentialMode mode;
    private final AmbientIdentityProbe probe;
    private final Duration probeTimeout;
    private final Function<String, String> environment;
    private final String managedIdentityClientId;

    private CredentialResolver(Builder builder) {
        this.mode = builder.mode != null ? builder.mode : CredentialMode.AUTO;
        this.managedIdentityClientId = blankToNull(builder.managedIdentityClientId);
        this.probe = builder.probe != null ? builder.probe : new ManagedIdentityProbe(managedIdentityClientId);
        this.probeTimeout = builder.probeTimeout != null ? builder.probeTimeout : DEFAULT_PROBE_TIMEOUT;
        this.environment = builder.environment != null ? builder.environment : System::getenv;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolve the credential for this process.
     *
     * @throws CredentialUnavailableException if no identity can be found for the configured mode
     */
    public Credential resolve() throws CredentialUnavailableException {
        switch (mode) {
            case MANAGED_IDENTITY:
                LOG.info("[vaultconfig] Using managed identity (forced by configuration)");
                return Credential.managedIdentity(managedIdentityClientId);
            case SERVICE_PRINCIPAL:
                Credential forced = servicePrincipalFromEnvironment();
                if (forced == null) {
                    throw new CredentialUnavailableException(
                            "Service principal requested but " + TENANT_ID + ", " + CLIENT_ID + ", "
                                    + CLIENT_SECRET + " or " + AUTH_CONNECTION_STRING + " are not set");
                }
                LOG.info("[vaultconfig] Using " + forced.describe() + " (forced by configuration)");
                return forced;
            default:
                break;
        }

        if (probe.isAvailable(probeTimeout)) {
            Credential credential = Credential.managedIdentity(managedIdentityClientId);
            LOG.info("[vaultconfig] Using " + credential.describe());
            return credential;
        }

        Credential fallback = servicePrincipalFromEnvironment();
        if (fallback == null) {
            throw new CredentialUnavailableException(
                    "No managed identity reachable within " + probeTimeout.toMillis() + "ms and no service principal "
                            + "configured (" + TENANT_ID + ", " + CLIENT_ID + ", " + CLIENT_SECRET + " or "
                            + AUTH_CONNECTION_STRING + ")");
        }
        LOG.info("[vaultconfig] Managed identity unavailable, using " + fallback.describe());
        return fallback;
    }

    private Credential servicePrincipalFromEnvironment() throws CredentialUnavailableException {
        String tenantId = blankToNull(environment.apply(TENANT_ID));
        String clientId = blankToNull(environment.apply(CLIENT_ID));
        String clientSecret = blankToNull(environment.apply(CLIENT_SECRET));
        if (tenantId != null && clientId != null && clientSecret != null) {
            return Credential.servicePrincipal(tenantId, clientId, clientSecret);
        }

        String connectionString = blankToNull(environment.apply(AUTH_CONNECTION_STRING));
        if (connectionString != null) {
            return parseConnectionString(connectionString);
        }
        return null;
    }

    /**
     * Parse {@code RunAs=App;AppId=...;TenantId=...;AppKey=...}. Keys are case-insensitive.
     */
    static Credential.ServicePrincipal parseConnectionString(String connectionString)
            throws CredentialUnavailableException {
        Map<String, String> parts = new HashMap<>();
        for (String pair : connectionString.split(";")) {
            if (pair.isBlank()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new CredentialUnavailableException(
                        AUTH_CONNECTION_STRING + " has a malformed segment: '" + pair.trim() + "'");
            }
            parts.put(pair.substring(0, eq).trim().toLowerCase(Locale.ROOT), pair.substring(eq + 1).trim());
        }

        String runAs = parts.get("runas");
        if (runAs != null && !runAs.equalsIgnoreCase("App")) {
            throw new CredentialUnavailableException(
                    AUTH_CONNECTION_STRING + " RunAs=" + runAs + " is not supported, only RunAs=App");
        }
        String appId = blankToNull(parts.get("appid"));
        String tenantId = blankToNull(parts.get("tenantid"));
        String appKey = blankToNull(parts.get("appkey"));
        if (appId == null || tenantId == null || appKey == null) {
            throw new CredentialUnavailableException(
                    AUTH_CONNECTION_STRING + " must contain AppId, TenantId and AppKey");
        }
        return Credential.servicePrincipal(tenantId, appId, appKey);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static final class Builder {
        private CredentialMode mode;
        private AmbientIdentityProbe probe;
        private Duration probeTimeout;
        private Function<String, String> environment;
        private String managedIdentityClientId;

        public Builder mode(CredentialMode mode) { this.mode = mode; return this; }
        public Builder probe(AmbientIdentityProbe probe) { this.probe = probe; return this; }
        public Builder probeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; return this; }
        public Builder managedIdentityClientId(String clientId) { this.managedIdentityClientId = clientId; return this; }

        /**
         * Where to look up the {@code AZURE_*} variables. Defaults to {@link System#getenv(String)}.
         */
        public Builder environment(Function<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            Objects.requireNonNull(environment, "environment");
            this.environment = environment::get;
            return this;
        }

        public CredentialResolver build() {
            return new CredentialResolver(this);
        }
    }
}
