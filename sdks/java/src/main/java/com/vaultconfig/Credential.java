package com.vaultconfig;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.ManagedIdentityCredentialBuilder;

import java.util.Objects;

/**
 * The identity used to authenticate against the vault. Resolved once at startup by
 * {@link CredentialResolver} and immutable afterwards.
 */
public abstract class Credential {

    private Credential() {
    }

    /**
     * Build the Azure token credential for this identity.
     */
    public abstract TokenCredential toTokenCredential();

    /**
     * Short, secret-free description for log output.
     */
    public abstract String describe();

    public static ManagedIdentity managedIdentity() {
        return new ManagedIdentity(null);
    }

    public static ManagedIdentity managedIdentity(String clientId) {
        return new ManagedIdentity(clientId);
    }

    public static ServicePrincipal servicePrincipal(String tenantId, String clientId, String clientSecret) {
        return new ServicePrincipal(tenantId, clientId, clientSecret);
    }

    @Override
    public String toString() {
        return describe();
    }

    /**
     * Identity supplied by the hosting environment. A client id selects a user-assigned identity;
     * without one the system-assigned identity is used.
     */
    public static final class ManagedIdentity extends Credential {
        private final String clientId;

        private ManagedIdentity(String clientId) {
            this.clientId = clientId;
        }

        public String getClientId() {
            return clientId;
        }

        @Override
        public TokenCredential toTokenCredential() {
            ManagedIdentityCredentialBuilder builder = new ManagedIdentityCredentialBuilder();
            if (clientId != null) {
                builder.clientId(clientId);
            }
            return builder.build();
        }

        @Override
        public String describe() {
            return clientId == null ? "managed identity" : "managed identity (client " + clientId + ")";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ManagedIdentity && Objects.equals(clientId, ((ManagedIdentity) o).clientId);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(clientId);
        }
    }

    /**
     * Application registration authenticating with a client secret.
     */
    public static final class ServicePrincipal extends Credential {
        private final String tenantId;
        private final String clientId;
        private final String clientSecret;

        private ServicePrincipal(String tenantId, String clientId, String clientSecret) {
            this.tenantId = Objects.requireNonNull(tenantId, "tenantId is required");
            this.clientId = Objects.requireNonNull(clientId, "clientId is required");
            this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret is required");
        }

        public String getTenantId() { return tenantId; }
        public String getClientId() { return clientId; }
        public String getClientSecret() { return clientSecret; }

        @Override
        public TokenCredential toTokenCredential() {
            return new ClientSecretCredentialBuilder()
                    .tenantId(tenantId)
                    .clientId(clientId)
                    .clientSecret(clientSecret)
                    .build();
        }

        @Override
        public String describe() {
            return "service principal " + clientId + " (tenant " + tenantId + ")";
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ServicePrincipal)) {
                return false;
            }
            ServicePrincipal other = (ServicePrincipal) o;
            return tenantId.equals(other.tenantId)
                    && clientId.equals(other.clientId)
                    && clientSecret.equals(other.clientSecret);
        }

        @Override
        public int hashCode() {
            return Objects.hash(tenantId, clientId, clientSecret);
        }
    }
}
