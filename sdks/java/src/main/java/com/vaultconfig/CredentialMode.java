package com.vaultconfig;

/**
 * How {@link CredentialResolver} picks the identity.
 */
public enum CredentialMode {
    /** Probe for a managed identity, fall back to a service principal. */
    AUTO,
    /** Always use the managed identity, without probing. */
    MANAGED_IDENTITY,
    /** Always use a service principal from the environment. */
    SERVICE_PRINCIPAL
}
