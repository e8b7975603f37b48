package com.vaultconfig;

import java.util.Map;

/**
 * Read-only view of one vault. Names are the vault's own, untranslated.
 */
public interface SecretStore {

    /**
     * Fetch every enabled secret.
     */
    Map<String, String> listSecrets() throws VaultConfigException;

    /**
     * Fetch one secret by name.
     *
     * @throws SecretNotFoundException if the vault has no secret with that name
     */
    String getSecret(String name) throws VaultConfigException;

    /**
     * Address of the vault, for log and error messages.
     */
    String location();
}
