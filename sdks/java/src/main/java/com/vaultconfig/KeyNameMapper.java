package com.vaultconfig;

import java.util.Objects;

/**
 * Translates between the flat names a vault allows and the hierarchical keys the
 * configuration system uses.
 *
 * <p>Key Vault secret names may only contain letters, digits and dashes, so nesting is
 * spelled with a dash sequence remotely and with {@code :} or {@code .} locally. Every
 * occurrence of the remote delimiter is replaced left to right; there is no escaping.
 */
public final class KeyNameMapper {

    /** {@code Secrets--ConnectionString} becomes {@code Secrets:ConnectionString}. */
    public static final KeyNameMapper DOUBLE_DASH = new KeyNameMapper("--", ":");

    /** {@code Secrets-ConnectionString} becomes {@code Secrets.ConnectionString}. */
    public static final KeyNameMapper SINGLE_DASH = new KeyNameMapper("-", ".");

    /** {@code Secrets__ConnectionString} environment variables become {@code Secrets:ConnectionString}. */
    public static final KeyNameMapper ENVIRONMENT = new KeyNameMapper("__", ":");

    private final String remoteDelimiter;
    private final String localDelimiter;

    public KeyNameMapper(String remoteDelimiter, String localDelimiter) {
        this.remoteDelimiter = requireDelimiter(remoteDelimiter, "remoteDelimiter");
        this.localDelimiter = requireDelimiter(localDelimiter, "localDelimiter");
        if (remoteDelimiter.contains(localDelimiter) || localDelimiter.contains(remoteDelimiter)) {
            throw new IllegalArgumentException(
                    "Delimiters must not overlap: '" + remoteDelimiter + "' and '" + localDelimiter + "'");
        }
    }

    public String getRemoteDelimiter() {
        return remoteDelimiter;
    }

    public String getLocalDelimiter() {
        return localDelimiter;
    }

    /**
     * Remote name to local hierarchical key.
     *
     * @throws KeyTranslationAmbiguousException if the remote name already contains the local delimiter
     */
    public String toLocal(String remoteName) throws KeyTranslationAmbiguousException {
        Objects.requireNonNull(remoteName, "remoteName");
        if (remoteName.contains(localDelimiter)) {
            throw new KeyTranslationAmbiguousException(
                    "Remote name '" + remoteName + "' contains the local delimiter '" + localDelimiter + "'");
        }
        return remoteName.replace(remoteDelimiter, localDelimiter);
    }

    /**
     * Local hierarchical key to remote name.
     *
     * @throws KeyTranslationAmbiguousException if the key could not have been produced by {@link #toLocal}
     */
    public String toRemote(String localKey) throws KeyTranslationAmbiguousException {
        Objects.requireNonNull(localKey, "localKey");
        String remote = localKey.replace(localDelimiter, remoteDelimiter);
        if (!remote.replace(remoteDelimiter, localDelimiter).equals(localKey)) {
            throw new KeyTranslationAmbiguousException(
                    "Local key '" + localKey + "' cannot be stored remotely with delimiter '" + remoteDelimiter + "'");
        }
        return remote;
    }

    @Override
    public String toString() {
        return "'" + remoteDelimiter + "' -> '" + localDelimiter + "'";
    }

    private static String requireDelimiter(String delimiter, String name) {
        Objects.requireNonNull(delimiter, name);
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return delimiter;
    }
}
