package com.vaultconfig;

import java.time.Duration;

/**
 * Checks whether an identity is available from the hosting environment.
 */
@FunctionalInterface
public interface AmbientIdentityProbe {

    /**
     * @return true if a token could be obtained within {@code timeout}
     */
    boolean isAvailable(Duration timeout);
}
