package com.vaultconfig.example.user;

import com.vaultconfig.CredentialUnavailableException;
import com.vaultconfig.VaultUnreachableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The application must not start serving when the secrets cannot be loaded.
 */
@DisplayName("Startup without secrets")
class StartupFailureTest {

    private final AtomicBoolean webServerStarted = new AtomicBoolean();

    private void start(String... args) {
        ApplicationListener<WebServerInitializedEvent> listener = event -> webServerStarted.set(true);
        new SpringApplicationBuilder(UserApiApplication.class)
                .listeners(listener)
                .run(args);
    }

    @Test
    @DisplayName("a vault timeout aborts startup before the web server starts")
    void vaultTimeout() {
        assertThatThrownBy(() -> start(
                "--server.port=0",
                "--vaultconfig.vault-url=" + FakeVaultStoreFactory.TIMEOUT_VAULT))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(VaultUnreachableException.class);

        assertThat(webServerStarted).isFalse();
    }

    @Test
    @DisplayName("a missing service principal aborts startup")
    void noCredential() {
        assertThatThrownBy(() -> start(
                "--server.port=0",
                "--AZURE_CLIENT_SECRET=",
                "--AzureServicesAuthConnectionString="))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(CredentialUnavailableException.class);

        assertThat(webServerStarted).isFalse();
    }
}
