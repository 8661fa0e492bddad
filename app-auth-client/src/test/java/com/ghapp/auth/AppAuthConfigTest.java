package com.ghapp.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ghapp.auth.jwt.JwtLifetime;

class AppAuthConfigTest {

    @Test
    @DisplayName("defaults match the GitHub token limits")
    void defaults() {
        AppAuthConfig config = new AppAuthConfig();

        assertThat(config.jwtLifetime()).isEqualTo(JwtLifetime.DEFAULT);
        assertThat(config.getAccessTokenRefreshMargin()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.getApiUrl()).isEqualTo(URI.create("https://api.github.com/"));
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getHeaderName()).isEqualTo("Authorization");
    }

    @Test
    @DisplayName("properties override defaults")
    void readsProperties() {
        Properties props = new Properties();
        props.setProperty("github.app.private-key-file", "/etc/app/key.pem");
        props.setProperty("github.app.id", " 123456 ");
        props.setProperty("github.app.api-url", "https://ghe.example.com/api/v3");
        props.setProperty("github.app.token-lifetime", "PT5M");
        props.setProperty("github.app.clock-drift", "PT30S");
        props.setProperty("github.app.request-timeout", "PT3S");

        AppAuthConfig config = AppAuthConfig.fromProperties(props);

        assertThat(config.getPrivateKeyFile()).isEqualTo(Path.of("/etc/app/key.pem"));
        assertThat(config.getAppId()).isEqualTo("123456");
        assertThat(config.getApiUrl()).isEqualTo(URI.create("https://ghe.example.com/api/v3"));
        assertThat(config.jwtLifetime())
            .isEqualTo(new JwtLifetime(Duration.ofMinutes(5), Duration.ofMinutes(2), Duration.ofSeconds(30)));
        assertThat(config.getRequestTimeout()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("validation requires a key file and an app id")
    void validates() {
        AppAuthConfig config = new AppAuthConfig();
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("private-key-file");

        config.setPrivateKeyFile(Path.of("key.pem"));
        config.setAppId(" ");
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("id");
    }
}
