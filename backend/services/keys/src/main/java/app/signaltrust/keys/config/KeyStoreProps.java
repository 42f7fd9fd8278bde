package app.signaltrust.keys.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.keys.store")
public record KeyStoreProps(
        String path,
        String masterPasswordEnv,
        Long lockTimeoutMs
) {
}
