package app.signaltrust.keys.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app.keys.validation")
public record ValidationProps(
        Long timeoutMs,
        List<String> requiredKeys
) {
}
