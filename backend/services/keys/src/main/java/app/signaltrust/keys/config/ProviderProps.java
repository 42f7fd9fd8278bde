package app.signaltrust.keys.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.keys.providers")
public record ProviderProps(
        String openaiBaseUrl,
        String anthropicBaseUrl,
        String anthropicVersion,
        String anthropicProbeModel,
        String groqBaseUrl,
        String coingeckoBaseUrl,
        String alphavantageBaseUrl
) {
}
