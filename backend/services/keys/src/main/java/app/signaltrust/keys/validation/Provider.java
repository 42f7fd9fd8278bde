package app.signaltrust.keys.validation;

import java.util.Arrays;
import java.util.Optional;

public enum Provider {
    OPENAI("OpenAI", "OPENAI_API_KEY",
            FormatRule.pattern("sk- followed by 20+ characters", "^sk-[A-Za-z0-9_-]{20,}$")),
    ANTHROPIC("Anthropic", "ANTHROPIC_API_KEY",
            FormatRule.pattern("sk-ant- followed by 32+ characters", "^sk-ant-[A-Za-z0-9_-]{32,}$")),
    GROQ("Groq", "GROQ_API_KEY",
            FormatRule.pattern("gsk_ followed by 20+ alphanumerics", "^gsk_[A-Za-z0-9]{20,}$")),
    COINGECKO("CoinGecko", "COINGECKO_API_KEY",
            FormatRule.pattern("CG- followed by 20+ alphanumerics", "^CG-[A-Za-z0-9]{20,}$")),
    ALPHAVANTAGE("Alpha Vantage", "ALPHAVANTAGE_API_KEY",
            FormatRule.pattern("16 uppercase alphanumerics", "^[A-Z0-9]{16}$")),
    WHALEALERT("Whale Alert", "WHALEALERT_API_KEY",
            FormatRule.pattern("32-64 alphanumerics", "^[A-Za-z0-9]{32,64}$")),
    NEWS_CATCHER("NewsCatcher", "NEWS_CATCHER_API_KEY",
            FormatRule.pattern("32+ characters of [A-Za-z0-9_-]", "^[A-Za-z0-9_-]{32,}$")),
    ETHERSCAN("Etherscan", "ETHERSCAN_API_KEY",
            FormatRule.pattern("34 uppercase alphanumerics", "^[A-Z0-9]{34}$"));

    private final String displayName;
    private final String keyName;
    private final FormatRule formatRule;

    Provider(String displayName, String keyName, FormatRule formatRule) {
        this.displayName = displayName;
        this.keyName = keyName;
        this.formatRule = formatRule;
    }

    public String displayName() {
        return displayName;
    }

    public String keyName() {
        return keyName;
    }

    public FormatRule formatRule() {
        return formatRule;
    }

    public static Optional<Provider> fromKeyName(String keyName) {
        return Arrays.stream(values())
                .filter(provider -> provider.keyName.equals(keyName))
                .findFirst();
    }
}
