package app.signaltrust.keys.validation;

import app.signaltrust.keys.config.ProviderProps;
import app.signaltrust.keys.error.ValidationNetworkException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.EnumMap;
import java.util.Map;

/**
 * HTTP connection probes, one cheap authenticated call per provider.
 */
public class ProviderProbes {

    private final RestClient.Builder restClientBuilder;
    private final ProviderProps props;
    private final ObjectMapper objectMapper;

    public ProviderProbes(RestClient.Builder restClientBuilder, ProviderProps props, ObjectMapper objectMapper) {
        this.restClientBuilder = restClientBuilder;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    public ProviderRegistry registry() {
        Map<Provider, ConnectionProbe> probes = new EnumMap<>(Provider.class);
        probes.put(Provider.OPENAI, openAi());
        probes.put(Provider.ANTHROPIC, anthropic());
        probes.put(Provider.GROQ, groq());
        probes.put(Provider.COINGECKO, coinGecko());
        probes.put(Provider.ALPHAVANTAGE, alphaVantage());
        return ProviderRegistry.builder().registerAll(probes).build();
    }

    public ConnectionProbe openAi() {
        RestClient restClient = client(props.openaiBaseUrl());
        return apiKey -> exchange(Provider.OPENAI, () -> restClient.get()
                .uri("/v1/models")
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .retrieve()
                .toBodilessEntity());
    }

    public ConnectionProbe anthropic() {
        RestClient restClient = client(props.anthropicBaseUrl());
        return apiKey -> {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("model", props.anthropicProbeModel());
            payload.put("max_tokens", 1);
            ArrayNode messages = payload.putArray("messages");
            ObjectNode user = messages.addObject();
            user.put("role", "user");
            user.put("content", "Hi");
            return exchange(Provider.ANTHROPIC, () -> restClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", props.anthropicVersion())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity());
        };
    }

    public ConnectionProbe groq() {
        RestClient restClient = client(props.groqBaseUrl());
        return apiKey -> exchange(Provider.GROQ, () -> restClient.get()
                .uri("/openai/v1/models")
                .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                .retrieve()
                .toBodilessEntity());
    }

    public ConnectionProbe coinGecko() {
        RestClient restClient = client(props.coingeckoBaseUrl());
        return apiKey -> exchange(Provider.COINGECKO, () -> restClient.get()
                .uri("/api/v3/ping")
                .header("x-cg-pro-api-key", apiKey)
                .retrieve()
                .toBodilessEntity());
    }

    /**
     * Alpha Vantage answers 200 for rejected keys and reports the problem in the body.
     */
    public ConnectionProbe alphaVantage() {
        RestClient restClient = client(props.alphavantageBaseUrl());
        return apiKey -> {
            JsonNode body;
            try {
                body = restClient.get()
                        .uri(uriBuilder -> uriBuilder.path("/query")
                                .queryParam("function", "GLOBAL_QUOTE")
                                .queryParam("symbol", "IBM")
                                .queryParam("apikey", apiKey)
                                .build())
                        .retrieve()
                        .body(JsonNode.class);
            } catch (RestClientResponseException ex) {
                return ProbeOutcome.fromStatus(ex.getStatusCode().value());
            } catch (ResourceAccessException ex) {
                throw unreachable(Provider.ALPHAVANTAGE, ex);
            }
            if (body == null) {
                return ProbeOutcome.retryable("Alpha Vantage response is empty");
            }
            if (body.hasNonNull("Error Message")) {
                return ProbeOutcome.rejected("Alpha Vantage rejected the key");
            }
            if (body.hasNonNull("Note") || body.hasNonNull("Information")) {
                return ProbeOutcome.retryable("Alpha Vantage rate limit or notice");
            }
            return ProbeOutcome.ok();
        };
    }

    private ProbeOutcome exchange(Provider provider, Runnable call) {
        try {
            call.run();
            return ProbeOutcome.ok();
        } catch (RestClientResponseException ex) {
            return ProbeOutcome.fromStatus(ex.getStatusCode().value());
        } catch (ResourceAccessException ex) {
            throw unreachable(provider, ex);
        }
    }

    private ValidationNetworkException unreachable(Provider provider, ResourceAccessException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        return new ValidationNetworkException(provider.displayName() + " is unreachable (" + cause.getClass().getSimpleName() + ")");
    }

    private RestClient client(String baseUrl) {
        return restClientBuilder.clone()
                .baseUrl(baseUrl)
                .build();
    }

    private String bearer(String apiKey) {
        return "Bearer " + apiKey;
    }
}
