package app.signaltrust.keys.config;

import app.signaltrust.keys.crypto.MasterKeyDeriver;
import app.signaltrust.keys.env.ProcessEnvironment;
import app.signaltrust.keys.secret.AtomicFileWriter;
import app.signaltrust.keys.secret.KeyManager;
import app.signaltrust.keys.secret.SecretStore;
import app.signaltrust.keys.secret.StoreFileCodec;
import app.signaltrust.keys.validation.KeyValidator;
import app.signaltrust.keys.validation.ProviderProbes;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class KeysConfig {

    private static final Logger log = LoggerFactory.getLogger(KeysConfig.class);

    @Bean
    public Clock keysClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessEnvironment processEnvironment() {
        return new ProcessEnvironment();
    }

    @Bean
    public MasterKeyDeriver masterKeyDeriver() {
        return new MasterKeyDeriver();
    }

    @Bean
    public SecretStore secretStore(KeyStoreProps props,
                                   ProcessEnvironment environment,
                                   MasterKeyDeriver deriver,
                                   ObjectMapper objectMapper,
                                   Clock keysClock) {
        String passwordEnv = props.masterPasswordEnv() == null || props.masterPasswordEnv().isBlank()
                ? "API_MASTER_PASSWORD"
                : props.masterPasswordEnv();
        char[] password = environment.get(passwordEnv).map(String::toCharArray).orElse(null);
        if (password == null) {
            log.warn("Master password is not set env={}; stored keys cannot be decrypted", passwordEnv);
        }
        long lockTimeoutMs = props.lockTimeoutMs() == null ? 5_000L : Math.max(props.lockTimeoutMs(), 1L);
        return new SecretStore(
                Path.of(props.path()),
                password,
                passwordEnv,
                deriver,
                new StoreFileCodec(objectMapper),
                new AtomicFileWriter(),
                Duration.ofMillis(lockTimeoutMs),
                keysClock
        );
    }

    @Bean
    public KeyValidator keyValidator(RestClient.Builder restClientBuilder,
                                     ProviderProps providerProps,
                                     ValidationProps validationProps,
                                     ObjectMapper objectMapper,
                                     Clock keysClock) {
        Duration timeout = Duration.ofMillis(validationProps.timeoutMs() == null ? 8_000L : Math.max(validationProps.timeoutMs(), 1L));
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(
                HttpClient.newBuilder().connectTimeout(timeout).build()
        );
        requestFactory.setReadTimeout(timeout);
        RestClient.Builder probeClientBuilder = restClientBuilder.clone().requestFactory(requestFactory);
        ProviderProbes probes = new ProviderProbes(probeClientBuilder, providerProps, objectMapper);
        return new KeyValidator(probes.registry(), timeout, keysClock);
    }

    @Bean
    public KeyManager keyManager(SecretStore secretStore,
                                 ProcessEnvironment environment,
                                 KeyValidator keyValidator) {
        return new KeyManager(secretStore, environment, keyValidator);
    }
}
