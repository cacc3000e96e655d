package dev.medrag.augment;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to query the Bing Web Search API.
 *
 * <p>Timeouts and the endpoint are externalized via {@code medrag.augment.bing.*} properties.
 * The subscription key is sent as a default header on every request. Enables Spring Retry for
 * {@link BingSearchClient}.
 */
@Configuration
@EnableRetry
public class BingSearchConfig {

    static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";

    /**
     * Creates a pre-configured {@link RestClient} targeting the Bing search endpoint.
     *
     * @param builder          Spring-provided builder with common defaults
     * @param endpoint         Bing Web Search v7 endpoint URL
     * @param apiKey           subscription key, possibly blank when augmentation is not set up
     * @param connectTimeoutMs TCP connection timeout in milliseconds
     * @param readTimeoutMs    response read timeout in milliseconds
     * @return a named REST client bean for injection into {@link BingSearchClient}
     */
    @Bean
    public RestClient bingRestClient(
            RestClient.Builder builder,
            @Value("${medrag.augment.bing.endpoint}") String endpoint,
            @Value("${medrag.augment.bing.api-key:}") String apiKey,
            @Value("${medrag.augment.bing.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${medrag.augment.bing.read-timeout-ms:10000}") int readTimeoutMs) {

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return builder
                .baseUrl(endpoint)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(SUBSCRIPTION_KEY_HEADER, apiKey)
                .build();
    }
}
