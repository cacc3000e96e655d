package dev.medrag.augment;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
public class BingSearchClient implements AugmentationProvider {

    private static final Logger log = LoggerFactory.getLogger(BingSearchClient.class);

    /** Appended to every query to keep results in the health domain. */
    static final String DOMAIN_SUFFIX = " 医疗健康";

    static final String PLACEHOLDER_KEY = "your_bing_search_key";

    private final RestClient restClient;
    private final String apiKey;
    private final int count;

    public BingSearchClient(
            @Qualifier("bingRestClient") RestClient restClient,
            @Value("${medrag.augment.bing.api-key:}") String apiKey,
            @Value("${medrag.augment.bing.count:3}") int count) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.count = count;
    }

    /**
     * Search the web for health pages about the query.
     * Skipped without a call when no subscription key is configured.
     * Retries on transient RestClientException with exponential backoff.
     */
    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${medrag.augment.bing.retry.max-attempts:2}",
            backoff = @Backoff(
                    delayExpression = "${medrag.augment.bing.retry.delay-ms:500}",
                    multiplierExpression = "${medrag.augment.bing.retry.multiplier:2.0}"
            )
    )
    public List<EvidenceItem> search(String query) {
        if (!isConfigured()) {
            log.info("Bing search key not configured, skipping augmentation");
            return List.of();
        }

        BingSearchResponse response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                        .queryParam("q", query + DOMAIN_SUFFIX)
                        .queryParam("count", count)
                        .queryParam("mkt", "zh-CN")
                        .queryParam("responseFilter", "Webpages")
                        .build())
                .retrieve()
                .body(BingSearchResponse.class);

        if (response == null) {
            return List.of();
        }
        List<EvidenceItem> items = response.pages().stream()
                .filter(page -> page.snippet() != null && !page.snippet().isBlank())
                .limit(count)
                .map(BingSearchClient::toEvidence)
                .toList();
        log.info("Bing search returned {} results for '{}'", items.size(), query);
        return items;
    }

    @Recover
    List<EvidenceItem> recoverSearch(RestClientException e, String query) {
        log.warn("Bing search failed after retries for '{}': {}", query, e.getMessage());
        return List.of();
    }

    boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_KEY.equals(apiKey);
    }

    private static EvidenceItem toEvidence(BingSearchResponse.WebPage page) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", page.name() == null ? "" : page.name());
        metadata.put("url", page.url() == null ? "" : page.url());
        metadata.put("retrieval_type", EvidenceOrigin.EXTERNAL.retrievalType());
        return new EvidenceItem(EvidenceOrigin.EXTERNAL, page.snippet(), null, metadata);
    }
}
