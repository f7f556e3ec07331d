package com.trialwatch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialwatch.config.TrialWatchProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Client for the ClinicalTrials.gov v2 API. Owns a single {@link RestTemplate} for its lifetime
 * and issues one blocking request at a time.
 */
@Service
public class ClinicalTrialsClient {

    private static final Logger log = LoggerFactory.getLogger(ClinicalTrialsClient.class);

    static final String NEXT_PAGE_HEADER = "x-next-page-token";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int defaultPageSize;
    private final Throttle throttle;

    @Autowired
    public ClinicalTrialsClient(RestTemplateBuilder restTemplateBuilder, TrialWatchProperties properties,
                                ObjectMapper objectMapper) {
        this(restTemplateBuilder
                        .defaultHeader(HttpHeaders.USER_AGENT, properties.getRegistry().getUserAgent())
                        .setConnectTimeout(properties.getRegistry().getTimeout())
                        .setReadTimeout(properties.getRegistry().getTimeout())
                        .build(),
                objectMapper,
                properties.getRegistry().getBaseUrl(),
                properties.getRegistry().getPageSize(),
                new Throttle(properties.getPipeline().getRegistryDelay()));
    }

    public ClinicalTrialsClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl,
                                int defaultPageSize, Throttle throttle) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.defaultPageSize = defaultPageSize;
        this.throttle = throttle;
    }

    /**
     * Lazily pages through {@code GET /studies}. The stream ends when a page carries no next-page
     * token, or after {@code maxPages} pages. A failed page aborts the stream with
     * {@link RegistryApiException}.
     *
     * @param params   registry query parameters; {@code format} and {@code pageSize} are added when absent
     * @param pageSize page size used when {@code params} has none, or null for the configured default
     * @param maxPages page cap, or null for no cap
     */
    public Stream<JsonNode> streamStudies(Map<String, String> params, Integer pageSize, Integer maxPages) {
        Map<String, String> query = new LinkedHashMap<>(params == null ? Map.of() : params);
        query.putIfAbsent("format", "json");
        query.putIfAbsent("pageSize", String.valueOf(pageSize != null ? pageSize : defaultPageSize));
        query.remove("pageToken");

        StudyPageIterator pages = new StudyPageIterator(query, maxPages);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Fetches one study by identifier.
     */
    public JsonNode getStudy(String nctId) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .pathSegment("studies", nctId)
                .build()
                .encode()
                .toUri();
        return get(uri).body();
    }

    private Page get(URI uri) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, null, String.class);
        } catch (RestClientResponseException e) {
            throw new RegistryApiException(e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            throw new RegistryApiException("ClinicalTrials.gov request failed: " + e.getMessage(), e);
        }
        int status = response.getStatusCode().value();
        if (status != 200) {
            throw new RegistryApiException(status, response.getBody());
        }
        try {
            JsonNode body = objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
            return new Page(body, response.getHeaders());
        } catch (JsonProcessingException e) {
            throw new RegistryApiException("ClinicalTrials.gov returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private record Page(JsonNode body, HttpHeaders headers) {

        /**
         * Body token first, then the response header some deployments use instead.
         */
        String nextPageToken() {
            JsonNode token = body.get("nextPageToken");
            if (token != null && token.isTextual() && !token.textValue().isEmpty()) {
                return token.textValue();
            }
            String header = headers.getFirst(NEXT_PAGE_HEADER);
            return header == null || header.isEmpty() ? null : header;
        }
    }

    private final class StudyPageIterator implements Iterator<JsonNode> {

        private final Map<String, String> query;
        private final Integer maxPages;
        private final Deque<JsonNode> buffer = new ArrayDeque<>();
        private String pageToken;
        private int pagesFetched;
        private boolean exhausted;

        StudyPageIterator(Map<String, String> query, Integer maxPages) {
            this.query = query;
            this.maxPages = maxPages;
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !exhausted) {
                fetchNextPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void fetchNextPage() {
            if (maxPages != null && pagesFetched >= maxPages) {
                exhausted = true;
                return;
            }
            if (pagesFetched > 0) {
                throttle.pause();
            }

            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).pathSegment("studies");
            query.forEach(builder::queryParam);
            if (pageToken != null) {
                builder.queryParam("pageToken", pageToken);
            }
            Page page = get(builder.build().encode().toUri());
            pagesFetched++;

            JsonNode studies = page.body().path("studies");
            int received = 0;
            if (studies.isArray()) {
                for (JsonNode study : studies) {
                    if (study.isObject()) {
                        buffer.add(study);
                        received++;
                    }
                }
            }
            pageToken = page.nextPageToken();
            log.debug("[ctgov] page {} returned {} studies, next token present: {}", pagesFetched, received, pageToken != null);
            if (pageToken == null) {
                exhausted = true;
            }
        }
    }
}
