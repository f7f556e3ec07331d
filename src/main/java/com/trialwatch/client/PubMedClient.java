package com.trialwatch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialwatch.config.TrialWatchProperties;
import com.trialwatch.model.Citation;
import org.jsoup.parser.Parser;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * PubMed E-utilities client linking registry identifiers to articles: ESearch over the
 * secondary source id field, then one ESummary call for the hits.
 */
@Service
public class PubMedClient {

    private static final Pattern INLINE_TAG =
            Pattern.compile("</?(?:i|b|u|em|strong|sup|sub)\\s*/?>", Pattern.CASE_INSENSITIVE);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String tool;
    private final String email;
    private final int retmax;
    private final Throttle throttle;

    @Autowired
    public PubMedClient(RestTemplateBuilder restTemplateBuilder, TrialWatchProperties properties,
                        ObjectMapper objectMapper) {
        this(restTemplateBuilder
                        .defaultHeader(HttpHeaders.USER_AGENT, userAgent(properties.getPubmed()))
                        .setConnectTimeout(properties.getPubmed().getTimeout())
                        .setReadTimeout(properties.getPubmed().getTimeout())
                        .build(),
                objectMapper,
                properties.getPubmed().getBaseUrl(),
                properties.getPubmed().getTool(),
                properties.getPubmed().getEmail(),
                properties.getPubmed().getRetmax(),
                new Throttle(properties.getPubmed().getDelay()));
    }

    public PubMedClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String tool,
                        String email, int retmax, Throttle throttle) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.tool = tool;
        this.email = email == null ? "" : email;
        this.retmax = retmax;
        this.throttle = throttle;
    }

    private static String userAgent(TrialWatchProperties.PubMed pubmed) {
        String email = pubmed.getEmail();
        return email == null || email.isBlank() ? pubmed.getTool() : pubmed.getTool() + " (mailto:" + email + ")";
    }

    /**
     * PubMed indexes registry ids in the SI field either bare or as {@code ClinicalTrials.gov/NCT...};
     * both forms are searched.
     */
    static String searchTerm(String nctId) {
        return "(\"ClinicalTrials.gov/" + nctId + "\"[SI] OR \"" + nctId + "\"[SI])";
    }

    public List<String> searchPmids(String nctId) {
        Map<String, String> params = baseParams();
        params.put("term", searchTerm(nctId));
        params.put("retmax", String.valueOf(retmax));

        JsonNode body = get("esearch.fcgi", params);
        throttle.pause();

        List<String> ids = new ArrayList<>();
        for (JsonNode id : body.path("esearchresult").path("idlist")) {
            if (id.isValueNode() && !id.asText().isEmpty()) {
                ids.add(id.asText());
            }
        }
        return ids;
    }

    /**
     * @return the ESummary document, or an empty object for an empty id list
     */
    public JsonNode summary(List<String> pmids) {
        if (pmids == null || pmids.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        Map<String, String> params = baseParams();
        params.put("id", String.join(",", pmids));

        JsonNode body = get("esummary.fcgi", params);
        throttle.pause();
        return body;
    }

    /**
     * Citations for one trial, in search order. Ids with no summary record are dropped.
     */
    public List<Citation> citationsFor(String nctId) {
        List<String> pmids = searchPmids(nctId);
        if (pmids.isEmpty()) {
            return List.of();
        }
        JsonNode result = summary(pmids).path("result");
        List<Citation> citations = new ArrayList<>();
        for (String pmid : pmids) {
            JsonNode item = result.path(pmid);
            if (!item.isObject()) {
                continue;
            }
            String source = text(item, "fulljournalname");
            citations.add(new Citation(
                    pmid,
                    plainTitle(text(item, "title")),
                    source != null ? source : text(item, "source"),
                    text(item, "pubdate"),
                    extractDoi(item)));
        }
        return citations;
    }

    /**
     * An {@code articleids} entry of type doi wins; otherwise {@code elocationid} when it
     * mentions a doi, with the {@code doi:} prefix stripped.
     */
    static String extractDoi(JsonNode item) {
        for (JsonNode articleId : item.path("articleids")) {
            if ("doi".equals(articleId.path("idtype").asText(null))) {
                JsonNode value = articleId.get("value");
                return value == null || value.isNull() ? null : value.asText();
            }
        }
        JsonNode eloc = item.get("elocationid");
        if (eloc != null && eloc.isTextual() && eloc.textValue().toLowerCase(Locale.ROOT).contains("doi")) {
            return eloc.textValue().replace("doi:", "").strip();
        }
        return null;
    }

    /**
     * Drops the inline formatting tags PubMed embeds in titles and decodes entities. Any other
     * angle bracket is part of the title and stays.
     */
    static String plainTitle(String title) {
        if (title == null || title.indexOf('<') < 0 && title.indexOf('&') < 0) {
            return title;
        }
        String stripped = INLINE_TAG.matcher(title).replaceAll("");
        return Parser.unescapeEntities(stripped, false);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    private Map<String, String> baseParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("db", "pubmed");
        params.put("retmode", "json");
        params.put("tool", tool);
        if (!email.isBlank()) {
            params.put("email", email);
        }
        return params;
    }

    private JsonNode get(String endpoint, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).pathSegment(endpoint);
        params.forEach(builder::queryParam);
        URI uri = builder.build().encode().toUri();

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, null, String.class);
        } catch (RestClientResponseException e) {
            throw new LiteratureApiException(endpoint, e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            throw new LiteratureApiException("PubMed " + endpoint + " request failed: " + e.getMessage(), e);
        }
        int status = response.getStatusCode().value();
        if (status != 200) {
            throw new LiteratureApiException(endpoint, status, response.getBody());
        }
        try {
            return objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
        } catch (JsonProcessingException e) {
            throw new LiteratureApiException("PubMed " + endpoint + " returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }
}
