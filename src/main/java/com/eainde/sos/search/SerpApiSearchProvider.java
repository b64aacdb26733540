package com.eainde.sos.search;

import com.eainde.sos.config.SosProperties;
import com.eainde.sos.model.SearchSnippet;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SearchProvider} backed by SerpApi's Google search endpoint.
 * Only {@code organic_results} are read; ads, maps and knowledge panels are ignored.
 */
@Slf4j
public class SerpApiSearchProvider implements SearchProvider {

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String apiKey;
    private final int resultsPerQuery;
    private final String language;

    public SerpApiSearchProvider(RestTemplate restTemplate, SosProperties.Search properties) {
        this.restTemplate = restTemplate;
        this.endpoint = properties.getEndpoint();
        this.apiKey = properties.getApiKey();
        this.resultsPerQuery = properties.getResultsPerQuery();
        this.language = properties.getLanguage();
    }

    @Override
    public List<SearchSnippet> search(String query) {
        if (apiKey == null || apiKey.isBlank()) {
            log.error("SerpApi API key not configured (sos.search.api-key)");
            return List.of();
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(endpoint)
                .queryParam("q", query)
                .queryParam("api_key", apiKey)
                .queryParam("num", resultsPerQuery)
                .queryParam("hl", language)
                .build()
                .encode()
                .toUri();

        JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
        return toSnippets(body);
    }

    private static List<SearchSnippet> toSnippets(JsonNode body) {
        if (body == null || !body.path("organic_results").isArray()) {
            return List.of();
        }
        List<SearchSnippet> snippets = new ArrayList<>();
        for (JsonNode result : body.path("organic_results")) {
            snippets.add(new SearchSnippet(
                    result.path("title").asText(""),
                    result.path("snippet").asText(""),
                    result.path("link").asText("")));
        }
        return snippets;
    }
}
