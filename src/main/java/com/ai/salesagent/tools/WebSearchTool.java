package com.ai.salesagent.tools;

import com.ai.salesagent.exception.LlmUnavailableException;
import com.ai.salesagent.service.LlmService;
import com.ai.salesagent.service.PromptTemplates;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Neighbourhood context from the web. Google Custom Search finds URLs and snippets when
 * configured, Tavily search otherwise; Tavily extract fills in page content when the
 * snippets are too thin.
 */
@Component
public class WebSearchTool {

    private static final Logger log = LoggerFactory.getLogger(WebSearchTool.class);

    static final int SHORT_SNIPPETS_THRESHOLD = 500;
    static final int SUFFICIENT_RESULT_LENGTH = 300;
    static final int EXTRACT_URLS = 2;
    static final int EXTRACT_CHARS_PER_PAGE = 2000;
    static final int DEFAULT_MAX_RESULTS = 10;

    private static final String GOOGLE_URL = "https://www.googleapis.com/customsearch/v1";
    private static final String TAVILY_URL = "https://api.tavily.com";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();
    private final LlmService llmService;
    private final PromptTemplates prompts;

    private final boolean googleEnabled;
    private final String googleApiKey;
    private final String googleCseId;
    private final String tavilyApiKey;

    public WebSearchTool(RestTemplateBuilder builder, LlmService llmService, PromptTemplates prompts,
                         @Value("${search.google.enabled:false}") boolean googleEnabled,
                         @Value("${search.google.api-key:}") String googleApiKey,
                         @Value("${search.google.cse-id:}") String googleCseId,
                         @Value("${search.tavily.api-key:}") String tavilyApiKey) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
        this.llmService = llmService;
        this.prompts = prompts;
        this.googleEnabled = googleEnabled && StringUtils.isNoneBlank(googleApiKey, googleCseId);
        this.googleApiKey = googleApiKey;
        this.googleCseId = googleCseId;
        this.tavilyApiKey = tavilyApiKey;
        log.info("Web search initialized - Google: {}, Tavily: {}",
                this.googleEnabled ? "ON" : "OFF", isTavilyEnabled() ? "ON" : "OFF");
    }

    public boolean isEnabled() {
        return googleEnabled || isTavilyEnabled();
    }

    public boolean isTavilyEnabled() {
        return StringUtils.isNotBlank(tavilyApiKey);
    }

    public List<SearchHit> googleSearch(String query, int num) {
        if (!googleEnabled) return new ArrayList<>();
        URI uri = UriComponentsBuilder.fromHttpUrl(GOOGLE_URL)
                .queryParam("key", googleApiKey)
                .queryParam("cx", googleCseId)
                .queryParam("q", query)
                .queryParam("num", Math.min(num, 10))
                .build()
                .encode()
                .toUri();
        try {
            log.info("Google search: '{}'", query);
            JsonNode root = mapper.readTree(restTemplate.getForObject(uri, String.class));
            List<SearchHit> hits = new ArrayList<>();
            for (JsonNode item : root.path("items")) {
                hits.add(new SearchHit(item.path("title").asText(""), item.path("snippet").asText(""),
                        item.path("link").asText("")));
            }
            log.info("Google found {} results", hits.size());
            return hits;
        } catch (RestClientException | IOException | IllegalArgumentException ex) {
            log.warn("Google search failed: {}", ex.getMessage());
            return new ArrayList<>();
        }
    }

    public List<SearchHit> tavilySearch(String query, int maxResults) {
        if (!isTavilyEnabled()) return new ArrayList<>();
        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("max_results", maxResults);
        try {
            log.info("Tavily search: '{}'", query);
            JsonNode root = postTavily("/search", body);
            List<SearchHit> hits = new ArrayList<>();
            for (JsonNode r : root.path("results")) {
                hits.add(new SearchHit(r.path("title").asText(""), r.path("content").asText(""),
                        r.path("url").asText("")));
            }
            log.info("Tavily found {} results", hits.size());
            return hits;
        } catch (RestClientException | IOException | IllegalArgumentException ex) {
            log.warn("Tavily search failed: {}", ex.getMessage());
            return new ArrayList<>();
        }
    }

    /** Page content per URL, each cut to {@value #EXTRACT_CHARS_PER_PAGE} characters. */
    public Map<String, String> tavilyExtract(List<String> urls) {
        Map<String, String> extracted = new LinkedHashMap<>();
        if (!isTavilyEnabled() || urls == null || urls.isEmpty()) return extracted;
        Map<String, Object> body = new HashMap<>();
        body.put("urls", urls);
        try {
            log.info("Tavily extracting {} URLs", urls.size());
            JsonNode root = postTavily("/extract", body);
            for (JsonNode r : root.path("results")) {
                String url = r.path("url").asText("");
                String content = r.path("raw_content").asText("");
                if (!url.isEmpty() && !content.isEmpty()) {
                    extracted.put(url, StringUtils.left(content, EXTRACT_CHARS_PER_PAGE));
                }
            }
            log.info("Tavily extracted {} pages", extracted.size());
        } catch (RestClientException | IOException | IllegalArgumentException ex) {
            log.warn("Tavily extract failed: {}", ex.getMessage());
        }
        return extracted;
    }

    /**
     * Search results rendered as numbered snippets, with extracted page content appended
     * when the snippets are short.
     *
     * @return the context text, or null when nothing was found
     */
    public String searchAndExtract(String query, int maxResults) {
        List<SearchHit> hits = googleEnabled ? googleSearch(query, maxResults) : tavilySearch(query, maxResults);
        if (hits.isEmpty()) {
            log.info("No web results for '{}'", query);
            return null;
        }

        String snippets = formatSnippets(hits);
        log.debug("Got {} chars of snippets for '{}'", snippets.length(), query);

        if (snippets.length() < SHORT_SNIPPETS_THRESHOLD && isTavilyEnabled()) {
            List<String> urls = new ArrayList<>();
            for (SearchHit hit : hits.subList(0, Math.min(EXTRACT_URLS, hits.size()))) {
                if (StringUtils.isNotBlank(hit.getUrl())) urls.add(hit.getUrl());
            }
            Map<String, String> extracted = tavilyExtract(urls);
            if (!extracted.isEmpty()) {
                List<String> parts = new ArrayList<>();
                extracted.forEach((url, content) -> parts.add("Source: " + url + "\n\n" + content));
                return snippets + "\n\n--- DETAILED CONTENT ---\n\n" + String.join("\n\n", parts);
            }
        }
        return snippets.isEmpty() ? null : snippets;
    }

    /**
     * Context for a question about a property's surroundings. Searches with the property
     * name first and falls back to the plain query when that yields too little.
     */
    public String searchContext(String question, String propertyName, String city) {
        log.info("Context search: question='{}', property='{}', city='{}'", question, propertyName, city);
        String searchQuery = buildSearchQuery(question, city);

        if (StringUtils.isNotBlank(propertyName)) {
            String result = searchAndExtract((propertyName + " " + searchQuery).trim(), DEFAULT_MAX_RESULTS);
            if (result != null && result.length() > SUFFICIENT_RESULT_LENGTH) return result;
            log.info("Property-specific search insufficient, retrying without property");
        }
        return searchAndExtract(searchQuery, DEFAULT_MAX_RESULTS);
    }

    String buildSearchQuery(String question, String city) {
        try {
            String query = StringUtils.strip(llmService.complete(prompts.searchQuery(question, city), 0.0), "\"' \n");
            if (StringUtils.isBlank(query)) throw new LlmUnavailableException("Empty search query");
            if (StringUtils.isNotBlank(city) && !StringUtils.containsIgnoreCase(query, city)) {
                query = query + " " + city;
            }
            log.info("LLM search query: '{}'", query);
            return query;
        } catch (LlmUnavailableException ex) {
            log.warn("Search query extraction failed, using fallback: {}", ex.getMessage());
            return StringUtils.isNotBlank(city) ? "best places " + city : StringUtils.left(question, 50);
        }
    }

    static String formatSnippets(List<SearchHit> hits) {
        List<String> parts = new ArrayList<>();
        int i = 1;
        for (SearchHit hit : hits) {
            if (StringUtils.isNotBlank(hit.getTitle()) && StringUtils.isNotBlank(hit.getSnippet())) {
                parts.add(i + ". **" + hit.getTitle() + "**\n" + hit.getSnippet() + "\nSource: " + hit.getUrl());
            }
            i++;
        }
        return String.join("\n\n", parts);
    }

    private JsonNode postTavily(String path, Map<String, Object> body) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tavilyApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        String response = restTemplate.postForObject(TAVILY_URL + path, new HttpEntity<>(body, headers), String.class);
        return mapper.readTree(response);
    }
}
