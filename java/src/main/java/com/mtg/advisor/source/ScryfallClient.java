package com.mtg.advisor.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.config.AdvisorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scryfall REST client for card search and named lookup.
 * Fetches a single page per search; caching and throttling belong to {@link CachingCardSource}.
 */
public class ScryfallClient implements CardSource {
    private static final Logger log = LoggerFactory.getLogger(ScryfallClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String userAgent;
    private final Duration timeout;
    private final int pageLimit;

    public ScryfallClient(AdvisorConfig config) {
        this(HttpClient.newBuilder()
                        .connectTimeout(config.requestTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                new ObjectMapper(), config);
    }

    public ScryfallClient(HttpClient httpClient, ObjectMapper mapper, AdvisorConfig config) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = config.scryfallBaseUrl();
        this.userAgent = config.userAgent();
        this.timeout = config.requestTimeout();
        this.pageLimit = config.pageLimit();
    }

    @Override
    public List<Card> search(String query, SearchOptions options) throws CardSourceException {
        String q = options.format() != null && !query.contains("legal:") && !query.contains("f:")
                ? query + " legal:" + options.format()
                : query;
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", q);
        params.put("order", options.order().apiValue());
        params.put("unique", options.unique().apiValue());

        Optional<JsonNode> body = get("/cards/search", params);
        if (body.isEmpty()) {
            return List.of();
        }
        List<Card> cards = ScryfallCardMapper.fromList(body.get());
        int limit = Math.min(options.limit(), pageLimit);
        log.debug("Query '{}' returned {} cards (total {})", q, cards.size(),
                body.get().path("total_cards").asInt(cards.size()));
        return cards.size() > limit ? List.copyOf(cards.subList(0, limit)) : cards;
    }

    @Override
    public Optional<Card> getByName(String name) throws CardSourceException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("exact", name);
        return get("/cards/named", params).map(ScryfallCardMapper::fromCard);
    }

    /**
     * Issue a GET request.
     *
     * @return the parsed body, or empty for a 404 not_found answer
     * @throws CardSourceException on transport failure, other error statuses, or an error object
     */
    private Optional<JsonNode> get(String path, Map<String, String> params) throws CardSourceException {
        URI uri = URI.create(baseUrl + path + "?" + encode(params));
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CardSourceException("Request to " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CardSourceException("Request to " + path + " interrupted", e);
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new CardSourceException("Unreadable response from " + path, response.statusCode(), e);
        }

        if ("error".equals(body.path("object").asText())) {
            if (response.statusCode() == 404 || "not_found".equals(body.path("code").asText())) {
                return Optional.empty();
            }
            throw new CardSourceException("Scryfall error " + body.path("status").asInt(response.statusCode())
                    + ": " + body.path("details").asText("unknown"), response.statusCode(), null);
        }
        if (response.statusCode() / 100 != 2) {
            throw new CardSourceException("Unexpected status " + response.statusCode() + " from " + path,
                    response.statusCode(), null);
        }
        return Optional.of(body);
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
