package com.mtg.advisor.source;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.config.AdvisorConfig;
import com.mtg.advisor.deck.DeckFixtures;
import com.mtg.advisor.recommend.RecommendationEngine;
import com.mtg.advisor.recommend.SmartRecommendation;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.time.Duration;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a local HTTP server replaying recorded Scryfall payloads.
 */
class ScryfallClientTest {

    private HttpServer server;
    private ScryfallClient client;
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final List<String> userAgents = new CopyOnWriteArrayList<>();
    private volatile String searchPage = "scryfall/search-red.json";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/cards/search", exchange -> {
            String query = URLDecoder.decode(exchange.getRequestURI().getRawQuery(), StandardCharsets.UTF_8);
            queries.add(query);
            userAgents.add(exchange.getRequestHeaders().getFirst("User-Agent"));
            if (query.contains("q=nothing")) {
                respond(exchange, 404, "scryfall/error-not-found.json");
            } else if (query.contains("q=broken")) {
                respond(exchange, 400, "scryfall/error-bad-request.json");
            } else if (query.contains("q=garbage")) {
                respondRaw(exchange, 200, "<html>oops</html>");
            } else if (query.contains("q=overload")) {
                respondRaw(exchange, 503, "{}");
            } else {
                respond(exchange, 200, searchPage);
            }
        });
        server.createContext("/cards/named", exchange -> {
            String query = URLDecoder.decode(exchange.getRequestURI().getRawQuery(), StandardCharsets.UTF_8);
            queries.add(query);
            if (query.equals("exact=Sol Ring")) {
                respond(exchange, 200, "scryfall/named-sol-ring.json");
            } else {
                respond(exchange, 404, "scryfall/error-not-found.json");
            }
        });
        server.start();

        AdvisorConfig config = AdvisorConfig.defaults()
                .withBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        client = new ScryfallClient(config);
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String resource) throws IOException {
        try (InputStream is = ScryfallClientTest.class.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(is, "missing fixture " + resource);
            byte[] body = is.readAllBytes();
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }

    private static void respondRaw(HttpExchange exchange, int status, String text) throws IOException {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Test
    void testSearchAddsFormatFilter() throws CardSourceException {
        List<Card> cards = client.search("t:creature c:r",
                SearchOptions.forFormat("Modern", SearchOptions.Order.EDHREC, 10));
        assertEquals(3, cards.size());
        assertEquals("q=t:creature c:r legal:modern&order=edhrec&unique=cards", queries.get(0));
        assertEquals(AdvisorConfig.DEFAULT_USER_AGENT, userAgents.get(0));
    }

    @Test
    void testExistingLegalityFilterKept() throws CardSourceException {
        client.search("legal:commander t:elf", SearchOptions.forFormat("commander", SearchOptions.Order.NAME, 10));
        assertEquals("q=legal:commander t:elf&order=name&unique=cards", queries.get(0));
    }

    @Test
    void testLimitTruncatesPage() throws CardSourceException {
        List<Card> cards = client.search("c:r", SearchOptions.defaults().withLimit(2));
        assertEquals(List.of("Lightning Bolt", "Goblin Guide"), cards.stream().map(Card::getName).toList());
    }

    @Test
    void testNotFoundIsEmpty() throws CardSourceException {
        assertTrue(client.search("nothing", SearchOptions.defaults()).isEmpty());
    }

    @Test
    void testErrorObjectThrows() {
        CardSourceException e = assertThrows(CardSourceException.class,
                () -> client.search("broken", SearchOptions.defaults()));
        assertEquals(400, e.getStatusCode());
        assertTrue(e.getMessage().contains("All of your terms were ignored"));
    }

    @Test
    void testUnreadableBodyThrows() {
        assertThrows(CardSourceException.class, () -> client.search("garbage", SearchOptions.defaults()));
    }

    @Test
    void testServerErrorThrows() {
        CardSourceException e = assertThrows(CardSourceException.class,
                () -> client.search("overload", SearchOptions.defaults()));
        assertEquals(503, e.getStatusCode());
    }

    @Test
    void testNamedLookup() throws CardSourceException {
        Optional<Card> ring = client.getByName("Sol Ring");
        assertTrue(ring.isPresent());
        assertEquals(1, ring.get().getCmc());
        assertTrue(client.getByName("Not A Card").isEmpty());
    }

    @Test
    void testUnknownManaSymbolsTolerated() throws CardSourceException {
        searchPage = "scryfall/search-unusual-symbols.json";
        List<Card> cards = client.search("set:unh", SearchOptions.defaults());
        assertEquals(List.of("Little Girl", "Shock"), cards.stream().map(Card::getName).toList());
        assertEquals(0, cards.get(0).getCmc());
    }

    @Test
    void testRecommendSurvivesUnusualCards() {
        searchPage = "scryfall/search-unusual-symbols.json";
        CachingCardSource source = new CachingCardSource(client, Duration.ofMinutes(5), 100,
                new RequestThrottle(Duration.ZERO));
        RecommendationEngine engine = new RecommendationEngine(source, 175);

        List<SmartRecommendation> recs = assertDoesNotThrow(
                () -> engine.recommend(DeckFixtures.monoRed(), null, 5, "modern"));
        for (SmartRecommendation rec : recs) {
            assertEquals("Shock", rec.name());
        }
        assertFalse(queries.isEmpty());
    }
}
