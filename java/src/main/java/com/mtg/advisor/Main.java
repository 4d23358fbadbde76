package com.mtg.advisor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mtg.advisor.analysis.DeckAnalysis;
import com.mtg.advisor.analysis.DeckHealth;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.ManaColor;
import com.mtg.advisor.config.AdvisorConfig;
import com.mtg.advisor.config.AdvisorConfigLoader;
import com.mtg.advisor.deck.Collection;
import com.mtg.advisor.deck.Deck;
import com.mtg.advisor.deck.DeckListParser;
import com.mtg.advisor.recommend.RecommendationEngine;
import com.mtg.advisor.recommend.SmartRecommendation;
import com.mtg.advisor.source.CachingCardSource;
import com.mtg.advisor.source.CardDatabase;
import com.mtg.advisor.source.CardSourceException;
import com.mtg.advisor.source.ScryfallClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * MTG Deck Advisor CLI - Main entry point.
 */
@Command(name = "mtg-advisor",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Deck analysis and card recommendations for MTG decks",
        subcommands = {
                Main.AnalyzeCommand.class,
                Main.RecommendCommand.class
        })
public class Main implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SHARED OPTIONS ==========

    static class DeckOptions {
        @Option(names = {"-d", "--deck"}, required = true,
                description = "Path to deck file ('COUNT Card Name' per line)")
        Path deckPath;

        @Option(names = {"-f", "--format"},
                description = "Format (standard, modern, commander, ...); defaults to standard")
        String format;

        @Option(names = {"--cards"},
                description = "Local card database (JSON array of Scryfall cards), consulted before the network")
        Path cardsPath;

        @Option(names = {"--base-url"},
                description = "Card data service base URL (overrides configuration)")
        String baseUrl;

        @Option(names = {"--json"}, description = "Print JSON instead of text")
        boolean json;

        AdvisorConfig config() {
            AdvisorConfig config = new AdvisorConfigLoader().load();
            return baseUrl != null ? config.withBaseUrl(baseUrl) : config;
        }

        String formatOrDefault() {
            return format != null ? format : "standard";
        }
    }

    // ========== ANALYZE COMMAND ==========
    @Command(name = "analyze", description = "Analyze a deck's curve, colors, archetype and health")
    static class AnalyzeCommand implements Callable<Integer> {
        @Mixin
        DeckOptions options;

        @Override
        public Integer call() throws Exception {
            AdvisorConfig config = options.config();
            CachingCardSource source = CachingCardSource.create(new ScryfallClient(config), config);

            Optional<Deck> deck = loadDeck(options, source);
            if (deck.isEmpty()) {
                return 1;
            }

            RecommendationEngine engine = new RecommendationEngine(source, config.pageLimit());
            DeckAnalysis analysis = engine.analyze(deck.get());

            if (options.json) {
                System.out.println(toJson(analysis));
            } else {
                printAnalysis(deck.get(), analysis);
            }
            return 0;
        }
    }

    // ========== RECOMMEND COMMAND ==========
    @Command(name = "recommend", description = "Recommend cards for a deck")
    static class RecommendCommand implements Callable<Integer> {
        @Mixin
        DeckOptions options;

        @Option(names = {"-c", "--collection"},
                description = "Owned cards ('COUNT Card Name' per line)")
        Path collectionPath;

        @Option(names = {"-n", "--count"}, defaultValue = "20",
                description = "Number of recommendations")
        int count;

        @Override
        public Integer call() throws Exception {
            if (count < 1) {
                System.err.println("✗ --count must be positive");
                return 1;
            }
            AdvisorConfig config = options.config();
            log.debug("Configuration: {}", config.summary());
            CachingCardSource source = CachingCardSource.create(new ScryfallClient(config), config);

            Optional<Deck> deck = loadDeck(options, source);
            if (deck.isEmpty()) {
                return 1;
            }

            Collection collection = Collection.empty();
            if (collectionPath != null) {
                try {
                    collection = DeckListParser.parseCollectionFile(collectionPath);
                    System.err.println("✓ Loaded collection of " + collection.uniqueCards() + " cards");
                } catch (DeckListParser.DeckException e) {
                    System.err.println("✗ Failed to parse collection '" + collectionPath + "': " + e.getMessage());
                    return 1;
                }
            }

            RecommendationEngine engine = new RecommendationEngine(source, config.pageLimit());
            long startTime = System.currentTimeMillis();
            List<SmartRecommendation> recommendations = engine.recommendWithProgress(
                    deck.get(), collection, count, options.formatOrDefault(),
                    (phase, gathered, total, partial) ->
                            System.err.printf("  [%s] %d/%d candidates%n", phase.getLabel(), gathered, total));
            long elapsed = System.currentTimeMillis() - startTime;
            System.err.printf("✓ %d recommendations in %.1fs (%d service requests)%n",
                    recommendations.size(), elapsed / 1000.0, source.getOutboundRequests());

            if (options.json) {
                System.out.println(toJson(recommendations));
            } else {
                printRecommendations(recommendations);
            }
            return 0;
        }
    }

    // ========== HELPERS ==========

    static Optional<Deck> loadDeck(DeckOptions options, CachingCardSource source) {
        CardDatabase db = null;
        if (options.cardsPath != null) {
            try {
                db = CardDatabase.fromFile(options.cardsPath);
                System.err.println("✓ Loaded " + db.cardCount() + " cards from " + options.cardsPath);
            } catch (CardSourceException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return Optional.empty();
            }
        }

        CardDatabase local = db;
        DeckListParser parser = new DeckListParser(name -> {
            Optional<Card> card = local != null ? local.find(name) : Optional.empty();
            return card.isPresent() ? card : source.getByName(name);
        });

        try {
            Deck deck = parser.parseDeckFile(options.deckPath, options.formatOrDefault());
            for (String name : DeckListParser.playsetViolations(deck)) {
                System.err.println("⚠ More than " + Deck.PLAYSET_LIMIT + " copies of " + name);
            }
            return Optional.of(deck);
        } catch (DeckListParser.DeckException e) {
            System.err.println("✗ Failed to parse deck file '" + options.deckPath + "': " + e.getMessage());
            return Optional.empty();
        }
    }

    static String toJson(Object value) throws JsonProcessingException {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsString(value);
    }

    static void printAnalysis(Deck deck, DeckAnalysis analysis) {
        System.out.println("\n=== Deck Analysis: " + deck.getName() + " ===\n");
        System.out.println("Cards:      " + analysis.totalCards() + " (" + analysis.nonLandCards() + " non-land)");
        System.out.println("Archetype:  " + analysis.archetype());
        System.out.println("Strategy:   " + analysis.strategy());
        System.out.println("Colors:     " + symbols(analysis.colors())
                + " (primary " + symbols(analysis.primaryColors()) + ")");
        System.out.printf("Avg CMC:    %.2f%n", analysis.averageCmc());
        System.out.println("Themes:     " + (analysis.themes().isEmpty() ? "none"
                : analysis.themes().stream().map(Object::toString).collect(Collectors.joining(", "))));

        System.out.println("\nMana curve:");
        for (Map.Entry<Integer, Integer> entry : analysis.curve().entrySet()) {
            String label = entry.getKey() >= DeckAnalysis.MAX_CURVE_BUCKET ? entry.getKey() + "+" : entry.getKey() + " ";
            System.out.printf("  %s | %-20s %d%n", label, "#".repeat(Math.min(20, entry.getValue())), entry.getValue());
        }

        DeckHealth health = analysis.health();
        System.out.println("\nHealth:");
        System.out.printf("  Curve:             %3d%n", health.curve());
        System.out.printf("  Color consistency: %3d%n", health.colorConsistency());
        System.out.printf("  Card balance:      %3d%n", health.cardBalance());
        System.out.printf("  Mana efficiency:   %3d%n", health.manaEfficiency());
        System.out.printf("  Overall:           %3d%n", health.overall());
    }

    static void printRecommendations(List<SmartRecommendation> recommendations) {
        System.out.println("\n=== Recommendations ===\n");
        System.out.printf("%-32s %-14s %6s %6s %6s %6s  %s%n",
                "Card", "Cost", "Conf", "Syn", "Meta", "Fit", "Status");
        System.out.println("-".repeat(100));
        for (SmartRecommendation rec : recommendations) {
            System.out.printf("%-32s %-14s %5.1f%% %5.1f%% %5.1f%% %5.1f%%  %s%n",
                    truncate(rec.name(), 32), truncate(rec.manaCost(), 14),
                    rec.confidence(), rec.synergyScore(), rec.metaScore(), rec.deckFit(),
                    rec.costConsideration());
            if (!rec.reasons().isEmpty()) {
                System.out.println("    " + String.join("; ", rec.reasons().subList(0, Math.min(3, rec.reasons().size()))));
            }
        }
    }

    private static String symbols(List<ManaColor> colors) {
        if (colors.isEmpty()) {
            return "colorless";
        }
        StringBuilder sb = new StringBuilder();
        for (ManaColor color : colors) {
            sb.append(color.getSymbol());
        }
        return sb.toString();
    }

    private static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max - 1) + "…";
    }
}
