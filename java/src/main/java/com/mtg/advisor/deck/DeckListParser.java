package com.mtg.advisor.deck;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.CardNames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses deck and collection lists.
 * Format: "4 Card Name" per line ("4x Card Name" also accepted), comments with # or //.
 * A line reading "Sideboard" (optionally followed by a colon) moves later cards to the sideboard.
 */
public class DeckListParser {

    private final Function<String, Optional<Card>> resolver;

    /**
     * @param resolver looks up card data by exact name
     */
    public DeckListParser(Function<String, Optional<Card>> resolver) {
        this.resolver = resolver;
    }

    /**
     * One "COUNT NAME" line.
     */
    record Entry(int lineNumber, int count, String name) {}

    /**
     * Load a deck from a file. The deck is named after the file without its ".txt" extension.
     *
     * @throws DeckException if the file cannot be read, a line is malformed or a card is unknown
     */
    public Deck parseDeckFile(Path path, String format) throws DeckException {
        String fileName = path.getFileName().toString();
        String deckName = fileName.endsWith(".txt") ? fileName.substring(0, fileName.length() - 4) : fileName;
        return parseDeck(read(path), deckName, format);
    }

    /**
     * Parse deck list text.
     */
    public Deck parseDeck(String content, String deckName, String format) throws DeckException {
        Deck deck = new Deck(deckName, format, List.of());
        Zone zone = Zone.MAINBOARD;
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();
            if (isSideboardMarker(line)) {
                zone = Zone.SIDEBOARD;
                continue;
            }
            Entry entry = parseLine(line, lineNum + 1);
            if (entry == null) {
                continue;
            }
            Card card = resolver.apply(entry.name())
                .orElseThrow(() -> new DeckException("Card not found at line " + entry.lineNumber() + ": " + entry.name()));
            deck.addCard(card, entry.count(), zone);
        }
        return deck;
    }

    /**
     * Load a collection from a file in the same line format. Cards are not resolved.
     */
    public static Collection parseCollectionFile(Path path) throws DeckException {
        return parseCollection(read(path));
    }

    public static Collection parseCollection(String content) throws DeckException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        String[] lines = content.split("\n");
        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();
            if (isSideboardMarker(line)) {
                continue;
            }
            Entry entry = parseLine(line, lineNum + 1);
            if (entry != null) {
                counts.merge(entry.name(), entry.count(), Integer::sum);
            }
        }
        Collection.Builder builder = Collection.builder();
        counts.forEach(builder::add);
        return builder.build();
    }

    /**
     * Parse one line; null for blank lines and comments.
     */
    static Entry parseLine(String line, int lineNumber) throws DeckException {
        if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
            return null;
        }

        int spaceIdx = line.indexOf(' ');
        if (spaceIdx == -1) {
            throw new DeckException("Invalid deck format at line " + lineNumber
                    + ": Expected format 'COUNT CARD_NAME'");
        }

        String countStr = line.substring(0, spaceIdx);
        if (countStr.endsWith("x") || countStr.endsWith("X")) {
            countStr = countStr.substring(0, countStr.length() - 1);
        }
        String cardName = line.substring(spaceIdx + 1).trim();

        int count;
        try {
            count = Integer.parseInt(countStr);
        } catch (NumberFormatException e) {
            throw new DeckException("Invalid deck format at line " + lineNumber
                    + ": '" + countStr + "' is not a valid number");
        }
        if (count < 1) {
            throw new DeckException("Invalid deck format at line " + lineNumber + ": count must be positive");
        }
        if (cardName.isEmpty()) {
            throw new DeckException("Invalid deck format at line " + lineNumber + ": missing card name");
        }
        return new Entry(lineNumber, count, cardName);
    }

    private static boolean isSideboardMarker(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.equals("sideboard") || lower.equals("sideboard:");
    }

    private static String read(Path path) throws DeckException {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new DeckException("Failed to read file " + path + ": " + e.getMessage());
        }
    }

    /**
     * Names in a deck list that exceed the playset limit across zones (basic lands excepted).
     */
    public static List<String> playsetViolations(Deck deck) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (DeckCard entry : deck.getCards()) {
            if (entry.card().isBasicLand()) {
                continue;
            }
            String key = CardNames.normalize(entry.card().getName());
            totals.merge(key, entry.quantity(), Integer::sum);
            displayNames.putIfAbsent(key, entry.card().getName());
        }
        List<String> violations = new ArrayList<>();
        totals.forEach((key, total) -> {
            if (total > Deck.PLAYSET_LIMIT) {
                violations.add(displayNames.get(key));
            }
        });
        return violations;
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }
    }
}
