package com.mtg.advisor.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.ColorFlags;
import com.mtg.advisor.card.Rarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts Scryfall card objects into {@link Card}s.
 * Double-faced cards keep the full name but read cost, type, text and stats from the front face.
 */
public final class ScryfallCardMapper {
    private static final Logger log = LoggerFactory.getLogger(ScryfallCardMapper.class);

    private ScryfallCardMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Map a Scryfall "list" object's data array.
     * Entries without a name, or that cannot be mapped, are skipped.
     */
    public static List<Card> fromList(JsonNode list) {
        JsonNode data = list.path("data");
        List<Card> cards = new ArrayList<>();
        for (JsonNode node : data) {
            if (!node.hasNonNull("name")) {
                continue;
            }
            try {
                cards.add(fromCard(node));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable card '{}': {}", node.get("name").asText(), e.toString());
            }
        }
        return cards;
    }

    public static Card fromCard(JsonNode node) {
        JsonNode face = node;
        JsonNode faces = node.path("card_faces");
        if (faces.isArray() && !faces.isEmpty() && !node.hasNonNull("mana_cost")) {
            face = faces.get(0);
        }

        Card.Builder builder = Card.builder(node.path("name").asText())
                .manaCost(text(face, "mana_cost"))
                .typeLine(firstText(face, node, "type_line"))
                .oracleText(firstText(face, node, "oracle_text"))
                .power(firstText(face, node, "power"))
                .toughness(firstText(face, node, "toughness"))
                .rarity(Rarity.fromString(text(node, "rarity")))
                .setCode(text(node, "set"));

        if (node.has("cmc") && node.get("cmc").isNumber()) {
            builder.cmc((int) node.get("cmc").asDouble());
        }
        JsonNode colors = node.has("colors") ? node.get("colors") : face.get("colors");
        if (colors != null && colors.isArray()) {
            builder.colors(colorsOf(colors));
        }
        JsonNode identity = node.get("color_identity");
        if (identity != null && identity.isArray()) {
            builder.colorIdentity(colorsOf(identity));
        }
        JsonNode legalities = node.path("legalities");
        Iterator<Map.Entry<String, JsonNode>> fields = legalities.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            builder.legality(entry.getKey(), entry.getValue().asText());
        }
        return builder.build();
    }

    private static ColorFlags colorsOf(JsonNode array) {
        StringBuilder symbols = new StringBuilder();
        for (JsonNode color : array) {
            symbols.append(color.asText());
        }
        return ColorFlags.parse(symbols.toString());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstText(JsonNode face, JsonNode card, String field) {
        String value = text(face, field);
        return value != null ? value : text(card, field);
    }
}
