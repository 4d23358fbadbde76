package com.mtg.advisor.card;

/**
 * Mana cost for a card.
 * Parses both Scryfall brace notation ("{2}{R}{R}") and compact notation ("2RR").
 */
public final class ManaCost {
    private static final ManaCost EMPTY = new ManaCost("", 0, 0, 0, 0, 0, 0, 0, 0);

    private final String text;
    private final int white;
    private final int blue;
    private final int black;
    private final int red;
    private final int green;
    private final int colorless;
    private final int generic;
    private final int hybrid;

    private ManaCost(String text, int white, int blue, int black, int red, int green,
                     int colorless, int generic, int hybrid) {
        this.text = text;
        this.white = white;
        this.blue = blue;
        this.black = black;
        this.red = red;
        this.green = green;
        this.colorless = colorless;
        this.generic = generic;
        this.hybrid = hybrid;
    }

    public static ManaCost empty() {
        return EMPTY;
    }

    /**
     * Calculate the converted mana cost (total mana value).
     * X costs count as zero, hybrid and phyrexian symbols count as one.
     */
    public int getCMC() {
        return white + blue + black + red + green + colorless + generic + hybrid;
    }

    /**
     * Get the amount of a specific color required by single-color symbols.
     */
    public int getColorAmount(ManaColor color) {
        return switch (color) {
            case WHITE -> white;
            case BLUE -> blue;
            case BLACK -> black;
            case RED -> red;
            case GREEN -> green;
            case COLORLESS -> colorless;
        };
    }

    /**
     * Colors appearing anywhere in the cost, hybrid halves included.
     */
    public ColorFlags getColors() {
        return ColorFlags.parse(text.replaceAll("[^WUBRGwubrg]", ""));
    }

    /**
     * Parse a mana cost string like "1BB", "{2}{G}", "{W/U}{W/U}" or "{X}{R}".
     * Split cards ("{1}{R} // {2}{U}") only contribute their first half.
     * Symbols that are not mana (funny-set symbols, stray characters) are ignored.
     */
    public static ManaCost parse(String costString) {
        if (costString == null || costString.isBlank()) {
            return EMPTY;
        }
        String cost = costString.trim();
        int split = cost.indexOf("//");
        if (split >= 0) {
            cost = cost.substring(0, split).trim();
        }
        Counts counts = new Counts();
        if (cost.indexOf('{') >= 0) {
            int i = 0;
            while (i < cost.length()) {
                int open = cost.indexOf('{', i);
                if (open < 0) {
                    break;
                }
                int close = cost.indexOf('}', open);
                if (close < 0) {
                    // Unterminated symbol runs to the end of the cost
                    close = cost.length();
                }
                counts.addSymbol(cost.substring(open + 1, close));
                i = close + 1;
            }
        } else {
            StringBuilder genericBuilder = new StringBuilder();
            for (char c : cost.toCharArray()) {
                if (Character.isDigit(c)) {
                    genericBuilder.append(c);
                } else if (!Character.isWhitespace(c)) {
                    counts.addSymbol(String.valueOf(c));
                }
            }
            if (!genericBuilder.isEmpty()) {
                counts.generic += Integer.parseInt(genericBuilder.toString());
            }
        }
        return new ManaCost(cost, counts.white, counts.blue, counts.black, counts.red, counts.green,
                counts.colorless, counts.generic, counts.hybrid);
    }

    // Getters
    public int getWhite() { return white; }
    public int getBlue() { return blue; }
    public int getBlack() { return black; }
    public int getRed() { return red; }
    public int getGreen() { return green; }
    public int getColorless() { return colorless; }
    public int getGeneric() { return generic; }
    public int getHybrid() { return hybrid; }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public String toString() {
        return text;
    }

    private static final class Counts {
        int white, blue, black, red, green, colorless, generic, hybrid;

        void addSymbol(String symbol) {
            String s = symbol.trim().toUpperCase();
            if (s.isEmpty()) {
                return;
            }
            if (s.chars().allMatch(Character::isDigit)) {
                generic += Integer.parseInt(s);
                return;
            }
            if (s.indexOf('/') >= 0) {
                // {W/U}, {2/W}, {R/P}
                hybrid++;
                return;
            }
            switch (s) {
                case "W" -> white++;
                case "U" -> blue++;
                case "B" -> black++;
                case "R" -> red++;
                case "G" -> green++;
                case "C" -> colorless++;
                case "X", "Y", "Z" -> { }
                case "S" -> generic++;
                default -> {
                    // Unknown symbols ({HW}, {∞}, {½}) add nothing
                }
            }
        }
    }
}
