package com.mtg.advisor.card;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Bitflag representation of a set of colors, used for identity and overlap checks.
 * Instances are immutable.
 */
public final class ColorFlags {
    public static final int WHITE = 1 << 0;     // 1
    public static final int BLUE = 1 << 1;      // 2
    public static final int BLACK = 1 << 2;     // 4
    public static final int RED = 1 << 3;       // 8
    public static final int GREEN = 1 << 4;     // 16
    public static final int COLORLESS = 1 << 5; // 32

    private static final ColorFlags NONE = new ColorFlags(0);

    private final int flags;

    private ColorFlags(int flags) {
        this.flags = flags;
    }

    public static ColorFlags none() {
        return NONE;
    }

    public static ColorFlags of(ManaColor... colors) {
        int flags = 0;
        for (ManaColor color : colors) {
            flags |= color.getFlag();
        }
        return new ColorFlags(flags);
    }

    public static ColorFlags of(Collection<ManaColor> colors) {
        int flags = 0;
        for (ManaColor color : colors) {
            flags |= color.getFlag();
        }
        return new ColorFlags(flags);
    }

    /**
     * Parse a color string such as "WU" or "r g". Unknown characters are ignored.
     */
    public static ColorFlags parse(String symbols) {
        if (symbols == null) {
            return NONE;
        }
        int flags = 0;
        for (char c : symbols.toCharArray()) {
            switch (Character.toUpperCase(c)) {
                case 'W' -> flags |= WHITE;
                case 'U' -> flags |= BLUE;
                case 'B' -> flags |= BLACK;
                case 'R' -> flags |= RED;
                case 'G' -> flags |= GREEN;
                default -> { }
            }
        }
        return new ColorFlags(flags);
    }

    public ColorFlags with(ManaColor color) {
        return new ColorFlags(flags | color.getFlag());
    }

    public ColorFlags union(ColorFlags other) {
        return new ColorFlags(flags | other.flags);
    }

    public ColorFlags intersect(ColorFlags other) {
        return new ColorFlags(flags & other.flags);
    }

    public ColorFlags minus(ColorFlags other) {
        return new ColorFlags(flags & ~other.flags);
    }

    public boolean containsFlag(int flag) {
        return (this.flags & flag) != 0;
    }

    public boolean contains(ManaColor color) {
        return containsFlag(color.getFlag());
    }

    /**
     * True when every color in this set also appears in {@code other}.
     */
    public boolean isSubsetOf(ColorFlags other) {
        return (flags & ~other.flags) == 0;
    }

    public boolean isEmpty() {
        return flags == 0;
    }

    public int count() {
        return Integer.bitCount(flags);
    }

    public int getFlags() {
        return flags;
    }

    /**
     * Colors in WUBRG order.
     */
    public List<ManaColor> toList() {
        List<ManaColor> colors = new ArrayList<>(count());
        for (ManaColor color : ManaColor.WUBRG) {
            if (contains(color)) {
                colors.add(color);
            }
        }
        return colors;
    }

    /**
     * Symbol string in WUBRG order, e.g. "UR". Empty for colorless.
     */
    public String toSymbols() {
        StringBuilder sb = new StringBuilder();
        for (ManaColor color : toList()) {
            sb.append(color.getSymbol());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColorFlags other && other.flags == flags;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(flags);
    }

    @Override
    public String toString() {
        return isEmpty() ? "C" : toSymbols();
    }
}
