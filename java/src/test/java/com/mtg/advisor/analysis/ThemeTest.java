package com.mtg.advisor.analysis;

import com.mtg.advisor.card.Card;
import com.mtg.advisor.card.Rarity;
import com.mtg.advisor.deck.DeckFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThemeTest {

    @Test
    void testTribalFromTypeLine() {
        assertEquals(List.of(Theme.GOBLIN), Theme.detect(DeckFixtures.GOBLIN_GUIDE));
    }

    @Test
    void testMechanicalFromRulesText() {
        assertEquals(List.of(Theme.BURN), Theme.detect(DeckFixtures.LIGHTNING_BOLT));
    }

    @Test
    void testTribalWordInRulesTextIsNotTribal() {
        Card command = DeckFixtures.spell("Krenko's Command", "{1}{R}", "Sorcery",
                "Create two 1/1 red Goblin creature tokens.", Rarity.COMMON);
        List<Theme> themes = Theme.detect(command);
        assertTrue(themes.contains(Theme.TOKENS));
        assertFalse(themes.contains(Theme.GOBLIN));
    }

    @Test
    void testTribalFromName() {
        Card mystic = DeckFixtures.creature("Elvish Mystic", "{G}", "Creature — Elf Druid", "1/1",
                "{T}: Add {G}.", Rarity.COMMON);
        List<Theme> themes = Theme.detect(mystic);
        assertTrue(themes.contains(Theme.ELF));
        assertTrue(themes.contains(Theme.RAMP));
    }

    @Test
    void testMatchesCard() {
        assertTrue(Theme.BURN.matches(DeckFixtures.CHAR));
        assertFalse(Theme.BURN.matches(DeckFixtures.SWIFTSPEAR));
        assertTrue(Theme.SPELLS_MATTER.matches(DeckFixtures.SWIFTSPEAR));
    }

    @Test
    void testSearchFragments() {
        assertEquals("t:goblin", Theme.GOBLIN.getSearchFragment());
        assertTrue(Theme.GOBLIN.isTribal());
        assertFalse(Theme.BURN.isTribal());
        assertEquals("spells matter", Theme.SPELLS_MATTER.getLabel());
    }
}
