package com.publicdomain.matching.rules;

import com.publicdomain.matching.core.model.FieldKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null, FieldKind.TITLE, "eng"));
        assertEquals("", engine.normalize("", FieldKind.TITLE, "eng"));
        assertEquals("", engine.normalize("   ", FieldKind.TITLE, "eng"));
    }

    @ParameterizedTest
    @DisplayName("Should expand publishing abbreviations")
    @CsvSource({
            "harper & bros.,harper and brothers",
            "doubleday doran & co.,doubleday doran and company",
            "macmillan co,macmillan company",
            "yale univ. press,yale university press",
            "natl. geographic soc.,national geographic society",
            "charles scribner's sons,charles scribners sons"
    })
    void testAbbreviations(String input, String expected) {
        assertEquals(expected, engine.normalize(input, FieldKind.PUBLISHER, "eng"));
    }

    @Test
    @DisplayName("Should normalize ampersand per language")
    void testAmpersand() {
        assertEquals("procter and gamble", engine.normalize("procter & gamble", FieldKind.PUBLISHER, "eng"));
        assertEquals("plon et nourrit", engine.normalize("plon & nourrit", FieldKind.PUBLISHER, "fre"));
        assertEquals("ullstein und sohn", engine.normalize("ullstein&sohn", FieldKind.PUBLISHER, "ger"));
    }

    @ParameterizedTest
    @DisplayName("Should normalize numbers in titles")
    @CsvSource({
            "henry viii,henry 8",
            "world war ii,world war 2",
            "chapter xxiv,chapter 24",
            "twenty-one stories,21 stories",
            "second series,2 series",
            "the 3rd edition,the 3 edition",
            "three men in a boat,3 men in a boat",
            "i am a cat,i am a cat"
    })
    void testNumbers(String input, String expected) {
        assertEquals(expected, engine.normalize(input, FieldKind.TITLE, "eng"));
    }

    @Test
    @DisplayName("Should apply language-specific number words")
    void testLanguageNumbers() {
        assertEquals("tome 2", engine.normalize("tome deuxieme", FieldKind.TITLE, "fre"));
        assertEquals("die 3 musketiere", engine.normalize("die drei musketiere", FieldKind.TITLE, "ger"));
        assertEquals("tome deuxieme", engine.normalize("tome deuxieme", FieldKind.TITLE, "eng"));
    }

    @Test
    @DisplayName("Should strip punctuation and collapse whitespace")
    void testPunctuation() {
        assertEquals("the sun also rises a novel",
                engine.normalize("the sun also rises : a novel /", FieldKind.TITLE, "eng"));
        assertEquals("big blue", engine.normalize("big    blue", FieldKind.TITLE, "eng"));
    }

    @Test
    @DisplayName("Should leave abbreviations alone when expansion is off")
    void testNoAbbreviationExpansion() {
        NormalizationEngine plain = DefaultNormalizationRules.createEngine(false);

        assertEquals("harper and bros", plain.normalize("harper & bros.", FieldKind.PUBLISHER, "eng"));
    }

    @Test
    @DisplayName("Should apply rules in priority order")
    void testRulePriority() {
        NormalizationRule late = NormalizationRule.builder()
                .name("late").pattern("b").replacement("c").priority(20).build();
        NormalizationRule early = NormalizationRule.builder()
                .name("early").pattern("a").replacement("b").priority(10).build();

        NormalizationEngine custom = new NormalizationEngine(List.of(late, early));

        assertEquals("early", custom.getRules().get(0).getName());
        assertEquals("cc", custom.normalize("ab", FieldKind.TITLE, "eng"));
    }

    @Test
    @DisplayName("Field-specific rules should only apply to their fields")
    void testFieldSpecificRule() {
        NormalizationRule rule = NormalizationRule.builder()
                .name("publisher-only").pattern("press").replacement("").applicableFields(FieldKind.PUBLISHER).build();
        NormalizationEngine custom = new NormalizationEngine(List.of(rule));

        assertEquals("yale", custom.normalize("yale press", FieldKind.PUBLISHER, "eng"));
        assertEquals("yale press", custom.normalize("yale press", FieldKind.TITLE, "eng"));
        assertTrue(rule.appliesTo(FieldKind.PUBLISHER, null));
    }

    @ParameterizedTest
    @DisplayName("Should convert Roman numerals")
    @CsvSource({"ii,2", "iv,4", "ix,9", "xiv,14", "xxxix,39"})
    void testRomanToInt(String roman, int expected) {
        assertEquals(expected, DefaultNormalizationRules.romanToInt(roman));
    }
}
