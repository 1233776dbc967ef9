package com.publicdomain.matching.matching;

import com.publicdomain.matching.rules.TextNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects derived works such as indexes, bibliographies, supplements and concordances.
 * Their titles name the original work, which makes them look like strong matches for it.
 * English patterns are also tried for other languages at 90% confidence.
 */
public class DerivedWorkDetector {

    private static final double CROSS_LANGUAGE_FACTOR = 0.9;

    private record DerivedPattern(Pattern pattern, double confidence, String kind) {
        static DerivedPattern of(String regex, double confidence, String kind) {
            return new DerivedPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), confidence, kind);
        }
    }

    private static final List<DerivedPattern> ENGLISH = List.of(
            DerivedPattern.of("^index\\s+(to|of|for)\\s+", 0.95, "index"),
            DerivedPattern.of("^bibliography\\s+(of|for|on)\\s+", 0.95, "bibliography"),
            DerivedPattern.of("^supplement\\s+(to|for)\\s+", 0.9, "supplement"),
            DerivedPattern.of("^guide\\s+(to|for)\\s+", 0.8, "guide"),
            DerivedPattern.of("^handbook\\s+(of|for|on)\\s+", 0.8, "handbook"),
            DerivedPattern.of("^companion\\s+(to|for)\\s+", 0.85, "companion"),
            DerivedPattern.of("^introduction\\s+to\\s+", 0.7, "introduction"),
            DerivedPattern.of("^abstracts?\\s+(of|from)\\s+", 0.9, "abstract"),
            DerivedPattern.of("^digest\\s+(of|from)\\s+", 0.85, "digest"),
            DerivedPattern.of("^concordance\\s+(to|of)\\s+", 0.95, "concordance"),
            DerivedPattern.of("^selected\\s+(readings?|works?|papers?)\\s+(from|of)\\s+", 0.8, "selection"),
            DerivedPattern.of("^excerpts?\\s+(from|of)\\s+", 0.85, "excerpt"),
            DerivedPattern.of("\\s+index$", 0.9, "index_suffix"),
            DerivedPattern.of("\\s+bibliography$", 0.9, "bibliography_suffix"),
            DerivedPattern.of("\\s+supplement$", 0.85, "supplement_suffix")
    );

    private static final Map<String, List<DerivedPattern>> PATTERNS = Map.of(
            "eng", ENGLISH,
            "fre", List.of(
                    DerivedPattern.of("^index\\s+(de|des|du|pour)\\s+", 0.95, "index"),
                    DerivedPattern.of("^bibliographie\\s+(de|des|du|sur)\\s+", 0.95, "bibliographie"),
                    DerivedPattern.of("^supplement\\s+(au?|de|du|pour)\\s+", 0.9, "supplement"),
                    DerivedPattern.of("^guide\\s+(de|des|du|pour)\\s+", 0.8, "guide"),
                    DerivedPattern.of("^manuel\\s+(de|des|du)\\s+", 0.8, "manuel"),
                    DerivedPattern.of("^introduction\\s+a\\s+", 0.7, "introduction"),
                    DerivedPattern.of("^abrege\\s+(de|des|du)\\s+", 0.85, "abrege"),
                    DerivedPattern.of("^extraits?\\s+(de|des|du)\\s+", 0.85, "extrait"),
                    DerivedPattern.of("^concordance\\s+(de|des|du)\\s+", 0.95, "concordance"),
                    DerivedPattern.of("\\s+index$", 0.9, "index_suffix"),
                    DerivedPattern.of("\\s+bibliographie$", 0.9, "bibliographie_suffix")),
            "ger", List.of(
                    DerivedPattern.of("^index\\s+(zu|von|fur)\\s+", 0.95, "index"),
                    DerivedPattern.of("^register\\s+(zu|von|fur)\\s+", 0.95, "register"),
                    DerivedPattern.of("^bibliographie\\s+(zu|von|uber)\\s+", 0.95, "bibliographie"),
                    DerivedPattern.of("^erganzung\\s+(zu|zur|zum|von)\\s+", 0.9, "ergaenzung"),
                    DerivedPattern.of("^nachtrag\\s+(zu|zur|zum|von)\\s+", 0.9, "nachtrag"),
                    DerivedPattern.of("^handbuch\\s+(der|des|zu|zur|zum|uber)\\s+", 0.8, "handbuch"),
                    DerivedPattern.of("^einfuhrung\\s+in\\s+", 0.7, "einfuehrung"),
                    DerivedPattern.of("^auszuge?\\s+(aus|von)\\s+", 0.85, "auszug"),
                    DerivedPattern.of("^konkordanz\\s+(zu|zur|zum|von)\\s+", 0.95, "konkordanz")),
            "spa", List.of(
                    DerivedPattern.of("^indice\\s+(de|del|para)\\s+", 0.95, "indice"),
                    DerivedPattern.of("^bibliografia\\s+(de|del|sobre)\\s+", 0.95, "bibliografia"),
                    DerivedPattern.of("^suplemento\\s+(de|del|al?|para)\\s+", 0.9, "suplemento"),
                    DerivedPattern.of("^guia\\s+(de|del|para)\\s+", 0.8, "guia"),
                    DerivedPattern.of("^manual\\s+(de|del)\\s+", 0.8, "manual"),
                    DerivedPattern.of("^introduccion\\s+a\\s+", 0.7, "introduccion"),
                    DerivedPattern.of("^extractos?\\s+(de|del)\\s+", 0.85, "extracto"),
                    DerivedPattern.of("^concordancia\\s+(de|del)\\s+", 0.95, "concordancia")),
            "ita", List.of(
                    DerivedPattern.of("^indice\\s+(di|del|per)\\s+", 0.95, "indice"),
                    DerivedPattern.of("^bibliografia\\s+(di|del|su)\\s+", 0.95, "bibliografia"),
                    DerivedPattern.of("^supplemento\\s+(di|del|al?|per)\\s+", 0.9, "supplemento"),
                    DerivedPattern.of("^guida\\s+(di|del|per|a)\\s+", 0.8, "guida"),
                    DerivedPattern.of("^manuale\\s+(di|del)\\s+", 0.8, "manuale"),
                    DerivedPattern.of("^introduzione\\s+a\\s+", 0.7, "introduzione"),
                    DerivedPattern.of("^estratti?\\s+(da|di|del)\\s+", 0.85, "estratto"),
                    DerivedPattern.of("^concordanza\\s+(di|del)\\s+", 0.95, "concordanza"))
    );

    /**
     * Checks a single title, keeping the highest-confidence pattern that matches.
     */
    public DerivedWorkInfo detect(String title, String language) {
        if (title == null || title.isBlank()) {
            return DerivedWorkInfo.NONE;
        }
        String normalized = TextNormalizer.foldToAscii(title).toLowerCase(Locale.ROOT).trim();
        String lang = language != null && PATTERNS.containsKey(language) ? language : "eng";

        DerivedWorkInfo best = DerivedWorkInfo.NONE;
        for (DerivedPattern p : PATTERNS.get(lang)) {
            if (p.confidence() > best.confidence() && p.pattern().matcher(normalized).find()) {
                best = new DerivedWorkInfo(true, p.kind(), p.confidence());
            }
        }
        if (!"eng".equals(lang)) {
            for (DerivedPattern p : ENGLISH) {
                double adjusted = p.confidence() * CROSS_LANGUAGE_FACTOR;
                if (adjusted > best.confidence() && p.pattern().matcher(normalized).find()) {
                    best = new DerivedWorkInfo(true, p.kind() + "_eng", adjusted);
                }
            }
        }
        return best;
    }
}
