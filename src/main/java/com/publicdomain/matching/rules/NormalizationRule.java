package com.publicdomain.matching.rules;

import com.publicdomain.matching.core.model.FieldKind;

import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied during text normalization.
 * Rules have priority ordering and can be scoped to specific fields and languages.
 * The replacement is either a fixed string or a function of the match.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Function<MatchResult, String> replacer;
    private final Set<FieldKind> applicableFields;
    private final Set<String> languages;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.replacement = builder.replacement;
        this.replacer = builder.replacer;
        this.applicableFields = builder.applicableFields != null ?
                Set.copyOf(builder.applicableFields) : Set.of();
        this.languages = builder.languages != null ? Set.copyOf(builder.languages) : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Set<FieldKind> getApplicableFields() {
        return applicableFields;
    }

    public Set<String> getLanguages() {
        return languages;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Checks if this rule applies to the given field and language.
     * Empty field or language sets mean the rule applies to all.
     */
    public boolean appliesTo(FieldKind field, String language) {
        boolean fieldMatches = field == null || applicableFields.isEmpty() || applicableFields.contains(field);
        boolean languageMatches = languages.isEmpty() || (language != null && languages.contains(language));
        return fieldMatches && languageMatches;
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        if (replacer != null) {
            return pattern.matcher(input).replaceAll(replacer);
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private Function<MatchResult, String> replacer;
        private Set<FieldKind> applicableFields;
        private Set<String> languages;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder replacer(Function<MatchResult, String> replacer) {
            this.replacer = replacer;
            return this;
        }

        public Builder applicableFields(FieldKind... fields) {
            this.applicableFields = Set.of(fields);
            return this;
        }

        public Builder languages(String... languages) {
            this.languages = Set.of(languages);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            if (replacement == null && replacer == null) {
                throw new NullPointerException("replacement or replacer is required");
            }
            return new NormalizationRule(this);
        }
    }
}
