package com.publicdomain.matching.core.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * A catalog record whose copyright status is being determined.
 * Immutable once built; match outcomes are attached through {@link MatchedRecord}.
 */
@JsonDeserialize(builder = InputRecord.Builder.class)
public final class InputRecord {
    private final String sourceId;
    private final String title;
    private final String author;
    private final String mainAuthor;
    private final String publisher;
    private final Integer year;
    private final String normalizedLccn;
    private final String languageCode;
    private final String countryCode;

    private InputRecord(Builder builder) {
        this.sourceId = builder.sourceId;
        this.title = nullToEmpty(builder.title);
        this.author = nullToEmpty(builder.author);
        this.mainAuthor = nullToEmpty(builder.mainAuthor);
        this.publisher = nullToEmpty(builder.publisher);
        this.year = builder.year;
        this.normalizedLccn = builder.normalizedLccn == null || builder.normalizedLccn.isBlank()
                ? null : builder.normalizedLccn;
        this.languageCode = nullToEmpty(builder.languageCode);
        this.countryCode = nullToEmpty(builder.countryCode);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getMainAuthor() {
        return mainAuthor;
    }

    public String getPublisher() {
        return publisher;
    }

    public Integer getYear() {
        return year;
    }

    public String getNormalizedLccn() {
        return normalizedLccn;
    }

    public String getLanguageCode() {
        return languageCode;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public boolean hasYear() {
        return year != null;
    }

    public boolean hasAuthorData() {
        return !author.isBlank() || !mainAuthor.isBlank();
    }

    public boolean hasPublisher() {
        return !publisher.isBlank();
    }

    public boolean hasLccn() {
        return normalizedLccn != null;
    }

    public CountryClassification countryClassification() {
        return CountryClassification.fromCountryCode(countryCode);
    }

    /**
     * Language to use for text processing, falling back to the given default when unset.
     */
    public String languageOr(String defaultLanguage) {
        return languageCode.isBlank() ? defaultLanguage : languageCode;
    }

    public Builder toBuilder() {
        return new Builder()
                .sourceId(sourceId)
                .title(title)
                .author(author)
                .mainAuthor(mainAuthor)
                .publisher(publisher)
                .year(year)
                .normalizedLccn(normalizedLccn)
                .languageCode(languageCode)
                .countryCode(countryCode);
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InputRecord that = (InputRecord) o;
        return Objects.equals(sourceId, that.sourceId)
                && title.equals(that.title)
                && author.equals(that.author)
                && mainAuthor.equals(that.mainAuthor)
                && publisher.equals(that.publisher)
                && Objects.equals(year, that.year)
                && Objects.equals(normalizedLccn, that.normalizedLccn)
                && languageCode.equals(that.languageCode)
                && countryCode.equals(that.countryCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, title, author, mainAuthor, publisher, year, normalizedLccn,
                languageCode, countryCode);
    }

    @Override
    public String toString() {
        return "InputRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", title='" + title + '\'' +
                ", year=" + year +
                ", lccn=" + normalizedLccn +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String sourceId;
        private String title;
        private String author;
        private String mainAuthor;
        private String publisher;
        private Integer year;
        private String normalizedLccn;
        private String languageCode;
        private String countryCode;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder mainAuthor(String mainAuthor) {
            this.mainAuthor = mainAuthor;
            return this;
        }

        public Builder publisher(String publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder normalizedLccn(String normalizedLccn) {
            this.normalizedLccn = normalizedLccn;
            return this;
        }

        public Builder languageCode(String languageCode) {
            this.languageCode = languageCode;
            return this;
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public InputRecord build() {
            return new InputRecord(this);
        }
    }
}
