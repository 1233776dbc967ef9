package com.publicdomain.matching.core.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Objects;

/**
 * A copyright registration or renewal entry. Owned by a candidate index; the matcher only
 * reads it. Renewals may carry the full entry text, which holds a richer publisher string
 * than the extracted field.
 */
@JsonDeserialize(builder = CandidateRecord.Builder.class)
public final class CandidateRecord {
    private final String sourceId;
    private final SourceType sourceType;
    private final String title;
    private final String author;
    private final String mainAuthor;
    private final String publisher;
    private final Integer year;
    private final String pubDate;
    private final String normalizedLccn;
    private final String fullText;

    private CandidateRecord(Builder builder) {
        this.sourceId = InputRecord.nullToEmpty(builder.sourceId);
        this.sourceType = Objects.requireNonNull(builder.sourceType, "sourceType is required");
        this.title = InputRecord.nullToEmpty(builder.title);
        this.author = InputRecord.nullToEmpty(builder.author);
        this.mainAuthor = InputRecord.nullToEmpty(builder.mainAuthor);
        this.publisher = InputRecord.nullToEmpty(builder.publisher);
        this.year = builder.year;
        this.pubDate = InputRecord.nullToEmpty(builder.pubDate);
        this.normalizedLccn = builder.normalizedLccn == null || builder.normalizedLccn.isBlank()
                ? null : builder.normalizedLccn;
        this.fullText = InputRecord.nullToEmpty(builder.fullText);
    }

    public String getSourceId() {
        return sourceId;
    }

    public SourceType getSourceType() {
        return sourceType;
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

    public String getPubDate() {
        return pubDate;
    }

    public String getNormalizedLccn() {
        return normalizedLccn;
    }

    public String getFullText() {
        return fullText;
    }

    public boolean hasAuthorData() {
        return !author.isBlank() || !mainAuthor.isBlank();
    }

    public boolean hasPublisher() {
        return !publisher.isBlank();
    }

    public boolean hasFullText() {
        return !fullText.isBlank();
    }

    /**
     * True when there is any publisher text to compare against: the extracted field,
     * or for renewals the full entry text.
     */
    public boolean hasPublisherText() {
        return hasPublisher() || hasFullText();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CandidateRecord that = (CandidateRecord) o;
        return sourceId.equals(that.sourceId)
                && sourceType == that.sourceType
                && title.equals(that.title)
                && author.equals(that.author)
                && mainAuthor.equals(that.mainAuthor)
                && publisher.equals(that.publisher)
                && Objects.equals(year, that.year)
                && pubDate.equals(that.pubDate)
                && Objects.equals(normalizedLccn, that.normalizedLccn)
                && fullText.equals(that.fullText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, sourceType, title, author, mainAuthor, publisher, year, pubDate,
                normalizedLccn, fullText);
    }

    @Override
    public String toString() {
        return "CandidateRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", sourceType=" + sourceType +
                ", title='" + title + '\'' +
                ", year=" + year +
                '}';
    }

    public Builder toBuilder() {
        return new Builder()
                .sourceId(sourceId)
                .sourceType(sourceType)
                .title(title)
                .author(author)
                .mainAuthor(mainAuthor)
                .publisher(publisher)
                .year(year)
                .pubDate(pubDate)
                .normalizedLccn(normalizedLccn)
                .fullText(fullText);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String sourceId;
        private SourceType sourceType = SourceType.REGISTRATION;
        private String title;
        private String author;
        private String mainAuthor;
        private String publisher;
        private Integer year;
        private String pubDate;
        private String normalizedLccn;
        private String fullText;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder sourceType(SourceType sourceType) {
            this.sourceType = sourceType;
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

        public Builder pubDate(String pubDate) {
            this.pubDate = pubDate;
            return this;
        }

        public Builder normalizedLccn(String normalizedLccn) {
            this.normalizedLccn = normalizedLccn;
            return this;
        }

        public Builder fullText(String fullText) {
            this.fullText = fullText;
            return this;
        }

        public CandidateRecord build() {
            return new CandidateRecord(this);
        }
    }
}
