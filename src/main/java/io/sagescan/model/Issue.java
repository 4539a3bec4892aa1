package io.sagescan.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A single issue found during analysis.
 *
 * @param id            Content hash of (file path, rule/check id, start line); see {@link IssueIds}
 * @param title         Short title, also part of the dedup signature
 * @param description   Human-readable description
 * @param severity      Severity of the issue
 * @param category      Category of the issue
 * @param location      Where the issue was found
 * @param codeSnippet   Source excerpt around the location (if available)
 * @param suggestedFix  Suggested fix text (if available)
 * @param fixDescription Explanation of the suggested fix, set only by enrichment
 * @param aiExplanation Explanation set only by enrichment
 * @param confidence    Confidence in [0.0, 1.0]
 * @param autoFixable   Whether the issue can be fixed mechanically
 * @param ruleId        Originating rule or check id (if any)
 * @param metadata      Free-form extra data
 */
public record Issue(
        String id,
        String title,
        String description,
        Severity severity,
        Category category,
        Location location,
        String codeSnippet,
        String suggestedFix,
        String fixDescription,
        String aiExplanation,
        double confidence,
        boolean autoFixable,
        String ruleId,
        Map<String, Object> metadata
) {
    /**
     * Compact constructor with validation.
     */
    public Issue {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0], was " + confidence);
        }
        if (description == null) {
            description = "";
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String filePath() {
        return location.filePath();
    }

    public int startLine() {
        return location.startLine();
    }

    public Optional<String> rule() {
        return Optional.ofNullable(ruleId);
    }

    /**
     * Returns a copy carrying the enrichment fields. Null arguments keep the current value.
     */
    public Issue withEnrichment(String explanation, String fix, String fixText) {
        return new Issue(id, title, description, severity, category, location, codeSnippet,
                fix != null ? fix : suggestedFix,
                fixText != null ? fixText : fixDescription,
                explanation != null ? explanation : aiExplanation,
                confidence, autoFixable, ruleId, metadata);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .description(description)
                .severity(severity)
                .category(category)
                .location(location)
                .codeSnippet(codeSnippet)
                .suggestedFix(suggestedFix)
                .fixDescription(fixDescription)
                .aiExplanation(aiExplanation)
                .confidence(confidence)
                .autoFixable(autoFixable)
                .ruleId(ruleId)
                .metadata(metadata);
    }

    public static class Builder {
        private String id;
        private String title;
        private String description = "";
        private Severity severity;
        private Category category;
        private Location location;
        private String codeSnippet;
        private String suggestedFix;
        private String fixDescription;
        private String aiExplanation;
        private double confidence = 1.0;
        private boolean autoFixable;
        private String ruleId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder codeSnippet(String codeSnippet) {
            this.codeSnippet = codeSnippet;
            return this;
        }

        public Builder suggestedFix(String suggestedFix) {
            this.suggestedFix = suggestedFix;
            return this;
        }

        public Builder fixDescription(String fixDescription) {
            this.fixDescription = fixDescription;
            return this;
        }

        public Builder aiExplanation(String aiExplanation) {
            this.aiExplanation = aiExplanation;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder autoFixable(boolean autoFixable) {
            this.autoFixable = autoFixable;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null && value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Issue build() {
            return new Issue(
                    id,
                    title,
                    description,
                    severity,
                    category,
                    location,
                    codeSnippet,
                    suggestedFix,
                    fixDescription,
                    aiExplanation,
                    confidence,
                    autoFixable,
                    ruleId,
                    metadata
            );
        }
    }
}
