package com.groviate.aicodereviewer.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewCategory;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON-документ ответа в колонке review_response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class ReviewDocument {

    @JsonProperty("comments")
    private List<CommentDocument> comments;

    @JsonProperty("summary")
    private String summary;

    @JsonProperty("score")
    private Double score;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    @JsonProperty("timestamp")
    private Instant timestamp;

    static ReviewDocument from(ReviewResponse response) {
        return ReviewDocument.builder()
                .comments(response.getComments() == null ? List.of() : response.getComments().stream()
                        .map(CommentDocument::from)
                        .toList())
                .summary(response.getSummary())
                .score(response.getScore())
                .metadata(response.getMetadata())
                .timestamp(response.getTimestamp())
                .build();
    }

    ReviewResponse toResponse() {
        if (comments == null || summary == null) {
            throw new IllegalArgumentException("document has no comments/summary");
        }
        return ReviewResponse.builder()
                .comments(comments.stream().map(CommentDocument::toComment).toList())
                .summary(summary)
                .score(score)
                .metadata(metadata == null ? Map.of() : metadata)
                .timestamp(timestamp)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CommentDocument {

        @JsonProperty("line_number")
        private Integer lineNumber;

        @JsonProperty("content")
        private String content;

        @JsonProperty("severity")
        private String severity;

        @JsonProperty("category")
        private String category;

        @JsonProperty("suggested_fix")
        private String suggestedFix;

        static CommentDocument from(ReviewComment c) {
            return CommentDocument.builder()
                    .lineNumber(c.getLineNumber())
                    .content(c.getContent())
                    .severity(c.getSeverity() == null ? null : c.getSeverity().getValue())
                    .category(c.getCategory() == null ? null : c.getCategory().getValue())
                    .suggestedFix(c.getSuggestedFix())
                    .build();
        }

        ReviewComment toComment() {
            if (content == null) {
                throw new IllegalArgumentException("comment has no content");
            }
            return ReviewComment.builder()
                    .lineNumber(lineNumber)
                    .content(content)
                    .severity(CommentSeverity.normalize(severity))
                    .category(ReviewCategory.normalize(category))
                    .suggestedFix(suggestedFix)
                    .build();
        }
    }
}
