package com.groviate.aicodereviewer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(
        name = "reviews",
        indexes = {
                @Index(name = "idx_reviews_file_path", columnList = "file_path"),
                @Index(name = "idx_reviews_timestamp", columnList = "reviewed_at")
        }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRecordEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "file_path", nullable = false, length = 1024)
    private String filePath;

    @Column(name = "review_type", nullable = false, length = 32)
    private String reviewType;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "review_response", nullable = false)
    private String reviewResponse;

    @Column(name = "reviewed_at", nullable = false)
    private Instant reviewedAt;

    @JdbcTypeCode(SqlTypes.LONG32VARCHAR)
    @Column(name = "metadata")
    private String metadata;
}
