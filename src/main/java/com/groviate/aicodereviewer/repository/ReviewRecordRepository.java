package com.groviate.aicodereviewer.repository;

import com.groviate.aicodereviewer.entity.ReviewRecordEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ReviewRecordRepository extends JpaRepository<ReviewRecordEntity, String> {

    List<ReviewRecordEntity> findByFilePathOrderByReviewedAtDesc(String filePath, Pageable pageable);

    List<ReviewRecordEntity> findByFilePathAndReviewTypeOrderByReviewedAtDesc(String filePath,
                                                                             String reviewType,
                                                                             Pageable pageable);

    List<ReviewRecordEntity> findByReviewedAtBetweenOrderByReviewedAtDesc(Instant start, Instant end);

    List<ReviewRecordEntity> findByReviewedAtBetweenAndReviewTypeOrderByReviewedAtDesc(Instant start,
                                                                                      Instant end,
                                                                                      String reviewType);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ReviewRecordEntity r where r.id = :id")
    int deleteRecord(@Param("id") String id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from ReviewRecordEntity r where r.reviewedAt < :olderThan")
    int deleteOlderThan(@Param("olderThan") Instant olderThan);
}
