package com.fritter.freet.repository;

import com.fritter.freet.domain.FreetReport;
import com.fritter.freet.domain.ReportCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FreetReportRepository extends JpaRepository<FreetReport, UUID> {

    Optional<FreetReport> findByUserIdAndFreetId(UUID userId, UUID freetId);

    long countByFreetId(UUID freetId);

    long countByFreetIdAndCategory(UUID freetId, ReportCategory category);

    @Modifying
    @Query("DELETE FROM FreetReport r WHERE r.freetId = :freetId")
    int deleteAllByFreetId(@Param("freetId") UUID freetId);
}
