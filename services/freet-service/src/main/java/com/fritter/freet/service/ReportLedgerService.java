package com.fritter.freet.service;

import com.fritter.freet.config.FritterProperties;
import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FreetReport;
import com.fritter.freet.domain.ReportCategory;
import com.fritter.freet.exception.AuditConflictException;
import com.fritter.freet.exception.FreetNotFoundException;
import com.fritter.freet.exception.UserNotFoundException;
import com.fritter.freet.repository.FreetReportRepository;
import com.fritter.freet.repository.FreetRepository;
import com.fritter.freet.repository.FritterUserRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Records and withdraws user reports, and escalates a freet to audit once reports
 * outweigh a tenth of its downvotes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportLedgerService {

    private final FreetRepository freetRepository;
    private final FritterUserRepository userRepository;
    private final FreetReportRepository reportRepository;
    private final AuditService auditService;
    private final FritterProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Toggle the user's report on a freet. A user with an open report withdraws it,
     * whatever category is requested; otherwise a new report is filed.
     */
    @Transactional
    public Freet report(UUID freetId, UUID userId, ReportCategory category) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        Freet freet = freetRepository.findByIdForUpdate(freetId)
                .orElseThrow(() -> new FreetNotFoundException(freetId));
        if (freet.getAuditState() != AuditState.NONE) {
            throw new AuditConflictException(freetId, freet.getAuditState(), AuditState.NONE);
        }

        Optional<FreetReport> open = reportRepository.findByUserIdAndFreetId(userId, freetId);
        if (open.isPresent()) {
            ReportCategory original = open.get().getCategory();
            freet.getReportTally().decrement(original);
            reportRepository.delete(open.get());
            log.debug("Report {} on freet {} withdrawn by {}", original, freetId, userId);
            meterRegistry.counter("fritter.reports", "category", original.name(), "withdrawn", "true").increment();
            return freetRepository.save(freet);
        }

        freet.getReportTally().increment(category);
        reportRepository.save(FreetReport.builder()
                .userId(userId)
                .freetId(freetId)
                .category(category)
                .reportedAt(Instant.now(clock))
                .build());
        log.debug("Freet {} reported as {} by {}", freetId, category, userId);
        meterRegistry.counter("fritter.reports", "category", category.name(), "withdrawn", "false").increment();

        if (isAuditThresholdReached(freet)) {
            auditService.beginAudit(freet);
        }
        return freetRepository.save(freet);
    }

    /**
     * downvotes > minDownvotes and reports > downvotes / reportDivisor, compared without
     * integer division.
     */
    boolean isAuditThresholdReached(Freet freet) {
        FritterProperties.AuditProperties audit = properties.getAudit();
        int downvotes = freet.getDownvotes();
        long totalReports = freet.getReportTally().total();
        return downvotes > audit.getMinDownvotes()
                && totalReports * audit.getReportDivisor() > downvotes;
    }
}
