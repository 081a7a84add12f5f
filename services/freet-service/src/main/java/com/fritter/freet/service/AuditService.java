package com.fritter.freet.service;

import com.fritter.freet.config.FritterProperties;
import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.AuditTally;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.ReportCategory;
import com.fritter.freet.event.FreetModerationEvent;
import com.fritter.freet.exception.AuditConflictException;
import com.fritter.freet.exception.FreetNotFoundException;
import com.fritter.freet.repository.FreetRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Community audit of reported freets: NONE -> TESTING -> PASSED | FAILED.
 *
 * Resolution is lazy. A running audit is only evaluated when an audit vote arrives
 * (or when the optional reaper sweeps expired audits), never on a timer of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final FreetRepository freetRepository;
    private final FreetService freetService;
    private final FritterProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Put a freet under audit for its most reported category. Joins the caller's transaction;
     * the caller holds the freet lock and saves it.
     */
    @Transactional
    public void beginAudit(Freet freet) {
        ReportCategory category = freet.getReportTally().dominantCategory();
        freet.startAudit(category, Instant.now(clock));

        log.info("Audit started for freet {} as {} (downvotes={}, reports={})", freet.getId(), category,
            freet.getDownvotes(), freet.getReportTally().total());
        meterRegistry.counter("fritter.audits.started", "category", category.name()).increment();
        publish(FreetModerationEvent.EventType.AUDIT_STARTED, freet);
    }

    @Transactional
    public AuditVoteResult auditVote(UUID freetId, boolean confirm) {
        Freet freet = freetRepository.findByIdForUpdate(freetId)
                .orElseThrow(() -> new FreetNotFoundException(freetId));
        if (!freet.isUnderAudit()) {
            throw new AuditConflictException(freetId, freet.getAuditState(), AuditState.TESTING);
        }

        AuditTally tally = freet.getAuditTally();
        tally.record(confirm);
        log.debug("Audit vote on freet {}: confirm={} (yes={}, no={})", freetId, confirm,
            tally.getYesCount(), tally.getNoCount());

        if (tally.isWindowElapsed(Instant.now(clock), properties.getAudit().getWindow())) {
            return resolve(freet);
        }
        return AuditVoteResult.retained(freetRepository.save(freet));
    }

    /**
     * Resolve a running audit whose window has elapsed without waiting for another vote.
     *
     * @return the outcome, or empty when the freet is gone, not under audit, or still within its window
     */
    @Transactional
    public Optional<AuditVoteResult> resolveIfExpired(UUID freetId) {
        Optional<Freet> candidate = freetRepository.findByIdForUpdate(freetId);
        if (candidate.isEmpty() || !candidate.get().isUnderAudit()) {
            return Optional.empty();
        }
        Freet freet = candidate.get();
        if (!freet.getAuditTally().isWindowElapsed(Instant.now(clock), properties.getAudit().getWindow())) {
            return Optional.empty();
        }
        return Optional.of(resolve(freet));
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpiredAudits() {
        Instant cutoff = Instant.now(clock).minus(properties.getAudit().getWindow());
        return freetRepository.findIdsByAuditStateStartedAtOrBefore(AuditState.TESTING, cutoff);
    }

    private AuditVoteResult resolve(Freet freet) {
        AuditTally tally = freet.getAuditTally();
        boolean failed = tally.confirmRatio() >= properties.getAudit().getFailRatio();
        freet.resolveAudit(failed);

        log.info("Audit of freet {} resolved {} (category={}, yes={}, no={})", freet.getId(),
            freet.getAuditState(), freet.getAuditCategory(), tally.getYesCount(), tally.getNoCount());
        meterRegistry.counter("fritter.audits.resolved", "outcome", freet.getAuditState().name()).increment();

        if (failed && freet.getAuditCategory().isRemovedOnFailedAudit()) {
            publish(FreetModerationEvent.EventType.AUDIT_FAILED_REMOVED, freet);
            freetService.removeFreet(freet);
            return AuditVoteResult.removed(freet.getId());
        }

        publish(failed ? FreetModerationEvent.EventType.AUDIT_FAILED_COVERED
                : FreetModerationEvent.EventType.AUDIT_PASSED, freet);
        return AuditVoteResult.retained(freetRepository.save(freet));
    }

    private void publish(FreetModerationEvent.EventType type, Freet freet) {
        AuditTally tally = freet.getAuditTally();
        eventPublisher.publishEvent(FreetModerationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .freetId(freet.getId())
                .authorId(freet.getAuthorId())
                .auditState(freet.getAuditState())
                .auditCategory(freet.getAuditCategory())
                .cover(freet.getCover())
                .yesCount(tally != null ? tally.getYesCount() : null)
                .noCount(tally != null ? tally.getNoCount() : null)
                .timestamp(Instant.now(clock))
                .build());
    }
}
