package com.fritter.freet.scheduler;

import com.fritter.freet.service.AuditService;
import com.fritter.freet.service.AuditVoteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves audits whose window elapsed without a further vote.
 * Off unless {@code fritter.audit.reaper.enabled=true}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fritter.audit.reaper", name = "enabled", havingValue = "true")
public class AuditExpiryReaper {

    private final AuditService auditService;

    @Scheduled(fixedDelayString = "${fritter.audit.reaper.interval:PT5M}")
    public void resolveExpiredAudits() {
        List<UUID> expired = auditService.findExpiredAudits();
        if (expired.isEmpty()) {
            return;
        }
        log.info("=== Scheduled Job: Resolve {} expired audits ===", expired.size());
        int resolved = 0;
        for (UUID freetId : expired) {
            try {
                Optional<AuditVoteResult> result = auditService.resolveIfExpired(freetId);
                if (result.isPresent()) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("Error resolving expired audit for freet {}", freetId, e);
            }
        }
        log.info("Resolved {} of {} expired audits", resolved, expired.size());
    }
}
