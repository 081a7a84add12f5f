package com.fritter.freet.event;

import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.Cover;
import com.fritter.freet.domain.ReportCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Moderation decision on a freet, published to Kafka once the deciding transaction commits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FreetModerationEvent {

    private String eventId;
    private EventType eventType;
    private UUID freetId;
    private UUID authorId;
    private AuditState auditState;
    private ReportCategory auditCategory;
    private Cover cover;
    private Integer yesCount;
    private Integer noCount;
    private Instant timestamp;
    @Builder.Default
    private String version = "1.0";

    public enum EventType {
        AUDIT_STARTED,
        AUDIT_PASSED,
        AUDIT_FAILED_COVERED,
        AUDIT_FAILED_REMOVED
    }
}
