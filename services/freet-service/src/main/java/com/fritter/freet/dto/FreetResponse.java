package com.fritter.freet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.Cover;
import com.fritter.freet.domain.ReportCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FreetResponse {

    private UUID id;
    private UUID authorId;
    private String author;
    private String content;
    private Instant createdAt;
    private Instant modifiedAt;
    private int upvotes;
    private int downvotes;
    private ReportCounts reports;
    private boolean flagged;
    private Cover cover;
    private AuditState auditState;
    private AuditInfo audit;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReportCounts {
        private int spam;
        private int misinformation;
        private int offensive;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuditInfo {
        private ReportCategory category;
        private int yes;
        private int no;
        private Instant startedAt;
    }
}
