package com.fritter.freet.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fritter.freet.domain.AuditState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditVoteResponse {

    private UUID freetId;
    private AuditState auditState;
    private boolean resolved;
    private boolean removed;
    private FreetResponse freet;
}
