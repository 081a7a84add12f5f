package com.fritter.freet.controller;

import com.fritter.common.api.ApiResponse;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.ReportCategory;
import com.fritter.freet.domain.VoteKind;
import com.fritter.freet.dto.AuditVoteResponse;
import com.fritter.freet.dto.CreateFreetRequest;
import com.fritter.freet.dto.FreetResponse;
import com.fritter.freet.dto.FreetResponseMapper;
import com.fritter.freet.dto.UpdateFreetRequest;
import com.fritter.freet.service.AuditService;
import com.fritter.freet.service.AuditVoteResult;
import com.fritter.freet.service.FreetService;
import com.fritter.freet.service.ReportLedgerService;
import com.fritter.freet.service.VoteLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/freets")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Freets", description = "Freet lifecycle, voting, reporting and audits")
public class FreetController {

    private final FreetService freetService;
    private final VoteLedgerService voteLedgerService;
    private final ReportLedgerService reportLedgerService;
    private final AuditService auditService;
    private final FreetResponseMapper mapper;

    @GetMapping
    @Operation(summary = "List freets, optionally filtered by author username")
    public ResponseEntity<ApiResponse<List<FreetResponse>>> getFreets(
            @RequestParam(required = false) String author) {
        List<Freet> freets;
        if (author == null) {
            log.info("Fetching all freets");
            freets = freetService.findAll();
        } else {
            log.info("Fetching freets of author: {}", author);
            freets = freetService.findAllByUsername(author);
        }
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponses(freets)));
    }

    @GetMapping("/{freetId}")
    @Operation(summary = "Get a freet")
    public ResponseEntity<ApiResponse<FreetResponse>> getFreet(@PathVariable UUID freetId) {
        log.info("Fetching freet: {}", freetId);

        Freet freet = freetService.getFreet(freetId);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(freet)));
    }

    @PostMapping
    @Operation(summary = "Post a freet")
    public ResponseEntity<ApiResponse<FreetResponse>> createFreet(
            @RequestHeader("X-User-Id") UUID userId,
            @Valid @RequestBody CreateFreetRequest request) {
        log.info("Creating freet for user: {}", userId);

        Freet freet = freetService.createFreet(userId, request.getContent());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(mapper.toResponse(freet), "Your freet was created successfully."));
    }

    @PutMapping("/{freetId}")
    @Operation(summary = "Edit the content of a freet")
    public ResponseEntity<ApiResponse<FreetResponse>> updateFreet(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID freetId,
            @Valid @RequestBody UpdateFreetRequest request) {
        log.info("Updating freet {} for user: {}", freetId, userId);

        Freet freet = freetService.updateFreet(freetId, userId, request.getContent());
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(freet), "Your freet was updated successfully."));
    }

    @DeleteMapping("/{freetId}")
    @Operation(summary = "Delete a freet")
    public ResponseEntity<ApiResponse<Void>> deleteFreet(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID freetId) {
        log.info("Deleting freet {} for user: {}", freetId, userId);

        freetService.deleteFreet(freetId, userId);
        return ResponseEntity.ok(ApiResponse.success(null, "Your freet was deleted successfully."));
    }

    @PutMapping("/{freetId}/vote")
    @Operation(summary = "Upvote or downvote a freet; repeating the same vote withdraws it")
    public ResponseEntity<ApiResponse<FreetResponse>> vote(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID freetId,
            @Parameter(description = "upvote or downvote") @RequestParam String voteType) {
        VoteKind kind = VoteKind.fromValue(voteType);
        log.info("Vote {} on freet {} by user: {}", kind, freetId, userId);

        Freet freet = voteLedgerService.vote(freetId, userId, kind);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(freet)));
    }

    @PutMapping("/{freetId}/report")
    @Operation(summary = "Report a freet; reporting again withdraws the open report")
    public ResponseEntity<ApiResponse<FreetResponse>> report(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID freetId,
            @Parameter(description = "spam, misinformation or offensive") @RequestParam String reportType) {
        ReportCategory category = ReportCategory.fromValue(reportType);
        log.info("Report {} on freet {} by user: {}", category, freetId, userId);

        Freet freet = reportLedgerService.report(freetId, userId, category);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(freet)));
    }

    @PutMapping("/{freetId}/audit-vote")
    @Operation(summary = "Confirm or reject the reports of a freet under audit")
    public ResponseEntity<ApiResponse<AuditVoteResponse>> auditVote(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID freetId,
            @RequestParam boolean confirm) {
        log.info("Audit vote {} on freet {} by user: {}", confirm, freetId, userId);

        AuditVoteResult result = auditService.auditVote(freetId, confirm);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponse(result)));
    }
}
