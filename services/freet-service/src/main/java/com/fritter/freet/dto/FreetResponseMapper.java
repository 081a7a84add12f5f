package com.fritter.freet.dto;

import com.fritter.freet.domain.AuditTally;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FritterUser;
import com.fritter.freet.domain.ReportTally;
import com.fritter.freet.repository.FritterUserRepository;
import com.fritter.freet.service.AuditVoteResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps freets to API responses, resolving author usernames in one lookup per batch.
 */
@Component
@RequiredArgsConstructor
public class FreetResponseMapper {

    private final FritterUserRepository userRepository;

    public FreetResponse toResponse(Freet freet) {
        return toResponses(List.of(freet)).get(0);
    }

    public List<FreetResponse> toResponses(List<Freet> freets) {
        Map<UUID, String> usernames = resolveUsernames(freets);
        return freets.stream()
                .map(freet -> map(freet, usernames.get(freet.getAuthorId())))
                .collect(Collectors.toList());
    }

    public AuditVoteResponse toResponse(AuditVoteResult result) {
        return AuditVoteResponse.builder()
                .freetId(result.getFreetId())
                .auditState(result.getAuditState())
                .resolved(result.isResolved())
                .removed(result.isRemoved())
                .freet(result.getFreet() != null ? toResponse(result.getFreet()) : null)
                .build();
    }

    private Map<UUID, String> resolveUsernames(List<Freet> freets) {
        Set<UUID> authorIds = freets.stream().map(Freet::getAuthorId).collect(Collectors.toSet());
        if (authorIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return userRepository.findAllById(authorIds).stream()
                .collect(Collectors.toMap(FritterUser::getId, FritterUser::getUsername, (a, b) -> a));
    }

    private FreetResponse map(Freet freet, String author) {
        ReportTally reports = freet.getReportTally();
        AuditTally audit = freet.getAuditTally();
        return FreetResponse.builder()
                .id(freet.getId())
                .authorId(freet.getAuthorId())
                .author(author)
                .content(freet.getContent())
                .createdAt(freet.getCreatedAt())
                .modifiedAt(freet.getModifiedAt())
                .upvotes(freet.getUpvotes())
                .downvotes(freet.getDownvotes())
                .reports(FreetResponse.ReportCounts.builder()
                        .spam(reports.getSpam())
                        .misinformation(reports.getMisinformation())
                        .offensive(reports.getOffensive())
                        .build())
                .flagged(freet.isFlagged())
                .cover(freet.getCover())
                .auditState(freet.getAuditState())
                .audit(audit == null ? null : FreetResponse.AuditInfo.builder()
                        .category(freet.getAuditCategory())
                        .yes(audit.getYesCount())
                        .no(audit.getNoCount())
                        .startedAt(audit.getStartedAt())
                        .build())
                .build();
    }
}
