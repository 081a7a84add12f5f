package com.fritter.freet.controller;

import com.fritter.common.api.ApiResponse;
import com.fritter.freet.config.FritterProperties;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.SortType;
import com.fritter.freet.domain.TabType;
import com.fritter.freet.dto.FreetResponse;
import com.fritter.freet.dto.FreetResponseMapper;
import com.fritter.freet.service.FeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/feed")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Feed", description = "Ranked feed tabs")
public class FeedController {

    private final FeedService feedService;
    private final FreetResponseMapper mapper;
    private final FritterProperties properties;

    @GetMapping
    @Operation(summary = "Default feed: home tab sorted by best")
    public ResponseEntity<ApiResponse<List<FreetResponse>>> getDefaultFeed(
            @RequestHeader("X-User-Id") UUID userId) {
        log.info("Fetching default feed for user: {}", userId);

        List<Freet> freets = feedService.chooseTab(userId, TabType.HOME, SortType.BEST);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponses(freets)));
    }

    @GetMapping("/{tabType}")
    @Operation(summary = "Feed tab (home, verified or discovery) in the requested order")
    public ResponseEntity<ApiResponse<List<FreetResponse>>> getFeed(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable String tabType,
            @Parameter(description = "best, hot, rising or new") @RequestParam(required = false) String sortType) {
        TabType tab = TabType.fromValue(tabType);
        SortType sort = sortType != null
                ? SortType.fromValue(sortType)
                : properties.getFeed().getDefaultSort();
        log.info("Fetching {} feed sorted by {} for user: {}", tab, sort, userId);

        List<Freet> freets = feedService.chooseTab(userId, tab, sort);
        return ResponseEntity.ok(ApiResponse.success(mapper.toResponses(freets)));
    }
}
