package dev.sidechain.controller;

import dev.sidechain.dto.NotificationGroup;
import dev.sidechain.dto.PageResponse;
import dev.sidechain.security.AuthenticatedUser;
import dev.sidechain.service.NotificationFeedService;
import dev.sidechain.service.NotificationPreferenceService;
import dev.sidechain.service.feed.NotificationCounts;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Validated
@Tag(name = "Notifications", description = "Notification feed, badge counts and preferences")
@SecurityRequirement(name = "bearerAuth")
@Slf4j
public class NotificationController {

    private final NotificationFeedService feedService;
    private final NotificationPreferenceService preferenceService;

    @GetMapping
    @Operation(summary = "Aggregated notifications, newest first")
    public Mono<PageResponse<NotificationGroup>> getNotifications(
            @AuthenticationPrincipal AuthenticatedUser user,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        log.debug("Fetching notifications for {}: page={}, size={}", user.userId(), page, size);
        return feedService.getNotifications(user.userId(), page, size);
    }

    @GetMapping("/counts")
    @Operation(summary = "Unread and unseen badge counts")
    public Mono<NotificationCounts> getCounts(@AuthenticationPrincipal AuthenticatedUser user) {
        return feedService.getCounts(user.userId());
    }

    @PostMapping("/read")
    @Operation(summary = "Mark all notifications read")
    public Mono<NotificationCounts> markRead(@AuthenticationPrincipal AuthenticatedUser user) {
        log.debug("Marking notifications read for {}", user.userId());
        return feedService.markAllRead(user.userId());
    }

    @PostMapping("/seen")
    @Operation(summary = "Mark all notifications seen")
    public Mono<NotificationCounts> markSeen(@AuthenticationPrincipal AuthenticatedUser user) {
        log.debug("Marking notifications seen for {}", user.userId());
        return feedService.markAllSeen(user.userId());
    }

    @GetMapping("/preferences")
    @Operation(summary = "Per-category notification switches")
    public Mono<Map<String, Boolean>> getPreferences(@AuthenticationPrincipal AuthenticatedUser user) {
        return preferenceService.getPreferences(user.userId());
    }

    @PutMapping("/preferences")
    @Operation(summary = "Update some notification switches", description = "Returns all categories after the update")
    public Mono<Map<String, Boolean>> updatePreferences(
            @AuthenticationPrincipal AuthenticatedUser user,
            @RequestBody Map<String, Boolean> updates) {
        log.info("Updating notification preferences for {}: {}", user.userId(), updates.keySet());
        return preferenceService.setPreferences(user.userId(), updates);
    }
}
