package dev.sidechain.controller;

import dev.sidechain.dto.ActivityStatusRequest;
import dev.sidechain.dto.ActivityStatusResponse;
import dev.sidechain.security.AuthenticatedUser;
import dev.sidechain.service.ActivityVisibility;
import dev.sidechain.service.PresenceVisibilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/settings/activity-status")
@RequiredArgsConstructor
@Tag(name = "Settings", description = "Presence visibility settings")
@SecurityRequirement(name = "bearerAuth")
@Slf4j
public class ActivityStatusController {

    private final PresenceVisibilityService visibilityService;

    @GetMapping
    @Operation(summary = "Whether others see my online status and last-active time")
    public Mono<ActivityStatusResponse> getActivityStatus(@AuthenticationPrincipal AuthenticatedUser user) {
        return visibilityService.visibilityOf(user.userId()).map(ActivityStatusController::toResponse);
    }

    @PutMapping
    @Operation(summary = "Update presence visibility")
    public Mono<ActivityStatusResponse> updateActivityStatus(
            @AuthenticationPrincipal AuthenticatedUser user,
            @Valid @RequestBody ActivityStatusRequest request) {
        return visibilityService.update(user.userId(), request.getShowActivityStatus(), request.getShowLastActive())
                .map(ActivityStatusController::toResponse);
    }

    private static ActivityStatusResponse toResponse(ActivityVisibility visibility) {
        return ActivityStatusResponse.builder()
                .showActivityStatus(visibility.showActivityStatus())
                .showLastActive(visibility.showLastActive())
                .build();
    }
}
