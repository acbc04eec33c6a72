package dev.sidechain.controller;

import dev.sidechain.dto.CustomStatusRequest;
import dev.sidechain.dto.CustomStatusResponse;
import dev.sidechain.dto.PresenceStatusRequest;
import dev.sidechain.dto.PresenceView;
import dev.sidechain.security.AuthenticatedUser;
import dev.sidechain.service.PresenceState;
import dev.sidechain.service.PresenceTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/presence")
@RequiredArgsConstructor
@Validated
@Tag(name = "Presence", description = "Who is online and who is in the studio")
@SecurityRequirement(name = "bearerAuth")
@Slf4j
public class PresenceController {

    private final PresenceTracker presenceTracker;

    @GetMapping("/{userId}")
    @Operation(summary = "Presence of one user, as their visibility settings allow")
    public Mono<PresenceView> getPresence(@PathVariable @Size(min = 1, max = 64) String userId) {
        return presenceTracker.presenceFor(userId);
    }

    @PostMapping("/status")
    @Operation(summary = "Presence of up to 100 users")
    public Mono<Map<String, PresenceView>> getPresenceBulk(@Valid @RequestBody PresenceStatusRequest request) {
        return presenceTracker.presenceFor(request.getUserIds());
    }

    @GetMapping("/friends-in-studio")
    @Operation(summary = "Followed users currently in the studio")
    public Mono<List<PresenceView>> getFriendsInStudio(@AuthenticationPrincipal AuthenticatedUser user) {
        return presenceTracker.friendsInStudio(user.userId()).collectList();
    }

    @PutMapping("/custom-status")
    @Operation(summary = "Set or clear my custom status")
    public Mono<CustomStatusResponse> setCustomStatus(
            @AuthenticationPrincipal AuthenticatedUser user,
            @Valid @RequestBody CustomStatusRequest request) {
        PresenceState state = presenceTracker.setCustomStatus(user.userId(), request.getText());
        log.debug("Custom status of {} set to '{}'", user.userId(), state.customStatus());
        return Mono.just(new CustomStatusResponse(user.userId(), state.customStatus()));
    }
}
