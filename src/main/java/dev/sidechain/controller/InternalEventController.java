package dev.sidechain.controller;

import dev.sidechain.dto.DispatchEventRequest;
import dev.sidechain.service.FanoutReport;
import dev.sidechain.service.NotificationFanoutRouter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Entry point for the services that own the social data: they post here after committing a
 * like, follow, comment and so on, and the event fans out to the listed recipients.
 */
@RestController
@RequestMapping("/api/v1/internal/events")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('SERVICE', 'ADMIN')")
@Tag(name = "Internal - Events", description = "Domain event dispatch")
@SecurityRequirement(name = "bearerAuth")
@Slf4j
public class InternalEventController {

    private final NotificationFanoutRouter router;

    @PostMapping
    @Operation(summary = "Dispatch a domain event to its recipients")
    public Mono<FanoutReport> dispatch(@Valid @RequestBody DispatchEventRequest request) {
        log.debug("Dispatch request: type={}, actor={}, recipients={}",
                request.getType(), request.getActorId(), request.getRecipients().size());
        return Mono.fromSupplier(request::toDomainEvent)
                .flatMap(event -> router.dispatch(event, request.getRecipients()));
    }
}
