package dev.sidechain.controller;

import dev.sidechain.metrics.RealtimeMetrics;
import dev.sidechain.scheduler.ReconciliationSweeper;
import dev.sidechain.scheduler.SweepResult;
import dev.sidechain.scheduler.TaskSupervisor;
import dev.sidechain.websocket.ConnectionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

@RestController
@RequestMapping("/api/v1/admin/realtime")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Realtime", description = "Connection statistics and search reconciliation")
@SecurityRequirement(name = "bearerAuth")
@Slf4j
public class AdminRealtimeController {

    private final ConnectionRegistry registry;
    private final RealtimeMetrics metrics;
    private final TaskSupervisor supervisor;
    private final ReconciliationSweeper sweeper;

    @GetMapping("/metrics")
    @Operation(summary = "Live connection statistics and online users on this node")
    public Mono<Map<String, Object>> getMetrics() {
        Map<String, Object> body = new LinkedHashMap<>(metrics.snapshot());
        body.put("active_connections", registry.activeConnections());
        body.put("online_user_count", registry.onlineUserCount());
        body.put("online_user_ids", new TreeSet<>(registry.onlineUserIds()));
        body.put("scheduled_tasks", supervisor.activeTaskNames().size());
        body.put("reconciliation_running", sweeper.isRunning());
        return Mono.just(body);
    }

    @PostMapping("/reconciliation")
    @Operation(summary = "Run one search reconciliation pass now")
    public Mono<SweepResult> reconcile() {
        log.info("Manual reconciliation pass requested");
        // the pass is a series of database and index round trips; keep it off the event loop
        return sweeper.sweepOnce().subscribeOn(Schedulers.boundedElastic());
    }
}
