package com.phillippitts.enginecoordinator.presentation.controller;

import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.config.properties.RoutingProperties;
import com.phillippitts.enginecoordinator.domain.CoordinationResult;
import com.phillippitts.enginecoordinator.domain.Task;
import com.phillippitts.enginecoordinator.presentation.dto.MemoryRequest;
import com.phillippitts.enginecoordinator.presentation.dto.MemoryResponse;
import com.phillippitts.enginecoordinator.presentation.dto.TaskRequest;
import com.phillippitts.enginecoordinator.service.coordination.Coordinator;
import com.phillippitts.enginecoordinator.service.coordination.EngineStatusReport;
import com.phillippitts.enginecoordinator.service.cost.CostSummary;
import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import com.phillippitts.enginecoordinator.service.provider.ProviderStatus;
import com.phillippitts.enginecoordinator.service.recall.MemoryEntry;
import com.phillippitts.enginecoordinator.service.recall.RecallStore;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Task intake and read-only views over providers, costs and engines.
 *
 * <p>{@code POST /api/v1/tasks} always answers 200 with a {@link CoordinationResult}, whatever
 * its status. Only malformed requests are turned away, by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
class TaskController {

    private static final Logger LOG = LogManager.getLogger(TaskController.class);

    private final Coordinator coordinator;
    private final ProviderRegistry registry;
    private final RecallStore recallStore;
    private final RoutingProperties routingProperties;
    private final CreativeProperties creativeProperties;
    private final Clock clock;

    TaskController(Coordinator coordinator,
                   ProviderRegistry registry,
                   RecallStore recallStore,
                   RoutingProperties routingProperties,
                   CreativeProperties creativeProperties,
                   Clock clock) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.recallStore = recallStore;
        this.routingProperties = routingProperties;
        this.creativeProperties = creativeProperties;
        this.clock = clock;
    }

    @PostMapping("/tasks")
    ResponseEntity<CoordinationResult> submit(@Valid @RequestBody TaskRequest request) {
        Task task = request.toTask(recallStore.defaultTopK(), creativeProperties.getCount());
        LOG.debug("Accepted task id={}, kind={}", task.id(), task.kind());
        return ResponseEntity.ok(coordinator.coordinate(task));
    }

    @GetMapping("/providers")
    ResponseEntity<List<ProviderStatus>> providers() {
        return ResponseEntity.ok(registry.statuses());
    }

    @GetMapping("/costs")
    ResponseEntity<CostSummary> costs() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return ResponseEntity.ok(registry.ledger().summary(today,
                routingProperties.getDailyCloudBudget(), routingProperties.getBaselineCostPerKToken()));
    }

    @GetMapping("/engines")
    ResponseEntity<EngineStatusReport> engines() {
        return ResponseEntity.ok(coordinator.status());
    }

    @PostMapping("/memories")
    ResponseEntity<MemoryResponse> remember(@Valid @RequestBody MemoryRequest request) {
        String id = request.id() == null || request.id().isBlank() ? UUID.randomUUID().toString() : request.id();
        MemoryEntry entry = recallStore.remember(id, request.content(), request.metadata());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new MemoryResponse(entry.id(), recallStore.size(), entry.storedAt()));
    }
}
