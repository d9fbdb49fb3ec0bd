package com.phillippitts.enginecoordinator.presentation.controller;

import com.phillippitts.enginecoordinator.config.properties.CreativeProperties;
import com.phillippitts.enginecoordinator.config.properties.RecallProperties;
import com.phillippitts.enginecoordinator.config.properties.RoutingProperties;
import com.phillippitts.enginecoordinator.domain.CompletionPayload;
import com.phillippitts.enginecoordinator.domain.CoordinationResult;
import com.phillippitts.enginecoordinator.domain.CoordinationStatus;
import com.phillippitts.enginecoordinator.domain.ErrorKind;
import com.phillippitts.enginecoordinator.domain.Task;
import com.phillippitts.enginecoordinator.domain.TaskKind;
import com.phillippitts.enginecoordinator.presentation.dto.MemoryRequest;
import com.phillippitts.enginecoordinator.presentation.dto.MemoryResponse;
import com.phillippitts.enginecoordinator.presentation.dto.TaskRequest;
import com.phillippitts.enginecoordinator.service.coordination.Coordinator;
import com.phillippitts.enginecoordinator.service.cost.CostSummary;
import com.phillippitts.enginecoordinator.service.cost.UsageLedger;
import com.phillippitts.enginecoordinator.service.cost.UsageRecord;
import com.phillippitts.enginecoordinator.service.provider.ProviderDescriptor;
import com.phillippitts.enginecoordinator.service.provider.ProviderKind;
import com.phillippitts.enginecoordinator.service.provider.ProviderRegistry;
import com.phillippitts.enginecoordinator.service.provider.ProviderStatus;
import com.phillippitts.enginecoordinator.service.provider.adapter.EchoProvider;
import com.phillippitts.enginecoordinator.service.recall.HashingEmbedder;
import com.phillippitts.enginecoordinator.service.recall.InMemoryVectorBackend;
import com.phillippitts.enginecoordinator.service.recall.RecallStore;
import com.phillippitts.enginecoordinator.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskControllerTest {

    private final MutableClock clock = new MutableClock();
    private ExecutorService executor;
    private Coordinator coordinator;
    private ProviderRegistry registry;
    private RecallStore recallStore;
    private RoutingProperties routing;
    private TaskController controller;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        coordinator = mock(Coordinator.class);
        registry = new ProviderRegistry(new UsageLedger(), ProviderRegistry.TieBreak.REGISTRATION_ORDER);
        registry.register(new ProviderDescriptor("local", ProviderKind.LOCAL, "local://echo", 0, 0.0,
                Duration.ofSeconds(1), new EchoProvider("local")));
        registry.register(new ProviderDescriptor("cloud", ProviderKind.CLOUD, "https://api.example.com", 1, 0.03,
                Duration.ofSeconds(1), new EchoProvider("cloud")));
        recallStore = new RecallStore(new InMemoryVectorBackend(new HashingEmbedder(), clock), executor,
                new RecallProperties());
        routing = new RoutingProperties();
        routing.setDailyCloudBudget(1.0);
        controller = new TaskController(coordinator, registry, recallStore, routing, new CreativeProperties(), clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void submitCoordinatesTheTaskAndAnswersOkWhateverItsStatus() {
        CoordinationResult failed = CoordinationResult.rejected(
                Task.of(new CompletionPayload("hi", 0), null),
                ErrorKind.ALL_PROVIDERS_EXHAUSTED, "nobody home", 3);
        when(coordinator.coordinate(any())).thenReturn(failed);

        ResponseEntity<CoordinationResult> response = controller.submit(
                new TaskRequest("completion", "hi", null, null, null, null, 2000L, 5, 64));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().status()).isEqualTo(CoordinationStatus.FAILED);
        ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
        verify(coordinator).coordinate(captor.capture());
        Task task = captor.getValue();
        assertThat(task.kind()).isEqualTo(TaskKind.COMPLETION);
        assertThat(task.deadline()).isEqualTo(Duration.ofMillis(2000));
        assertThat(task.priorityHint()).isEqualTo(5);
        assertThat(((CompletionPayload) task.payload()).maxTokens()).isEqualTo(64);
    }

    @Test
    void submitRejectsUnknownKindBeforeCoordinating() {
        assertThatThrownBy(() -> controller.submit(
                new TaskRequest("poetry", "hi", null, null, null, null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown taskKind");
        verify(coordinator, never()).coordinate(any());
    }

    @Test
    void providersListsEveryProviderInPriorityOrder() {
        ResponseEntity<List<ProviderStatus>> response = controller.providers();

        assertThat(response.getBody()).extracting(ProviderStatus::id).containsExactly("local", "cloud");
    }

    @Test
    void costsSummariseTodaysLedger() {
        registry.recordUsage(UsageRecord.success("cloud", ProviderKind.CLOUD, 600, 400, 0.03, 120, clock.instant()));
        registry.recordUsage(UsageRecord.success("local", ProviderKind.LOCAL, 100, 100, 0.0, 20, clock.instant()));

        CostSummary summary = controller.costs().getBody();

        assertThat(summary.totalCost()).isCloseTo(0.03, offset(1e-9));
        assertThat(summary.localRequests()).isEqualTo(1);
        assertThat(summary.cloudRequests()).isEqualTo(1);
        assertThat(summary.cloudSpendToday()).isCloseTo(0.03, offset(1e-9));
        assertThat(summary.budgetRemaining()).isCloseTo(0.97, offset(1e-9));
    }

    @Test
    void rememberGeneratesIdWhenAbsent() {
        ResponseEntity<MemoryResponse> response = controller.remember(
                new MemoryRequest(null, "the deploy window opens friday", Map.of("source", "wiki")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().id()).isNotBlank();
        assertThat(response.getBody().storedEntries()).isEqualTo(1);
        assertThat(response.getBody().storedAt()).isEqualTo(clock.instant());
    }

    @Test
    void rememberKeepsCallerId() {
        controller.remember(new MemoryRequest("m-1", "first version", null));
        ResponseEntity<MemoryResponse> response = controller.remember(new MemoryRequest("m-1", "second version", null));

        assertThat(response.getBody().id()).isEqualTo("m-1");
        assertThat(response.getBody().storedEntries()).isEqualTo(1);
    }
}
