package com.phillippitts.enginecoordinator.exception;

import com.phillippitts.enginecoordinator.domain.ProviderAttempt;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void coordinatorExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        CoordinatorException ex = new CoordinatorException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void domainExceptionsShareTheBaseType() {
        assertThat(new QueueFullException(10, 10)).isInstanceOf(CoordinatorException.class);
        assertThat(new EngineCrashException("job", null)).isInstanceOf(CoordinatorException.class);
        assertThat(new AllProvidersExhaustedException(List.of())).isInstanceOf(CoordinatorException.class);
        assertThat(new ProviderUnavailableException("down", "local")).isInstanceOf(CoordinatorException.class);
    }

    @Test
    void queueFullExceptionShouldExposeDepthAndLimit() {
        QueueFullException ex = new QueueFullException(100, 100);

        assertThat(ex.getQueueDepth()).isEqualTo(100);
        assertThat(ex.getLimit()).isEqualTo(100);
        assertThat(ex.getMessage()).contains("depth=100").contains("limit=100");
    }

    @Test
    void engineCrashExceptionShouldNameSourceAndCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        EngineCrashException ex = new EngineCrashException("parallel-2", cause);

        assertThat(ex.getMessage()).contains("parallel-2").contains("boom");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void allProvidersExhaustedShouldListEveryAttempt() {
        AllProvidersExhaustedException ex = new AllProvidersExhaustedException(List.of(
                new ProviderAttempt("local", "timeout after 300ms", 300),
                new ProviderAttempt("cloud", "skipped: unhealthy", 0)));

        assertThat(ex.getAttempts()).hasSize(2);
        assertThat(ex.getMessage())
                .isEqualTo("All providers exhausted: local=timeout after 300ms; cloud=skipped: unhealthy");
    }

    @Test
    void allProvidersExhaustedWithoutAttemptsMeansNoProviders() {
        AllProvidersExhaustedException ex = new AllProvidersExhaustedException(null);

        assertThat(ex.getAttempts()).isEmpty();
        assertThat(ex.getMessage()).isEqualTo("No providers available");
    }

    @Test
    void builderShouldAppendStructuredDetails() {
        IOException cause = new IOException("connection reset");
        ProviderUnavailableException ex = ProviderUnavailableExceptionBuilder.create("Completion request failed")
                .provider("cloud-openai")
                .httpStatus(502)
                .durationMs(830)
                .metadata("model", "gpt-4o-mini")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getProviderId()).isEqualTo("cloud-openai");
        assertThat(ex.getMessage()).isEqualTo(
                "Completion request failed (httpStatus=502, durationMs=830, model=gpt-4o-mini)");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void builderWithoutDetailsKeepsPlainMessage() {
        ProviderUnavailableException ex = ProviderUnavailableExceptionBuilder.create("down").build();

        assertThat(ex.getMessage()).isEqualTo("down");
        assertThat(ex.getProviderId()).isEqualTo("unknown");
        assertThat(ex.getCause()).isNull();
    }
}
