package com.phillippitts.enginecoordinator.service.coordination;

import com.phillippitts.enginecoordinator.domain.ErrorKind;
import com.phillippitts.enginecoordinator.exception.AllProvidersExhaustedException;
import com.phillippitts.enginecoordinator.exception.ProviderUnavailableException;
import com.phillippitts.enginecoordinator.exception.QueueFullException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps engine failures onto the error taxonomy.
 */
final class Failures {

    private Failures() {
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static ErrorKind classify(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof AllProvidersExhaustedException) {
            return ErrorKind.ALL_PROVIDERS_EXHAUSTED;
        }
        if (cause instanceof ProviderUnavailableException) {
            return ErrorKind.PROVIDER_UNAVAILABLE;
        }
        if (cause instanceof QueueFullException) {
            return ErrorKind.QUEUE_FULL;
        }
        if (cause instanceof TimeoutException || cause instanceof CancellationException) {
            return ErrorKind.COORDINATION_TIMEOUT;
        }
        return ErrorKind.ENGINE_CRASH;
    }

    static String describe(Throwable t) {
        Throwable cause = unwrap(t);
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
