package com.phillippitts.enginecoordinator.presentation.exception;

import com.phillippitts.enginecoordinator.domain.ProviderAttempt;
import com.phillippitts.enginecoordinator.exception.AllProvidersExhaustedException;
import com.phillippitts.enginecoordinator.exception.CoordinatorException;
import com.phillippitts.enginecoordinator.exception.QueueFullException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesValidationFailureReturns400WithFieldDetails() throws Exception {
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(new Object(), "taskRequest");
        binding.addError(new FieldError("taskRequest", "taskKind", "taskKind is required"));
        binding.addError(new FieldError("taskRequest", "topK", "topK must be >= 1"));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("setUp"), -1);

        ResponseEntity<?> response = handler.handleValidation(new MethodArgumentNotValidException(parameter, binding));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("ValidationFailed")
                .contains("taskKind: taskKind is required; topK: topK must be >= 1");
    }

    @Test
    void verifiesUnreadableBodyReturns400WithoutParserDetails() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error: Unexpected character ('}' (code 125))",
                new MockHttpInputMessage(new byte[0]));

        ResponseEntity<?> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("MalformedRequest")
                .doesNotContain("code 125");
    }

    @Test
    void verifiesInvalidTaskShapeReturns400WithReason() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("Unknown taskKind: poetry"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("IllegalArgumentException")
                .contains("Invalid request")
                .contains("Unknown taskKind: poetry");
    }

    @Test
    void verifiesQueueFullReturns429() {
        ResponseEntity<?> response = handler.handleQueueFull(new QueueFullException(100, 100));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody().toString())
                .contains("QueueFullException")
                .contains("at capacity")
                .contains("retry");
    }

    @Test
    void verifiesCoordinatorFailureReturns503WithoutInternalDetails() {
        AllProvidersExhaustedException ex = new AllProvidersExhaustedException(List.of(
                new ProviderAttempt("cloud", "api key sk-secret123 rejected", 40)));

        ResponseEntity<?> response = handler.handleCoordinatorFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("AllProvidersExhaustedException")
                .contains("temporarily unavailable")
                .doesNotContain("sk-secret123");
    }

    @Test
    void verifiesUnexpectedReturns500WithGenericMessage() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("Internal stack trace"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .contains("unexpected error")
                .doesNotContain("IllegalStateException")
                .doesNotContain("stack trace");
    }

    @Test
    void verifiesErrorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleCoordinatorFailure(new CoordinatorException("test"));

        assertThat(response.getBody()).isNotNull();
        String bodyStr = response.getBody().toString();
        assertThat(bodyStr).contains("errorCode=");
        assertThat(bodyStr).contains("message=");
        assertThat(bodyStr).contains("details=");
        assertThat(bodyStr).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
