package com.phillippitts.wfmparity.presentation.exception;

import com.phillippitts.wfmparity.domain.JobStatus;
import com.phillippitts.wfmparity.exception.FailurePatternNotFoundException;
import com.phillippitts.wfmparity.exception.IllegalJobTransitionException;
import com.phillippitts.wfmparity.exception.InvalidJobInputException;
import com.phillippitts.wfmparity.exception.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void mapsMissingJobToNotFound() {
        UUID id = UUID.randomUUID();
        ResponseEntity<?> response = handler.handleJobNotFound(new JobNotFoundException(id));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("JobNotFoundException").contains(id.toString());
    }

    @Test
    void mapsMissingPatternToNotFound() {
        ResponseEntity<?> response = handler.handlePatternNotFound(
                new FailurePatternNotFoundException(UUID.randomUUID()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("Failure pattern not found");
    }

    @Test
    void joinsAllInputViolationsInDetails() {
        ResponseEntity<?> response = handler.handleInvalidJobInput(new InvalidJobInputException(
                List.of("missing required input: offered_calls", "priority must be in [1,5], got: 9")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("missing required input: offered_calls; priority must be in [1,5], got: 9");
    }

    @Test
    void mapsIllegalTransitionToConflict() {
        ResponseEntity<?> response = handler.handleIllegalTransition(new IllegalJobTransitionException(
                UUID.randomUUID(), JobStatus.COMPLETED, JobStatus.RUNNING));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("Job state conflict");
    }

    @Test
    void mapsIllegalArgumentToBadRequest() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("batch_size must be positive"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("batch_size must be positive");
    }

    @Test
    void mapsStorageFailureToServiceUnavailable() {
        ResponseEntity<?> response = handler.handleDataAccess(
                new DataAccessResourceFailureException("connection refused"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("Storage temporarily unavailable")
                .doesNotContain("connection refused");
    }

    @Test
    void hidesDetailsOfUnexpectedErrors() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret internals");
    }
}
