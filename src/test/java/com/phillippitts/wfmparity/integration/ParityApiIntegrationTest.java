package com.phillippitts.wfmparity.integration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives a job through the REST surface: submit, process, inspect.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ParityApiIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY =
            new ParameterizedTypeReference<>() {};

    @Autowired
    private TestRestTemplate rest;

    @Test
    void submittedJobIsProcessedAndCompared() {
        Map<String, Object> body = Map.of(
                "project_code", "INTEG",
                "queue_code", "billing",
                "interval_type", "30m",
                "input_parameters", Map.of("offered_calls", 100, "average_handle_time", 180),
                "priority", 1);

        ResponseEntity<Map<String, Object>> submitted = post("/api/v1/jobs", body);
        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String jobId = String.valueOf(submitted.getBody().get("job_id"));
        assertThat(UUID.fromString(jobId)).isNotNull();

        ResponseEntity<Map<String, Object>> processed = post("/api/v1/jobs/process?batch_size=5", null);
        assertThat(processed.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<Map<String, Object>> job = get("/api/v1/jobs/" + jobId);
        assertThat(job.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(job.getBody()).containsEntry("status", "COMPLETED")
                .containsEntry("project_code", "INTEG")
                .containsKey("comparison_id");
        assertThat(job.getBody().get("reference_result_id")).isNotNull();
        assertThat(job.getBody().get("candidate_result_id")).isNotNull();

        ResponseEntity<Map<String, Object>> comparison = get("/api/v1/jobs/" + jobId + "/comparison");
        assertThat(comparison.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(comparison.getBody()).containsKey("recommendation").containsKey("algorithms_agree");
    }

    @Test
    void invalidSubmissionIsRejectedWithEveryViolation() {
        Map<String, Object> body = Map.of(
                "project_code", "INTEG",
                "interval_type", "30m",
                "input_parameters", Map.of("offered_calls", "lots"));

        ResponseEntity<Map<String, Object>> response = post("/api/v1/jobs", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(String.valueOf(response.getBody().get("details")))
                .contains("offered_calls")
                .contains("average_handle_time");
    }

    @Test
    void unknownJobIsNotFound() {
        ResponseEntity<Map<String, Object>> response = get("/api/v1/jobs/" + UUID.randomUUID());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void malformedJobIdIsBadRequest() {
        ResponseEntity<Map<String, Object>> response = get("/api/v1/jobs/not-a-uuid");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void healthReportsQueueDetails() {
        ResponseEntity<Map<String, Object>> response = get("/actuator/health");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "UP");
        assertThat(String.valueOf(response.getBody().get("components"))).contains("jobQueue");
    }

    @Test
    void exhaustedJobRaisesOperatorAlert() {
        Map<String, Object> body = Map.of(
                "project_code", "ALERTS",
                "interval_type", "30m",
                "input_parameters", Map.of("offered_calls", 1_000_000, "average_handle_time", 3600),
                "priority", 1);
        String jobId = String.valueOf(post("/api/v1/jobs", body).getBody().get("job_id"));

        await().atMost(30, SECONDS).pollInterval(1, SECONDS).until(() -> {
            post("/api/v1/jobs/process?batch_size=5", null);
            return "FAILED".equals(get("/api/v1/jobs/" + jobId).getBody().get("status"));
        });

        await().atMost(5, SECONDS).until(() -> {
            ResponseEntity<List<Map<String, Object>>> alerts = rest.exchange(
                    "/api/v1/operator-alerts", HttpMethod.GET, null, JSON_ARRAY);
            return alerts.getBody().stream().anyMatch(a -> jobId.equals(String.valueOf(a.get("job_id"))));
        });
    }

    private ResponseEntity<Map<String, Object>> post(String path, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-ID", "integ-" + UUID.randomUUID());
        return rest.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), JSON_OBJECT);
    }

    private ResponseEntity<Map<String, Object>> get(String path) {
        return rest.exchange(path, HttpMethod.GET, null, JSON_OBJECT);
    }
}
