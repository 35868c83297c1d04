package com.phillippitts.multishot.presentation.controller;

import com.phillippitts.multishot.config.IntegrationTestConfiguration;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises the run and metrics endpoints end to end over HTTP.
 */
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RunApiIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private ResponseEntity<String> post(String path, JSONObject body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.postForEntity("http://localhost:" + port + path,
                new HttpEntity<>(body.toString(), headers), String.class);
    }

    private ResponseEntity<String> get(String path) {
        return restTemplate.getForEntity("http://localhost:" + port + path, String.class);
    }

    @Test
    void runsPromptAgainstRequestedEngines() {
        JSONObject body = new JSONObject()
                .put("prompt", "Explain consistent hashing")
                .put("engines", new JSONArray().put("gpt-4o").put("mistral-broken"))
                .put("retries", 0);

        ResponseEntity<String> response = post("/api/runs", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JSONObject json = new JSONObject(response.getBody());
        assertThat(json.getBoolean("success")).isTrue();
        assertThat(json.getInt("successCount")).isEqualTo(1);
        assertThat(json.getInt("failureCount")).isEqualTo(1);
        assertThat(json.getJSONArray("errors").getString(0)).isEqualTo("mistral-broken: HTTP 500 from backend");
        JSONObject first = json.getJSONArray("results").getJSONObject(0);
        assertThat(first.getString("engine")).isEqualTo("gpt-4o");
        assertThat(first.getString("content")).isEqualTo("gpt-4o says: Explain consistent hashing");

        ResponseEntity<String> metrics = get("/api/metrics/runs/" + json.getString("runId"));
        assertThat(metrics.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(new JSONObject(metrics.getBody()).getDouble("successRate")).isEqualTo(0.5);
    }

    @Test
    void failFastRunReturnsBadGateway() {
        JSONObject body = new JSONObject()
                .put("prompt", "hello")
                .put("engines", new JSONArray().put("mistral-broken"))
                .put("retries", 0)
                .put("continueOnError", false);

        ResponseEntity<String> response = post("/api/runs", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).contains("RunAbortedException");
    }

    @Test
    void blankPromptIsRejected() {
        ResponseEntity<String> response = post("/api/runs", new JSONObject().put("prompt", "  "));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).contains("prompt must not be blank");
    }

    @Test
    void nullMetadataValueIsRejected() {
        JSONObject body = new JSONObject()
                .put("prompt", "hello")
                .put("metadata", new JSONObject().put("ticket", JSONObject.NULL));

        ResponseEntity<String> response = post("/api/runs", body);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).contains("metadata entry 'ticket' must not be null");
    }

    @Test
    void reportsEngineStatus() {
        ResponseEntity<String> response = get("/api/engines/status?names=gpt-4o,tinyllama");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JSONObject json = new JSONObject(response.getBody());
        assertThat(json.getBoolean("gpt-4o")).isTrue();
        // no LOCAL transport is registered in tests
        assertThat(json.getBoolean("tinyllama")).isFalse();
    }

    @Test
    void unknownRunMetricsReturnNotFound() {
        assertThat(get("/api/metrics/runs/run-missing").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void metricsSummaryIncludesTrends() {
        post("/api/runs", new JSONObject().put("prompt", "warm up").put("engines", new JSONArray().put("gpt-4o")));

        ResponseEntity<String> response = get("/api/metrics/summary");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JSONObject json = new JSONObject(response.getBody());
        assertThat(json.getJSONObject("summary").getInt("totalRuns")).isPositive();
        assertThat(json.getJSONObject("trends").has("COST")).isTrue();
    }
}
