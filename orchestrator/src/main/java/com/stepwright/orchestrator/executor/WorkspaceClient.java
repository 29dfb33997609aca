package com.stepwright.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.executor.dto.PublishResponse;
import com.stepwright.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the executor service's workspace endpoints.
 *
 *   POST   /workspace/create       clone baseline into a new workspace
 *   POST   /workspace/reset        discard changes, back to baseline
 *   POST   /workspace/apply_patch  apply a checkpoint's diff
 *   POST   /workspace/publish      ship the finished workspace
 *   DELETE /workspace/{ref}
 *
 * Uses java.net.http.HttpClient directly so every header and byte on the
 * wire is explicit. Called from worker threads; blocking I/O is fine here.
 */
@Component
public class WorkspaceClient implements WorkspaceManager, Publisher {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public WorkspaceClient(
            @Value("${stepwright.executor.base-url}") String baseUrl,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)   // uvicorn doesn't support h2c upgrade
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Workspace lifecycle
    // ------------------------------------------------------------------

    @Override
    public void prepare(String workspaceRef, Baseline baseline) {
        log.info("Creating workspace '{}' from {} @ {}", workspaceRef, baseline.repository(), baseline.ref());
        String body = toJson(Map.of("workspace_ref", workspaceRef,
                                    "repo_url",      baseline.repository(),
                                    "git_ref",       baseline.ref()));
        post("/workspace/create", body, "prepare " + workspaceRef);
    }

    @Override
    public void reset(String workspaceRef, Baseline baseline) {
        log.info("Resetting workspace '{}' to {} @ {}", workspaceRef, baseline.repository(), baseline.ref());
        String body = toJson(Map.of("workspace_ref", workspaceRef,
                                    "repo_url",      baseline.repository(),
                                    "git_ref",       baseline.ref()));
        post("/workspace/reset", body, "reset " + workspaceRef);
    }

    @Override
    public void applyPatch(String workspaceRef, String patch) {
        String body = toJson(Map.of("workspace_ref", workspaceRef,
                                    "patch",         patch));
        post("/workspace/apply_patch", body, "applyPatch on " + workspaceRef);
    }

    @Override
    public void delete(String workspaceRef) {
        log.info("Deleting workspace '{}'", workspaceRef);
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/workspace/" + workspaceRef))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept", "application/json")
                    .DELETE()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        "delete failed for " + workspaceRef
                        + ": HTTP " + resp.statusCode() + ": " + resp.body());
            }
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException("delete interrupted for " + workspaceRef, e);
        } catch (Exception e) {
            throw new ExecutorException("delete failed for " + workspaceRef, e);
        }
    }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    @Override
    public String publish(Job job, String workspaceRef) {
        log.info("Publishing workspace '{}' for job {}", workspaceRef, job.getId());
        String body = toJson(Map.of("workspace_ref", workspaceRef,
                                    "job_id",        job.getId().toString(),
                                    "job_type",      job.getType()));
        String respBody = post("/workspace/publish", body, "publish " + workspaceRef);
        try {
            PublishResponse resp = json.readValue(respBody, PublishResponse.class);
            return resp.ref();
        } catch (JsonProcessingException e) {
            throw new ExecutorException("Failed to parse publish response", e);
        }
    }

    // ------------------------------------------------------------------
    // Shared with ExecutorStepRuntime
    // ------------------------------------------------------------------

    HttpClient http()     { return http; }
    String     baseUrl()  { return baseUrl; }

    /** POST with default 120-second timeout; returns response body as String. */
    String post(String path, String jsonBody, String opName) {
        return post(path, jsonBody, opName, Duration.ofSeconds(120));
    }

    /** POST with an explicit timeout; returns response body as String. */
    String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutorException(opName + " failed", e);
        }
    }

    /** Serialize obj to JSON string; throws ExecutorException on failure. */
    String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutorException("JSON serialization failed", e);
        }
    }
}
