package com.stepwright.orchestrator.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepwright.orchestrator.executor.dto.RunStepEvent;
import com.stepwright.orchestrator.executor.dto.RunStepRequest;
import com.stepwright.orchestrator.task.RetryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

/**
 * {@link StepRuntime} backed by the executor service.
 *
 * POST /workspace/run_step streams NDJSON: progress lines while the step
 * runs, then a single "result" line. Every line pulses the activity
 * listener, which is what the idle watchdog watches.
 *
 * No request timeout is set: wall-clock and idle limits are enforced by
 * the attempt supervisor, which calls {@link #terminate} on a trip.
 */
@Component
public class ExecutorStepRuntime implements StepRuntime {

    private static final Logger log = LoggerFactory.getLogger(ExecutorStepRuntime.class);

    private final WorkspaceClient client;
    private final ObjectMapper    json;

    public ExecutorStepRuntime(WorkspaceClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.json   = objectMapper;
    }

    @Override
    public StepOutcome execute(StepInvocation inv, ActivityListener activity) throws InterruptedException {
        RetryContext retry = inv.retry();
        RunStepRequest body = new RunStepRequest(
                inv.jobId().toString(),
                inv.workspaceRef(),
                inv.step().stepId(),
                inv.step().stepIndex(),
                inv.stepCount(),
                inv.attempt(),
                inv.step().skillId(),
                inv.instruction(),
                retry == null ? null : retry.failureSummary(),
                retry == null ? null : retry.priorDiffHash(),
                retry == null ? null : retry.priorChangedFiles());

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(client.baseUrl() + "/workspace/run_step"))
                .header("Content-Type", "application/json")
                .header("Accept",       "application/x-ndjson")
                .POST(HttpRequest.BodyPublishers.ofString(client.toJson(body)))
                .build();

        HttpResponse<Stream<String>> resp;
        try {
            resp = client.http().send(req, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new ExecutorException("run_step failed for " + inv.step().stepId(), e);
        }

        try (Stream<String> lines = resp.body()) {
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutorException("run_step failed: HTTP " + resp.statusCode());
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("run_step interrupted");
                }
                String line = it.next();
                if (line.isBlank()) continue;
                activity.pulse();
                RunStepEvent event = parse(line);
                if (event != null && event.isResult()) {
                    return toOutcome(event);
                }
            }
        }
        return StepOutcome.failure(null, null, "runtime stream ended without a result", "", null);
    }

    @Override
    public void terminate(StepInvocation inv) {
        log.warn("Terminating runtime for step {} attempt {} in workspace '{}'",
                inv.step().stepId(), inv.attempt(), inv.workspaceRef());
        String body = client.toJson(Map.of("workspace_ref", inv.workspaceRef(),
                                           "job_id",        inv.jobId().toString()));
        client.post("/workspace/run_step/cancel", body, "terminate " + inv.workspaceRef());
    }

    private RunStepEvent parse(String line) {
        try {
            return json.readValue(line, RunStepEvent.class);
        } catch (JsonProcessingException e) {
            // Plain text output still counts as activity.
            log.debug("Non-JSON runtime line: {}", line);
            return null;
        }
    }

    private static StepOutcome toOutcome(RunStepEvent e) {
        boolean ok = Boolean.TRUE.equals(e.succeeded());
        return new StepOutcome(ok, e.summary(), e.diff(), e.changed_files(),
                e.exit_code(), e.failure_hint(), e.error());
    }
}
