package com.stepwright.orchestrator.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses job payloads into {@link TaskDocument}s and (de)serializes the
 * resolved step list stored on the job row.
 *
 * Step resolution:
 *   - task.steps missing or empty → a single step "step-1" carrying the task skill
 *   - step id: explicit "id", else "step-{index+1}"; ids must be unique
 *   - skill:   step.skill.id, else task.skill.id, else "auto"
 */
@Component
public class TaskDocumentReader {

    static final String AUTO_SKILL = "auto";

    private static final TypeReference<List<ResolvedStep>> STEP_LIST = new TypeReference<>() {};

    private final ObjectMapper json;

    public TaskDocumentReader(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public TaskDocument read(String payload) {
        JsonNode root;
        try {
            root = json.readTree(payload == null ? "" : payload);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskException("Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidTaskException("Payload must be a JSON object");
        }

        JsonNode task = root.path("task");
        String objective = text(task.path("instructions"));
        String taskSkill = text(task.path("skill").path("id"));
        if (taskSkill == null) taskSkill = AUTO_SKILL;

        return new TaskDocument(
                text(root.path("repository")),
                text(root.path("baseRef")),
                capabilities(root.path("requiredCapabilities")),
                objective,
                taskSkill,
                resolveSteps(task.path("steps"), taskSkill));
    }

    // ------------------------------------------------------------------
    // Resolved step list (jobs.resolved_steps)
    // ------------------------------------------------------------------

    public String writeSteps(List<ResolvedStep> steps) {
        try {
            return json.writeValueAsString(steps);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskException("Could not serialize resolved steps", e);
        }
    }

    public List<ResolvedStep> readSteps(String resolvedSteps) {
        if (resolvedSteps == null || resolvedSteps.isBlank()) {
            throw new InvalidTaskException("Job has no resolved steps");
        }
        try {
            return json.readValue(resolvedSteps, STEP_LIST);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskException("Stored step list is corrupt", e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<ResolvedStep> resolveSteps(JsonNode rawSteps, String taskSkill) {
        if (!rawSteps.isArray() || rawSteps.isEmpty()) {
            return List.of(new ResolvedStep(0, "step-1", null, null, taskSkill));
        }
        List<ResolvedStep> steps = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rawSteps.size(); i++) {
            JsonNode step = rawSteps.get(i);
            String id = text(step.path("id"));
            if (id == null) id = "step-" + (i + 1);
            if (!seen.add(id)) {
                throw new InvalidTaskException("Duplicate step id '" + id + "'");
            }
            String skill = text(step.path("skill").path("id"));
            steps.add(new ResolvedStep(i, id,
                    text(step.path("title")),
                    text(step.path("instructions")),
                    skill != null ? skill : taskSkill));
        }
        return steps;
    }

    private static List<String> capabilities(JsonNode node) {
        if (!node.isArray()) return List.of();
        Set<String> caps = new LinkedHashSet<>();
        node.forEach(c -> {
            String value = text(c);
            if (value != null) caps.add(value.toLowerCase(Locale.ROOT));
        });
        return List.copyOf(caps);
    }

    /** Trimmed text of a scalar node; null when missing or blank. */
    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) return null;
        String value = node.asText().strip();
        return value.isEmpty() ? null : value;
    }
}
