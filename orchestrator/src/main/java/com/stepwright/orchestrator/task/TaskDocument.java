package com.stepwright.orchestrator.task;

import java.util.List;

/**
 * Parsed view of a job payload.
 *
 * <pre>
 * {
 *   "repository": "org/repo", "baseRef": "main",
 *   "requiredCapabilities": ["git", "python"],
 *   "task": {
 *     "instructions": "overall objective",
 *     "skill": {"id": "auto"},
 *     "steps": [{"id": "lint", "title": "...", "instructions": "...", "skill": {"id": "..."}}]
 *   }
 * }
 * </pre>
 */
public record TaskDocument(
        String             repository,
        String             baseRef,
        List<String>       requiredCapabilities,
        String             objective,
        String             skillId,
        List<ResolvedStep> steps
) {}
