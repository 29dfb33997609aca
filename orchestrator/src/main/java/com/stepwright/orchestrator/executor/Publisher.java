package com.stepwright.orchestrator.executor;

import com.stepwright.orchestrator.model.Job;

/**
 * Ships the finished workspace (branch, PR, artifact upload ...).
 * Called at most once per job, after every step succeeded.
 */
public interface Publisher {

    /** @return a short human-readable pointer to what was published */
    String publish(Job job, String workspaceRef);
}
