package ca.on.oicr.gsi.baker.core;

import java.util.Optional;

/**
 * A job that was registered with the workflow engine
 *
 * @param recipeId the identifier of the recipe the job was built from
 * @param jobId the identifier the workflow engine assigned
 * @param runId the identifier of the run started for the job, if one was
 * @param hookId the identifier of the automation hook attached to the job, if one was
 */
public record RegisteredJob(
    String recipeId, String jobId, Optional<String> runId, Optional<String> hookId) {}
