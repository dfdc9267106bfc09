package ca.on.oicr.gsi.baker.core;

import java.util.Optional;

/**
 * Where a batch of registrations comes from and where it goes
 *
 * @param repository the repository that owns the manifest, in <code>owner/name</code> form; it is
 *     used as the storage namespace for all of the repository's recipes
 * @param projectName the workflow engine project the jobs are registered under
 * @param correlationId if present, each registered job is run immediately under this name and an
 *     automation hook reports the result back to the repository
 */
public record RegistrationContext(
    String repository, String projectName, Optional<String> correlationId) {}
