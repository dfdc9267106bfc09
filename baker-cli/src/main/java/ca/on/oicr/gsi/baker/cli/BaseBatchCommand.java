package ca.on.oicr.gsi.baker.cli;

import ca.on.oicr.gsi.baker.RecipeLoader;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Bakery;
import ca.on.oicr.gsi.baker.api.RecipeManifest;
import ca.on.oicr.gsi.baker.api.Versions;
import ca.on.oicr.gsi.baker.core.DeclarativeRecipeLoader;
import ca.on.oicr.gsi.baker.core.RecipeLoaderChain;
import ca.on.oicr.gsi.baker.core.RegisteredRecipeLoader;
import ca.on.oicr.gsi.baker.core.RegistrationContext;
import ca.on.oicr.gsi.baker.core.RegistrationOrchestrator;
import ca.on.oicr.gsi.baker.core.RegistrationReport;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;

/**
 * Common options for commands that process a whole recipe manifest
 *
 * <p>Exit codes: 0 if every recipe was registered, 1 if the batch stopped on a failure, 2 if an
 * input file or the configuration could not be used.
 */
abstract class BaseBatchCommand implements Callable<Integer> {
  static final int EXIT_FAILED = 1;
  static final int EXIT_SUCCESS = 0;
  static final int EXIT_UNUSABLE_INPUT = 2;

  static ObjectNode toJson(RegistrationReport report) {
    final var output = InputFiles.JSON_MAPPER.createObjectNode();
    final var registered = output.putArray("registered");
    for (final var job : report.registered()) {
      final var node = registered.addObject();
      node.put("recipe_id", job.recipeId());
      node.put("job_id", job.jobId());
      job.runId().ifPresent(runId -> node.put("run_id", runId));
      job.hookId().ifPresent(hookId -> node.put("hook_id", hookId));
    }
    report
        .failure()
        .ifPresent(
            failure -> {
              final var node = output.putObject("failure");
              node.put("error", failure.error().name());
              node.put("category", failure.error().category().name());
              node.put("message", failure.message());
            });
    return output;
  }

  @CommandLine.Option(
      names = {"-b", "--bakeries"},
      required = true,
      description = "The YAML file describing all known bakeries")
  private Path bakeriesFile;

  @CommandLine.Option(
      names = {"--correlation-id"},
      defaultValue = "${env:COMMENT_ID}",
      description =
          "If set, each registered job is run under this name and its result reported back")
  private String correlationId;

  @CommandLine.Option(
      names = {"-m", "--meta"},
      required = true,
      description = "The recipe manifest")
  private Path metaFile;

  @CommandLine.Option(
      names = {"--project"},
      defaultValue = "${env:PREFECT_PROJECT_NAME}",
      description = "The workflow engine project to register jobs under")
  private String projectName;

  @CommandLine.Option(
      names = {"--prune"},
      description = "Register reduced copies of the recipes for testing")
  private boolean prune;

  @CommandLine.Option(
      names = {"-r", "--repository"},
      defaultValue = "${env:GITHUB_REPOSITORY}",
      description = "The repository that owns the manifest, as owner/name")
  private String repository;

  @CommandLine.Option(
      names = {"-s", "--secrets"},
      required = true,
      description = "The JSON file of credentials, by name")
  private Path secretsFile;

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Show debugging messages")
  private boolean verbose;

  @CommandLine.Option(
      names = {"--versions"},
      required = true,
      description = "The JSON file of toolchain versions installed where this runs")
  private Path versionsFile;

  @Override
  public final Integer call() throws Exception {
    if (verbose) {
      final var root = Logger.getLogger("");
      root.setLevel(Level.FINE);
      for (final var handler : root.getHandlers()) {
        handler.setLevel(Level.FINE);
      }
    }
    if (repository == null || repository.isBlank()) {
      System.err.println("No repository given. Use --repository or set GITHUB_REPOSITORY.");
      return EXIT_UNUSABLE_INPUT;
    }
    if (projectName == null || projectName.isBlank()) {
      System.err.println("No project given. Use --project or set PREFECT_PROJECT_NAME.");
      return EXIT_UNUSABLE_INPUT;
    }
    final RegistrationOrchestrator orchestrator;
    final Batch batch;
    try {
      batch =
          new Batch(
              InputFiles.manifest(metaFile),
              InputFiles.bakeries(bakeriesFile),
              InputFiles.secrets(secretsFile),
              InputFiles.versions(versionsFile));
      orchestrator = orchestrator();
    } catch (IOException | IllegalStateException e) {
      System.err.println(e.getMessage());
      return EXIT_UNUSABLE_INPUT;
    }
    final var report =
        orchestrator.register(
            new RegistrationContext(repository, projectName, correlationId()),
            metaFile,
            batch.manifest(),
            batch.bakeries(),
            batch.secrets(),
            batch.versions(),
            prune);
    report.failure().ifPresent(failure -> System.err.println(failure.message()));
    write(report, batch.secrets());
    return report.isSuccessful() ? EXIT_SUCCESS : EXIT_FAILED;
  }

  /** The name runs are started under, if any */
  protected Optional<String> correlationId() {
    return Optional.ofNullable(correlationId).filter(id -> !id.isBlank());
  }

  /**
   * Print the outcome of the batch to standard output
   *
   * <p>Called whether the batch succeeded or not.
   */
  protected void write(RegistrationReport report, Secrets secrets) throws IOException {
    System.out.println(
        InputFiles.JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(report)));
  }

  /** Find recipes by reference: first from installed recipe plugins, then from data files */
  protected final RecipeLoader loader() {
    return new RecipeLoaderChain(
        List.of(RegisteredRecipeLoader.fromServices(), new DeclarativeRecipeLoader()));
  }

  /** Create the orchestrator for this command */
  protected abstract RegistrationOrchestrator orchestrator() throws IOException;

  private record Batch(
      RecipeManifest manifest, Map<String, Bakery> bakeries, Secrets secrets, Versions versions) {}
}
