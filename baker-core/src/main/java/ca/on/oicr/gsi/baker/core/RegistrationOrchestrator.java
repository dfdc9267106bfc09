package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.AutomationHookRegistrar;
import ca.on.oicr.gsi.baker.PipelineJob;
import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.RecipeLoader;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.StorageFilesystem;
import ca.on.oicr.gsi.baker.WorkflowEngineClient;
import ca.on.oicr.gsi.baker.api.Bakery;
import ca.on.oicr.gsi.baker.api.RecipeEntry;
import ca.on.oicr.gsi.baker.api.RecipeManifest;
import ca.on.oicr.gsi.baker.api.TargetDescriptor;
import ca.on.oicr.gsi.baker.api.Versions;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registers every recipe in a manifest with the workflow engine
 *
 * <p>The manifest's bakery is located and the toolchain versions are checked before anything else
 * happens. The recipes are then registered one at a time, in the order the manifest lists them;
 * the members of a family are registered in the family's order. The first failure stops the
 * batch. Jobs registered before the failure are not withdrawn.
 *
 * <p>A batch with a correlation identifier starts a run of every job and attaches an automation
 * hook to it, so it requires an automation hook registrar.
 */
public final class RegistrationOrchestrator {
  public static final String DEFAULT_BOT_TOKEN_SECRET = "ACTIONS_BOT_TOKEN";
  private static final Logger LOGGER = System.getLogger(RegistrationOrchestrator.class.getName());

  private static Resolution<String> extension(Recipe recipe) {
    return switch (recipe.kind()) {
      case XARRAY_ZARR -> Resolution.resolved("zarr");
      case HDF_REFERENCE -> Resolution.failed(
          ResolutionError.UNSUPPORTED_RECIPE_TYPE,
          String.format("Recipe kind %s cannot be registered.", recipe.kind()));
    };
  }

  private final FlowAssembler assembler;
  private final Optional<AutomationHookRegistrar> automation;
  private final String botTokenSecret;
  private final WorkflowEngineClient engine;
  private final RecipeLoader loader;
  private final TargetResolver targetResolver;

  public RegistrationOrchestrator(
      StorageFilesystem filesystem,
      RecipeLoader loader,
      WorkflowEngineClient engine,
      Optional<AutomationHookRegistrar> automation,
      String botTokenSecret) {
    this(
        new TargetResolver(filesystem),
        new FlowAssembler(),
        loader,
        engine,
        automation,
        botTokenSecret);
  }

  public RegistrationOrchestrator(
      TargetResolver targetResolver,
      FlowAssembler assembler,
      RecipeLoader loader,
      WorkflowEngineClient engine,
      Optional<AutomationHookRegistrar> automation,
      String botTokenSecret) {
    this.targetResolver = targetResolver;
    this.assembler = assembler;
    this.loader = loader;
    this.engine = engine;
    this.automation = automation;
    this.botTokenSecret = botTokenSecret;
  }

  private Resolution<Map<String, Recipe>> load(Path manifestLocation, RecipeEntry entry) {
    if (entry.isFamily()) {
      return loader.loadFamily(manifestLocation, entry.getDictObject());
    }
    if (entry.getId() == null) {
      return Resolution.failed(
          ResolutionError.UNKNOWN_RECIPE_REFERENCE,
          String.format(
              "Recipe %s in %s has no identifier.", entry.getObject(), manifestLocation));
    }
    return loader
        .loadRecipe(manifestLocation, entry.getObject())
        .map(recipe -> Map.of(entry.getId(), recipe));
  }

  /**
   * Register a manifest's recipes
   *
   * @param context the repository, project, and correlation identifier for this batch
   * @param manifestLocation the path of the manifest, used to find recipe definitions
   * @param manifest the manifest
   * @param bakeries all known bakeries, by identifier
   * @param secrets the credentials available to the batch
   * @param runtimeVersions the toolchain versions of the registering process
   * @param prune whether to register reduced copies of the recipes
   * @return the jobs registered and the failure that stopped the batch, if any
   */
  public RegistrationReport register(
      RegistrationContext context,
      Path manifestLocation,
      RecipeManifest manifest,
      Map<String, Bakery> bakeries,
      Secrets secrets,
      Versions runtimeVersions,
      boolean prune) {
    final var registered = new ArrayList<RegisteredJob>();
    if (context.correlationId().isPresent() && automation.isEmpty()) {
      return RegistrationReport.failed(
          registered,
          ResolutionError.MISSING_AUTOMATION,
          String.format(
              "Correlation identifier %s requires an automation hook registrar, but none is"
                  + " configured.",
              context.correlationId().get()));
    }
    final var recipeBakery = manifest.getBakery();
    if (recipeBakery == null || !bakeries.containsKey(recipeBakery.getId())) {
      return RegistrationReport.failed(
          registered,
          ResolutionError.UNKNOWN_BAKERY,
          String.format(
              "Manifest %s refers to unknown bakery %s.",
              manifestLocation, recipeBakery == null ? null : recipeBakery.getId()));
    }
    final var bakery = bakeries.get(recipeBakery.getId());
    LOGGER.log(Level.INFO, "Using bakery {0} for {1}", recipeBakery.getId(), manifestLocation);

    final var versions =
        VersionGate.check(manifest.versions(), bakery.getCluster().versions(), runtimeVersions);
    if (!versions.isResolved()) {
      return versions.apply(new ReportFailure(registered));
    }

    final var descriptor = bakery.getTargets().get(recipeBakery.getTarget());
    if (descriptor == null) {
      return RegistrationReport.failed(
          registered,
          ResolutionError.UNKNOWN_TARGET,
          String.format(
              "Bakery %s has no target %s.", recipeBakery.getId(), recipeBakery.getTarget()));
    }

    for (final var entry : manifest.getRecipes()) {
      final var recipes = load(manifestLocation, entry);
      if (!recipes.isResolved()) {
        return recipes.apply(new ReportFailure(registered));
      }
      for (final var recipe : recipes.orElseThrow().entrySet()) {
        final var result =
            registerRecipe(
                context,
                manifest,
                bakery,
                recipeBakery.getTarget(),
                descriptor,
                recipe.getKey(),
                recipe.getValue(),
                secrets,
                prune,
                registered);
        if (!result.isResolved()) {
          LOGGER.log(Level.ERROR, "Failed to register {0}: {1}", recipe.getKey(), result);
          return result.apply(new ReportFailure(registered));
        }
      }
    }
    return RegistrationReport.succeeded(registered);
  }

  private Resolution<RegisteredJob> registerRecipe(
      RegistrationContext context,
      RecipeManifest manifest,
      Bakery bakery,
      String targetName,
      TargetDescriptor descriptor,
      String recipeId,
      Recipe recipe,
      Secrets secrets,
      boolean prune,
      List<RegisteredJob> registered) {
    return extension(recipe)
        .then(
            extension ->
                targetResolver.resolve(
                    targetName, descriptor, context.repository(), recipeId, extension, secrets))
        .then(
            targets ->
                assembler.assemble(bakery, manifest, recipeId, recipe, targets, secrets, prune))
        .then(job -> submit(context, recipeId, job, secrets, registered));
  }

  private Resolution<RegisteredJob> send(
      RegistrationContext context,
      String recipeId,
      PipelineJob job,
      String botToken,
      List<RegisteredJob> registered) {
    String jobId = null;
    try {
      jobId = engine.register(job, context.projectName());
      LOGGER.log(Level.INFO, "Registered {0} as {1}", recipeId, jobId);
      Optional<String> runId = Optional.empty();
      Optional<String> hookId = Optional.empty();
      if (context.correlationId().isPresent()) {
        runId = Optional.of(engine.createRun(jobId, context.correlationId().get()));
        LOGGER.log(Level.INFO, "Started run {0} of {1}", runId.get(), jobId);
        hookId =
            Optional.of(automation.orElseThrow().register(jobId, context.repository(), botToken));
        LOGGER.log(Level.INFO, "Attached hook {0} to {1}", hookId.get(), jobId);
      }
      final var result = new RegisteredJob(recipeId, jobId, runId, hookId);
      registered.add(result);
      return Resolution.resolved(result);
    } catch (IOException e) {
      return engineFailure(recipeId, jobId, e, registered);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return engineFailure(recipeId, jobId, e, registered);
    }
  }

  private Resolution<RegisteredJob> submit(
      RegistrationContext context,
      String recipeId,
      PipelineJob job,
      Secrets secrets,
      List<RegisteredJob> registered) {
    // A missing bot token must fail before anything is registered
    final Resolution<String> botToken =
        context.correlationId().isPresent()
            ? secrets.get(botTokenSecret)
            : Resolution.resolved(null);
    return botToken.then(token -> send(context, recipeId, job, token, registered));
  }

  private static Resolution<RegisteredJob> engineFailure(
      String recipeId, String jobId, Exception e, List<RegisteredJob> registered) {
    if (jobId != null) {
      registered.add(new RegisteredJob(recipeId, jobId, Optional.empty(), Optional.empty()));
    }
    return Resolution.failed(
        ResolutionError.ENGINE_FAILURE,
        String.format("Workflow engine failed while registering %s: %s", recipeId, e.getMessage()));
  }

  private static final class ReportFailure
      implements Resolution.Visitor<Object, RegistrationReport> {
    private final List<RegisteredJob> registered;

    private ReportFailure(List<RegisteredJob> registered) {
      this.registered = registered;
    }

    @Override
    public RegistrationReport failed(ResolutionError error, String message) {
      return RegistrationReport.failed(registered, error, message);
    }

    @Override
    public RegistrationReport resolved(Object value) {
      return RegistrationReport.succeeded(registered);
    }
  }
}
