package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeInfo.As;
import com.fasterxml.jackson.annotation.JsonTypeInfo.Id;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import java.io.IOException;
import java.util.Map;
import java.util.Map.Entry;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Collectors;

/**
 * A connection to the workflow engine that assembled jobs are registered with
 *
 * <p>Implementations are read from the configuration file using jackson-databind; the
 * <code>type</code> property selects the implementation through {@link
 * WorkflowEngineClientProvider} services.
 */
@JsonTypeIdResolver(WorkflowEngineClient.WorkflowEngineClientIdResolver.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = As.PROPERTY, property = "type")
public interface WorkflowEngineClient {

  final class WorkflowEngineClientIdResolver extends TypeIdResolverBase {
    private final Map<String, Class<? extends WorkflowEngineClient>> knownIds =
        ServiceLoader.load(WorkflowEngineClientProvider.class).stream()
            .map(Provider::get)
            .flatMap(WorkflowEngineClientProvider::types)
            .collect(Collectors.toMap(Entry::getKey, Entry::getValue));

    @Override
    public Id getMechanism() {
      return Id.CUSTOM;
    }

    @Override
    public String idFromValue(Object o) {
      return knownIds.entrySet().stream()
          .filter(known -> known.getValue().isInstance(o))
          .map(Entry::getKey)
          .findFirst()
          .orElseThrow();
    }

    @Override
    public String idFromValueAndType(Object o, Class<?> aClass) {
      return idFromValue(o);
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
      final var clazz = knownIds.get(id);
      return clazz == null ? null : context.constructType(clazz);
    }
  }

  /**
   * Start a run of a registered job
   *
   * @param jobId the identifier returned by {@link #register(PipelineJob, String)}
   * @param runName the name of the run
   * @return the identifier of the run
   */
  String createRun(String jobId, String runName) throws IOException, InterruptedException;

  /**
   * Register a job so that it can be run
   *
   * @param job the fully assembled job
   * @param projectName the project in the workflow engine to register the job under
   * @return the identifier of the registered job
   */
  String register(PipelineJob job, String projectName) throws IOException, InterruptedException;

  /**
   * Called to initialise this client.
   *
   * <p>If the configuration is invalid, this should throw a runtime exception.
   */
  void startup();
}
