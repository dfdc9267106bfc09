package ca.on.oicr.gsi.baker.prefect;

import ca.on.oicr.gsi.baker.PipelineJob;
import ca.on.oicr.gsi.baker.WorkflowEngineClient;
import ca.on.oicr.gsi.baker.WorkflowEngineClientProvider;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/** Registers jobs as flows on a Prefect server */
public final class PrefectWorkflowEngineClient extends BasePrefectClient
    implements WorkflowEngineClient {
  static final String CREATE_FLOW =
      "mutation($input: create_flow_input!) { create_flow(input: $input) { id } }";
  static final String CREATE_FLOW_RUN =
      "mutation($input: create_flow_run_input!) { create_flow_run(input: $input) { id } }";
  private static final Logger LOGGER =
      System.getLogger(PrefectWorkflowEngineClient.class.getName());
  static final String PROJECT_QUERY =
      "query($name: String) { project(where: {name: {_eq: $name}}) { id } }";

  public static WorkflowEngineClientProvider provider() {
    return () -> Stream.of(Map.entry("prefect", PrefectWorkflowEngineClient.class));
  }

  /**
   * Extract a single identifier from a mutation result
   *
   * @param data the response data
   * @param field the name of the mutation
   */
  static String id(JsonNode data, String field) throws IOException {
    final var id = data.path(field).path("id");
    if (!id.isTextual()) {
      throw new IOException(String.format("Prefect server did not return an ID for %s", field));
    }
    return id.asText();
  }

  /**
   * Extract the project identifier from a project query result
   *
   * @param data the response data
   * @param projectName the project that was requested, for error messages
   */
  static String projectId(JsonNode data, String projectName) throws IOException {
    final var projects = data.path("project");
    if (!projects.isArray() || projects.size() == 0) {
      throw new IOException(String.format("Prefect project %s does not exist", projectName));
    }
    return projects.get(0).path("id").asText();
  }

  private final Map<String, String> projectIds = new ConcurrentHashMap<>();

  @Override
  public String createRun(String jobId, String runName) throws IOException, InterruptedException {
    final var input = object();
    input.putObject("input").put("flow_id", jobId).put("flow_run_name", runName);
    final var runId = id(execute(CREATE_FLOW_RUN, input), "create_flow_run");
    LOGGER.log(Level.DEBUG, "Created flow run {0} for {1}", runId, jobId);
    return runId;
  }

  private String findProject(String projectName) throws IOException, InterruptedException {
    final var cached = projectIds.get(projectName);
    if (cached != null) {
      return cached;
    }
    final var variables = object();
    variables.put("name", projectName);
    final var projectId = projectId(execute(PROJECT_QUERY, variables), projectName);
    projectIds.put(projectName, projectId);
    return projectId;
  }

  @Override
  public String register(PipelineJob job, String projectName)
      throws IOException, InterruptedException {
    final var serialized = FlowSerializer.serialize(job);
    final var variables = object();
    final var input = variables.putObject("input");
    input.put("project_id", findProject(projectName));
    input.set("serialized_flow", serialized);
    input.put("set_schedule_active", false);
    final var flowId = id(execute(CREATE_FLOW, variables), "create_flow");
    LOGGER.log(Level.DEBUG, "Registered flow {0} in project {1}", flowId, projectName);
    return flowId;
  }
}
