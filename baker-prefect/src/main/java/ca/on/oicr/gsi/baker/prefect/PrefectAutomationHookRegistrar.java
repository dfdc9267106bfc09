package ca.on.oicr.gsi.baker.prefect;

import ca.on.oicr.gsi.baker.AutomationHookRegistrar;
import ca.on.oicr.gsi.baker.AutomationHookRegistrarProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Attaches a hook to a Prefect flow that sends a repository dispatch event to GitHub when a run of
 * the flow succeeds or fails
 */
public final class PrefectAutomationHookRegistrar extends BasePrefectClient
    implements AutomationHookRegistrar {
  static final String CREATE_ACTION =
      "mutation($input: create_action_input!) { create_action(input: $input) { id } }";
  static final String CREATE_HOOK =
      "mutation($input: create_flow_run_state_changed_hook_input!) "
          + "{ create_flow_run_state_changed_hook(input: $input) { id } }";
  static final String EVENT_TYPE = "prefect-webhook";
  static final String FLOW_GROUP_QUERY =
      "query($id: uuid!) { flow_by_pk(id: $id) { flow_group_id } }";

  public static AutomationHookRegistrarProvider provider() {
    return () -> Stream.of(Map.entry("prefect-github", PrefectAutomationHookRegistrar.class));
  }

  /**
   * Build the input for an action that calls the repository dispatch webhook
   *
   * @param apiUrl the base URL of the GitHub API
   * @param jobId the flow the action reports on
   * @param repository the <code>owner/name</code> of the repository
   * @param botCredential the token used to call the webhook
   */
  static ObjectNode actionInput(
      String apiUrl, String jobId, String repository, String botCredential) {
    final var variables = MAPPER.createObjectNode();
    final var webhook =
        variables
            .putObject("input")
            .put("name", String.format("dispatch-%s", jobId))
            .putObject("config")
            .putObject("webhook");
    webhook.put("url", String.format("%s/repos/%s/dispatches", apiUrl, repository));
    webhook
        .putObject("headers")
        .put("Authorization", "token " + botCredential)
        .put("Accept", "application/vnd.github.v3+json");
    final var payload = webhook.putObject("payload");
    payload.put("event_type", EVENT_TYPE);
    payload.putObject("client_payload").put("flow_id", jobId);
    return variables;
  }

  static String flowGroupId(JsonNode data, String jobId) throws IOException {
    final var flowGroup = data.path("flow_by_pk").path("flow_group_id");
    if (!flowGroup.isTextual()) {
      throw new IOException(String.format("Prefect flow %s does not exist", jobId));
    }
    return flowGroup.asText();
  }

  static ObjectNode hookInput(String flowGroupId, String actionId) {
    final var variables = MAPPER.createObjectNode();
    final var input = variables.putObject("input");
    input.putArray("flow_group_ids").add(flowGroupId);
    input.put("action_id", actionId);
    input.putArray("states").add("Success").add("Failed");
    return variables;
  }

  private String githubUrl = "https://api.github.com";

  public String getGithubUrl() {
    return githubUrl;
  }

  @Override
  public String register(String jobId, String repository, String botCredential)
      throws IOException, InterruptedException {
    final var query = object();
    query.put("id", jobId);
    final var flowGroup = flowGroupId(execute(FLOW_GROUP_QUERY, query), jobId);
    final var actionId =
        PrefectWorkflowEngineClient.id(
            execute(CREATE_ACTION, actionInput(githubUrl, jobId, repository, botCredential)),
            "create_action");
    return PrefectWorkflowEngineClient.id(
        execute(CREATE_HOOK, hookInput(flowGroup, actionId)),
        "create_flow_run_state_changed_hook");
  }

  public void setGithubUrl(String githubUrl) {
    this.githubUrl = githubUrl;
  }
}
