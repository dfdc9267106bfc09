package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/** Runs the driver process as a container orchestrator job */
public record KubernetesRunConfig(
    ObjectNode jobTemplate,
    String image,
    List<String> labels,
    String memoryRequest,
    String cpuRequest,
    Map<String, String> env)
    implements RunConfig {}
