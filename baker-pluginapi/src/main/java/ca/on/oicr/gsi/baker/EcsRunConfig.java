package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/** Runs the driver process as a serverless container task */
public record EcsRunConfig(
    String image,
    List<String> labels,
    ObjectNode taskDefinition,
    List<Map<String, String>> runTaskTags)
    implements RunConfig {}
