package ca.on.oicr.gsi.baker;

import java.util.List;
import java.util.Map;

/**
 * A container orchestrator pod that runs one process of a worker pool
 *
 * @param podType whether this pod is a <code>scheduler</code> or a <code>worker</code>
 * @param image the container image
 * @param labels labels attached to the pod
 * @param cpuRequest the CPU request, in orchestrator units (<i>e.g.</i>, <code>250m</code>)
 * @param memoryRequest the memory request, in orchestrator units (<i>e.g.</i>, <code>512Mi</code>)
 * @param args the container arguments
 * @param env environment variables for the container
 */
public record PodTemplate(
    String podType,
    String image,
    Map<String, String> labels,
    String cpuRequest,
    String memoryRequest,
    List<String> args,
    Map<String, String> env) {}
