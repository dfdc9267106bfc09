package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.PipelineJob;
import ca.on.oicr.gsi.baker.WorkflowEngineClient;
import ca.on.oicr.gsi.baker.WorkflowEngineClientProvider;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/** A workflow engine that accepts every job and runs nothing */
public final class DryRunWorkflowEngineClient implements WorkflowEngineClient {

  public static WorkflowEngineClientProvider provider() {
    return () -> Stream.of(Map.entry("dry-run", DryRunWorkflowEngineClient.class));
  }

  private final List<PipelineJob> jobs = new ArrayList<>();
  private int runs;

  @Override
  public String createRun(String jobId, String runName) {
    return String.format("%s/run-%d", jobId, ++runs);
  }

  /** The jobs registered so far, in order */
  @JsonIgnore
  public List<PipelineJob> jobs() {
    return Collections.unmodifiableList(jobs);
  }

  @Override
  public String register(PipelineJob job, String projectName) {
    jobs.add(job);
    return String.format("dry-run-%d", jobs.size());
  }

  @Override
  public void startup() {
    // Always ok.
  }
}
