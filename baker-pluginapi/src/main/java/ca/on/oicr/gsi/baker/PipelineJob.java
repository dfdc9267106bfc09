package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A pipeline job, in the form a workflow engine registers
 *
 * <p>Recipes produce a job containing only their tasks; the remaining fields are filled in from the
 * bakery when the job is assembled.
 */
public final class PipelineJob {
  private Executor executor;
  private String name;
  private RunConfig runConfig;
  private FlowStorage storage;
  private final List<PipelineTask> tasks;

  public PipelineJob(String name, List<PipelineTask> tasks) {
    this.name = name;
    this.tasks = List.copyOf(tasks);
  }

  public Executor getExecutor() {
    return executor;
  }

  public String getName() {
    return name;
  }

  @JsonProperty("run_config")
  public RunConfig getRunConfig() {
    return runConfig;
  }

  public FlowStorage getStorage() {
    return storage;
  }

  public List<PipelineTask> getTasks() {
    return tasks;
  }

  public void setExecutor(Executor executor) {
    this.executor = executor;
  }

  public void setName(String name) {
    this.name = name;
  }

  public void setRunConfig(RunConfig runConfig) {
    this.runConfig = runConfig;
  }

  public void setStorage(FlowStorage storage) {
    this.storage = storage;
  }
}
