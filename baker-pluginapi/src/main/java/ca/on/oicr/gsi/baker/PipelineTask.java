package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** One unit of work in a pipeline job, along with how the workflow engine should retry it */
public final class PipelineTask {
  private TaskBody body;
  private int maxRetries;
  private final String name;
  private Duration retryDelay;

  public PipelineTask(String name, TaskBody body) {
    this.name = Objects.requireNonNull(name);
    this.body = Objects.requireNonNull(body);
  }

  @JsonProperty("max_retries")
  public int getMaxRetries() {
    return maxRetries;
  }

  public String getName() {
    return name;
  }

  @JsonProperty("retry_delay")
  public Duration getRetryDelay() {
    return retryDelay;
  }

  /**
   * Execute the task's body
   *
   * @return the result of the body
   */
  public Object run() throws Exception {
    return body.run();
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }

  /**
   * Replace the body with a decorated version of itself
   *
   * @param wrapper a function that takes the current body and produces its replacement
   */
  @JsonIgnore
  public void wrap(UnaryOperator<TaskBody> wrapper) {
    body = Objects.requireNonNull(wrapper.apply(body));
  }
}
