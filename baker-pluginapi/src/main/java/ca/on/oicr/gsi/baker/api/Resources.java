package ca.on.oicr.gsi.baker.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** The worker size a recipe asks for, in the cluster's native units */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Resources {
  private int cpu;
  private int memory;

  public Resources() {}

  public Resources(int cpu, int memory) {
    this.cpu = cpu;
    this.memory = memory;
  }

  public int getCpu() {
    return cpu;
  }

  public int getMemory() {
    return memory;
  }

  public void setCpu(int cpu) {
    this.cpu = cpu;
  }

  public void setMemory(int memory) {
    this.memory = memory;
  }
}
