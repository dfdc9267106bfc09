package ca.on.oicr.gsi.baker;

import java.util.Map;
import java.util.stream.Stream;

/** Defines JSON objects that can be used as workflow engine clients */
public interface WorkflowEngineClientProvider {

  /** Provides the type names and classes this plugin provides */
  Stream<Map.Entry<String, Class<? extends WorkflowEngineClient>>> types();
}
