import ca.on.oicr.gsi.baker.RecipeProvider;
import ca.on.oicr.gsi.baker.WorkflowEngineClientProvider;
import ca.on.oicr.gsi.baker.core.DryRunWorkflowEngineClient;

/** Main implementation of Baker */
module ca.on.oicr.gsi.baker.core {
  exports ca.on.oicr.gsi.baker.core;

  opens ca.on.oicr.gsi.baker.core to
      com.fasterxml.jackson.annotation,
      com.fasterxml.jackson.core,
      com.fasterxml.jackson.databind;

  requires transitive ca.on.oicr.gsi.baker.pluginapi;
  requires com.fasterxml.jackson.core;
  requires com.fasterxml.jackson.databind;
  requires com.fasterxml.jackson.dataformat.yaml;
  requires java.logging;

  uses RecipeProvider;

  provides WorkflowEngineClientProvider with
      DryRunWorkflowEngineClient;
}
