/** Command line interface for Baker */
module ca.on.oicr.gsi.baker.cli {
  uses ca.on.oicr.gsi.baker.AutomationHookRegistrarProvider;
  uses ca.on.oicr.gsi.baker.RecipeProvider;
  uses ca.on.oicr.gsi.baker.WorkflowEngineClientProvider;

  exports ca.on.oicr.gsi.baker.cli;

  requires ca.on.oicr.gsi.baker.core;
  requires ca.on.oicr.gsi.baker.pluginapi;
  requires com.fasterxml.jackson.databind;
  requires com.fasterxml.jackson.dataformat.yaml;
  requires com.fasterxml.jackson.datatype.jsr310;
  requires info.picocli;
  requires java.logging;

  opens ca.on.oicr.gsi.baker.cli to
      com.fasterxml.jackson.annotation,
      com.fasterxml.jackson.core,
      com.fasterxml.jackson.databind,
      info.picocli;
}
