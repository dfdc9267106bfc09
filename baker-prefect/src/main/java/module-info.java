import ca.on.oicr.gsi.baker.AutomationHookRegistrarProvider;
import ca.on.oicr.gsi.baker.WorkflowEngineClientProvider;
import ca.on.oicr.gsi.baker.prefect.PrefectAutomationHookRegistrar;
import ca.on.oicr.gsi.baker.prefect.PrefectWorkflowEngineClient;

/** Provides an implementation of Baker plugins that register jobs with a Prefect server */
module ca.on.oicr.gsi.baker.prefect {
  requires ca.on.oicr.gsi.baker.pluginapi;
  requires com.fasterxml.jackson.annotation;
  requires com.fasterxml.jackson.core;
  requires com.fasterxml.jackson.databind;
  requires com.fasterxml.jackson.datatype.jsr310;
  requires java.net.http;
  requires simpleclient;

  opens ca.on.oicr.gsi.baker.prefect to
      com.fasterxml.jackson.databind;

  provides WorkflowEngineClientProvider with
      PrefectWorkflowEngineClient;
  provides AutomationHookRegistrarProvider with
      PrefectAutomationHookRegistrar;
}
