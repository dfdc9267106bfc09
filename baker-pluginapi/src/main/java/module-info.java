import ca.on.oicr.gsi.baker.AutomationHookRegistrarProvider;
import ca.on.oicr.gsi.baker.RecipeProvider;
import ca.on.oicr.gsi.baker.WorkflowEngineClientProvider;

/**
 * The API plugins are expected to implement
 *
 * <p>Baker uses plugins to talk to workflow engines and to supply recipes. This module defines the
 * APIs that plugins are expected to provide as well as the recipe, job and bakery data they
 * exchange with the core.
 */
module ca.on.oicr.gsi.baker.pluginapi {
  uses AutomationHookRegistrarProvider;
  uses RecipeProvider;
  uses WorkflowEngineClientProvider;

  exports ca.on.oicr.gsi.baker;
  exports ca.on.oicr.gsi.baker.api;

  opens ca.on.oicr.gsi.baker to
      com.fasterxml.jackson.annotation,
      com.fasterxml.jackson.core,
      com.fasterxml.jackson.databind,
      com.fasterxml.jackson.datatype.jsr310;
  opens ca.on.oicr.gsi.baker.api to
      com.fasterxml.jackson.annotation,
      com.fasterxml.jackson.core,
      com.fasterxml.jackson.databind;

  requires transitive com.fasterxml.jackson.annotation;
  requires transitive com.fasterxml.jackson.core;
  requires transitive com.fasterxml.jackson.databind;
  requires transitive com.fasterxml.jackson.datatype.jsr310;
  requires transitive java.logging;
  requires transitive java.net.http;
}
