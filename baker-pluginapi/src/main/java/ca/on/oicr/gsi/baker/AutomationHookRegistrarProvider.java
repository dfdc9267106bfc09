package ca.on.oicr.gsi.baker;

import java.util.Map;
import java.util.stream.Stream;

/** Defines JSON objects that can be used as automation hook registrars */
public interface AutomationHookRegistrarProvider {

  /** Provides the type names and classes this plugin provides */
  Stream<Map.Entry<String, Class<? extends AutomationHookRegistrar>>> types();
}
