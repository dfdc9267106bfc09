package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeInfo.As;
import com.fasterxml.jackson.annotation.JsonTypeInfo.Id;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import java.io.IOException;
import java.util.Map;
import java.util.Map.Entry;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Collectors;

/**
 * Registers a follow-up action that reacts to the outcome of a job's runs
 *
 * <p>Implementations are read from the configuration file using jackson-databind; the
 * <code>type</code> property selects the implementation through {@link
 * AutomationHookRegistrarProvider} services.
 */
@JsonTypeIdResolver(AutomationHookRegistrar.AutomationHookRegistrarIdResolver.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = As.PROPERTY, property = "type")
public interface AutomationHookRegistrar {

  final class AutomationHookRegistrarIdResolver extends TypeIdResolverBase {
    private final Map<String, Class<? extends AutomationHookRegistrar>> knownIds =
        ServiceLoader.load(AutomationHookRegistrarProvider.class).stream()
            .map(Provider::get)
            .flatMap(AutomationHookRegistrarProvider::types)
            .collect(Collectors.toMap(Entry::getKey, Entry::getValue));

    @Override
    public Id getMechanism() {
      return Id.CUSTOM;
    }

    @Override
    public String idFromValue(Object o) {
      return knownIds.entrySet().stream()
          .filter(known -> known.getValue().isInstance(o))
          .map(Entry::getKey)
          .findFirst()
          .orElseThrow();
    }

    @Override
    public String idFromValueAndType(Object o, Class<?> aClass) {
      return idFromValue(o);
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
      final var clazz = knownIds.get(id);
      return clazz == null ? null : context.constructType(clazz);
    }
  }

  /**
   * Register a hook for a job
   *
   * @param jobId the identifier of the registered job
   * @param repository the repository that the hook reports back to
   * @param botCredential the credential the hook uses to report back
   * @return the identifier of the hook
   */
  String register(String jobId, String repository, String botCredential)
      throws IOException, InterruptedException;

  /**
   * Called to initialise this registrar.
   *
   * <p>If the configuration is invalid, this should throw a runtime exception.
   */
  void startup();
}
