package ca.on.oicr.gsi.baker.cli;

import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.core.DeferredStorageFilesystem;
import ca.on.oicr.gsi.baker.core.DryRunWorkflowEngineClient;
import ca.on.oicr.gsi.baker.core.RegistrationOrchestrator;
import ca.on.oicr.gsi.baker.core.RegistrationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import picocli.CommandLine;

/**
 * Subcommand to resolve a manifest without registering anything
 *
 * <p>The jobs that would be registered are printed instead of the registration report, with every
 * credential value masked.
 */
@CommandLine.Command(
    name = "check",
    description = "Resolve every recipe in a manifest and print the jobs that would be registered")
public class CommandCheck extends BaseBatchCommand {
  static final String MASK = "********";
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

  /**
   * Replace any text that contains a credential
   *
   * @param node the tree to clean; it is modified in place
   * @param values the credential values to hide
   */
  static void scrub(JsonNode node, Set<String> values) {
    if (node instanceof ObjectNode object) {
      final var names = new TreeSet<String>();
      object.fieldNames().forEachRemaining(names::add);
      for (final var name : names) {
        final var child = object.get(name);
        if (child.isTextual() && containsAny(child.asText(), values)) {
          object.put(name, MASK);
        } else {
          scrub(child, values);
        }
      }
    } else if (node instanceof ArrayNode array) {
      for (var i = 0; i < array.size(); i++) {
        final var child = array.get(i);
        if (child.isTextual() && containsAny(child.asText(), values)) {
          array.set(i, array.textNode(MASK));
        } else {
          scrub(child, values);
        }
      }
    }
  }

  private static boolean containsAny(String text, Set<String> values) {
    return values.stream().anyMatch(value -> !value.isEmpty() && text.contains(value));
  }

  private final DryRunWorkflowEngineClient engine = new DryRunWorkflowEngineClient();

  @Override
  protected Optional<String> correlationId() {
    return Optional.empty();
  }

  /**
   * Convert the jobs the dry-run engine accepted to JSON with every credential masked
   *
   * @param secrets the credentials to mask
   */
  ArrayNode jobs(Secrets secrets) {
    final var values = new TreeSet<String>();
    for (final var name : secrets.names()) {
      values.add(secrets.get(name).orElseThrow());
    }
    final ArrayNode jobs = MAPPER.valueToTree(engine.jobs());
    scrub(jobs, values);
    return jobs;
  }

  @Override
  protected void write(RegistrationReport report, Secrets secrets) throws IOException {
    System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(jobs(secrets)));
  }

  @Override
  protected RegistrationOrchestrator orchestrator() {
    engine.startup();
    return new RegistrationOrchestrator(
        new DeferredStorageFilesystem(), loader(), engine, Optional.empty(), "");
  }
}
