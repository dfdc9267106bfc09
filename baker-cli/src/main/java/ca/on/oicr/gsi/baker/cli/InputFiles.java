package ca.on.oicr.gsi.baker.cli;

import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.Bakery;
import ca.on.oicr.gsi.baker.api.RecipeManifest;
import ca.on.oicr.gsi.baker.api.Versions;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the files a registration batch is made from
 *
 * <p>Manifests and bakery tables are YAML; secrets, versions and configuration are JSON.
 */
final class InputFiles {
  static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  static Map<String, Bakery> bakeries(Path file) throws IOException {
    return YAML_MAPPER.readValue(file.toFile(), new TypeReference<Map<String, Bakery>>() {});
  }

  static BakerConfiguration configuration(Path file) throws IOException {
    return JSON_MAPPER.readValue(file.toFile(), BakerConfiguration.class);
  }

  static RecipeManifest manifest(Path file) throws IOException {
    final var manifest = YAML_MAPPER.readValue(file.toFile(), RecipeManifest.class);
    if (manifest == null) {
      throw new IOException(String.format("Manifest %s is empty", file));
    }
    return manifest;
  }

  static Secrets secrets(Path file) throws IOException {
    final var values =
        JSON_MAPPER.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});
    if (values == null || values.containsValue(null)) {
      throw new IOException(String.format("Secrets in %s must all have values", file));
    }
    return Secrets.of(values);
  }

  static Versions versions(Path file) throws IOException {
    return JSON_MAPPER.readValue(file.toFile(), Versions.class);
  }

  private InputFiles() {}
}
