package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.RecipeLoader;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads recipe definitions from data files next to the manifest
 *
 * <p>A reference <code>module:name</code> names the file <code>module.yaml</code>, <code>
 * module.yml</code>, or <code>module.json</code> in the manifest's directory and the top-level
 * attribute <code>name</code> inside it. The attribute is either a recipe definition, selected by
 * its <code>type</code> field, or a map of recipe identifiers to recipe definitions, which is a
 * family.
 *
 * <p>Each file is read once; every load produces new recipe objects.
 */
public final class DeclarativeRecipeLoader implements RecipeLoader {
  private static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");
  private static final Logger LOGGER = System.getLogger(DeclarativeRecipeLoader.class.getName());

  private record Reference(String module, String name) {}

  private static Resolution<Reference> parse(Path manifestLocation, String reference) {
    final var separator = reference == null ? -1 : reference.lastIndexOf(':');
    if (separator < 1 || separator == reference.length() - 1) {
      return Resolution.failed(
          ResolutionError.UNKNOWN_RECIPE_REFERENCE,
          String.format(
              "Recipe reference %s in %s is not of the form module:name.",
              reference, manifestLocation));
    }
    return Resolution.resolved(
        new Reference(reference.substring(0, separator), reference.substring(separator + 1)));
  }

  private final ObjectMapper jsonMapper;
  private final Map<Path, Resolution<JsonNode>> modules = new HashMap<>();
  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  public DeclarativeRecipeLoader() {
    this(new ObjectMapper());
  }

  public DeclarativeRecipeLoader(ObjectMapper jsonMapper) {
    this.jsonMapper = jsonMapper;
  }

  private Resolution<JsonNode> attribute(Path manifestLocation, Reference reference) {
    final var directory = manifestLocation.toAbsolutePath().getParent();
    return EXTENSIONS.stream()
        .map(extension -> directory.resolve(reference.module() + extension))
        .filter(Files::isRegularFile)
        .findFirst()
        .map(file -> modules.computeIfAbsent(file, this::read))
        .orElseGet(
            () ->
                Resolution.failed(
                    ResolutionError.UNKNOWN_RECIPE_REFERENCE,
                    String.format(
                        "No recipe module %s next to %s.", reference.module(), manifestLocation)))
        .then(
            module -> {
              final var node = module.get(reference.name());
              return node == null || !node.isObject()
                  ? Resolution.failed(
                      ResolutionError.UNKNOWN_RECIPE_REFERENCE,
                      String.format(
                          "Recipe module %s has no definition %s.",
                          reference.module(), reference.name()))
                  : Resolution.resolved(node);
            });
  }

  private Resolution<Recipe> convert(String name, JsonNode definition) {
    try {
      return Resolution.resolved(jsonMapper.treeToValue(definition, Recipe.class));
    } catch (InvalidTypeIdException e) {
      return Resolution.failed(
          ResolutionError.UNSUPPORTED_RECIPE_TYPE,
          String.format("Recipe %s has unsupported type %s.", name, e.getTypeId()));
    } catch (JsonProcessingException e) {
      return Resolution.failed(
          ResolutionError.UNKNOWN_RECIPE_REFERENCE,
          String.format("Recipe %s is not a valid definition: %s", name, e.getOriginalMessage()));
    }
  }

  @Override
  public Resolution<Map<String, Recipe>> loadFamily(Path manifestLocation, String reference) {
    return parse(manifestLocation, reference)
        .then(parsed -> attribute(manifestLocation, parsed))
        .then(
            definition -> {
              if (definition.has("type")) {
                return Resolution.failed(
                    ResolutionError.UNKNOWN_RECIPE_REFERENCE,
                    String.format("%s refers to a single recipe, not a family.", reference));
              }
              Resolution<LinkedHashMap<String, Recipe>> family =
                  Resolution.resolved(new LinkedHashMap<>());
              final var fields = definition.fields();
              while (fields.hasNext()) {
                final var field = fields.next();
                family =
                    family.then(
                        members ->
                            convert(field.getKey(), field.getValue())
                                .map(
                                    recipe -> {
                                      members.put(field.getKey(), recipe);
                                      return members;
                                    }));
              }
              return family.<Map<String, Recipe>>map(Collections::unmodifiableMap);
            });
  }

  @Override
  public Resolution<Recipe> loadRecipe(Path manifestLocation, String reference) {
    return parse(manifestLocation, reference)
        .then(parsed -> attribute(manifestLocation, parsed))
        .then(definition -> convert(reference, definition));
  }

  private Resolution<JsonNode> read(Path file) {
    final var mapper = file.getFileName().toString().endsWith(".json") ? jsonMapper : yamlMapper;
    try {
      LOGGER.log(Level.DEBUG, "Reading recipe module {0}", file);
      final var root = mapper.readTree(file.toFile());
      return root != null && root.isObject()
          ? Resolution.resolved(root)
          : Resolution.failed(
              ResolutionError.UNKNOWN_RECIPE_REFERENCE,
              String.format("Recipe module %s does not contain a map of definitions.", file));
    } catch (IOException e) {
      return Resolution.failed(
          ResolutionError.UNKNOWN_RECIPE_REFERENCE,
          String.format("Cannot read recipe module %s: %s", file, e.getMessage()));
    }
  }
}
