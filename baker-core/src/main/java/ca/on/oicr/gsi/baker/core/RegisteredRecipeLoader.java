package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.RecipeLoader;
import ca.on.oicr.gsi.baker.RecipeProvider;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Finds recipes in a table of factories registered ahead of time
 *
 * <p>The table is built once, either explicitly or from every {@link RecipeProvider} service, and
 * is not changed afterwards. Each load calls the factory again, so callers always receive fresh
 * recipes.
 */
public final class RegisteredRecipeLoader implements RecipeLoader {

  /** Collects recipe factories */
  public static final class Builder {
    private final Map<String, Supplier<Map<String, Recipe>>> families = new TreeMap<>();
    private final Map<String, Supplier<Recipe>> recipes = new TreeMap<>();

    private Builder() {}

    public RegisteredRecipeLoader build() {
      return new RegisteredRecipeLoader(Map.copyOf(families), Map.copyOf(recipes));
    }

    /**
     * Add a family of recipes
     *
     * @param reference the reference manifests use, in <code>module:name</code> form
     * @param factory creates the family
     * @throws IllegalArgumentException if the reference is already used
     */
    public Builder family(String reference, Supplier<Map<String, Recipe>> factory) {
      if (families.putIfAbsent(reference, factory) != null) {
        throw new IllegalArgumentException(
            String.format("Recipe family %s is registered more than once.", reference));
      }
      return this;
    }

    /**
     * Add a single recipe
     *
     * @param reference the reference manifests use, in <code>module:name</code> form
     * @param factory creates the recipe
     * @throws IllegalArgumentException if the reference is already used
     */
    public Builder recipe(String reference, Supplier<Recipe> factory) {
      if (recipes.putIfAbsent(reference, factory) != null) {
        throw new IllegalArgumentException(
            String.format("Recipe %s is registered more than once.", reference));
      }
      return this;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Create a loader containing every recipe provided by a {@link RecipeProvider} service */
  public static RegisteredRecipeLoader fromServices() {
    final var builder = builder();
    ServiceLoader.load(RecipeProvider.class).stream()
        .map(Provider::get)
        .forEach(
            provider -> {
              provider.families().forEach(e -> builder.family(e.getKey(), e.getValue()));
              provider.recipes().forEach(e -> builder.recipe(e.getKey(), e.getValue()));
            });
    return builder.build();
  }

  private final Map<String, Supplier<Map<String, Recipe>>> families;
  private final Map<String, Supplier<Recipe>> recipes;

  private RegisteredRecipeLoader(
      Map<String, Supplier<Map<String, Recipe>>> families, Map<String, Supplier<Recipe>> recipes) {
    this.families = families;
    this.recipes = recipes;
  }

  @Override
  public Resolution<Map<String, Recipe>> loadFamily(Path manifestLocation, String reference) {
    final var factory = reference == null ? null : families.get(reference);
    if (factory == null) {
      return Resolution.failed(
          ResolutionError.UNKNOWN_RECIPE_REFERENCE,
          String.format(
              "No recipe family %s is registered (referenced from %s).",
              reference, manifestLocation));
    }
    return Resolution.resolved(Collections.unmodifiableMap(new LinkedHashMap<>(factory.get())));
  }

  @Override
  public Resolution<Recipe> loadRecipe(Path manifestLocation, String reference) {
    final var factory = reference == null ? null : recipes.get(reference);
    if (factory == null) {
      return Resolution.failed(
          ResolutionError.UNKNOWN_RECIPE_REFERENCE,
          String.format(
              "No recipe %s is registered (referenced from %s).", reference, manifestLocation));
    }
    return Resolution.resolved(factory.get());
  }
}
