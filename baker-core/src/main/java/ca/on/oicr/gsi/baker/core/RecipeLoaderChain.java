package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.RecipeLoader;
import ca.on.oicr.gsi.baker.Resolution;
import ca.on.oicr.gsi.baker.ResolutionError;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Asks several loaders for a recipe, in order
 *
 * <p>A loader that does not know a reference passes it to the next one. Any other failure is
 * reported immediately.
 */
public final class RecipeLoaderChain implements RecipeLoader {
  private final List<RecipeLoader> loaders;

  public RecipeLoaderChain(List<RecipeLoader> loaders) {
    if (loaders.isEmpty()) {
      throw new IllegalArgumentException("At least one recipe loader is required.");
    }
    this.loaders = List.copyOf(loaders);
  }

  private <T> Resolution<T> first(Function<RecipeLoader, Resolution<T>> load) {
    Resolution<T> result = null;
    for (final var loader : loaders) {
      result = load.apply(loader);
      if (!result.error().equals(Optional.of(ResolutionError.UNKNOWN_RECIPE_REFERENCE))) {
        return result;
      }
    }
    return result;
  }

  @Override
  public Resolution<Map<String, Recipe>> loadFamily(Path manifestLocation, String reference) {
    return first(loader -> loader.loadFamily(manifestLocation, reference));
  }

  @Override
  public Resolution<Recipe> loadRecipe(Path manifestLocation, String reference) {
    return first(loader -> loader.loadRecipe(manifestLocation, reference));
  }
}
