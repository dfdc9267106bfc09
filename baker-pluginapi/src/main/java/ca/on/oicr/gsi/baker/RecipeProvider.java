package ca.on.oicr.gsi.baker;

import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;

/** Supplies recipes written in Java so that manifests can refer to them */
public interface RecipeProvider {

  /**
   * The families of recipes this plugin provides
   *
   * <p>Each supplier is called once per load and must return a fresh, ordered map of fresh recipes.
   */
  default Stream<Map.Entry<String, Supplier<Map<String, Recipe>>>> families() {
    return Stream.empty();
  }

  /**
   * The single recipes this plugin provides
   *
   * <p>Each supplier is called once per load and must return a fresh recipe.
   */
  default Stream<Map.Entry<String, Supplier<Recipe>>> recipes() {
    return Stream.empty();
  }
}
