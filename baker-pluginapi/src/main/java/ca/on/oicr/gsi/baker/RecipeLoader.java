package ca.on.oicr.gsi.baker;

import java.nio.file.Path;
import java.util.Map;

/**
 * Finds the recipes a manifest refers to
 *
 * <p>References have the form <code>module:name</code>. A reference resolves either to a single
 * recipe or to a family of recipes keyed by recipe identifier.
 */
public interface RecipeLoader {

  /**
   * Load a family of recipes
   *
   * @param manifestLocation the path of the manifest that contains the reference
   * @param reference the reference to the family
   * @return the recipes, keyed by identifier, in the order they should be registered
   */
  Resolution<Map<String, Recipe>> loadFamily(Path manifestLocation, String reference);

  /**
   * Load a single recipe
   *
   * @param manifestLocation the path of the manifest that contains the reference
   * @param reference the reference to the recipe
   */
  Resolution<Recipe> loadRecipe(Path manifestLocation, String reference);
}
