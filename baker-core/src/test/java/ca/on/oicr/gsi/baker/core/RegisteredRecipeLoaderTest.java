package ca.on.oicr.gsi.baker.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.ResolutionError;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import org.junit.Test;

public class RegisteredRecipeLoaderTest {
  private static final Path MANIFEST = Path.of("meta.yaml");

  private final RegisteredRecipeLoader loader =
      RegisteredRecipeLoader.builder()
          .recipe("recipe:recipe", () -> Fixtures.recipe(4))
          .family(
              "recipe:recipes",
              () -> {
                final var family = new LinkedHashMap<String, Recipe>();
                family.put("z", Fixtures.recipe(1));
                family.put("a", Fixtures.recipe(1));
                return family;
              })
          .build();

  @Test
  public void eachLoad_producesFreshRecipe() {
    final var first = loader.loadRecipe(MANIFEST, "recipe:recipe").orElseThrow();
    final var second = loader.loadRecipe(MANIFEST, "recipe:recipe").orElseThrow();
    assertNotSame(first, second);
  }

  @Test
  public void family_keepsItsOrder() {
    assertEquals(
        List.of("z", "a"),
        List.copyOf(loader.loadFamily(MANIFEST, "recipe:recipes").orElseThrow().keySet()));
  }

  @Test
  public void unknownReference_isReported() {
    assertEquals(
        Optional.of(ResolutionError.UNKNOWN_RECIPE_REFERENCE),
        loader.loadRecipe(MANIFEST, "recipe:other").error());
    assertEquals(
        Optional.of(ResolutionError.UNKNOWN_RECIPE_REFERENCE),
        loader.loadFamily(MANIFEST, "recipe:recipe").error());
    assertEquals(
        Optional.of(ResolutionError.UNKNOWN_RECIPE_REFERENCE),
        loader.loadRecipe(MANIFEST, null).error());
  }

  @Test(expected = IllegalArgumentException.class)
  public void duplicateReference_isRejected() {
    RegisteredRecipeLoader.builder()
        .recipe("recipe:recipe", () -> Fixtures.recipe(1))
        .recipe("recipe:recipe", () -> Fixtures.recipe(2));
  }
}
