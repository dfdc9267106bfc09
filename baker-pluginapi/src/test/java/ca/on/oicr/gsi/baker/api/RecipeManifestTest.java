package ca.on.oicr.gsi.baker.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

public class RecipeManifestTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  public void manifest_deserializes() throws JsonProcessingException {
    final var manifest =
        mapper.readValue(
            "{\"title\": \"Global Precipitation\","
                + "\"pangeo_forge_version\": \"0.5.0\","
                + "\"pangeo_notebook_version\": \"2021.07.17\","
                + "\"maintainers\": [{\"name\": \"A. Maintainer\", \"github\": \"maintainer\"}],"
                + "\"recipes\": ["
                + "  {\"id\": \"gpcp\", \"object\": \"recipe:recipe\"},"
                + "  {\"id\": \"by-region\", \"dict_object\": \"recipe:recipes\"}],"
                + "\"bakery\": {\"id\": \"devseed.bakery.development.aws.us-west-2\","
                + "  \"target\": \"pangeo-forge-aws-bakery-flowcachebucketdasktest4\","
                + "  \"resources\": {\"cpu\": 2048, \"memory\": 8192}}}",
            RecipeManifest.class);
    assertEquals(new Versions("2021.07.17", "0.5.0", null), manifest.versions());
    assertNull(manifest.versions().getEngineVersion());
    assertFalse(manifest.getRecipes().get(0).isFamily());
    assertTrue(manifest.getRecipes().get(1).isFamily());
    assertEquals("recipe:recipes", manifest.getRecipes().get(1).getDictObject());
    assertEquals(2048, manifest.getBakery().getResources().orElseThrow().getCpu());
    assertEquals(8192, manifest.getBakery().getResources().orElseThrow().getMemory());
  }

  @Test
  public void resources_areOptional() throws JsonProcessingException {
    final var bakery =
        mapper.readValue("{\"id\": \"bakery\", \"target\": \"target\"}", RecipeBakery.class);
    assertTrue(bakery.getResources().isEmpty());
  }
}
