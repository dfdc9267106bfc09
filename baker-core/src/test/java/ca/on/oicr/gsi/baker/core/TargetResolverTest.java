package ca.on.oicr.gsi.baker.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import ca.on.oicr.gsi.baker.ResolutionError;
import ca.on.oicr.gsi.baker.Secrets;
import ca.on.oicr.gsi.baker.api.StorageOptions;
import ca.on.oicr.gsi.baker.api.TargetDescriptor;
import ca.on.oicr.gsi.baker.api.TargetProtocol;
import java.util.Map;
import java.util.Optional;
import org.junit.Test;

public class TargetResolverTest {
  private static final TargetDescriptor S3 =
      new TargetDescriptor(new TargetProtocol("s3", new StorageOptions("AWS_KEY", "AWS_SECRET")));

  @Test
  public void objectStore_derivesPathsFromNamespaceAndRecipe() {
    final var filesystem = new RecordingFilesystem();
    final var targets =
        new TargetResolver(filesystem)
            .resolve("my-bucket", S3, "org/repo", "foo", "zarr", Fixtures.secrets())
            .orElseThrow();
    assertEquals("s3://my-bucket/org/repo/foo.zarr", targets.output().rootPath());
    assertEquals("s3://my-bucket/org/repo/foo/cache", targets.inputCache().rootPath());
    assertEquals("s3://my-bucket/org/repo/foo/cache/metadata", targets.metadataCache().rootPath());
  }

  @Test
  public void objectStore_opensOneFilesystemWithCredentials() {
    final var filesystem = new RecordingFilesystem();
    final var targets =
        new TargetResolver(filesystem)
            .resolve("my-bucket", S3, "org/repo", "foo", "zarr", Fixtures.secrets())
            .orElseThrow();
    assertEquals(1, filesystem.opened.size());
    final var handle = filesystem.opened.get(0);
    assertEquals("s3", handle.protocol());
    assertEquals(false, handle.options().get("anon"));
    assertEquals("none", handle.options().get("default_cache_type"));
    assertEquals(false, handle.options().get("default_fill_cache"));
    assertEquals("access-key", handle.options().get("key"));
    assertEquals("secret-key", handle.options().get("secret"));
    assertSame(targets.output().fileSystem(), targets.inputCache().fileSystem());
    assertSame(targets.output().fileSystem(), targets.metadataCache().fileSystem());
  }

  @Test
  public void repeatedResolution_derivesIdenticalPaths() {
    final var resolver = new TargetResolver(new RecordingFilesystem());
    final var first =
        resolver.resolve("my-bucket", S3, "org/repo", "foo", "zarr", Fixtures.secrets());
    final var second =
        resolver.resolve("my-bucket", S3, "org/repo", "foo", "zarr", Fixtures.secrets());
    assertEquals(first.orElseThrow(), second.orElseThrow());
  }

  @Test
  public void connectionString_usesSecretAsConnectionString() {
    final var filesystem = new RecordingFilesystem();
    final var targets =
        new TargetResolver(filesystem)
            .resolve(
                "container",
                new TargetDescriptor(
                    new TargetProtocol("abfs", new StorageOptions(null, "AZURE_CONNECTION"))),
                "org/repo",
                "foo",
                "zarr",
                Fixtures.secrets())
            .orElseThrow();
    assertEquals("abfs://container/org/repo/foo.zarr", targets.output().rootPath());
    assertEquals(
        Map.of("connection_string", "DefaultEndpointsProtocol=https;AccountName=bakery"),
        filesystem.opened.get(0).options());
  }

  @Test
  public void unknownProtocol_isUnsupported() {
    final var filesystem = new RecordingFilesystem();
    final var result =
        new TargetResolver(filesystem)
            .resolve(
                "bucket",
                new TargetDescriptor(new TargetProtocol("gcs", new StorageOptions("A", "B"))),
                "org/repo",
                "foo",
                "zarr",
                Fixtures.secrets());
    assertEquals(Optional.of(ResolutionError.UNSUPPORTED_TARGET), result.error());
    assertTrue(filesystem.opened.isEmpty());
  }

  @Test
  public void objectStoreWithoutCredentialNames_isUnsupported() {
    final var result =
        new TargetResolver(new RecordingFilesystem())
            .resolve(
                "bucket",
                new TargetDescriptor(new TargetProtocol("s3", null)),
                "org/repo",
                "foo",
                "zarr",
                Fixtures.secrets());
    assertEquals(Optional.of(ResolutionError.UNSUPPORTED_TARGET), result.error());
  }

  @Test
  public void missingPrivateProtocol_isUnsupported() {
    final var result =
        new TargetResolver(new RecordingFilesystem())
            .resolve(
                "bucket", new TargetDescriptor(), "org/repo", "foo", "zarr", Fixtures.secrets());
    assertEquals(Optional.of(ResolutionError.UNSUPPORTED_TARGET), result.error());
  }

  @Test
  public void missingSecret_isReportedAndNothingOpened() {
    final var filesystem = new RecordingFilesystem();
    final var result =
        new TargetResolver(filesystem)
            .resolve(
                "bucket", S3, "org/repo", "foo", "zarr", Secrets.of(Map.of("AWS_KEY", "key")));
    assertEquals(Optional.of(ResolutionError.MISSING_SECRET), result.error());
    assertTrue(filesystem.opened.isEmpty());
  }
}
