package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Concatenates many input files along one dimension and writes them to a single chunked array
 * store
 *
 * <p>The job caches every input (unless disabled), prepares the target, stores one chunk per group
 * of {@link #getInputsPerChunk()} inputs, and finally consolidates the target's metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class XarrayZarrRecipe extends Recipe {
  /** The number of inputs kept by {@link #copyPruned()} */
  public static final int PRUNED_INPUTS = 2;

  @JsonProperty("cache_inputs")
  private boolean cacheInputs = true;

  @JsonProperty("file_pattern")
  private FilePattern filePattern;

  @JsonProperty("inputs_per_chunk")
  private int inputsPerChunk = 1;

  @JsonProperty("target_chunks")
  private Map<String, Integer> targetChunks = Collections.emptyMap();

  public XarrayZarrRecipe() {}

  public XarrayZarrRecipe(FilePattern filePattern) {
    this.filePattern = filePattern;
  }

  @Override
  public XarrayZarrRecipe copyPruned() {
    final var copy = new XarrayZarrRecipe(filePattern.prune(PRUNED_INPUTS));
    copy.cacheInputs = cacheInputs;
    copy.inputsPerChunk = inputsPerChunk;
    copy.targetChunks = targetChunks;
    return copySlotsTo(copy);
  }

  public FilePattern getFilePattern() {
    return filePattern;
  }

  public int getInputsPerChunk() {
    return inputsPerChunk;
  }

  public Map<String, Integer> getTargetChunks() {
    return targetChunks;
  }

  public boolean isCacheInputs() {
    return cacheInputs;
  }

  @Override
  public RecipeKind kind() {
    return RecipeKind.XARRAY_ZARR;
  }

  public void setCacheInputs(boolean cacheInputs) {
    this.cacheInputs = cacheInputs;
  }

  public void setFilePattern(FilePattern filePattern) {
    this.filePattern = filePattern;
  }

  public void setInputsPerChunk(int inputsPerChunk) {
    this.inputsPerChunk = inputsPerChunk;
  }

  public void setTargetChunks(Map<String, Integer> targetChunks) {
    this.targetChunks = targetChunks;
  }

  @Override
  public PipelineJob toJob() {
    final var target = requireTarget();
    if (inputsPerChunk < 1) {
      throw new IllegalStateException("Inputs per chunk must be positive.");
    }
    final var urls = filePattern.urls();
    final var cache = getInputCache();
    final var tasks = new ArrayList<PipelineTask>();
    if (cacheInputs) {
      if (cache == null) {
        throw new IllegalStateException("Recipe caches inputs but has no input cache set.");
      }
      for (var i = 0; i < urls.size(); i++) {
        final var url = urls.get(i);
        final var cachePath = cache.path(Integer.toString(i));
        tasks.add(
            new PipelineTask(
                String.format("cache_input[%d]", i),
                () -> {
                  LOGGER.log(Level.DEBUG, "Caching input {0} to {1}", url, cachePath);
                  return cachePath;
                }));
      }
    }
    tasks.add(
        new PipelineTask(
            "prepare_target",
            () -> {
              LOGGER.log(
                  Level.DEBUG,
                  "Preparing target {0} with chunks {1}",
                  target.rootPath(),
                  targetChunks);
              return target.rootPath();
            }));
    for (var chunk = 0; chunk * inputsPerChunk < urls.size(); chunk++) {
      final var inputs =
          List.copyOf(
              urls.subList(
                  chunk * inputsPerChunk, Math.min(urls.size(), (chunk + 1) * inputsPerChunk)));
      final var index = chunk;
      tasks.add(
          new PipelineTask(
              String.format("store_chunk[%d]", chunk),
              () -> {
                LOGGER.log(
                    Level.DEBUG,
                    "Storing chunk {0} from {1} along {2}",
                    index,
                    inputs,
                    filePattern.getConcatDim());
                return inputs;
              }));
    }
    tasks.add(
        new PipelineTask(
            "finalize_target",
            () -> {
              LOGGER.log(Level.DEBUG, "Consolidating metadata for {0}", target.rootPath());
              return target.rootPath();
            }));
    return new PipelineJob(null, tasks);
  }

  @Override
  public Stream<String> validate() {
    return Stream.concat(
        validatePattern(filePattern),
        inputsPerChunk < 1
            ? Stream.of(
                String.format("Inputs per chunk is %d but must be positive.", inputsPerChunk))
            : Stream.empty());
  }
}
