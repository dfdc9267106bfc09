package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/** Scans existing hierarchical data files and writes a single reference index over them */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class HdfReferenceRecipe extends Recipe {
  @JsonProperty("file_pattern")
  private FilePattern filePattern;

  @JsonProperty("output_json_fname")
  private String outputJsonFname = "reference.json";

  public HdfReferenceRecipe() {}

  public HdfReferenceRecipe(FilePattern filePattern) {
    this.filePattern = filePattern;
  }

  @Override
  public HdfReferenceRecipe copyPruned() {
    final var copy = new HdfReferenceRecipe(filePattern.prune(XarrayZarrRecipe.PRUNED_INPUTS));
    copy.outputJsonFname = outputJsonFname;
    return copySlotsTo(copy);
  }

  public FilePattern getFilePattern() {
    return filePattern;
  }

  public String getOutputJsonFname() {
    return outputJsonFname;
  }

  @Override
  public RecipeKind kind() {
    return RecipeKind.HDF_REFERENCE;
  }

  public void setFilePattern(FilePattern filePattern) {
    this.filePattern = filePattern;
  }

  public void setOutputJsonFname(String outputJsonFname) {
    this.outputJsonFname = outputJsonFname;
  }

  @Override
  public PipelineJob toJob() {
    final var target = requireTarget();
    final var tasks = new ArrayList<PipelineTask>();
    final var urls = filePattern.urls();
    for (var i = 0; i < urls.size(); i++) {
      final var url = urls.get(i);
      tasks.add(
          new PipelineTask(
              String.format("scan_file[%d]", i),
              () -> {
                LOGGER.log(Level.DEBUG, "Scanning {0}", url);
                return url;
              }));
    }
    final var output = target.path(outputJsonFname);
    tasks.add(
        new PipelineTask(
            "write_references",
            () -> {
              LOGGER.log(
                  Level.DEBUG, "Writing references for {0} inputs to {1}", urls.size(), output);
              return List.of(output);
            }));
    return new PipelineJob(null, tasks);
  }

  @Override
  public Stream<String> validate() {
    return Stream.concat(
        validatePattern(filePattern),
        outputJsonFname == null || outputJsonFname.isBlank()
            ? Stream.of("Recipe has no output file name.")
            : Stream.empty());
  }
}
