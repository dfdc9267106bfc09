package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * The set of input files a recipe reads, generated from a URL template
 *
 * <p>The template contains a <code>{dimension}</code> placeholder that is replaced by each key in
 * turn, so the order of the keys is the order of the inputs along the concatenation dimension.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FilePattern {
  @JsonProperty("concat_dim")
  private String concatDim;

  private List<String> keys = Collections.emptyList();

  @JsonProperty("nitems_per_file")
  private Integer nitemsPerFile;

  @JsonProperty("url_template")
  private String urlTemplate;

  public FilePattern() {}

  public FilePattern(String urlTemplate, String concatDim, List<String> keys) {
    this.urlTemplate = urlTemplate;
    this.concatDim = concatDim;
    this.keys = List.copyOf(keys);
  }

  public String getConcatDim() {
    return concatDim;
  }

  public List<String> getKeys() {
    return keys;
  }

  public Integer getNitemsPerFile() {
    return nitemsPerFile;
  }

  public String getUrlTemplate() {
    return urlTemplate;
  }

  /**
   * Create a copy of this pattern limited to the first inputs
   *
   * @param count the number of inputs to keep
   */
  public FilePattern prune(int count) {
    final var copy =
        new FilePattern(urlTemplate, concatDim, keys.subList(0, Math.min(count, keys.size())));
    copy.nitemsPerFile = nitemsPerFile;
    return copy;
  }

  public void setConcatDim(String concatDim) {
    this.concatDim = concatDim;
  }

  public void setKeys(List<String> keys) {
    this.keys = keys;
  }

  public void setNitemsPerFile(Integer nitemsPerFile) {
    this.nitemsPerFile = nitemsPerFile;
  }

  public void setUrlTemplate(String urlTemplate) {
    this.urlTemplate = urlTemplate;
  }

  /** Describe anything that prevents generating the input URLs */
  public Stream<String> validate() {
    final var errors = Stream.<String>builder();
    if (urlTemplate == null || urlTemplate.isBlank()) {
      errors.add("File pattern has no URL template.");
    }
    if (concatDim == null || concatDim.isBlank()) {
      errors.add("File pattern has no concatenation dimension.");
    }
    if (keys == null || keys.isEmpty()) {
      errors.add("File pattern has no keys.");
    }
    return errors.build();
  }

  /** The URLs of every input, in order */
  public List<String> urls() {
    final var placeholder = "{" + concatDim + "}";
    final var urls = new ArrayList<String>(keys.size());
    for (final var key : keys) {
      urls.add(urlTemplate.replace(placeholder, key));
    }
    return urls;
  }
}
