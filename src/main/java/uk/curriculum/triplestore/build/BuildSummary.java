package uk.curriculum.triplestore.build;

import java.nio.file.Path;
import java.util.List;

public record BuildSummary(List<Path> outputs, long totalBytes) {

  public int files() {
    return outputs.size();
  }
}
