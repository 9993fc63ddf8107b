package uk.curriculum.triplestore.source;

import org.apache.jena.rdf.model.Model;

import java.nio.file.Path;
import java.util.List;

public record MergedSources(Model model, List<Path> files, List<SourceParseException> failures) {

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  public int parsedFiles() {
    return files.size() - failures.size();
  }
}
