package uk.curriculum.triplestore.sanity;

import java.nio.file.Path;
import java.util.List;

public record ConversionSummary(int documents, List<String> subjects, List<String> skipped, List<Path> files) {
}
