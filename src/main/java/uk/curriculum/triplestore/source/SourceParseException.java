package uk.curriculum.triplestore.source;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class SourceParseException extends RuntimeException {
  private final Path file;

  public SourceParseException(Path file, Throwable cause) {
    super("%s: %s".formatted(file, cause.getMessage()), cause);
    this.file = file;
  }
}
