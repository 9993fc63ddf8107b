package uk.curriculum.triplestore.sanity;

public class SanityException extends RuntimeException {

  public SanityException(String message) {
    super(message);
  }

  public SanityException(String message, Throwable cause) {
    super(message, cause);
  }
}
