package dev.ragservice.summary;

/** Raised when the generative backend reports an error while producing a summary. */
public class GenerationException extends RuntimeException {

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
