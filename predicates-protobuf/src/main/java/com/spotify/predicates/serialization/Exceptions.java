package com.spotify.predicates.serialization;

public class Exceptions {

  private Exceptions() {}

  /** The input does not have the structure of an expression or of a clause collection. */
  public static class ParseError extends RuntimeException {
    public ParseError(String message) {
      super(message);
    }

    public ParseError(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** An encoded expression could not be printed, e.g. a literal encoded as a non-finite number. */
  public static class EncodingError extends RuntimeException {
    public EncodingError(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
