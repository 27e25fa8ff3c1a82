package com.scholary.vocal.coach.service;

/**
 * Exception thrown when an attempt fails boundary validation.
 *
 * <p>The message names the offending field, e.g. {@code userWords[3].end}.
 */
public class InvalidAttemptException extends RuntimeException {

  public InvalidAttemptException(String message) {
    super(message);
  }

  public InvalidAttemptException(String message, Throwable cause) {
    super(message, cause);
  }
}
