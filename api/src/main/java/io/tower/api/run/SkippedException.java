package io.tower.api.run;

/**
 * Thrown when a skipped step is invoked. This is not a failure.
 */
public class SkippedException extends RuntimeException {
   public SkippedException(String message) {
      super(message);
   }
}
