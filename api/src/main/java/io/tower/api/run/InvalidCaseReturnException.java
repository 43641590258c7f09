package io.tower.api.run;

/**
 * Case body broke its contract of returning a non-negative error count.
 */
public class InvalidCaseReturnException extends RuntimeException {
   public InvalidCaseReturnException(String message) {
      super(message);
   }
}
