package io.tower.api.run;

/**
 * Soft abort: stops the waiting or running unit that observes it. Cases convert it into
 * {@link RunStatus#CANCELED} and return normally.
 */
public class CancelSignal extends RuntimeException {
   public CancelSignal(String message) {
      super(message, null, false, false);
   }
}
