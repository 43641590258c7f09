package io.tower.api.run;

/**
 * The unit could not be admitted for execution because other locked units were running.
 */
public abstract class AdmissionException extends RuntimeException {
   private final long waitedMillis;

   protected AdmissionException(String message, long waitedMillis) {
      super(message);
      this.waitedMillis = waitedMillis;
   }

   public long waitedMillis() {
      return waitedMillis;
   }
}
