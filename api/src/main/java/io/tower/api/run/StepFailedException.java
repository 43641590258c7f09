package io.tower.api.run;

public class StepFailedException extends RuntimeException {
   private final String stepName;

   public StepFailedException(String stepName, String message, Throwable cause) {
      super(message, cause);
      this.stepName = stepName;
   }

   public String stepName() {
      return stepName;
   }
}
