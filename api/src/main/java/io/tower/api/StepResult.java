package io.tower.api;

import io.tower.api.run.StepFailedException;

/**
 * Outcome of {@link Step#runStep(Object)}: either the value returned by the step action, or the error
 * of a step configured to continue on failure.
 */
public final class StepResult<O> {
   private static final StepResult<?> EMPTY = new StepResult<>(null, null, null);

   private final O value;
   private final String stepName;
   private final Throwable error;

   private StepResult(O value, String stepName, Throwable error) {
      this.value = value;
      this.stepName = stepName;
      this.error = error;
   }

   public static <O> StepResult<O> of(O value) {
      if (value == null) {
         @SuppressWarnings("unchecked")
         StepResult<O> empty = (StepResult<O>) EMPTY;
         return empty;
      }
      return new StepResult<>(value, null, null);
   }

   public static <O> StepResult<O> failed(String stepName, Throwable error) {
      if (error == null) {
         throw new IllegalArgumentException("Failed result requires an error");
      }
      return new StepResult<>(null, stepName, error);
   }

   public boolean isFailed() {
      return error != null;
   }

   /**
    * @return Value returned by the step action.
    * @throws StepFailedException if the step failed and was configured to continue.
    */
   public O value() {
      if (error != null) {
         throw new StepFailedException(stepName, "Step " + stepName + " failed: " + error.getMessage(), error);
      }
      return value;
   }

   public O orElse(O other) {
      return error != null ? other : value;
   }

   public Throwable error() {
      return error;
   }

   @Override
   public String toString() {
      return error != null ? "StepResult{failed: " + error + "}" : "StepResult{" + value + "}";
   }
}
