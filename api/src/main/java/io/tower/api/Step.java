package io.tower.api;

import io.tower.api.run.RunStatus;
import io.tower.api.run.Verdict;

/**
 * Leaf unit of work owned by a case.
 */
public interface Step<I, O> {
   String name();

   /**
    * @return 1-based position of the step within its case.
    */
   int index();

   String caseNum();

   boolean isLocked();

   boolean isSkip();

   boolean isFailContinue();

   RunStatus status();

   Verdict verdict();

   /**
    * @return Error text captured during the last execution, or {@code null}.
    */
   String error();

   /**
    * Waits for admission and executes the step action.
    *
    * @param input Passed to the step action.
    * @return Value of the action, or a failed result if the step is configured to continue on failure.
    * @throws io.tower.api.run.SkippedException if the step is skipped.
    * @throws io.tower.api.run.AdmissionException if the step could not be admitted.
    * @throws io.tower.api.run.StepFailedException if the action threw and the step does not continue on failure.
    */
   StepResult<O> runStep(I input);

   default StepResult<O> runStep() {
      return runStep(null);
   }
}
