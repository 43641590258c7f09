package io.tower.api.run;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Result of a single loop iteration of a case.
 */
public final class LoopRecord implements Serializable {
   public final int index;
   public final RunStatus status;
   public final Verdict verdict;
   public final long durationMillis;
   public final long totalTimeMillis;
   public final String error;
   public final List<String> stepErrors;

   public LoopRecord(int index, RunStatus status, Verdict verdict, long durationMillis, long totalTimeMillis,
                     String error, List<String> stepErrors) {
      this.index = index;
      this.status = status;
      this.verdict = verdict;
      this.durationMillis = durationMillis;
      this.totalTimeMillis = totalTimeMillis;
      this.error = error;
      this.stepErrors = stepErrors == null ? Collections.emptyList() : List.copyOf(stepErrors);
   }

   public boolean isPassed() {
      return verdict == Verdict.PASSED;
   }

   @Override
   public String toString() {
      return "LoopRecord{index=" + index + ", status=" + status + ", verdict=" + verdict +
            ", duration=" + durationMillis + " ms, totalTime=" + totalTimeMillis + " ms" +
            (error != null ? ", error=" + error : "") + '}';
   }
}
