package io.tower.api.run;

import java.io.Serializable;
import java.util.List;

import io.tower.api.config.CaseLevel;

/**
 * Immutable snapshot of a case taken while the project runs.
 */
public final class CaseStatus implements Serializable {
   public final int id;
   public final String caseNum;
   public final String caseTitle;
   public final CaseLevel level;
   public final String featureName;
   public final RunStatus status;
   public final Verdict verdict;
   public final long durationMillis;
   public final long totalTimeMillis;
   public final int runCount;
   public final List<LoopRecord> loops;

   public CaseStatus(int id, String caseNum, String caseTitle, CaseLevel level, String featureName, RunStatus status,
                     Verdict verdict, long durationMillis, long totalTimeMillis, int runCount, List<LoopRecord> loops) {
      this.id = id;
      this.caseNum = caseNum;
      this.caseTitle = caseTitle;
      this.level = level;
      this.featureName = featureName;
      this.status = status;
      this.verdict = verdict;
      this.durationMillis = durationMillis;
      this.totalTimeMillis = totalTimeMillis;
      this.runCount = runCount;
      this.loops = List.copyOf(loops);
   }

   @Override
   public String toString() {
      return caseNum + " [" + status + "/" + verdict + ", runs=" + runCount + "]";
   }
}
