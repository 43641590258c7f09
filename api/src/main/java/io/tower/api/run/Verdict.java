package io.tower.api.run;

/**
 * Pass result of a step or case; {@link #UNKNOWN} until the unit reaches
 * {@link RunStatus#FINISHED} or {@link RunStatus#ERROR}.
 */
public enum Verdict {
   UNKNOWN,
   PASSED,
   FAILED;

   public static Verdict of(boolean passed) {
      return passed ? PASSED : FAILED;
   }

   public boolean isKnown() {
      return this != UNKNOWN;
   }
}
