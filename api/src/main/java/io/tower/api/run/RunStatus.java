package io.tower.api.run;

/**
 * Lifecycle shared by steps and cases.
 * <p>
 * {@code NOT_RUN → SKIPPED}, {@code NOT_RUN → WAITING → RUNNING → FINISHED|ERROR},
 * {@code WAITING → TIMEOUT} and {@code WAITING|RUNNING → CANCELED|KILLED}.
 */
public enum RunStatus {
   NOT_RUN,
   SKIPPED,
   WAITING,
   RUNNING,
   FINISHED,
   ERROR,
   TIMEOUT,
   CANCELED,
   KILLED;

   public boolean isActive() {
      return this == WAITING || this == RUNNING;
   }

   public boolean isTerminal() {
      return this != NOT_RUN && !isActive();
   }

   /**
    * @return {@code true} if the unit was stopped by a cancel or kill signal.
    */
   public boolean isAborted() {
      return this == CANCELED || this == KILLED;
   }
}
