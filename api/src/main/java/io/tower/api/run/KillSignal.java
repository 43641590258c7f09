package io.tower.api.run;

/**
 * Hard abort: every level it passes through records {@link RunStatus#KILLED} (or logs) and re-throws it,
 * up to the project which is the only place where it is swallowed.
 */
public class KillSignal extends RuntimeException {
   public KillSignal(String message) {
      super(message, null, false, false);
   }
}
