package io.tower.core.admission;

/**
 * Unit of work that asks an {@link AdmissionController} for permission to run.
 */
public interface Admissible {
   /**
    * @return Human readable identification used in log messages and exceptions.
    */
   String describe();

   /**
    * Locked units never run at the same time as another locked unit of the same controller.
    */
   boolean isLocked();

   /**
    * Invoked after each denied attempt that is followed by another one.
    *
    * @param waitedMillis Time spent waiting so far.
    */
   default void onAdmissionDenied(long waitedMillis) {
   }
}
