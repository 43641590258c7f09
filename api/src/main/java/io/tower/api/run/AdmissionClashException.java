package io.tower.api.run;

/**
 * Admission was checked exactly once (timeout {@code 0}) and denied.
 */
public class AdmissionClashException extends AdmissionException {
   public AdmissionClashException(String message) {
      super(message, 0);
   }
}
