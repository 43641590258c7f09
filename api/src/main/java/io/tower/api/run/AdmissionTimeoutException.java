package io.tower.api.run;

public class AdmissionTimeoutException extends AdmissionException {
   public AdmissionTimeoutException(String message, long waitedMillis) {
      super(message, waitedMillis);
   }
}
