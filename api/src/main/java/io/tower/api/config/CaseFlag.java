package io.tower.api.config;

public enum CaseFlag {
   NONE,
   SETUP,
   TEARDOWN;

   /**
    * @return {@code true} for setup and teardown; these cases bypass selection.
    */
   public boolean isFixture() {
      return this != NONE;
   }
}
