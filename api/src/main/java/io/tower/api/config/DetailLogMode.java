package io.tower.api.config;

/**
 * When the detail logger records a case: before its body, after it, both or never.
 */
public enum DetailLogMode {
   NONE,
   START,
   END,
   BOTH;

   public boolean atStart() {
      return this == START || this == BOTH;
   }

   public boolean atEnd() {
      return this == END || this == BOTH;
   }
}
