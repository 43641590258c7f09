package io.tower.api.config;

import io.tower.impl.Util;
import io.tower.internal.Properties;

final class Defaults {
   static final long TIMEOUT = Properties.get(Properties.ADMISSION_TIMEOUT, Defaults::parseTimeout, 0L);
   static final long FREQUENCY = Properties.get(Properties.ADMISSION_FREQUENCY, Util::parseToMillis, 15_000L);
   static final DetailLogMode DETAIL_LOG_MODE = Properties.get(Properties.DETAIL_LOG_MODE,
         value -> DetailLogMode.valueOf(value.trim().toUpperCase()), DetailLogMode.END);

   private Defaults() {
   }

   static long parseTimeout(String value) {
      return "-1".equals(value.trim()) ? -1 : Util.parseToMillis(value);
   }

   static void checkTimeout(long timeout, String where) {
      if (timeout < -1) {
         throw new TowerDefinitionException(where + ": timeout must be -1 (forever), 0 (check once) or positive; was " + timeout);
      }
   }

   static void checkFrequency(long frequency, String where) {
      if (frequency <= 0) {
         throw new TowerDefinitionException(where + ": frequency must be positive; was " + frequency);
      }
   }

   static boolean isEmpty(String s) {
      return s == null || s.isBlank();
   }
}
