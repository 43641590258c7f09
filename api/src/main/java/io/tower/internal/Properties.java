package io.tower.internal;

import java.util.function.Function;

public interface Properties {
   String ADMISSION_FREQUENCY = "io.tower.admission.frequency";
   String ADMISSION_TIMEOUT = "io.tower.admission.timeout";
   String DETAIL_LOG_MODE = "io.tower.detail.log.mode";
   String BRIEF_LOGGER = "io.tower.log.brief";
   String DETAIL_LOGGER = "io.tower.log.detail";
   String TOWER_STACKTRACE = "io.tower.stacktrace";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static long getLong(String property, long def) {
      return get(property, Long::valueOf, def);
   }

   static int getInt(String property, int def) {
      return get(property, Integer::valueOf, def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
