package io.tower.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import io.tower.api.config.TowerDefinitionException;
import io.tower.internal.Properties;

public class Util {
   private static final boolean STACKTRACE = Properties.getBoolean(Properties.TOWER_STACKTRACE);

   private Util() {
   }

   /**
    * Pretty prints time
    *
    * @param timeNanos Time in nanoseconds.
    * @return Formatted string.
    */
   public static String prettyPrintNanos(long timeNanos) {
      if (timeNanos < 1000) {
         return String.format("%d ns", timeNanos);
      } else if (timeNanos < 1000_000) {
         return String.format("%.2f μs", timeNanos / 1000d);
      } else if (timeNanos < 1000_000_000) {
         return String.format("%.2f ms", timeNanos / 1000_000d);
      } else {
         return String.format("%.2f s", timeNanos / 1000_000_000d);
      }
   }

   public static String prettyPrintMillis(long timeMillis) {
      return prettyPrintNanos(TimeUnit.MILLISECONDS.toNanos(timeMillis));
   }

   public static String explainCauses(Throwable e) {
      StringBuilder causes = new StringBuilder();
      Set<Throwable> reported = new HashSet<>();
      while (e != null && !reported.contains(e)) {
         if (causes.length() != 0) {
            causes.append(": ");
         }
         causes.append(e.getMessage());
         reported.add(e);
         e = e.getCause();
      }
      return causes.toString();
   }

   /**
    * Formats the error the way it is stored on steps and cases: class name and message, followed by the stack
    * trace when {@value Properties#TOWER_STACKTRACE} is set.
    */
   public static String describeError(Throwable e) {
      String text = e.getClass().getSimpleName() + ": " + explainCauses(e);
      if (!STACKTRACE) {
         return text;
      }
      StringWriter writer = new StringWriter();
      e.printStackTrace(new PrintWriter(writer));
      return text + "\nAt:\n" + writer;
   }

   public static String toString(InputStream stream) throws IOException {
      ByteArrayOutputStream result = new ByteArrayOutputStream();
      byte[] buffer = new byte[1024];
      int length;
      while ((length = stream.read(buffer)) != -1) {
         result.write(buffer, 0, length);
      }
      return result.toString(StandardCharsets.UTF_8.name());
   }

   public static long parseToMillis(String time) {
      time = time.trim();
      TimeUnit unit;
      String prefix;
      switch (time.charAt(time.length() - 1)) {
         case 's':
            if (time.endsWith("ms")) {
               unit = TimeUnit.MILLISECONDS;
               prefix = time.substring(0, time.length() - 2).trim();
            } else {
               unit = TimeUnit.SECONDS;
               prefix = time.substring(0, time.length() - 1).trim();
            }
            break;
         case 'm':
            unit = TimeUnit.MINUTES;
            prefix = time.substring(0, time.length() - 1).trim();
            break;
         case 'h':
            unit = TimeUnit.HOURS;
            prefix = time.substring(0, time.length() - 1).trim();
            break;
         default:
            unit = TimeUnit.SECONDS;
            prefix = time;
            break;
      }
      try {
         return unit.toMillis(Long.parseLong(prefix));
      } catch (NumberFormatException e) {
         throw new TowerDefinitionException("Cannot parse time: " + time, e);
      }
   }
}
