package io.tower.api.run;

import java.util.Objects;

/**
 * Count of passed and failed cases returned by every {@code run()} in the tree.
 */
public final class Tally {
   public static final Tally ZERO = new Tally(0, 0);

   private final int passed;
   private final int failed;

   public Tally(int passed, int failed) {
      this.passed = passed;
      this.failed = failed;
   }

   public int passed() {
      return passed;
   }

   public int failed() {
      return failed;
   }

   public int total() {
      return passed + failed;
   }

   public Tally plus(Tally other) {
      if (other.total() == 0) {
         return this;
      }
      return new Tally(passed + other.passed, failed + other.failed);
   }

   public Tally record(Verdict verdict) {
      switch (verdict) {
         case PASSED:
            return new Tally(passed + 1, failed);
         case FAILED:
            return new Tally(passed, failed + 1);
         default:
            return this;
      }
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Tally)) {
         return false;
      }
      Tally tally = (Tally) o;
      return passed == tally.passed && failed == tally.failed;
   }

   @Override
   public int hashCode() {
      return Objects.hash(passed, failed);
   }

   @Override
   public String toString() {
      return "(" + passed + ", " + failed + ")";
   }
}
