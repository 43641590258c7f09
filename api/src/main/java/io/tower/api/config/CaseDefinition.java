package io.tower.api.config;

import java.util.List;
import java.util.Set;

import io.tower.function.CaseBody;

public final class CaseDefinition {
   public final String caseNum;
   public final String caseTitle;
   public final Set<String> labels;
   public final CaseFlag flag;
   public final CaseLevel level;
   public final boolean locked;
   public final boolean skip;
   /**
    * Admission timeout in milliseconds: {@code -1} waits forever, {@code 0} checks once.
    */
   public final long timeout;
   /**
    * Admission polling interval in milliseconds.
    */
   public final long frequency;
   public final int loop;
   public final double order;
   public final CaseBody body;
   public final List<StepDefinition> steps;

   public CaseDefinition(String caseNum, String caseTitle, Set<String> labels, CaseFlag flag, CaseLevel level, boolean locked,
                         boolean skip, long timeout, long frequency, int loop, double order, CaseBody body,
                         List<StepDefinition> steps) {
      this.caseNum = caseNum;
      this.caseTitle = caseTitle;
      this.labels = Set.copyOf(labels);
      this.flag = flag;
      this.level = level;
      this.locked = locked;
      // fixtures are never skipped
      this.skip = skip && !flag.isFixture();
      this.timeout = timeout;
      this.frequency = frequency;
      this.loop = loop;
      this.order = order;
      this.body = body;
      this.steps = List.copyOf(steps);
   }

   public String fullName() {
      return "TestCase: " + caseNum + ", " + caseTitle;
   }

   @Override
   public String toString() {
      return fullName();
   }
}
