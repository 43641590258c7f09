package io.tower.api.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import io.tower.function.CaseBody;
import io.tower.function.StepAction;
import io.tower.impl.Util;

/**
 * Builds a single case; {@code P} is the builder that {@link #endCase()} returns to.
 */
public class CaseBuilder<P> {
   private final P parent;
   private final String caseNum;
   private final CaseFlag flag;
   private final CaseLevel level;
   private final List<StepBuilder<P>> steps = new ArrayList<>();
   private final Set<String> labels = new LinkedHashSet<>();
   private String title;
   private boolean locked = true;
   private boolean skip = true;
   private long timeout = Defaults.TIMEOUT;
   private long frequency = Defaults.FREQUENCY;
   private int loop = 1;
   private double order = 1;
   private CaseBody body;

   CaseBuilder(P parent, String caseNum, CaseFlag flag, CaseLevel level) {
      this.parent = parent;
      this.caseNum = caseNum;
      this.flag = flag;
      this.level = level;
   }

   public String caseNum() {
      return caseNum;
   }

   public CaseFlag flag() {
      return flag;
   }

   public CaseBuilder<P> title(String title) {
      this.title = title;
      return this;
   }

   public CaseBuilder<P> labels(String... labels) {
      return labels(Arrays.asList(labels));
   }

   public CaseBuilder<P> labels(Collection<String> labels) {
      labels.stream().map(l -> l.trim().toLowerCase(Locale.ROOT)).filter(l -> !l.isEmpty()).forEach(this.labels::add);
      return this;
   }

   /**
    * Locked cases never run concurrently with other locked cases.
    */
   public CaseBuilder<P> locked(boolean locked) {
      this.locked = locked;
      return this;
   }

   /**
    * Only considered when the project selects cases with {@link RunBy#SKIP}. Ignored for setup and teardown.
    */
   public CaseBuilder<P> skip(boolean skip) {
      this.skip = skip;
      return this;
   }

   /**
    * @param timeout Milliseconds to wait for admission; {@code -1} waits forever, {@code 0} checks once.
    */
   public CaseBuilder<P> timeoutMillis(long timeout) {
      this.timeout = timeout;
      return this;
   }

   /**
    * @param timeout Time with unit ({@code 500ms}, {@code 10s}, {@code 2m}); plain numbers are seconds.
    *                {@code -1} waits forever, {@code 0} checks once.
    */
   public CaseBuilder<P> timeout(String timeout) {
      return timeoutMillis(Defaults.parseTimeout(timeout));
   }

   /**
    * @param frequency Milliseconds between two admission checks.
    */
   public CaseBuilder<P> frequencyMillis(long frequency) {
      this.frequency = frequency;
      return this;
   }

   /**
    * @param frequency Time with unit; plain numbers are seconds.
    */
   public CaseBuilder<P> frequency(String frequency) {
      return frequencyMillis(Util.parseToMillis(frequency));
   }

   public CaseBuilder<P> loop(int loop) {
      this.loop = loop;
      return this;
   }

   /**
    * Cases in a feature run sorted by order and then by case number.
    */
   public CaseBuilder<P> order(double order) {
      this.order = order;
      return this;
   }

   public CaseBuilder<P> body(CaseBody body) {
      this.body = body;
      return this;
   }

   public <I, O> StepBuilder<P> step(String name, StepAction<I, O> action) {
      StepBuilder<P> step = new StepBuilder<>(this, name, action);
      steps.add(step);
      return step;
   }

   public CaseBuilder<P> addStep(String name, StepAction<?, ?> action) {
      steps.add(new StepBuilder<>(this, name, action));
      return this;
   }

   public P endCase() {
      return parent;
   }

   CaseDefinition build(String featureName) {
      String where = "Case " + caseNum + (featureName == null ? "" : " in feature " + featureName);
      if (Defaults.isEmpty(caseNum)) {
         throw new TowerDefinitionException("Case number is not defined" + (featureName == null ? "" : " in feature " + featureName));
      }
      String title = this.title;
      if (Defaults.isEmpty(title)) {
         if (flag.isFixture()) {
            title = (featureName == null ? "project" : featureName) + " " + flag.name().toLowerCase(Locale.ROOT);
         } else {
            throw new TowerDefinitionException(where + " does not define a title");
         }
      }
      if (body == null) {
         throw new TowerDefinitionException(where + " does not define a body");
      }
      if (loop < 1) {
         throw new TowerDefinitionException(where + ": loop must be at least 1; was " + loop);
      }
      Defaults.checkTimeout(timeout, where);
      Defaults.checkFrequency(frequency, where);
      Set<String> stepNames = new HashSet<>();
      List<StepDefinition> stepDefinitions = new ArrayList<>(steps.size());
      for (StepBuilder<P> step : steps) {
         if (Defaults.isEmpty(step.name())) {
            throw new TowerDefinitionException(where + " has a step without name");
         }
         if (!stepNames.add(step.name())) {
            throw new TowerDefinitionException(where + " has duplicate step name: " + step.name());
         }
         stepDefinitions.add(step.build(stepDefinitions.size() + 1, caseNum));
      }
      Set<String> labels = this.labels;
      if (labels.isEmpty()) {
         labels = new LinkedHashSet<>();
         if (featureName != null) {
            labels.add(featureName.toLowerCase(Locale.ROOT));
         }
         labels.add(caseNum.toLowerCase(Locale.ROOT));
      }
      return new CaseDefinition(caseNum, title, labels, flag, level, locked, skip, timeout, frequency, loop, order, body,
            stepDefinitions);
   }
}
