package io.tower.api.config;

import io.tower.function.StepAction;
import io.tower.impl.Util;

public class StepBuilder<P> {
   private final CaseBuilder<P> parent;
   private final String name;
   private final StepAction<?, ?> action;
   private boolean locked = true;
   private boolean skip = false;
   private long timeout = Defaults.TIMEOUT;
   private long frequency = Defaults.FREQUENCY;
   private boolean failContinue = false;

   StepBuilder(CaseBuilder<P> parent, String name, StepAction<?, ?> action) {
      this.parent = parent;
      this.name = name;
      this.action = action;
   }

   public String name() {
      return name;
   }

   /**
    * Locked steps never run concurrently with other locked steps; unlocked steps run as soon as they are invoked.
    */
   public StepBuilder<P> locked(boolean locked) {
      this.locked = locked;
      return this;
   }

   public StepBuilder<P> skip(boolean skip) {
      this.skip = skip;
      return this;
   }

   /**
    * @param timeout Milliseconds to wait for admission; {@code -1} waits forever, {@code 0} checks once.
    */
   public StepBuilder<P> timeoutMillis(long timeout) {
      this.timeout = timeout;
      return this;
   }

   /**
    * @param timeout Time with unit ({@code 500ms}, {@code 10s}, {@code 2m}); plain numbers are seconds.
    *                {@code -1} waits forever, {@code 0} checks once.
    */
   public StepBuilder<P> timeout(String timeout) {
      return timeoutMillis(Defaults.parseTimeout(timeout));
   }

   /**
    * @param frequency Milliseconds between two admission checks.
    */
   public StepBuilder<P> frequencyMillis(long frequency) {
      this.frequency = frequency;
      return this;
   }

   /**
    * @param frequency Time with unit; plain numbers are seconds.
    */
   public StepBuilder<P> frequency(String frequency) {
      return frequencyMillis(Util.parseToMillis(frequency));
   }

   /**
    * When set, a failing step increments the error count of its case and returns a failed
    * {@link io.tower.api.StepResult} instead of throwing.
    */
   public StepBuilder<P> failContinue(boolean failContinue) {
      this.failContinue = failContinue;
      return this;
   }

   public CaseBuilder<P> endStep() {
      return parent;
   }

   StepDefinition build(int index, String caseNum) {
      String where = "Step " + name + " of case " + caseNum;
      if (action == null) {
         throw new TowerDefinitionException(where + " has no action");
      }
      Defaults.checkTimeout(timeout, where);
      Defaults.checkFrequency(frequency, where);
      return new StepDefinition(name, index, action, locked, skip, timeout, frequency, failContinue);
   }
}
