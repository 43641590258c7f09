package io.tower.api.config;

import io.tower.function.StepAction;

public final class StepDefinition {
   public final String name;
   public final int index;
   public final StepAction<?, ?> action;
   public final boolean locked;
   public final boolean skip;
   public final long timeout;
   public final long frequency;
   public final boolean failContinue;

   public StepDefinition(String name, int index, StepAction<?, ?> action, boolean locked, boolean skip, long timeout,
                         long frequency, boolean failContinue) {
      this.name = name;
      this.index = index;
      this.action = action;
      this.locked = locked;
      this.skip = skip;
      this.timeout = timeout;
      this.frequency = frequency;
      this.failContinue = failContinue;
   }

   @Override
   public String toString() {
      return "Step " + index + ": " + name;
   }
}
