package io.tower.core.impl;

import io.tower.core.admission.AdmissionController;

/**
 * Pair of independent admission controllers, one for cases and one for steps. Projects sharing
 * a domain never run two locked cases (or two locked steps) at the same time.
 */
public final class AdmissionDomain {
   private static final AdmissionDomain PROCESS_WIDE = new AdmissionDomain("process");

   private final String name;
   private final AdmissionController<CaseUnit> cases;
   private final AdmissionController<StepUnit<?, ?>> steps;

   public AdmissionDomain(String name) {
      this.name = name;
      this.cases = new AdmissionController<>(name + "/cases");
      this.steps = new AdmissionController<>(name + "/steps");
   }

   /**
    * @return Domain shared by all projects in this JVM that were not given their own.
    */
   public static AdmissionDomain processWide() {
      return PROCESS_WIDE;
   }

   public String name() {
      return name;
   }

   public AdmissionController<CaseUnit> cases() {
      return cases;
   }

   public AdmissionController<StepUnit<?, ?>> steps() {
      return steps;
   }
}
