package io.tower.api.config;

import java.util.List;

public final class FeatureDefinition {
   public final String name;
   public final CaseDefinition setup;
   public final CaseDefinition teardown;
   public final List<CaseDefinition> cases;
   public final List<FeatureDefinition> children;

   public FeatureDefinition(String name, CaseDefinition setup, CaseDefinition teardown, List<CaseDefinition> cases,
                            List<FeatureDefinition> children) {
      this.name = name;
      this.setup = setup;
      this.teardown = teardown;
      this.cases = List.copyOf(cases);
      this.children = List.copyOf(children);
   }

   @Override
   public String toString() {
      return "Feature " + name + " (" + cases.size() + " cases, " + children.size() + " children)";
   }
}
