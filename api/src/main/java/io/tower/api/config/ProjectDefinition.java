package io.tower.api.config;

import java.util.List;

/**
 * Immutable description of the whole tree, produced by {@link ProjectBuilder#build()}.
 */
public final class ProjectDefinition {
   public final String name;
   public final RunBy runBy;
   public final DetailLogMode detailLogMode;
   public final CaseDefinition setup;
   public final CaseDefinition teardown;
   public final List<FeatureDefinition> features;

   public ProjectDefinition(String name, RunBy runBy, DetailLogMode detailLogMode, CaseDefinition setup,
                            CaseDefinition teardown, List<FeatureDefinition> features) {
      this.name = name;
      this.runBy = runBy;
      this.detailLogMode = detailLogMode;
      this.setup = setup;
      this.teardown = teardown;
      this.features = List.copyOf(features);
   }
}
