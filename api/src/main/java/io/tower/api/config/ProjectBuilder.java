package io.tower.api.config;

import java.util.ArrayList;
import java.util.List;

import io.tower.function.CaseBody;

/**
 * Entry point for assembling a project tree.
 * <pre>
 * ProjectDefinition project = ProjectBuilder.builder("smoke")
 *       .runBy(RunBy.SKIP)
 *       .addFeature("login")
 *          .addCase("TC-1").title("valid credentials").skip(false).body(ctx -&gt; 0).endCase()
 *       .endFeature()
 *       .build();
 * </pre>
 */
public class ProjectBuilder {
   private final String name;
   private final CaseNumberRegistry registry = new CaseNumberRegistry();
   private final List<FeatureBuilder<ProjectBuilder>> features = new ArrayList<>();
   private RunBy runBy = RunBy.ARGUMENTS;
   private DetailLogMode detailLogMode = Defaults.DETAIL_LOG_MODE;
   private CaseBuilder<ProjectBuilder> setup;
   private CaseBuilder<ProjectBuilder> teardown;

   private ProjectBuilder(String name) {
      this.name = name;
   }

   public static ProjectBuilder builder(String name) {
      if (Defaults.isEmpty(name)) {
         throw new TowerDefinitionException("Project name must not be empty");
      }
      return new ProjectBuilder(name);
   }

   public String name() {
      return name;
   }

   CaseNumberRegistry registry() {
      return registry;
   }

   public ProjectBuilder runBy(RunBy runBy) {
      this.runBy = runBy;
      return this;
   }

   public ProjectBuilder detailLogMode(DetailLogMode detailLogMode) {
      this.detailLogMode = detailLogMode;
      return this;
   }

   public CaseBuilder<ProjectBuilder> setup(CaseBody body) {
      if (setup != null) {
         throw new TowerDefinitionException("Setup of project " + name + " is already defined");
      }
      setup = new CaseBuilder<>(this, "setup", CaseFlag.SETUP, CaseLevel.PROJECT).body(body);
      return setup;
   }

   public CaseBuilder<ProjectBuilder> teardown(CaseBody body) {
      if (teardown != null) {
         throw new TowerDefinitionException("Teardown of project " + name + " is already defined");
      }
      teardown = new CaseBuilder<>(this, "teardown", CaseFlag.TEARDOWN, CaseLevel.PROJECT).body(body);
      return teardown;
   }

   public FeatureBuilder<ProjectBuilder> addFeature(String name) {
      for (FeatureBuilder<ProjectBuilder> f : features) {
         if (f.name().equals(name)) {
            throw new TowerDefinitionException("Project " + this.name + " already contains feature " + name);
         }
      }
      FeatureBuilder<ProjectBuilder> feature = new FeatureBuilder<>(this, this, name, null);
      features.add(feature);
      return feature;
   }

   public ProjectDefinition build() {
      if (runBy == null) {
         throw new TowerDefinitionException("Project " + name + " does not define how cases are selected");
      }
      List<FeatureDefinition> featureDefinitions = new ArrayList<>(features.size());
      for (FeatureBuilder<ProjectBuilder> f : features) {
         featureDefinitions.add(f.build());
      }
      return new ProjectDefinition(name, runBy, detailLogMode == null ? DetailLogMode.NONE : detailLogMode,
            setup == null ? null : setup.build(null),
            teardown == null ? null : teardown.build(null),
            featureDefinitions);
   }
}
