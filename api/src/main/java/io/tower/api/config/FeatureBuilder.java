package io.tower.api.config;

import java.util.ArrayList;
import java.util.List;

import io.tower.function.CaseBody;

/**
 * Builds a feature group; {@code P} is either the {@link ProjectBuilder} or the parent {@link FeatureBuilder}.
 */
public class FeatureBuilder<P> {
   private final P parent;
   private final ProjectBuilder project;
   private final String name;
   private final String path;
   private final List<CaseBuilder<FeatureBuilder<P>>> cases = new ArrayList<>();
   private final List<FeatureBuilder<FeatureBuilder<P>>> children = new ArrayList<>();
   private CaseBuilder<FeatureBuilder<P>> setup;
   private CaseBuilder<FeatureBuilder<P>> teardown;

   FeatureBuilder(P parent, ProjectBuilder project, String name, String path) {
      if (Defaults.isEmpty(name)) {
         throw new TowerDefinitionException("Feature name must not be empty" + (path == null ? "" : " (in " + path + ")"));
      }
      this.parent = parent;
      this.project = project;
      this.name = name;
      this.path = path == null ? name : path + "/" + name;
   }

   public String name() {
      return name;
   }

   public FeatureBuilder<FeatureBuilder<P>> addFeature(String name) {
      for (FeatureBuilder<?> child : children) {
         if (child.name().equals(name)) {
            throw new TowerDefinitionException("Feature " + path + " already contains feature " + name);
         }
      }
      FeatureBuilder<FeatureBuilder<P>> child = new FeatureBuilder<>(this, project, name, path);
      children.add(child);
      return child;
   }

   public CaseBuilder<FeatureBuilder<P>> setup(CaseBody body) {
      if (setup != null) {
         throw new TowerDefinitionException("Setup of feature " + path + " is already defined");
      }
      setup = new CaseBuilder<>(this, "setup", CaseFlag.SETUP, CaseLevel.FEATURE).body(body);
      return setup;
   }

   public CaseBuilder<FeatureBuilder<P>> teardown(CaseBody body) {
      if (teardown != null) {
         throw new TowerDefinitionException("Teardown of feature " + path + " is already defined");
      }
      teardown = new CaseBuilder<>(this, "teardown", CaseFlag.TEARDOWN, CaseLevel.FEATURE).body(body);
      return teardown;
   }

   /**
    * @throws DuplicateCaseNumberException if another case of the project uses the same number.
    */
   public CaseBuilder<FeatureBuilder<P>> addCase(String caseNum) {
      if (Defaults.isEmpty(caseNum)) {
         throw new TowerDefinitionException("Case number must not be empty (in feature " + path + ")");
      }
      project.registry().register(caseNum, "feature " + path);
      CaseBuilder<FeatureBuilder<P>> builder = new CaseBuilder<>(this, caseNum, CaseFlag.NONE, CaseLevel.FEATURE);
      cases.add(builder);
      return builder;
   }

   /**
    * Adds a case implemented as a subclass of {@link BaseCase}.
    */
   public FeatureBuilder<P> addCase(BaseCase testCase) {
      String caseNum = testCase.caseNum();
      if (Defaults.isEmpty(caseNum)) {
         throw new TowerDefinitionException(testCase.getClass().getName() + " does not define a case number");
      }
      if (Defaults.isEmpty(testCase.caseTitle())) {
         throw new TowerDefinitionException(testCase.getClass().getName() + " does not define a case title");
      }
      CaseBuilder<FeatureBuilder<P>> builder = addCase(caseNum)
            .title(testCase.caseTitle())
            .labels(testCase.labels())
            .body(testCase);
      testCase.configure(builder);
      return this;
   }

   public P endFeature() {
      return parent;
   }

   FeatureDefinition build() {
      List<CaseDefinition> caseDefinitions = new ArrayList<>(cases.size());
      for (CaseBuilder<FeatureBuilder<P>> c : cases) {
         caseDefinitions.add(c.build(name));
      }
      List<FeatureDefinition> childDefinitions = new ArrayList<>(children.size());
      for (FeatureBuilder<FeatureBuilder<P>> child : children) {
         childDefinitions.add(child.build());
      }
      return new FeatureDefinition(name,
            setup == null ? null : setup.build(name),
            teardown == null ? null : teardown.build(name),
            caseDefinitions, childDefinitions);
   }
}
