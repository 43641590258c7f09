package io.tower.core.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.tower.api.config.CaseDefinition;
import io.tower.api.config.FeatureDefinition;
import io.tower.api.run.KillSignal;
import io.tower.api.run.Tally;
import io.tower.api.run.Verdict;

public class FeatureGroup {
   private static final Logger log = LogManager.getLogger(FeatureGroup.class);

   static final Comparator<CaseUnit> EXECUTION_ORDER = Comparator.comparingDouble(CaseUnit::order)
         .thenComparing(CaseUnit::caseNum);

   private final ProjectRoot project;
   private final FeatureGroup parent;
   private final String name;
   private final CaseUnit setup;
   private final CaseUnit teardown;
   private final List<CaseUnit> cases;
   private final List<FeatureGroup> children;

   FeatureGroup(ProjectRoot project, FeatureGroup parent, FeatureDefinition def) {
      this.project = project;
      this.parent = parent;
      this.name = def.name;
      this.setup = def.setup == null ? null : project.createCase(this, def.setup);
      this.teardown = def.teardown == null ? null : project.createCase(this, def.teardown);
      List<CaseUnit> cases = new ArrayList<>(def.cases.size());
      for (CaseDefinition c : def.cases) {
         cases.add(project.createCase(this, c));
      }
      cases.sort(EXECUTION_ORDER);
      this.cases = Collections.unmodifiableList(cases);
      List<FeatureGroup> children = new ArrayList<>(def.children.size());
      for (FeatureDefinition child : def.children) {
         children.add(new FeatureGroup(project, this, child));
      }
      this.children = Collections.unmodifiableList(children);
   }

   public String name() {
      return name;
   }

   public FeatureGroup parent() {
      return parent;
   }

   public CaseUnit setup() {
      return setup;
   }

   public CaseUnit teardown() {
      return teardown;
   }

   /**
    * @return Cases sorted by order and case number.
    */
   public List<CaseUnit> cases() {
      return cases;
   }

   public List<FeatureGroup> children() {
      return children;
   }

   /**
    * @return Case with the given number in this group, not looking into child groups.
    */
   public CaseUnit directCase(String caseNum) {
      for (CaseUnit c : cases) {
         if (c.caseNum().equals(caseNum)) {
            return c;
         }
      }
      return null;
   }

   /**
    * @return Case with the given number in this group or its descendants.
    */
   public CaseUnit findCase(String caseNum) {
      for (CaseUnit c : cases) {
         if (c.caseNum().equals(caseNum)) {
            return c;
         }
      }
      for (FeatureGroup child : children) {
         CaseUnit c = child.findCase(caseNum);
         if (c != null) {
            return c;
         }
      }
      return null;
   }

   public int countSelected() {
      int count = 0;
      for (CaseUnit c : cases) {
         if (project.shouldRun(c)) {
            ++count;
         }
      }
      for (FeatureGroup child : children) {
         count += child.countSelected();
      }
      return count;
   }

   void collectSelected(List<CaseUnit> selected) {
      for (CaseUnit c : cases) {
         if (project.shouldRun(c)) {
            selected.add(c);
         }
      }
      for (FeatureGroup child : children) {
         child.collectSelected(selected);
      }
   }

   void collectCases(List<CaseUnit> all, boolean fixtures) {
      if (fixtures && setup != null) {
         all.add(setup);
      }
      all.addAll(cases);
      for (FeatureGroup child : children) {
         child.collectCases(all, fixtures);
      }
      if (fixtures && teardown != null) {
         all.add(teardown);
      }
   }

   /**
    * Runs the setup, the cases, the child groups and the teardown.
    *
    * @return Passed and failed cases of this group and its descendants.
    * @throws KillSignal when a case was killed; the teardown is not run in that case.
    */
   public Tally run() {
      int selected = countSelected();
      if (selected == 0) {
         log.debug("No cases selected in feature {}", name);
         return Tally.ZERO;
      }
      try {
         if (setup != null) {
            project.detailLog().info("Feature {} setup", name);
            if (setup.run() != Verdict.PASSED) {
               project.briefLog().error("Setup of feature {} did not pass ({}); its {} cases are not run", name, setup.status(), selected);
               return Tally.ZERO;
            }
         }
         project.detailLog().info("Feature {} started, {} cases selected", name, selected);
         Tally tally = Tally.ZERO;
         for (CaseUnit c : cases) {
            tally = tally.record(c.run());
         }
         for (FeatureGroup child : children) {
            tally = tally.plus(child.run());
         }
         if (teardown != null) {
            project.detailLog().info("Feature {} teardown", name);
            Verdict verdict = teardown.run();
            if (verdict != Verdict.PASSED) {
               project.briefLog().warn("Teardown of feature {} did not pass: {} {}", name, teardown.status(),
                     teardown.error() == null ? "" : teardown.error());
            }
         }
         project.briefLog().info("Feature {} finished: {} passed, {} failed", name, tally.passed(), tally.failed());
         return tally;
      } catch (KillSignal e) {
         project.briefLog().error("Feature {} was killed: {}", name, e.getMessage());
         throw e;
      }
   }

   @Override
   public String toString() {
      return "Feature " + name + " (" + cases.size() + " cases, " + children.size() + " children)";
   }
}
