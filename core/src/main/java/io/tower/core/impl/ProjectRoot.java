package io.tower.core.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.tower.api.config.CaseDefinition;
import io.tower.api.config.DetailLogMode;
import io.tower.api.config.FeatureDefinition;
import io.tower.api.config.ProjectDefinition;
import io.tower.api.config.RunArguments;
import io.tower.api.config.RunBy;
import io.tower.api.config.TowerDefinitionException;
import io.tower.api.run.CaseStatus;
import io.tower.api.run.KillSignal;
import io.tower.api.run.ProjectStatus;
import io.tower.api.run.RunStatus;
import io.tower.api.run.Tally;
import io.tower.api.run.Verdict;
import io.tower.core.admission.CancellationToken;
import io.tower.impl.Util;
import io.tower.internal.Properties;

/**
 * Top of the tree: runs the global setup, every feature group and the global teardown.
 */
public class ProjectRoot {
   private static final Logger log = LogManager.getLogger(ProjectRoot.class);

   public static final String BRIEF_LOGGER = Properties.get(Properties.BRIEF_LOGGER, "io.tower.brief");
   public static final String DETAIL_LOGGER = Properties.get(Properties.DETAIL_LOGGER, "io.tower.detail");

   private final ProjectDefinition def;
   private final Logger briefLog;
   private final Logger detailLog;
   private final AdmissionDomain domain;
   private final CancellationToken token;
   private final AtomicInteger caseIds = new AtomicInteger();
   private final List<CaseUnit> allCases = new CopyOnWriteArrayList<>();
   private final CaseUnit setup;
   private final CaseUnit teardown;
   private final List<FeatureGroup> features;
   private volatile RunArguments arguments;

   public ProjectRoot(ProjectDefinition def) {
      this(def, LogManager.getLogger(BRIEF_LOGGER), LogManager.getLogger(DETAIL_LOGGER), AdmissionDomain.processWide());
   }

   public ProjectRoot(ProjectDefinition def, Logger briefLog, Logger detailLog, AdmissionDomain domain) {
      this.def = def;
      this.briefLog = briefLog;
      this.detailLog = detailLog;
      this.domain = domain;
      this.token = new CancellationToken("Project " + def.name);
      this.setup = def.setup == null ? null : createCase(null, def.setup);
      this.teardown = def.teardown == null ? null : createCase(null, def.teardown);
      List<FeatureGroup> features = new ArrayList<>(def.features.size());
      for (FeatureDefinition f : def.features) {
         features.add(new FeatureGroup(this, null, f));
      }
      this.features = Collections.unmodifiableList(features);
   }

   CaseUnit createCase(FeatureGroup feature, CaseDefinition definition) {
      CaseUnit unit = new CaseUnit(this, feature, definition, caseIds.incrementAndGet());
      allCases.add(unit);
      return unit;
   }

   public String name() {
      return def.name;
   }

   public ProjectDefinition definition() {
      return def;
   }

   public RunBy runBy() {
      return def.runBy;
   }

   public DetailLogMode detailLogMode() {
      return def.detailLogMode;
   }

   public Logger briefLog() {
      return briefLog;
   }

   public Logger detailLog() {
      return detailLog;
   }

   public AdmissionDomain domain() {
      return domain;
   }

   CancellationToken token() {
      return token;
   }

   public RunArguments arguments() {
      return arguments;
   }

   public ProjectRoot arguments(RunArguments arguments) {
      this.arguments = arguments;
      return this;
   }

   public CaseUnit setup() {
      return setup;
   }

   public CaseUnit teardown() {
      return teardown;
   }

   public List<FeatureGroup> features() {
      return features;
   }

   public FeatureGroup feature(String name) {
      for (FeatureGroup f : features) {
         if (f.name().equals(name)) {
            return f;
         }
      }
      return null;
   }

   public CaseUnit findCase(int id) {
      for (CaseUnit c : allCases) {
         if (c.id() == id) {
            return c;
         }
      }
      return null;
   }

   boolean shouldRun(CaseUnit c) {
      return Selection.shouldRun(c, def.runBy, arguments);
   }

   /**
    * @return Cases that would run with the current arguments, sorted by order and case number.
    */
   public List<CaseUnit> selectedCases() {
      List<CaseUnit> selected = new ArrayList<>();
      for (FeatureGroup f : features) {
         f.collectSelected(selected);
      }
      selected.sort(FeatureGroup.EXECUTION_ORDER);
      return selected;
   }

   /**
    * @return Cases, including setup and teardown, whose body is running right now.
    */
   public List<CaseUnit> runningCases() {
      return allCases.stream().filter(c -> c.status() == RunStatus.RUNNING).collect(Collectors.toList());
   }

   public ProjectStatus statusSnapshot(boolean excludeNotRun) {
      List<CaseStatus> running = runningCases().stream().map(CaseUnit::snapshot).collect(Collectors.toList());
      List<CaseUnit> cases = new ArrayList<>();
      for (FeatureGroup f : features) {
         f.collectCases(cases, false);
      }
      List<CaseStatus> all = cases.stream()
            .filter(c -> !excludeNotRun || c.status() != RunStatus.NOT_RUN)
            .map(CaseUnit::snapshot).collect(Collectors.toList());
      return new ProjectStatus(def.name, running, all);
   }

   /**
    * Cancels every case of the project until the current run ends.
    */
   public void cancel() {
      token.cancel();
   }

   /**
    * Kills every case of the project; the current run stops and returns what was counted so far.
    */
   public void kill() {
      token.kill();
   }

   /**
    * Runs the project.
    *
    * @return Passed and failed cases.
    * @throws TowerDefinitionException if cases are selected by arguments and no arguments were set.
    */
   public Tally run() {
      if (def.runBy == RunBy.ARGUMENTS && arguments == null) {
         throw new TowerDefinitionException("Project " + def.name + " selects cases by run arguments but none were set");
      }
      token.clear();
      long start = System.currentTimeMillis();
      Tally tally = Tally.ZERO;
      try {
         for (CaseUnit c : allCases) {
            c.reset();
            c.loop(c.definition().loop);
         }
         applyCaseLoops();
         if (def.runBy == RunBy.ARGUMENTS && arguments.feature() != null && feature(arguments.feature()) == null) {
            briefLog.warn("Project {} has no feature {}", def.name, arguments.feature());
            return Tally.ZERO;
         }
         int selected = features.stream().mapToInt(FeatureGroup::countSelected).sum();
         if (selected == 0) {
            briefLog.info("No cases of project {} are selected", def.name);
            return Tally.ZERO;
         }
         briefLog.info("Project {} started, {} cases selected by {}", def.name, selected, def.runBy);
         if (setup != null) {
            detailLog.info("Project {} setup", def.name);
            if (setup.run() != Verdict.PASSED) {
               briefLog.error("Setup of project {} did not pass ({}); no cases are run", def.name, setup.status());
               return Tally.ZERO;
            }
         }
         for (FeatureGroup f : features) {
            tally = tally.plus(f.run());
         }
         if (teardown != null) {
            detailLog.info("Project {} teardown", def.name);
            if (teardown.run() != Verdict.PASSED) {
               briefLog.warn("Teardown of project {} did not pass: {}", def.name, teardown.status());
            }
         }
      } catch (KillSignal e) {
         briefLog.error("Project {} was killed: {}", def.name, e.getMessage());
      } finally {
         token.clear();
      }
      briefLog.info("Project {} finished in {}: {} passed, {} failed", def.name,
            Util.prettyPrintMillis(System.currentTimeMillis() - start), tally.passed(), tally.failed());
      return tally;
   }

   private void applyCaseLoops() {
      if (arguments == null) {
         return;
      }
      for (Map.Entry<String, Map<String, Integer>> entry : arguments.caseLoops().entrySet()) {
         FeatureGroup f = feature(entry.getKey());
         if (f == null) {
            log.debug("Ignoring loops for unknown feature {}", entry.getKey());
            continue;
         }
         for (Map.Entry<String, Integer> loop : entry.getValue().entrySet()) {
            CaseUnit c = f.directCase(loop.getKey());
            if (c == null) {
               log.debug("Ignoring loops for unknown case {} in feature {}", loop.getKey(), entry.getKey());
            } else {
               c.loop(loop.getValue());
            }
         }
      }
   }

   @Override
   public String toString() {
      return "Project " + def.name + " (" + features.size() + " features)";
   }
}
