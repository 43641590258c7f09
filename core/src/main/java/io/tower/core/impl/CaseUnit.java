package io.tower.core.impl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.tower.api.CaseContext;
import io.tower.api.Step;
import io.tower.api.config.CaseDefinition;
import io.tower.api.config.CaseFlag;
import io.tower.api.config.CaseLevel;
import io.tower.api.config.RunArguments;
import io.tower.api.config.RunBy;
import io.tower.api.config.StepDefinition;
import io.tower.api.config.TowerDefinitionException;
import io.tower.api.run.AdmissionException;
import io.tower.api.run.CancelSignal;
import io.tower.api.run.CaseStatus;
import io.tower.api.run.InvalidCaseReturnException;
import io.tower.api.run.KillSignal;
import io.tower.api.run.LoopRecord;
import io.tower.api.run.RunStatus;
import io.tower.api.run.Verdict;
import io.tower.core.admission.Admissible;
import io.tower.core.admission.AdmissionController;
import io.tower.core.admission.CancellationToken;
import io.tower.impl.Util;

/**
 * Runtime state of a case: admission, loop iterations, timing and the loop records.
 */
public class CaseUnit implements CaseContext, Admissible {
   private static final Logger log = LogManager.getLogger(CaseUnit.class);
   private static final boolean trace = log.isTraceEnabled();

   private final ProjectRoot project;
   private final FeatureGroup feature;
   private final CaseDefinition def;
   private final int id;
   private final CancellationToken token;
   private final Map<String, StepUnit<?, ?>> steps = new LinkedHashMap<>();
   private final Map<String, Object> data = new ConcurrentHashMap<>();
   private final List<LoopRecord> loops = new CopyOnWriteArrayList<>();
   private final AtomicInteger errorCount = new AtomicInteger();

   private int loop;
   // Reads are done without locks
   private volatile RunStatus status = RunStatus.NOT_RUN;
   private volatile Verdict verdict = Verdict.UNKNOWN;
   private volatile String error;
   private volatile int loopIndex;
   private volatile int runCount;
   private volatile long launchTime;
   private volatile long beginTime;
   private volatile long durationMillis;
   private volatile long totalTimeMillis;
   private volatile long totalTimeSum;

   CaseUnit(ProjectRoot project, FeatureGroup feature, CaseDefinition def, int id) {
      this.project = project;
      this.feature = feature;
      this.def = def;
      this.id = id;
      this.loop = def.loop;
      this.token = project.token().child(def.fullName());
      for (StepDefinition step : def.steps) {
         steps.put(step.name, new StepUnit<>(this, step));
      }
   }

   public int id() {
      return id;
   }

   public CaseDefinition definition() {
      return def;
   }

   ProjectRoot project() {
      return project;
   }

   CancellationToken token() {
      return token;
   }

   /**
    * @return Owning feature group, {@code null} for project setup and teardown.
    */
   public FeatureGroup feature() {
      return feature;
   }

   @Override
   public String caseNum() {
      return def.caseNum;
   }

   @Override
   public String caseTitle() {
      return def.caseTitle;
   }

   public String fullName() {
      return def.fullName();
   }

   @Override
   public String featureName() {
      return feature == null ? null : feature.name();
   }

   public CaseFlag flag() {
      return def.flag;
   }

   public CaseLevel level() {
      return def.level;
   }

   public Set<String> labels() {
      return def.labels;
   }

   public boolean isSkip() {
      return def.skip;
   }

   @Override
   public boolean isLocked() {
      return def.locked;
   }

   public double order() {
      return def.order;
   }

   public int loop() {
      return loop;
   }

   void loop(int loop) {
      if (loop < 1) {
         throw new TowerDefinitionException(describe() + ": loop must be at least 1; was " + loop);
      }
      this.loop = loop;
   }

   public RunStatus status() {
      return status;
   }

   public Verdict verdict() {
      return verdict;
   }

   public String error() {
      return error;
   }

   /**
    * @return Iterations attempted in the last run, including those that never got admitted.
    */
   public int runCount() {
      return runCount;
   }

   public long launchTime() {
      return launchTime;
   }

   public long beginTime() {
      return beginTime;
   }

   /**
    * @return Time spent in the body; measured up to now while the case is running.
    */
   public long durationMillis() {
      if (status == RunStatus.RUNNING) {
         return System.currentTimeMillis() - beginTime;
      }
      return durationMillis;
   }

   /**
    * @return Time from launch including the admission wait; measured up to now while the case is active.
    */
   public long totalTimeMillis() {
      if (status.isActive()) {
         return System.currentTimeMillis() - launchTime;
      }
      return totalTimeMillis;
   }

   /**
    * @return Total time of all iterations of all runs of this case.
    */
   public long totalTimeSum() {
      return totalTimeSum;
   }

   public List<LoopRecord> loops() {
      return Collections.unmodifiableList(loops);
   }

   @Override
   public RunArguments arguments() {
      return project.arguments();
   }

   @Override
   public int loopIndex() {
      return loopIndex;
   }

   @SuppressWarnings("unchecked")
   @Override
   public <I, O> Step<I, O> step(String name) {
      StepUnit<?, ?> step = steps.get(name);
      if (step == null) {
         throw new IllegalArgumentException(describe() + " has no step " + name + "; known steps are " + steps.keySet());
      }
      return (Step<I, O>) step;
   }

   @Override
   public List<StepUnit<?, ?>> steps() {
      return Collections.unmodifiableList(new ArrayList<>(steps.values()));
   }

   public StepUnit<?, ?> runningStep() {
      for (StepUnit<?, ?> step : steps.values()) {
         if (step.status() == RunStatus.RUNNING) {
            return step;
         }
      }
      return null;
   }

   @Override
   public void checkpoint() {
      token.check();
   }

   @Override
   public int errorCount() {
      return errorCount.get();
   }

   int incrementErrors() {
      return errorCount.incrementAndGet();
   }

   @SuppressWarnings("unchecked")
   @Override
   public <T> T data(String key) {
      return (T) data.get(key);
   }

   @Override
   public void data(String key, Object value) {
      if (value == null) {
         data.remove(key);
      } else {
         data.put(key, value);
      }
   }

   @Override
   public Logger detailLog() {
      return project.detailLog();
   }

   @Override
   public String describe() {
      return def.fullName();
   }

   @Override
   public void onAdmissionDenied(long waitedMillis) {
      log.debug("{} is waiting for locked cases, {} ms so far", describe(), waitedMillis);
   }

   /**
    * Asks the case to stop; a waiting case gives up, a running body sees the signal at its next checkpoint.
    */
   public void cancel() {
      token.cancel();
   }

   public void kill() {
      token.kill();
   }

   void reset() {
      status = RunStatus.NOT_RUN;
      verdict = Verdict.UNKNOWN;
      error = null;
      loopIndex = 0;
      runCount = 0;
      launchTime = 0;
      beginTime = 0;
      durationMillis = 0;
      totalTimeMillis = 0;
      loops.clear();
      errorCount.set(0);
      steps.values().forEach(StepUnit::reset);
      token.clear();
   }

   /**
    * Runs all loop iterations of the case.
    *
    * @return Verdict of the last iteration; {@link Verdict#UNKNOWN} when the case was not selected or did not finish.
    * @throws KillSignal when the case was killed.
    */
   public Verdict run() {
      reset();
      if (!project.shouldRun(this)) {
         if (project.runBy() == RunBy.SKIP) {
            status = RunStatus.SKIPPED;
         }
         if (trace) {
            log.trace("{} is not selected", describe());
         }
         return Verdict.UNKNOWN;
      }
      for (int i = 0; i < loop; ++i) {
         runIteration(i);
         if (status == RunStatus.TIMEOUT || status == RunStatus.CANCELED) {
            if (i + 1 < loop) {
               project.briefLog().info("{}: remaining {} loops are not run after {}", describe(), loop - i - 1, status);
            }
            break;
         }
      }
      return verdict;
   }

   private void runIteration(int index) {
      loopIndex = index;
      status = RunStatus.WAITING;
      verdict = Verdict.UNKNOWN;
      error = null;
      beginTime = 0;
      durationMillis = 0;
      steps.values().forEach(StepUnit::reset);
      launchTime = System.currentTimeMillis();
      AdmissionController<CaseUnit> controller = project.domain().cases();
      try {
         try (AdmissionController<CaseUnit>.Ticket ticket = controller.await(this, def.timeout, def.frequency, token)) {
            beginTime = System.currentTimeMillis();
            errorCount.set(0);
            status = RunStatus.RUNNING;
            if (project.detailLogMode().atStart()) {
               project.detailLog().info("{} started (loop {}/{}, waited {})", describe(), index + 1, loop,
                     Util.prettyPrintMillis(ticket.waitedMillis()));
            }
            runBody();
         }
      } catch (AdmissionException e) {
         error = e.getMessage();
         status = RunStatus.TIMEOUT;
         project.briefLog().warn("{} timed out waiting for admission after {} ms", describe(), e.waitedMillis());
      } catch (CancelSignal e) {
         token.clear();
         status = RunStatus.CANCELED;
         project.briefLog().info("{} was canceled", describe());
      } catch (KillSignal e) {
         token.clear();
         status = RunStatus.KILLED;
         project.briefLog().error("{} was killed", describe());
         throw e;
      } finally {
         finishIteration(index);
      }
   }

   private void runBody() {
      try {
         token.check();
         int count = def.body.run(this);
         token.check();
         if (count < 0) {
            throw new InvalidCaseReturnException(describe() + " returned negative error count " + count);
         }
         int total = errorCount.addAndGet(count);
         verdict = Verdict.of(total == 0);
         status = RunStatus.FINISHED;
      } catch (CancelSignal | KillSignal e) {
         throw e;
      } catch (Exception | AssertionError e) {
         errorCount.incrementAndGet();
         error = Util.describeError(e);
         verdict = Verdict.FAILED;
         status = RunStatus.ERROR;
         project.briefLog().error("{} failed with an error: {}", describe(), Util.explainCauses(e));
      }
   }

   private void finishIteration(int index) {
      ++runCount;
      long now = System.currentTimeMillis();
      durationMillis = beginTime == 0 ? 0 : now - beginTime;
      totalTimeMillis = now - launchTime;
      totalTimeSum += totalTimeMillis;
      List<String> stepErrors = new ArrayList<>();
      for (StepUnit<?, ?> step : steps.values()) {
         if (step.error() != null) {
            stepErrors.add(step.name() + ": " + step.error());
         }
      }
      loops.add(new LoopRecord(index, status, verdict, durationMillis, totalTimeMillis, error, stepErrors));
      project.briefLog().info("{} loop {}/{}: {} {} in {}", describe(), index + 1, loop, status, verdict,
            Util.prettyPrintMillis(totalTimeMillis));
      if (project.detailLogMode().atEnd()) {
         project.detailLog().info("{} ended (loop {}/{}): {} {}, body {}, total {}{}", describe(), index + 1, loop,
               status, verdict, Util.prettyPrintMillis(durationMillis), Util.prettyPrintMillis(totalTimeMillis),
               error == null ? "" : ", error: " + error);
         for (String stepError : stepErrors) {
            project.detailLog().info("  {}", stepError);
         }
      }
   }

   public CaseStatus snapshot() {
      return new CaseStatus(id, def.caseNum, def.caseTitle, def.level, featureName(), status, verdict,
            durationMillis(), totalTimeMillis(), runCount, loops);
   }

   @Override
   public String toString() {
      return describe() + " [" + status + "]";
   }
}
