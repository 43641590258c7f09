package io.tower.core.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.tower.api.Step;
import io.tower.api.StepResult;
import io.tower.api.config.StepDefinition;
import io.tower.api.run.AdmissionException;
import io.tower.api.run.CancelSignal;
import io.tower.api.run.KillSignal;
import io.tower.api.run.RunStatus;
import io.tower.api.run.SkippedException;
import io.tower.api.run.StepFailedException;
import io.tower.api.run.Verdict;
import io.tower.core.admission.Admissible;
import io.tower.core.admission.AdmissionController;
import io.tower.function.StepAction;
import io.tower.impl.Util;

public class StepUnit<I, O> implements Step<I, O>, Admissible {
   private static final Logger log = LogManager.getLogger(StepUnit.class);
   private static final boolean trace = log.isTraceEnabled();

   private final CaseUnit owner;
   private final StepDefinition def;
   private final StepAction<I, O> action;
   // Reads are done without locks
   private volatile RunStatus status = RunStatus.NOT_RUN;
   private volatile Verdict verdict = Verdict.UNKNOWN;
   private volatile String error;

   @SuppressWarnings("unchecked")
   StepUnit(CaseUnit owner, StepDefinition def) {
      this.owner = owner;
      this.def = def;
      this.action = (StepAction<I, O>) def.action;
   }

   public CaseUnit owner() {
      return owner;
   }

   @Override
   public String name() {
      return def.name;
   }

   @Override
   public int index() {
      return def.index;
   }

   @Override
   public String caseNum() {
      return owner.caseNum();
   }

   @Override
   public boolean isLocked() {
      return def.locked;
   }

   @Override
   public boolean isSkip() {
      return def.skip;
   }

   @Override
   public boolean isFailContinue() {
      return def.failContinue;
   }

   @Override
   public RunStatus status() {
      return status;
   }

   @Override
   public Verdict verdict() {
      return verdict;
   }

   @Override
   public String error() {
      return error;
   }

   @Override
   public String describe() {
      return "Step " + def.index + " (" + def.name + ") of " + owner.caseNum();
   }

   @Override
   public void onAdmissionDenied(long waitedMillis) {
      log.debug("{} is waiting for locked steps, {} ms so far", describe(), waitedMillis);
   }

   void reset() {
      status = RunStatus.NOT_RUN;
      verdict = Verdict.UNKNOWN;
      error = null;
   }

   @Override
   public StepResult<O> runStep(I input) {
      reset();
      owner.checkpoint();
      if (def.skip) {
         status = RunStatus.SKIPPED;
         throw new SkippedException(describe() + " is skipped");
      }
      status = RunStatus.WAITING;
      AdmissionController<StepUnit<?, ?>> controller = owner.project().domain().steps();
      try (AdmissionController<StepUnit<?, ?>>.Ticket ticket = controller.await(this, def.timeout, def.frequency, owner.token())) {
         status = RunStatus.RUNNING;
         if (trace) {
            log.trace("{} running after {} ms in admission", describe(), ticket.waitedMillis());
         }
         O value = action.apply(input);
         verdict = Verdict.PASSED;
         status = RunStatus.FINISHED;
         return StepResult.of(value);
      } catch (AdmissionException e) {
         error = e.getMessage();
         status = RunStatus.TIMEOUT;
         throw e;
      } catch (CancelSignal e) {
         status = RunStatus.CANCELED;
         throw e;
      } catch (KillSignal e) {
         status = RunStatus.KILLED;
         throw e;
      } catch (Exception | AssertionError e) {
         error = Util.describeError(e);
         verdict = Verdict.FAILED;
         status = RunStatus.ERROR;
         if (def.failContinue) {
            int errors = owner.incrementErrors();
            owner.project().briefLog().warn("{} failed, continuing ({} errors): {}", describe(), errors, Util.explainCauses(e));
            return StepResult.failed(def.name, e);
         }
         throw new StepFailedException(def.name, describe() + " failed: " + Util.explainCauses(e), e);
      }
   }

   @Override
   public String toString() {
      return describe() + " [" + status + "]";
   }
}
