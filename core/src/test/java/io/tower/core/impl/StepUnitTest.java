package io.tower.core.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import io.tower.api.Step;
import io.tower.api.StepResult;
import io.tower.api.config.FeatureBuilder;
import io.tower.api.config.ProjectBuilder;
import io.tower.api.config.RunBy;
import io.tower.api.run.AdmissionClashException;
import io.tower.api.run.RunStatus;
import io.tower.api.run.SkippedException;
import io.tower.api.run.StepFailedException;
import io.tower.api.run.Verdict;
import io.tower.core.test.TestUtil;
import io.tower.function.CaseBody;
import io.tower.function.StepAction;

public class StepUnitTest {
   @Test
   public void testStepReturnsValue() {
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("parsing")
               .addCase("TC-1").title("parse").skip(false).body(ctx -> 0)
                  .step("parse", (String s) -> Integer.parseInt(s)).endStep()
               .endCase()
            .endFeature());
      Step<String, Integer> step = unit.step("parse");
      StepResult<Integer> result = step.runStep("42");
      assertThat(result.isFailed()).isFalse();
      assertThat(result.value()).isEqualTo(42);
      assertThat(step.status()).isEqualTo(RunStatus.FINISHED);
      assertThat(step.verdict()).isEqualTo(Verdict.PASSED);
      assertThat(step.index()).isEqualTo(1);
      assertThat(step.caseNum()).isEqualTo("TC-1");
   }

   @Test
   public void testSkippedStep() {
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("parsing")
               .addCase("TC-1").title("parse").skip(false).body(ctx -> 0)
                  .step("skipped", input -> "never").skip(true).endStep()
               .endCase()
            .endFeature());
      Step<Object, Object> step = unit.step("skipped");
      assertThrows(SkippedException.class, step::runStep);
      assertThat(step.status()).isEqualTo(RunStatus.SKIPPED);
      assertThat(step.verdict()).isEqualTo(Verdict.UNKNOWN);
   }

   @Test
   public void testFailingStepThrows() {
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("parsing")
               .addCase("TC-1").title("parse").skip(false).body(ctx -> 0)
                  .step("parse", (String s) -> Integer.parseInt(s)).endStep()
               .endCase()
            .endFeature());
      Step<String, Integer> step = unit.step("parse");
      StepFailedException e = assertThrows(StepFailedException.class, () -> step.runStep("forty-two"));
      assertThat(e.stepName()).isEqualTo("parse");
      assertThat(e.getCause()).isInstanceOf(NumberFormatException.class);
      assertThat(step.status()).isEqualTo(RunStatus.ERROR);
      assertThat(step.verdict()).isEqualTo(Verdict.FAILED);
      assertThat(step.error()).contains("forty-two");
      assertThat(unit.errorCount()).isZero();
   }

   @Test
   public void testFailContinueCountsError() {
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("parsing")
               .addCase("TC-1").title("parse").skip(false)
                  .body(ctx -> {
                     StepResult<Integer> first = ctx.<String, Integer>step("parse").runStep("x");
                     StepResult<Integer> second = ctx.<String, Integer>step("parse").runStep("7");
                     ctx.data("first", first);
                     ctx.data("second", second.value());
                     return 0;
                  })
                  .step("parse", (String s) -> Integer.parseInt(s)).failContinue(true).endStep()
               .endCase()
            .endFeature());
      assertThat(unit.run()).isEqualTo(Verdict.FAILED);
      assertThat(unit.status()).isEqualTo(RunStatus.FINISHED);
      assertThat(unit.errorCount()).isEqualTo(1);
      StepResult<Integer> first = unit.data("first");
      assertThat(first.isFailed()).isTrue();
      assertThat(first.orElse(-1)).isEqualTo(-1);
      assertThrows(StepFailedException.class, first::value);
      assertThat(unit.<Integer>data("second")).isEqualTo(7);
   }

   @Test
   public void testNestedLockedStepClashes() {
      AtomicReference<Step<?, ?>> inner = new AtomicReference<>();
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("nesting")
               .addCase("TC-1").title("nested").skip(false)
                  .body(ctx -> {
                     inner.set(ctx.step("inner"));
                     ctx.step("outer").runStep();
                     return 0;
                  })
                  .step("outer", input -> inner.get().runStep()).endStep()
                  .step("inner", input -> "inner").timeoutMillis(0).endStep()
               .endCase()
            .endFeature());
      assertThat(unit.run()).isEqualTo(Verdict.FAILED);
      assertThat(unit.status()).isEqualTo(RunStatus.ERROR);
      assertThat(unit.error()).contains("outer");
      assertThat(inner.get().status()).isEqualTo(RunStatus.TIMEOUT);
      assertThat(unit.step("outer").status()).isEqualTo(RunStatus.ERROR);
      assertThat(unit.loops()).hasSize(1);
      assertThat(unit.loops().get(0).stepErrors).hasSize(2);
      assertThat(unit.loops().get(0).stepErrors.get(0)).startsWith("outer: ").contains(AdmissionClashException.class.getSimpleName());
   }

   @Test
   public void testUnlockedStepRunsInsideLockedStep() {
      AtomicReference<Step<Object, Integer>> inner = new AtomicReference<>();
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("nesting")
               .addCase("TC-1").title("nested").skip(false)
                  .body(ctx -> ctx.<Object, Integer>step("outer").runStep().value())
                  .addStep("outer", input -> inner.get().runStep().value())
                  .step("inner", input -> 0).locked(false).timeoutMillis(0).endStep()
               .endCase()
            .endFeature());
      inner.set(unit.step("inner"));
      assertThat(unit.run()).isEqualTo(Verdict.PASSED);
      assertThat(unit.step("inner").status()).isEqualTo(RunStatus.FINISHED);
   }

   @Test
   public void testLockedStepsOfParallelCasesDoNotOverlap() throws Exception {
      AtomicInteger active = new AtomicInteger();
      AtomicInteger maxActive = new AtomicInteger();
      AtomicInteger calls = new AtomicInteger();
      StepAction<Object, Object> update = input -> {
         maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
         try {
            calls.incrementAndGet();
            Thread.sleep(2);
            return null;
         } finally {
            active.decrementAndGet();
         }
      };
      CaseBody body = ctx -> {
         for (int i = 0; i < 5; ++i) {
            ctx.step("update").runStep();
         }
         return 0;
      };
      ProjectBuilder builder = ProjectBuilder.builder("parallel").runBy(RunBy.SKIP);
      FeatureBuilder<ProjectBuilder> feature = builder.addFeature("writers");
      for (int i = 1; i <= 4; ++i) {
         feature.addCase("W-" + i).title("writer " + i).skip(false).locked(false).body(body)
               .step("update", update).timeoutMillis(-1).frequencyMillis(1).endStep();
      }
      ProjectRoot project = TestUtil.project(builder.build());

      ExecutorService executor = Executors.newFixedThreadPool(4);
      try {
         List<Future<Verdict>> futures = new ArrayList<>();
         for (CaseUnit c : project.features().get(0).cases()) {
            futures.add(executor.submit(c::run));
         }
         for (Future<Verdict> future : futures) {
            assertThat(future.get(30, TimeUnit.SECONDS)).isEqualTo(Verdict.PASSED);
         }
      } finally {
         executor.shutdownNow();
      }
      assertThat(calls.get()).isEqualTo(20);
      assertThat(maxActive.get()).isEqualTo(1);
      assertThat(project.domain().steps().running()).isEmpty();
   }

   @Test
   public void testUnknownStep() {
      CaseUnit unit = singleCase(ProjectBuilder.builder("steps").runBy(RunBy.SKIP)
            .addFeature("parsing")
               .addCase("TC-1").title("parse").skip(false).body(ctx -> 0).endCase()
            .endFeature());
      assertThrows(IllegalArgumentException.class, () -> unit.step("missing"));
   }

   private static CaseUnit singleCase(ProjectBuilder builder) {
      ProjectRoot project = TestUtil.project(builder.build());
      return project.features().get(0).cases().get(0);
   }
}
