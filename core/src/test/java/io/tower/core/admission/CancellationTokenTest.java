package io.tower.core.admission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import io.tower.api.run.CancelSignal;
import io.tower.api.run.KillSignal;

public class CancellationTokenTest {
   @Test
   public void testChildSeesParentSignal() {
      CancellationToken project = new CancellationToken("project");
      CancellationToken child = project.child("case");
      child.check();
      project.cancel();
      assertThat(child.pending()).isEqualTo(CancellationToken.Signal.CANCEL);
      assertThrows(CancelSignal.class, child::check);
      // clearing the child does not hide the parent's signal
      child.clear();
      assertThat(child.isSignalled()).isTrue();
      project.clear();
      assertThat(child.isSignalled()).isFalse();
   }

   @Test
   public void testKillWinsOverCancel() {
      CancellationToken project = new CancellationToken("project");
      CancellationToken child = project.child("case");
      child.kill();
      project.cancel();
      assertThat(child.pending()).isEqualTo(CancellationToken.Signal.KILL);
      assertThrows(KillSignal.class, child::check);
      child.cancel();
      assertThat(child.pending()).isEqualTo(CancellationToken.Signal.KILL);
      assertThat(project.pending()).isEqualTo(CancellationToken.Signal.CANCEL);
   }

   @Test
   public void testAwaitTimesOut() throws InterruptedException {
      CancellationToken token = new CancellationToken("token");
      long start = System.nanoTime();
      token.await(50);
      assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(50);
   }

   @Test
   public void testParentSignalWakesChildWaiter() throws InterruptedException {
      CancellationToken project = new CancellationToken("project");
      CancellationToken child = project.child("case");
      CountDownLatch woken = new CountDownLatch(1);
      Thread waiter = new Thread(() -> {
         try {
            child.await(60_000);
            woken.countDown();
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
         }
      });
      waiter.start();
      Thread.sleep(50);
      project.kill();
      assertThat(woken.await(10, TimeUnit.SECONDS)).isTrue();
      waiter.join(10_000);
   }
}
