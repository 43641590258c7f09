package io.tower.core.admission;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.tower.api.run.AdmissionClashException;
import io.tower.api.run.AdmissionTimeoutException;
import io.tower.api.run.KillSignal;

/**
 * Decides whether a unit may start while other units of the same kind are running.
 * <p>
 * Unlocked units are always admitted. A locked unit is admitted only when no other locked unit is running;
 * the grant also holds the controller's exclusive lock until the returned {@link Ticket} is closed.
 * Waiters are not queued, so there is no fairness among them.
 */
public class AdmissionController<U extends Admissible> {
   private static final Logger log = LogManager.getLogger(AdmissionController.class);
   private static final boolean trace = log.isTraceEnabled();

   private final String name;
   private final Set<U> running = ConcurrentHashMap.newKeySet();
   private final ReentrantLock exclusive = new ReentrantLock();

   public AdmissionController(String name) {
      this.name = name;
   }

   public String name() {
      return name;
   }

   /**
    * Waits until the unit is admitted.
    *
    * @param unit Unit asking for admission.
    * @param timeout Milliseconds; {@code -1} waits forever, {@code 0} checks only once.
    * @param frequency Milliseconds between two attempts.
    * @param token Checked before the first attempt and after every pause.
    * @return Ticket that must be closed when the unit stops running.
    * @throws AdmissionClashException if the single check failed.
    * @throws AdmissionTimeoutException if the unit was not admitted within the timeout.
    * @throws io.tower.api.run.CancelSignal if the token was canceled while waiting.
    * @throws KillSignal if the token was killed or the thread interrupted while waiting.
    */
   public Ticket await(U unit, long timeout, long frequency, CancellationToken token) {
      if (frequency <= 0) {
         throw new IllegalArgumentException("Frequency must be positive: " + frequency);
      }
      token.check();
      long start = System.currentTimeMillis();
      for (;;) {
         long waited = System.currentTimeMillis() - start;
         Ticket ticket = tryAdmit(unit, waited);
         if (ticket != null) {
            return ticket;
         }
         if (timeout == 0) {
            throw new AdmissionClashException(unit.describe() + " clashes with locked units running in " + name);
         } else if (timeout > 0 && waited >= timeout) {
            throw new AdmissionTimeoutException(unit.describe() + " was not admitted in " + name + " within " + timeout + " ms", waited);
         }
         unit.onAdmissionDenied(waited);
         long pause = timeout < 0 ? frequency : Math.min(frequency, timeout - waited);
         try {
            token.await(pause);
         } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KillSignal(unit.describe() + " was interrupted while waiting for admission");
         }
         token.check();
      }
   }

   /**
    * Single admission attempt.
    *
    * @return Ticket on grant, {@code null} when denied.
    */
   public Ticket tryAdmit(U unit) {
      return tryAdmit(unit, 0);
   }

   private Ticket tryAdmit(U unit, long waited) {
      boolean locked = unit.isLocked();
      if (locked) {
         for (U peer : running) {
            if (peer != unit && peer.isLocked()) {
               if (trace) {
                  log.trace("{}: {} denied, {} is running", name, unit.describe(), peer.describe());
               }
               return null;
            }
         }
         if (!exclusive.tryLock()) {
            return null;
         }
      }
      running.add(unit);
      if (trace) {
         log.trace("{}: {} admitted after {} ms", name, unit.describe(), waited);
      }
      return new Ticket(unit, locked, waited);
   }

   public Set<U> running() {
      return Collections.unmodifiableSet(running);
   }

   public boolean isRunning(U unit) {
      return running.contains(unit);
   }

   /**
    * Permission to run; releases the registry entry and the exclusive lock on close.
    * Must be closed by the thread that obtained it.
    */
   public final class Ticket implements AutoCloseable {
      private final U unit;
      private final boolean locked;
      private final long waitedMillis;
      private boolean closed;

      private Ticket(U unit, boolean locked, long waitedMillis) {
         this.unit = unit;
         this.locked = locked;
         this.waitedMillis = waitedMillis;
      }

      public U unit() {
         return unit;
      }

      public long waitedMillis() {
         return waitedMillis;
      }

      @Override
      public void close() {
         if (closed) {
            return;
         }
         closed = true;
         running.remove(unit);
         if (locked) {
            exclusive.unlock();
         }
      }
   }
}
