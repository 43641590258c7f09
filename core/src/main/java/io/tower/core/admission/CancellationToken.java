package io.tower.core.admission;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import io.tower.api.run.CancelSignal;
import io.tower.api.run.KillSignal;

/**
 * Cooperative stop request shared by the waiting and running code of a unit.
 * <p>
 * A token observes the signals of its parent as well as its own; {@link #clear()} resets only its own.
 * Waiters in {@link #await(long)} are woken as soon as a signal is raised on the token or any of its ancestors.
 */
public class CancellationToken {
   public enum Signal {
      NONE,
      CANCEL,
      KILL
   }

   private final String name;
   private final CancellationToken parent;
   private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
   private final Lock lock = new ReentrantLock();
   private final Condition condition = lock.newCondition();
   private volatile Signal signal = Signal.NONE;

   public CancellationToken(String name) {
      this(name, null);
   }

   private CancellationToken(String name, CancellationToken parent) {
      this.name = name;
      this.parent = parent;
   }

   public CancellationToken child(String name) {
      CancellationToken child = new CancellationToken(name, this);
      children.add(child);
      return child;
   }

   public String name() {
      return name;
   }

   public Signal pending() {
      Signal own = signal;
      if (parent == null) {
         return own;
      }
      Signal inherited = parent.pending();
      return inherited.compareTo(own) > 0 ? inherited : own;
   }

   public boolean isSignalled() {
      return pending() != Signal.NONE;
   }

   public void cancel() {
      raise(Signal.CANCEL);
   }

   public void kill() {
      raise(Signal.KILL);
   }

   public void clear() {
      lock.lock();
      try {
         signal = Signal.NONE;
      } finally {
         lock.unlock();
      }
   }

   /**
    * @throws KillSignal if a kill is pending.
    * @throws CancelSignal if a cancel is pending.
    */
   public void check() {
      switch (pending()) {
         case KILL:
            throw new KillSignal(name + " was killed");
         case CANCEL:
            throw new CancelSignal(name + " was canceled");
         default:
      }
   }

   /**
    * Sleeps until the timeout elapses or a signal is raised, whichever comes first. Does not throw the signal.
    */
   public void await(long millis) throws InterruptedException {
      long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
      lock.lock();
      try {
         long remaining;
         while (pending() == Signal.NONE && (remaining = deadline - System.nanoTime()) > 0) {
            condition.awaitNanos(remaining);
         }
      } finally {
         lock.unlock();
      }
   }

   private void raise(Signal s) {
      lock.lock();
      try {
         if (s.compareTo(signal) > 0) {
            signal = s;
         }
      } finally {
         lock.unlock();
      }
      wake();
   }

   private void wake() {
      lock.lock();
      try {
         condition.signalAll();
      } finally {
         lock.unlock();
      }
      for (CancellationToken child : children) {
         child.wake();
      }
   }

   @Override
   public String toString() {
      return "CancellationToken{" + name + ", " + pending() + "}";
   }
}
