package io.tower.api;

import java.util.List;

import org.apache.logging.log4j.Logger;

import io.tower.api.config.RunArguments;

/**
 * View of a running case available to its body.
 */
public interface CaseContext {
   String caseNum();

   String caseTitle();

   /**
    * @return Name of the owning feature group, or {@code null} for project-level cases.
    */
   String featureName();

   /**
    * @return Arguments of the current run; {@code null} when the project selects cases by their skip flag
    * and no arguments were set.
    */
   RunArguments arguments();

   /**
    * @return 0-based index of the current loop iteration.
    */
   int loopIndex();

   <I, O> Step<I, O> step(String name);

   List<? extends Step<?, ?>> steps();

   /**
    * Throws {@link io.tower.api.run.CancelSignal} or {@link io.tower.api.run.KillSignal} if the case
    * was asked to stop.
    */
   void checkpoint();

   int errorCount();

   <T> T data(String key);

   void data(String key, Object value);

   Logger detailLog();
}
