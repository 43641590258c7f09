package io.tower.function;

import io.tower.api.CaseContext;

/**
 * Body of a case. Drives the steps of the case through {@link CaseContext#step(String)}.
 */
@FunctionalInterface
public interface CaseBody {
   /**
    * @param ctx The case being executed.
    * @return Number of errors detected by the body, {@code 0} on success. Negative values are a contract violation.
    * @throws Exception Any exception marks the case as failed with an error.
    */
   int run(CaseContext ctx) throws Exception;
}
