package io.tower.api.config;

import java.util.Collection;
import java.util.Collections;

import io.tower.api.CaseContext;
import io.tower.function.CaseBody;

/**
 * Convenience base for cases written as classes; register them with {@link FeatureBuilder#addCase(BaseCase)}.
 */
public abstract class BaseCase implements CaseBody {
   public abstract String caseNum();

   public abstract String caseTitle();

   /**
    * @return Labels matched against the run tags. When empty the feature name and case number are used.
    */
   public Collection<String> labels() {
      return Collections.emptyList();
   }

   /**
    * Hook to tune admission options and declare steps.
    */
   protected void configure(CaseBuilder<?> builder) {
   }

   @Override
   public abstract int run(CaseContext ctx) throws Exception;
}
