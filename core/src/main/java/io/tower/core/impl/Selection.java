package io.tower.core.impl;

import java.util.List;

import io.tower.api.config.RunArguments;
import io.tower.api.config.RunBy;

/**
 * Decides which cases take part in a run.
 */
final class Selection {
   private Selection() {
   }

   static boolean shouldRun(CaseUnit c, RunBy runBy, RunArguments arguments) {
      if (c.flag().isFixture()) {
         return true;
      }
      switch (runBy) {
         case SKIP:
            return !c.isSkip();
         case ARGUMENTS:
            if (arguments == null || !featureSelected(c.feature(), arguments)) {
               return false;
            }
            return matchesTags(c.labels(), arguments.tags(), arguments.untags());
         default:
            throw new IllegalStateException("Unknown selection mode " + runBy);
      }
   }

   /**
    * A group takes part only when it and all its ancestors carry the requested feature name.
    */
   static boolean featureSelected(FeatureGroup group, RunArguments arguments) {
      if (arguments.feature() == null) {
         return true;
      }
      for (FeatureGroup g = group; g != null; g = g.parent()) {
         if (!arguments.feature().equals(g.name())) {
            return false;
         }
      }
      return true;
   }

   /**
    * Labels, tags and untags are expected in lower case. Untags win over tags.
    */
   static boolean matchesTags(Iterable<String> labels, List<String> tags, List<String> untags) {
      boolean tagged = false;
      for (String label : labels) {
         if (untags.contains(label)) {
            return false;
         }
         tagged = tagged || tags.contains(label);
      }
      return tagged;
   }
}
