package io.tower.core.parser;

import org.yaml.snakeyaml.events.ScalarEvent;

import io.tower.api.config.RunArguments;

/**
 * Parses the nested mapping of feature name to case number to loop count:
 * <pre>
 * caseLoops:
 *   login:
 *     TC-1: 3
 * </pre>
 */
class CaseLoopsParser implements Parser<RunArguments.Builder> {
   @Override
   public void parse(Context ctx, RunArguments.Builder target) throws ParserException {
      ctx.parseMapping(target, featureEvent -> (c1, b1) -> c1.parseMapping(b1,
            caseEvent -> (c2, b2) -> parseLoop(c2, b2, featureEvent.getValue(), caseEvent.getValue())));
   }

   private void parseLoop(Context ctx, RunArguments.Builder target, String feature, String caseNum) throws ParserException {
      ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
      int loop;
      try {
         loop = Integer.parseInt(event.getValue());
      } catch (NumberFormatException e) {
         throw new ParserException(event, "Loop count of case " + caseNum + " in feature " + feature + " is not an integer: " + event.getValue());
      }
      if (loop < 1) {
         throw new ParserException(event, "Loop count of case " + caseNum + " in feature " + feature + " must be at least 1, was " + loop);
      }
      target.caseLoop(feature, caseNum, loop);
   }
}
