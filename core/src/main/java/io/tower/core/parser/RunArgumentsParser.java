package io.tower.core.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;

import io.tower.api.config.RunArguments;
import io.tower.impl.Util;

/**
 * Reads {@link RunArguments} from YAML:
 * <pre>
 * project: shop
 * tag: smoke, api
 * untag: slow
 * serverIpAddress: 10.0.0.1
 * feature: login
 * caseLoops:
 *   login:
 *     TC-1: 3
 * extra:
 *   browser: firefox
 * </pre>
 * Tags may also be written as a sequence. Missing required keys fail with
 * {@link io.tower.api.config.TowerDefinitionException}.
 */
public class RunArgumentsParser extends AbstractMappingParser<RunArguments.Builder> {
   private static final Logger log = LogManager.getLogger(RunArgumentsParser.class);
   private static final RunArgumentsParser INSTANCE = new RunArgumentsParser();

   public static RunArgumentsParser instance() {
      return INSTANCE;
   }

   private RunArgumentsParser() {
      register("project", new PropertyParser.String<>(RunArguments.Builder::project));
      register("tag", new PropertyParser.CommaList<>(RunArguments.Builder::tag));
      register("untag", new PropertyParser.CommaList<>(RunArguments.Builder::untag));
      register("serverIpAddress", new PropertyParser.String<>(RunArguments.Builder::serverIpAddress));
      register("feature", new PropertyParser.String<>(RunArguments.Builder::feature));
      register("caseLoops", new CaseLoopsParser());
      register("extra", (ctx, target) -> ctx.parseMapping(target,
            key -> new PropertyParser.String<>((builder, value) -> builder.extra(key.getValue(), value))));
   }

   public RunArguments parse(InputStream stream) throws ParserException, IOException {
      return parse(Util.toString(stream));
   }

   public RunArguments parse(String source) throws ParserException {
      Yaml yaml = new Yaml();
      Iterator<Event> events = yaml.parse(new StringReader(source)).iterator();
      Context ctx = new Context(events);

      ctx.expectEvent(StreamStartEvent.class);
      ctx.expectEvent(DocumentStartEvent.class);
      RunArguments.Builder builder = RunArguments.builder();
      if (ctx.peek() instanceof ScalarEvent) {
         // empty document
         ctx.next();
      } else {
         parse(ctx, builder);
      }
      ctx.expectEvent(DocumentEndEvent.class);
      ctx.expectEvent(StreamEndEvent.class);

      RunArguments arguments = builder.build();
      log.debug("Parsed {}", arguments);
      return arguments;
   }
}
