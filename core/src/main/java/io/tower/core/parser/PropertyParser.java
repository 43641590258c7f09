package io.tower.core.parser;

import java.util.function.BiConsumer;

import org.yaml.snakeyaml.events.ScalarEvent;

public class PropertyParser {
   private PropertyParser() {}

   public static class String<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.String> consumer;

      public String(BiConsumer<T, java.lang.String> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         ScalarEvent event = ctx.expectEvent(ScalarEvent.class);
         consumer.accept(target, event.getValue());
      }
   }

   /**
    * Accepts either a comma-separated scalar or a sequence of scalars and passes them on joined by commas.
    */
   public static class CommaList<T> implements Parser<T> {
      private final BiConsumer<T, java.lang.String> consumer;

      public CommaList(BiConsumer<T, java.lang.String> consumer) {
         this.consumer = consumer;
      }

      @Override
      public void parse(Context ctx, T target) throws ParserException {
         if (ctx.peek() instanceof ScalarEvent) {
            consumer.accept(target, ctx.expectEvent(ScalarEvent.class).getValue());
            return;
         }
         StringBuilder sb = new StringBuilder();
         ctx.parseList(sb, (c, builder) -> {
            if (builder.length() > 0) {
               builder.append(',');
            }
            builder.append(c.expectEvent(ScalarEvent.class).getValue());
         });
         consumer.accept(target, sb.toString());
      }
   }
}
