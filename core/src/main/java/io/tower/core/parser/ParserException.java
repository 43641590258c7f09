package io.tower.core.parser;

import org.yaml.snakeyaml.events.Event;

public class ParserException extends Exception {
   public ParserException(String msg) {
      this(msg, null);
   }

   public ParserException(String msg, Throwable cause) {
      super(msg, cause);
   }

   public ParserException(Event event, String msg) {
      this(event, msg, null);
   }

   public ParserException(Event event, String msg, Throwable cause) {
      super(location(event) + ": " + msg, cause);
   }

   static String location(Event event) {
      return "line " + (event.getStartMark().getLine() + 1) + ", column " + (event.getStartMark().getColumn() + 1);
   }
}
