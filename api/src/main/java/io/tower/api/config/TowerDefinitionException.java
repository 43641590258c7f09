package io.tower.api.config;

/**
 * Problem in the definition of the tree or of the run arguments, detected before anything runs.
 */
public class TowerDefinitionException extends RuntimeException {
   public TowerDefinitionException(String msg) {
      super(msg);
   }

   public TowerDefinitionException(String msg, Throwable cause) {
      super(msg, cause);
   }
}
