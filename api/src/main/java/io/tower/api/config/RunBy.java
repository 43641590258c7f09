package io.tower.api.config;

/**
 * How the project decides which cases run.
 */
public enum RunBy {
   /**
    * Select cases by the tags in {@link RunArguments}.
    */
   ARGUMENTS,
   /**
    * Run every case that does not have its skip flag set.
    */
   SKIP
}
