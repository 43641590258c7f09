package io.tower.function;

@FunctionalInterface
public interface StepAction<I, O> {
   O apply(I input) throws Exception;
}
