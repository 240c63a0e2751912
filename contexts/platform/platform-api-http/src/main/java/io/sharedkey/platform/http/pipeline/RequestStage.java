package io.sharedkey.platform.http.pipeline;

/**
 * One step of the request pipeline. A stage either answers the request itself or calls {@code
 * next} with the (possibly enriched) request and returns what it gets back.
 */
@FunctionalInterface
public interface RequestStage {

  StageResponse handle(InboundRequest request, Next next);

  /** The remainder of the pipeline after the current stage. */
  @FunctionalInterface
  interface Next {
    StageResponse proceed(InboundRequest request);
  }
}
