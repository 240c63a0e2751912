package io.sharedkey.platform.http.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable list of {@link RequestStage}s, assembled once at startup.
 *
 * <p>{@link #dispatch} runs the stages in order and ends in the caller-supplied terminal, which
 * differs per request (for the servlet adapter it is the remaining filter chain).
 */
public final class RequestPipeline {
  private final List<RequestStage> stages;

  private RequestPipeline(List<RequestStage> stages) {
    this.stages = stages;
  }

  /**
   * @param stages stages in execution order
   * @throws NullPointerException if the list or any stage is null
   */
  public static RequestPipeline of(List<? extends RequestStage> stages) {
    Objects.requireNonNull(stages, "stages");
    return new RequestPipeline(List.copyOf(stages));
  }

  public static RequestPipeline of(RequestStage... stages) {
    return of(List.of(stages));
  }

  public List<RequestStage> stages() {
    return stages;
  }

  /**
   * Runs {@code request} through every stage, then {@code terminal}.
   *
   * @throws NullPointerException if {@code request} or {@code terminal} is null
   */
  public StageResponse dispatch(InboundRequest request, RequestStage.Next terminal) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(terminal, "terminal");
    return proceed(0, request, terminal);
  }

  private StageResponse proceed(int index, InboundRequest request, RequestStage.Next terminal) {
    if (index == stages.size()) {
      return terminal.proceed(request);
    }
    return stages.get(index).handle(request, r -> proceed(index + 1, r, terminal));
  }
}
