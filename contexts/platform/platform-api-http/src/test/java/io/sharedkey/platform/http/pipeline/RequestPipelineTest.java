package io.sharedkey.platform.http.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sharedkey.platform.domain.auth.Identity;
import io.sharedkey.platform.domain.error.ProblemTypes;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import io.sharedkey.problem.core.ProblemFactory;
import io.sharedkey.problem.core.RequestContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestPipelineTest {

  private static final InboundRequest REQUEST =
      InboundRequest.of(new SignedRequest("GET", "/x", "", RequestHeaders.empty()));

  @Test
  void stages_runInOrderThenTerminal() {
    List<String> trace = new ArrayList<>();
    var pipeline =
        RequestPipeline.of(
            (r, next) -> {
              trace.add("first");
              return next.proceed(r);
            },
            (r, next) -> {
              trace.add("second");
              return next.proceed(r);
            });

    var response =
        pipeline.dispatch(
            REQUEST,
            r -> {
              trace.add("terminal");
              return StageResponse.forwarded(r);
            });

    assertThat(trace).containsExactly("first", "second", "terminal");
    assertThat(response.isForwarded()).isTrue();
  }

  @Test
  void stage_canShortCircuit() {
    var problem =
        new ProblemFactory().build(new RequestContext("GET", "/x", null), ProblemTypes.custom("blocked", "Blocked", 429), "Slow down");
    List<String> trace = new ArrayList<>();
    var pipeline =
        RequestPipeline.of(
            (r, next) -> StageResponse.rejected(problem, "Too Many Requests", Map.of("Retry-After", "1")),
            (r, next) -> {
              trace.add("never");
              return next.proceed(r);
            });

    var response = pipeline.dispatch(REQUEST, StageResponse::forwarded);

    assertThat(trace).isEmpty();
    assertThat(response.status()).isEqualTo(429);
    assertThat(response.headers()).containsEntry("Retry-After", "1");
  }

  @Test
  void identity_flowsDownstreamByParameter() {
    var pipeline =
        RequestPipeline.of(
            (r, next) -> next.proceed(r.withIdentity(Identity.authenticated("alice", "SharedKey"))),
            (r, next) -> {
              assertThat(r.identity()).isPresent();
              return next.proceed(r);
            });

    var response = pipeline.dispatch(REQUEST, StageResponse::forwarded);

    assertThat(response.forwardedRequest().flatMap(InboundRequest::identity).map(Identity::account)).contains("alice");
    assertThat(REQUEST.identity()).isEmpty();
  }

  @Test
  void emptyPipeline_goesStraightToTerminal() {
    assertThat(RequestPipeline.of(List.of()).dispatch(REQUEST, StageResponse::forwarded).isForwarded()).isTrue();
  }

  @Test
  void stages_areImmutable() {
    List<RequestStage> stages = new ArrayList<>();
    stages.add((r, next) -> next.proceed(r));
    var pipeline = RequestPipeline.of(stages);
    stages.clear();

    assertThat(pipeline.stages()).hasSize(1);
    assertThatThrownBy(() -> pipeline.stages().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void nullArguments_areRejected() {
    var pipeline = RequestPipeline.of();

    assertThatThrownBy(() -> pipeline.dispatch(null, StageResponse::forwarded)).isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> pipeline.dispatch(REQUEST, null)).isInstanceOf(NullPointerException.class);
  }
}
