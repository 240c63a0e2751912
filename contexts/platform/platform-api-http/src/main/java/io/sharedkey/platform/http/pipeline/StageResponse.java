package io.sharedkey.platform.http.pipeline;

import io.sharedkey.problem.core.ProblemPayload;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Response produced by the pipeline: either a rejection (status, headers, problem body) or the
 * marker that the request reached the terminal, carrying the request as it arrived there.
 */
public final class StageResponse {
  private final int status;
  private final String reasonPhrase;
  private final Map<String, String> headers;
  private final ProblemPayload problem;
  private final InboundRequest forwarded;

  private StageResponse(
      int status,
      String reasonPhrase,
      Map<String, String> headers,
      ProblemPayload problem,
      InboundRequest forwarded) {
    this.status = status;
    this.reasonPhrase = reasonPhrase;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.problem = problem;
    this.forwarded = forwarded;
  }

  /** Request passed every stage; downstream processing continues with {@code request}. */
  public static StageResponse forwarded(InboundRequest request) {
    return new StageResponse(200, "OK", Map.of(), null, Objects.requireNonNull(request, "request"));
  }

  /**
   * Request passed every stage and was handled downstream, which answered with {@code status}.
   * The reason phrase is left empty; downstream owns the actual response.
   */
  public static StageResponse forwarded(InboundRequest request, int status) {
    return new StageResponse(status, "", Map.of(), null, Objects.requireNonNull(request, "request"));
  }

  /**
   * Request answered by a stage with a problem body.
   *
   * @param problem the problem payload; its status becomes the response status
   * @param reasonPhrase short diagnostic safe to show the caller
   * @param headers extra response headers (e.g. {@code WWW-Authenticate})
   */
  public static StageResponse rejected(ProblemPayload problem, String reasonPhrase, Map<String, String> headers) {
    Objects.requireNonNull(problem, "problem");
    return new StageResponse(problem.status(), reasonPhrase, Objects.requireNonNull(headers, "headers"), problem, null);
  }

  public int status() {
    return status;
  }

  public String reasonPhrase() {
    return reasonPhrase;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public Optional<ProblemPayload> problem() {
    return Optional.ofNullable(problem);
  }

  public Optional<InboundRequest> forwardedRequest() {
    return Optional.ofNullable(forwarded);
  }

  public boolean isForwarded() {
    return forwarded != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StageResponse r)) {
      return false;
    }
    return status == r.status
        && Objects.equals(reasonPhrase, r.reasonPhrase)
        && headers.equals(r.headers)
        && Objects.equals(problem, r.problem)
        && Objects.equals(forwarded, r.forwarded);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, reasonPhrase, headers, problem, forwarded);
  }

  @Override
  public String toString() {
    return "StageResponse[" + status + " " + reasonPhrase + (forwarded != null ? ", forwarded" : "") + "]";
  }
}
