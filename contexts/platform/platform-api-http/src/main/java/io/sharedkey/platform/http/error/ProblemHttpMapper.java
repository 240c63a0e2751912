package io.sharedkey.platform.http.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sharedkey.platform.http.pipeline.StageResponse;
import io.sharedkey.problem.core.ProblemPayload;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.ProblemDetailJacksonMixin;

/**
 * Maps the framework-agnostic {@link ProblemPayload} to Spring Web's {@link ProblemDetail} and
 * writes pipeline rejections to the servlet response as {@code application/problem+json}.
 *
 * <p>Extensions are flattened into the top-level JSON object, as RFC 7807 prescribes.
 *
 * <p>Thread-safety: immutable once constructed.
 */
public final class ProblemHttpMapper {

  private final ObjectMapper objectMapper;

  /**
   * @param objectMapper base mapper; a copy with the {@link ProblemDetail} mix-in is used so the
   *     caller's instance is left untouched
   */
  public ProblemHttpMapper(ObjectMapper objectMapper) {
    this.objectMapper =
        Objects.requireNonNull(objectMapper, "objectMapper")
            .copy()
            .addMixIn(ProblemDetail.class, ProblemDetailJacksonMixin.class);
  }

  /**
   * Converts a {@link ProblemPayload} into a Spring {@link ProblemDetail}.
   *
   * @param p the domain problem payload (must not be {@code null})
   * @return a new {@link ProblemDetail} mirroring the supplied payload
   */
  public ProblemDetail toProblemDetail(final ProblemPayload p) {
    Objects.requireNonNull(p, "problem payload");
    ProblemDetail pd =
        ProblemDetail.forStatusAndDetail(HttpStatusCode.valueOf(p.status()), p.detail());
    pd.setTitle(p.title());
    pd.setType(p.type());
    pd.setInstance(URI.create(p.instance()));
    p.extensions().forEach(pd::setProperty);
    return pd;
  }

  /** Serializes the payload as the JSON body of a problem response. */
  public byte[] toJson(ProblemPayload p) throws IOException {
    return objectMapper.writeValueAsBytes(toProblemDetail(p));
  }

  /**
   * Writes a non-forwarded {@link StageResponse}: status, headers, and the problem body if any.
   *
   * @throws IllegalArgumentException if {@code stageResponse} was forwarded
   */
  public void write(StageResponse stageResponse, HttpServletResponse response) throws IOException {
    if (stageResponse.isForwarded()) {
      throw new IllegalArgumentException("forwarded responses are not written by the mapper");
    }
    response.setStatus(stageResponse.status());
    stageResponse.headers().forEach(response::setHeader);
    Optional<ProblemPayload> problem = stageResponse.problem();
    if (problem.isEmpty()) {
      return;
    }
    byte[] body = toJson(problem.get());
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    response.setContentLength(body.length);
    response.getOutputStream().write(body);
  }
}
