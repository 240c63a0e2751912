package io.sharedkey.platform.application.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class RequestSignerTest {

  private static final Instant T0 = Instant.parse("2024-10-01T12:00:00Z");
  private static final byte[] SECRET = "K".getBytes(StandardCharsets.UTF_8);

  private final RequestSigner signer = new RequestSigner(SharedKeyScheme.defaults(), Clock.fixed(T0, ZoneOffset.UTC));

  @Test
  void sign_addsTimestampAndAuthorization() {
    var request = SignedRequest.of("GET", URI.create("/data?x=1"), RequestHeaders.empty());

    var signed = signer.sign(request, "alice", SECRET);

    assertThat(signed.headers().first("x-sk-date")).contains("Tue, 1 Oct 2024 12:00:00 GMT");
    assertThat(signed.headers().first("Authorization")).hasValueSatisfying(v -> assertThat(v).startsWith("SharedKey alice:"));
  }

  @Test
  void authorization_isHmacOfCanonicalString() {
    var request =
        new SignedRequest("GET", "/data", "", RequestHeaders.builder().add("x-sk-date", "Tue, 1 Oct 2024 12:00:00 GMT").build());
    String canonical = "GET\n\n\nTue, 1 Oct 2024 12:00:00 GMT\nx-sk-date:Tue, 1 Oct 2024 12:00:00 GMT\n/data";
    byte[] expected = HmacAlgorithm.HMAC_SHA256.mac(SECRET, canonical.getBytes(StandardCharsets.UTF_8));

    assertThat(signer.authorization(request, "alice", SECRET))
        .isEqualTo("SharedKey alice:" + Base64.getEncoder().encodeToString(expected));
  }

  @Test
  void sign_keepsExistingTimestamp() {
    var request =
        new SignedRequest("GET", "/", "", RequestHeaders.builder().add("x-sk-date", "Mon, 30 Sep 2024 08:00:00 GMT").build());

    assertThat(signer.sign(request, "alice", SECRET).headers().all("x-sk-date"))
        .containsExactly("Mon, 30 Sep 2024 08:00:00 GMT");
  }

  @Test
  void sign_isDeterministic() {
    var request = new SignedRequest("DELETE", "/orders/1", "", RequestHeaders.empty());

    assertThat(signer.sign(request, "alice", SECRET)).isEqualTo(signer.sign(request, "alice", SECRET));
  }

  @Test
  void bodyWithoutContentHeaders_cannotBeSigned() {
    var request = new SignedRequest("POST", "/", "", RequestHeaders.builder().add("Content-Length", "2").build());

    assertThatThrownBy(() -> signer.sign(request, "alice", SECRET))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Content-Type");
  }

  @Test
  void blankAccountOrEmptySecret_isRejected() {
    var request = new SignedRequest("GET", "/", "", RequestHeaders.empty());

    assertThatThrownBy(() -> signer.sign(request, " ", SECRET)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> signer.sign(request, "alice", new byte[0])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void timestamps_roundTripThroughRfc1123() {
    assertThat(RequestTimestamps.parse(RequestTimestamps.format(T0))).contains(T0);
    assertThat(RequestTimestamps.parse("not a date")).isEmpty();
    assertThat(RequestTimestamps.parse("  ")).isEmpty();
  }
}
