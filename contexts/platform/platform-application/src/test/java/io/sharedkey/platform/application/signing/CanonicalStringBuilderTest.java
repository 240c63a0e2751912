package io.sharedkey.platform.application.signing;

import static org.assertj.core.api.Assertions.assertThat;

import io.sharedkey.platform.domain.auth.ValidationError.Kind;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import org.junit.jupiter.api.Test;

class CanonicalStringBuilderTest {

  private static final String TS = "Tue, 1 Oct 2024 12:00:00 GMT";

  private final CanonicalStringBuilder builder = new CanonicalStringBuilder(SharedKeyScheme.defaults());

  @Test
  void build_layoutForRequestWithBody() {
    var headers =
        RequestHeaders.builder()
            .add("Content-Type", "application/json")
            .add("Content-Length", "10")
            .add("Content-Digest", "sha-256=:abc=:")
            .add("x-sk-date", TS)
            .add("X-SK-Tenant", "  acme   corp ")
            .add("x-sk-trace", "t1")
            .add("Accept", "application/json")
            .build();
    var request = new SignedRequest("post", "/orders", "b=2&a=1&a=0", headers);

    var canonical = builder.build(request, TS);

    assertThat(canonical.value().text())
        .isEqualTo(
            "POST\n"
                + "sha-256=:abc=:\n"
                + "application/json\n"
                + TS + "\n"
                + "x-sk-date:" + TS + "\n"
                + "x-sk-tenant:acme corp\n"
                + "x-sk-trace:t1\n"
                + "/orders\n"
                + "a:0,1\n"
                + "b:2");
  }

  @Test
  void build_emptyFieldsForBodylessRequest() {
    var request = new SignedRequest("GET", "/data", "", RequestHeaders.builder().add("Date", TS).build());

    assertThat(builder.build(request, TS).value().text()).isEqualTo("GET\n\n\n" + TS + "\n/data");
  }

  @Test
  void build_ignoresHeaderOrderAndNameCase() {
    var a =
        RequestHeaders.builder().add("x-sk-b", "2").add("X-Sk-A", "1").add("Date", TS).build();
    var b =
        RequestHeaders.builder().add("Date", TS).add("x-sk-a", "1").add("X-SK-B", "2").build();

    assertThat(builder.build(new SignedRequest("GET", "/", "", a), TS).value())
        .isEqualTo(builder.build(new SignedRequest("GET", "/", "", b), TS).value());
  }

  @Test
  void canonicalResource_keepsPercentEncodingAndSortsQuery() {
    var request = new SignedRequest("GET", "/a%2Fb", "z=%20&flag&y=1", RequestHeaders.empty());

    assertThat(builder.canonicalResource(request)).isEqualTo("/a%2Fb\nflag:\ny:1\nz:%2520");
  }

  @Test
  void canonicalResource_escapesQueryDelimiters() {
    var request = new SignedRequest("GET", "/", "k:1=a,b%2C", RequestHeaders.empty());

    assertThat(builder.canonicalResource(request)).isEqualTo("/\nk%3A1:a%2Cb%252C");
  }

  @Test
  void colonMovedAcrossEquals_changesCanonicalString() {
    assertThat(canonicalOf("a=b:c")).isNotEqualTo(canonicalOf("a:b=c"));
  }

  @Test
  void repeatedKeyAndCommaJoinedValue_changeCanonicalString() {
    assertThat(canonicalOf("ids=1&ids=2")).isNotEqualTo(canonicalOf("ids=1,2"));
    assertThat(canonicalOf("ids=1%2C2")).isNotEqualTo(canonicalOf("ids=1,2"));
  }

  @Test
  void queryParameter_cannotImitateExtensionHeader() {
    var asHeader = RequestHeaders.builder().add("Date", TS).add("x-sk-foo", "bar").build();
    var asQuery = RequestHeaders.builder().add("Date", TS).build();

    assertThat(builder.build(new SignedRequest("GET", "/data", "", asHeader), TS).value())
        .isNotEqualTo(builder.build(new SignedRequest("GET", "/data", "x-sk-foo=bar", asQuery), TS).value());
  }

  @Test
  void bodyWithoutContentType_isMissingRequiredField() {
    var headers = RequestHeaders.builder().add("Content-Length", "5").add("Content-Digest", "d").build();

    var step = builder.build(new SignedRequest("PUT", "/x", "", headers), TS);

    assertThat(step.error().kind()).isEqualTo(Kind.MISSING_REQUIRED_FIELD);
    assertThat(step.error().reason()).endsWith("Content-Type");
  }

  @Test
  void bodyWithoutDigest_isMissingRequiredField() {
    var headers =
        RequestHeaders.builder().add("Transfer-Encoding", "chunked").add("Content-Type", "text/plain").build();

    var step = builder.build(new SignedRequest("POST", "/x", "", headers), TS);

    assertThat(step.error().reason()).endsWith("Content-Digest");
  }

  @Test
  void contentHeaderRequirement_canBeRelaxed() {
    var relaxed =
        new CanonicalStringBuilder(SharedKeyScheme.builder().requireContentHeadersForBody(false).build());
    var headers = RequestHeaders.builder().add("Content-Length", "5").build();

    assertThat(relaxed.build(new SignedRequest("POST", "/x", "", headers), TS).isOk()).isTrue();
  }

  private CanonicalString canonicalOf(String rawQuery) {
    var headers = RequestHeaders.builder().add("Date", TS).build();
    return builder.build(new SignedRequest("GET", "/data", rawQuery, headers), TS).value();
  }
}
