package io.sharedkey.platform.domain.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestHeadersTest {

  @Test
  void lookup_ignoresCase() {
    var headers = RequestHeaders.builder().add("X-SK-Date", "Tue, 01 Oct 2024 12:00:00 GMT").build();

    assertThat(headers.first("x-sk-date")).contains("Tue, 01 Oct 2024 12:00:00 GMT");
    assertThat(headers.contains("X-SK-DATE")).isTrue();
    assertThat(headers.names()).containsExactly("x-sk-date");
    assertThat(headers.spelling("x-sk-date")).isEqualTo("X-SK-Date");
  }

  @Test
  void repeatedHeader_keepsArrivalOrder() {
    var headers = RequestHeaders.builder().add("Accept", "b").add("accept", "a").build();

    assertThat(headers.all("ACCEPT")).containsExactly("b", "a");
    assertThat(headers.count("accept")).isEqualTo(2);
    assertThat(headers.size()).isEqualTo(1);
  }

  @Test
  void with_replacesAllValuesOfName() {
    var headers = RequestHeaders.builder().add("A", "1").add("a", "2").add("B", "x").build();

    var replaced = headers.with("a", "3");

    assertThat(replaced.all("a")).containsExactly("3");
    assertThat(replaced.all("b")).containsExactly("x");
    assertThat(headers.all("a")).containsExactly("1", "2");
  }

  @Test
  void of_copiesMapAndSkipsNullValueLists() {
    Map<String, List<String>> source = new java.util.HashMap<>();
    source.put("Content-Type", List.of("application/json"));
    source.put("X-Empty", null);

    var headers = RequestHeaders.of(source);

    assertThat(headers.first("content-type")).contains("application/json");
    assertThat(headers.contains("x-empty")).isFalse();
  }

  @Test
  void toString_neverShowsValues() {
    var headers = RequestHeaders.builder().add("Authorization", "SharedKey alice:c2VjcmV0").build();

    assertThat(headers.toString()).contains("Authorization").doesNotContain("alice");
  }

  @Test
  void blankName_isRejected() {
    assertThatThrownBy(() -> RequestHeaders.builder().add("  ", "v"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void signedRequest_normalizesMethodPathAndQuery() {
    var request = new SignedRequest("get", "", null, RequestHeaders.empty());

    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.rawPath()).isEqualTo("/");
    assertThat(request.rawQuery()).isEmpty();
    assertThat(request.target()).isEqualTo("/");
  }

  @Test
  void signedRequest_fromUriKeepsEncoding() {
    var request = SignedRequest.of("GET", URI.create("https://api.example.com/a%2Fb?q=x%20y"), RequestHeaders.empty());

    assertThat(request.rawPath()).isEqualTo("/a%2Fb");
    assertThat(request.rawQuery()).isEqualTo("q=x%20y");
    assertThat(request.target()).isEqualTo("/a%2Fb?q=x%20y");
  }

  @Test
  void declaresBody_fromLengthOrTransferEncoding() {
    var none = new SignedRequest("POST", "/", "", RequestHeaders.builder().add("Content-Length", "0").build());
    var sized = new SignedRequest("POST", "/", "", RequestHeaders.builder().add("Content-Length", "12").build());
    var chunked = new SignedRequest("POST", "/", "", RequestHeaders.builder().add("Transfer-Encoding", "chunked").build());
    var garbage = new SignedRequest("POST", "/", "", RequestHeaders.builder().add("Content-Length", "abc").build());

    assertThat(none.declaresBody()).isFalse();
    assertThat(sized.declaresBody()).isTrue();
    assertThat(chunked.declaresBody()).isTrue();
    assertThat(garbage.declaresBody()).isTrue();
  }
}
