package io.sharedkey.platform.domain.request;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, case-insensitive, multi-valued view of request headers.
 *
 * <p>Names are matched ignoring case; the spelling of the first occurrence is kept for display.
 * Values of a repeated header keep their arrival order. Iteration order is the order in which
 * names were first seen, which callers must not rely on for anything signed.
 */
public final class RequestHeaders {

  private static final RequestHeaders EMPTY = new RequestHeaders(Map.of(), Map.of());

  // lower-cased name -> values
  private final Map<String, List<String>> values;
  // lower-cased name -> name as first received
  private final Map<String, String> spellings;

  private RequestHeaders(Map<String, List<String>> values, Map<String, String> spellings) {
    this.values = values;
    this.spellings = spellings;
  }

  /** Returns an empty header set. */
  public static RequestHeaders empty() {
    return EMPTY;
  }

  /** Returns a builder for a new header set. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Copies a name-to-values map (for instance a servlet header snapshot).
   *
   * @param source headers to copy; {@code null} values are skipped
   * @return immutable headers
   */
  public static RequestHeaders of(Map<String, ? extends List<String>> source) {
    Objects.requireNonNull(source, "source");
    Builder b = builder();
    source.forEach(
        (name, vs) -> {
          if (vs != null) {
            vs.forEach(v -> b.add(name, v));
          }
        });
    return b.build();
  }

  /** Returns all values for {@code name} (case-insensitive), possibly empty. */
  public List<String> all(String name) {
    List<String> vs = values.get(key(name));
    return vs == null ? List.of() : vs;
  }

  /** Returns the first value for {@code name}, if any. */
  public Optional<String> first(String name) {
    List<String> vs = all(name);
    return vs.isEmpty() ? Optional.empty() : Optional.of(vs.get(0));
  }

  /** Returns whether at least one value is present for {@code name}. */
  public boolean contains(String name) {
    return !all(name).isEmpty();
  }

  /** Returns the number of values carried for {@code name}. */
  public int count(String name) {
    return all(name).size();
  }

  /** Returns the lower-cased names present. */
  public Set<String> names() {
    return Collections.unmodifiableSet(values.keySet());
  }

  /** Returns the name as first received for a lower-cased key. */
  public String spelling(String name) {
    return spellings.getOrDefault(key(name), name);
  }

  /** Returns the number of distinct header names. */
  public int size() {
    return values.size();
  }

  /** Returns a copy with {@code name} replaced by a single {@code value}. */
  public RequestHeaders with(String name, String value) {
    Builder b = builder();
    String k = key(name);
    values.forEach(
        (n, vs) -> {
          if (!n.equals(k)) {
            vs.forEach(v -> b.add(spellings.get(n), v));
          }
        });
    b.add(name, value);
    return b.build();
  }

  /** Returns a name-to-values copy using the received spellings. */
  public Map<String, List<String>> toMap() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    values.forEach((n, vs) -> out.put(spellings.get(n), vs));
    return Collections.unmodifiableMap(out);
  }

  private static String key(String name) {
    Objects.requireNonNull(name, "name");
    return name.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RequestHeaders other && values.equals(other.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    // names only: values may carry credentials
    return "RequestHeaders" + spellings.values();
  }

  /** Mutable builder; not thread-safe. */
  public static final class Builder {
    private final Map<String, List<String>> values = new LinkedHashMap<>();
    private final Map<String, String> spellings = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Appends a value for {@code name}.
     *
     * @throws NullPointerException if {@code name} or {@code value} is null
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public Builder add(String name, String value) {
      Objects.requireNonNull(value, "value");
      String trimmed = Objects.requireNonNull(name, "name").trim();
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException("header name must not be blank");
      }
      String k = trimmed.toLowerCase(Locale.ROOT);
      spellings.putIfAbsent(k, trimmed);
      values.computeIfAbsent(k, x -> new ArrayList<>(1)).add(value);
      return this;
    }

    public RequestHeaders build() {
      if (values.isEmpty()) {
        return EMPTY;
      }
      Map<String, List<String>> frozen = new LinkedHashMap<>();
      values.forEach((k, vs) -> frozen.put(k, List.copyOf(vs)));
      return new RequestHeaders(
          Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(new LinkedHashMap<>(spellings)));
    }
  }
}
