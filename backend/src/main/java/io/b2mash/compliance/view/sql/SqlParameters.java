package io.b2mash.compliance.view.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Collects named bind parameters ({@code p0}, {@code p1}, ...) for one generated clause. */
public class SqlParameters {

  private final Map<String, Object> values = new LinkedHashMap<>();

  /** Registers {@code value} and returns its placeholder, e.g. {@code :p0}. */
  public String bind(Object value) {
    String name = "p" + values.size();
    values.put(name, value);
    return ":" + name;
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }
}
