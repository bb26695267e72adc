package io.b2mash.compliance.view.compile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SortOrder {
  ASC,
  DESC;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SortOrder fromId(String id) {
    return id == null ? null : valueOf(id.trim().toUpperCase(Locale.ROOT));
  }
}
