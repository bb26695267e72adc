package io.b2mash.compliance.view.session;

import io.b2mash.compliance.view.ViewVisibility;
import java.util.UUID;

/** Optional attributes of a view saved from a session. */
public record SaveViewOptions(
    String description,
    String color,
    boolean isDefault,
    boolean isPinned,
    ViewVisibility visibility,
    UUID sharedWithTeamId) {

  public static SaveViewOptions personal() {
    return new SaveViewOptions(null, null, false, false, ViewVisibility.PRIVATE, null);
  }

  public SaveViewOptions asDefault() {
    return new SaveViewOptions(description, color, true, isPinned, visibility, sharedWithTeamId);
  }
}
