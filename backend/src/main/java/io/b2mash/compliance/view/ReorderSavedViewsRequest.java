package io.b2mash.compliance.view;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

public record ReorderSavedViewsRequest(@NotEmpty List<@Valid Item> items) {

  public record Item(@NotNull UUID id, int displayOrder) {}
}
