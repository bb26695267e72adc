package io.b2mash.compliance.view;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

/** Presentation state of one list column in a saved view. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnConfig(@NotBlank String key, boolean visible, int order, Integer width) {}
