package io.b2mash.compliance.view;

import jakarta.validation.constraints.Size;

/** Optional body of a duplicate call; a null name yields {@code "<source name> (Copy)"}. */
public record DuplicateSavedViewRequest(@Size(min = 1, max = 100) String name) {}
