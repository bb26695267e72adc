package io.b2mash.compliance.view.compile;

/** Validated sort: a sortable property, its column and the direction. */
public record SortSpec(String propertyId, String column, SortOrder order) {}
