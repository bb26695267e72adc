package io.b2mash.compliance.view;

import java.util.List;

/** Views the caller owns and views other members shared with them. */
public record SavedViewListResponse(
    List<SavedViewResponse> owned, List<SavedViewResponse> shared, int total) {}
