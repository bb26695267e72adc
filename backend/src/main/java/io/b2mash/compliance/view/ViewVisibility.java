package io.b2mash.compliance.view;

/**
 * Who besides the owner may see a saved view. Only consulted when the view is shared; a view that
 * is not shared is private whatever its visibility says.
 */
public enum ViewVisibility {
  PRIVATE,
  /** Members of the view's {@code sharedWithTeamId}. */
  TEAM,
  /** Every member of the organization. */
  EVERYONE
}
