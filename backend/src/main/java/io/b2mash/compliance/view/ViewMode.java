package io.b2mash.compliance.view;

/** How a list page renders its rows. */
public enum ViewMode {
  TABLE,
  BOARD
}
