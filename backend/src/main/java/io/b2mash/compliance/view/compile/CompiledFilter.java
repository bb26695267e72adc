package io.b2mash.compliance.view.compile;

import java.util.List;

/**
 * Result of {@link FilterCompiler#compile}: the predicate and sort to execute, plus the property
 * ids of conditions that were dropped or pruned.
 *
 * @param sort null when no (valid) sort was requested; the data-access layer applies its default
 */
public record CompiledFilter(
    FilterPredicate predicate, SortSpec sort, List<String> invalidFilters) {

  public CompiledFilter {
    invalidFilters = invalidFilters != null ? List.copyOf(invalidFilters) : List.of();
  }

  public boolean matchesEverything() {
    return predicate instanceof FilterPredicate.MatchAll;
  }
}
