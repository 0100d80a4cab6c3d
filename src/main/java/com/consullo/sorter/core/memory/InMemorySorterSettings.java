package com.consullo.sorter.core.memory;

import com.consullo.sorter.core.FilterMode;
import com.consullo.sorter.core.SessionFilter;
import com.consullo.sorter.core.SortOrder;
import com.consullo.sorter.core.SorterSettings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Volatile {@link SorterSettings} kept in memory.
 *
 * @since 1.0
 */
public final class InMemorySorterSettings implements SorterSettings {

  private volatile FilterMode filterMode = FilterMode.ALL;
  private volatile List<String> cameraBucketIds = Collections.emptyList();
  private volatile SortOrder sortOrder = SortOrder.dateDescending();
  private volatile SessionFilter sessionFilter;

  @Override
  public FilterMode filterMode() {
    return filterMode;
  }

  public void setFilterMode(final FilterMode filterMode) {
    Validate.notNull(filterMode, "filterMode must not be null");
    this.filterMode = filterMode;
  }

  @Override
  public List<String> cameraBucketIds() {
    return cameraBucketIds;
  }

  public void setCameraBucketIds(final List<String> bucketIds) {
    Validate.notNull(bucketIds, "bucketIds must not be null");
    this.cameraBucketIds = Collections.unmodifiableList(new ArrayList<>(bucketIds));
  }

  @Override
  public SortOrder sortOrder() {
    return sortOrder;
  }

  @Override
  public void setSortOrder(final SortOrder sortOrder) {
    Validate.notNull(sortOrder, "sortOrder must not be null");
    this.sortOrder = sortOrder;
  }

  @Override
  public Optional<SessionFilter> sessionFilter() {
    return Optional.ofNullable(sessionFilter);
  }

  @Override
  public void setSessionFilter(final SessionFilter filter) {
    Validate.notNull(filter, "filter must not be null");
    this.sessionFilter = filter;
  }

  @Override
  public void clearSessionFilter() {
    this.sessionFilter = null;
  }
}
