package com.consullo.sorter.core;

import java.util.List;

/**
 * Session-scoped filter held by {@link SorterSettings}.
 *
 * <p>A precise filter is set by flows such as "sort this day of the timeline" or "start from this
 * photo onward" and takes priority over the global filter mode. A non-precise filter is the one the
 * user picks for {@link FilterMode#CUSTOM}; its end date is a day start and gets widened to the end
 * of that day.
 *
 * @param bucketIds buckets to include (null or empty for all)
 * @param startMillis inclusive start timestamp, or null
 * @param endMillis inclusive end timestamp, or null
 * @param recordIds explicit allow-list of record ids (null or empty for none)
 * @param precise whether the date range is used exactly as given
 * @since 1.0
 */
public record SessionFilter(
    List<String> bucketIds,
    Long startMillis,
    Long endMillis,
    List<String> recordIds,
    boolean precise) {

  public SessionFilter {
    bucketIds = bucketIds == null ? List.of() : List.copyOf(bucketIds);
    recordIds = recordIds == null ? List.of() : List.copyOf(recordIds);
  }

  public static SessionFilter preciseRange(List<String> bucketIds, Long startMillis, Long endMillis) {
    return new SessionFilter(bucketIds, startMillis, endMillis, null, true);
  }

  public static SessionFilter preciseIds(List<String> recordIds) {
    return new SessionFilter(null, null, null, recordIds, true);
  }

  public static SessionFilter custom(List<String> bucketIds, Long startMillis, Long endMillis) {
    return new SessionFilter(bucketIds, startMillis, endMillis, null, false);
  }

  public boolean hasRecordIds() {
    return !recordIds.isEmpty();
  }
}
