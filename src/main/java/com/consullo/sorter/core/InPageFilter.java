package com.consullo.sorter.core;

import java.util.List;

/**
 * Ad-hoc filter chosen on the current screen, for example "sort this album".
 *
 * @param bucketIds buckets to include (null or empty for all)
 * @param startMillis inclusive start of the chosen day range, or null
 * @param endMillis start of the last chosen day, or null; widened to the end of that day
 * @since 1.0
 */
public record InPageFilter(List<String> bucketIds, Long startMillis, Long endMillis) {

  public InPageFilter {
    bucketIds = bucketIds == null ? List.of() : List.copyOf(bucketIds);
  }

  public static InPageFilter bucket(String bucketId) {
    if (bucketId == null || bucketId.isEmpty()) {
      throw new IllegalArgumentException("bucketId must not be empty.");
    }
    return new InPageFilter(List.of(bucketId), null, null);
  }

  public boolean isEmpty() {
    return bucketIds.isEmpty() && startMillis == null && endMillis == null;
  }
}
