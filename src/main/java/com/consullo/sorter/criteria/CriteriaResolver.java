package com.consullo.sorter.criteria;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.FilterMode;
import com.consullo.sorter.core.InPageFilter;
import com.consullo.sorter.core.SessionFilter;
import java.util.List;

/**
 * Merges the independent filter sources into one canonical {@link Criteria}.
 *
 * <p>
 * Exactly one source is active, chosen by priority:
 * <ol>
 * <li>a precise session filter carrying an explicit id allow-list;</li>
 * <li>the in-page filter (album or day range picked on the current screen);</li>
 * <li>a precise session filter carrying album/date constraints;</li>
 * <li>the global filter mode.</li>
 * </ol>
 * Lower-priority sources are ignored, never merged. Only precise sources keep their end date as
 * given; every other source has it widened to the end of that day.
 * </p>
 */
public final class CriteriaResolver {

  private CriteriaResolver() {
  }

  /**
   * Resolve the active criteria.
   *
   * @param inPageFilter in-page filter, may be null
   * @param sessionFilter session-scoped filter, may be null
   * @param filterMode global filter mode, null is treated as {@link FilterMode#ALL}
   * @param cameraBucketIds camera bucket ids, may be null
   * @return resolved criteria
   */
  public static Criteria resolve(
          InPageFilter inPageFilter,
          SessionFilter sessionFilter,
          FilterMode filterMode,
          List<String> cameraBucketIds
  ) {
    boolean precise = sessionFilter != null && sessionFilter.precise();

    if (precise && sessionFilter.hasRecordIds()) {
      return Criteria.builder()
              .allowList(sessionFilter.recordIds())
              .precise(true)
              .build();
    }

    if (inPageFilter != null && !inPageFilter.isEmpty()) {
      return Criteria.builder()
              .includeBuckets(inPageFilter.bucketIds())
              .startMillis(inPageFilter.startMillis())
              .endMillis(inPageFilter.endMillis())
              .precise(false)
              .build();
    }

    if (precise) {
      return Criteria.builder()
              .includeBuckets(sessionFilter.bucketIds())
              .startMillis(sessionFilter.startMillis())
              .endMillis(sessionFilter.endMillis())
              .precise(true)
              .build();
    }

    return resolveGlobal(filterMode == null ? FilterMode.ALL : filterMode, sessionFilter, cameraBucketIds);
  }

  private static Criteria resolveGlobal(FilterMode mode, SessionFilter sessionFilter, List<String> cameraBucketIds) {
    boolean hasCamera = cameraBucketIds != null && !cameraBucketIds.isEmpty();

    switch (mode) {
      case CAMERA_ONLY:
        // No known camera album means there is nothing to sort in this mode.
        if (!hasCamera) {
          return Criteria.nothing();
        }
        return Criteria.builder().includeBuckets(cameraBucketIds).build();

      case EXCLUDE_CAMERA:
        if (!hasCamera) {
          return Criteria.all();
        }
        return Criteria.builder().excludeBuckets(cameraBucketIds).build();

      case CUSTOM:
        if (sessionFilter == null) {
          return Criteria.all();
        }
        if (sessionFilter.hasRecordIds()) {
          return Criteria.builder().allowList(sessionFilter.recordIds()).build();
        }
        return Criteria.builder()
                .includeBuckets(sessionFilter.bucketIds())
                .startMillis(sessionFilter.startMillis())
                .endMillis(sessionFilter.endMillis())
                .precise(false)
                .build();

      default:
        return Criteria.all();
    }
  }
}
