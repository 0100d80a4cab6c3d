package com.consullo.sorter.session;

import java.util.List;

/**
 * One page fetch prepared by a session.
 *
 * @param pageIndex index of the page being fetched
 * @param limit maximum number of records to fetch
 * @param offset store offset for windowed fetches (0 for snapshot slices)
 * @param ids id slice for snapshot fetches (empty for windowed fetches)
 * @param offsetClamped true if the compensated windowed offset went negative and was clamped
 * @since 1.0
 */
public record PageRequest(
    int pageIndex,
    int limit,
    int offset,
    List<String> ids,
    boolean offsetClamped) {

  public PageRequest {
    ids = ids == null ? List.of() : List.copyOf(ids);
  }
}
