package com.consullo.sorter.core;

/**
 * Read-only copy of one classifiable record as returned by the {@link RecordStore}.
 *
 * @param id opaque, stable record identifier
 * @param dateTakenMillis creation timestamp in epoch milliseconds (sort key)
 * @param bucketId album/bucket the record belongs to (grouping key)
 * @param status status at the time the copy was read
 * @since 1.0
 */
public record PhotoRecord(
    String id,
    long dateTakenMillis,
    String bucketId,
    RecordStatus status) {

  public PhotoRecord {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("id must not be empty.");
    }
    if (status == null) {
      throw new IllegalArgumentException("status must not be null.");
    }
  }

  /**
   * Returns a copy carrying a different status.
   *
   * @param newStatus status for the copy
   * @return copy of this record
   */
  public PhotoRecord withStatus(RecordStatus newStatus) {
    return new PhotoRecord(id, dateTakenMillis, bucketId, newStatus);
  }
}
