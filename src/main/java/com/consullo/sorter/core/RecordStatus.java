package com.consullo.sorter.core;

/**
 * Classification status of a single record.
 *
 * @since 1.0
 */
public enum RecordStatus {

  /** Not yet classified. Only records in this state are offered for classification. */
  UNCLASSIFIED,

  /** The user wants to keep the photo. */
  KEEP,

  /** Marked for trash. The store only records the status, nothing is deleted. */
  TRASH,

  /** Undecided, kept aside for a later comparison pass. */
  MAYBE
}
