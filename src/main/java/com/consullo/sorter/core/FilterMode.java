package com.consullo.sorter.core;

/**
 * Global filter mode chosen in the settings screen.
 *
 * @since 1.0
 */
public enum FilterMode {
  ALL,
  CAMERA_ONLY,
  EXCLUDE_CAMERA,
  CUSTOM
}
