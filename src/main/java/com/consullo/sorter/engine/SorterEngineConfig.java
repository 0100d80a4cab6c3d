package com.consullo.sorter.engine;

import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Sorter engine configuration values.
 *
 * @param pageSize records fetched per page
 * @param preloadThreshold visible record count below which the next page is requested
 * @param windowedThreshold unclassified counts above this value use windowed pagination
 * @param comboWindowMillis maximum gap between actions that still extends a combo
 * @param comboResetDelayMillis delay after a combo goes inactive before its count drops to zero
 * @param loadMoreDebounceMillis debounce applied to automatic page requests
 * @param undoDepth number of undoable actions kept
 * @param maxPageFetchRetries consecutive page-fetch failures tolerated before an error is shown
 * @since 1.0
 */
public record SorterEngineConfig(
    int pageSize,
    int preloadThreshold,
    int windowedThreshold,
    long comboWindowMillis,
    long comboResetDelayMillis,
    long loadMoreDebounceMillis,
    int undoDepth,
    int maxPageFetchRetries) {

  public static final String PREFIX = "sorter.";

  public SorterEngineConfig {
    Validate.isTrue(pageSize > 0, "pageSize must be positive: %d", pageSize);
    Validate.isTrue(preloadThreshold >= 0, "preloadThreshold must not be negative: %d", preloadThreshold);
    Validate.isTrue(windowedThreshold >= 0, "windowedThreshold must not be negative: %d", windowedThreshold);
    Validate.isTrue(comboWindowMillis > 0, "comboWindowMillis must be positive: %d", comboWindowMillis);
    Validate.isTrue(comboResetDelayMillis >= 0, "comboResetDelayMillis must not be negative: %d",
        comboResetDelayMillis);
    Validate.isTrue(loadMoreDebounceMillis >= 0, "loadMoreDebounceMillis must not be negative: %d",
        loadMoreDebounceMillis);
    Validate.isTrue(undoDepth > 0, "undoDepth must be positive: %d", undoDepth);
    Validate.isTrue(maxPageFetchRetries > 0, "maxPageFetchRetries must be positive: %d", maxPageFetchRetries);
  }

  public static SorterEngineConfig defaults() {
    return new SorterEngineConfig(500, 50, 5000, 1500L, 300L, 50L, 1, 3);
  }

  /**
   * Reads values from properties with the {@code sorter.} prefix, falling back to
   * {@link #defaults()} for absent keys.
   *
   * @param properties properties, e.g. loaded from {@code sorter-engine.properties}
   * @return configuration
   * @throws IllegalArgumentException if a value is not a number or out of range
   */
  public static SorterEngineConfig fromProperties(final Properties properties) {
    Validate.notNull(properties, "properties must not be null");
    final SorterEngineConfig d = defaults();
    return new SorterEngineConfig(
        readInt(properties, "pageSize", d.pageSize()),
        readInt(properties, "preloadThreshold", d.preloadThreshold()),
        readInt(properties, "windowedThreshold", d.windowedThreshold()),
        read(properties, "comboWindowMillis", d.comboWindowMillis()),
        read(properties, "comboResetDelayMillis", d.comboResetDelayMillis()),
        read(properties, "loadMoreDebounceMillis", d.loadMoreDebounceMillis()),
        readInt(properties, "undoDepth", d.undoDepth()),
        readInt(properties, "maxPageFetchRetries", d.maxPageFetchRetries()));
  }

  private static int readInt(final Properties properties, final String name, final int fallback) {
    final long value = read(properties, name, fallback);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Value for " + PREFIX + name + " is out of int range: " + value);
    }
    return (int) value;
  }

  private static long read(final Properties properties, final String name, final long fallback) {
    final String raw = properties.getProperty(PREFIX + name);
    if (StringUtils.isBlank(raw)) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + PREFIX + name + ": " + raw, e);
    }
  }
}
