package com.consullo.sorter.engine;

/**
 * Snapshot of the rapid-action streak.
 *
 * @param count consecutive actions inside the combo window
 * @param maxCount best count reached since the last reset
 * @param lastActionMillis time of the last registered action, 0 if none
 * @param active whether the streak is still inside its window
 * @since 1.0
 */
public record ComboState(int count, int maxCount, long lastActionMillis, boolean active) {

  public static final ComboState INITIAL = new ComboState(0, 0, 0L, false);

  public ComboLevel level() {
    return ComboLevel.of(count);
  }
}
