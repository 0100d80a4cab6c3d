package com.consullo.sorter.engine;

/**
 * Visual intensity tier of a combo count.
 *
 * @since 1.0
 */
public enum ComboLevel {
  NONE,
  NORMAL,
  WARM,
  HOT,
  FIRE;

  public static ComboLevel of(int count) {
    if (count >= 20) {
      return FIRE;
    }
    if (count >= 10) {
      return HOT;
    }
    if (count >= 5) {
      return WARM;
    }
    if (count >= 1) {
      return NORMAL;
    }
    return NONE;
  }
}
