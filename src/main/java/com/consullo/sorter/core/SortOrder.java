package com.consullo.sorter.core;

/**
 * Order in which a session walks its records.
 *
 * <p>{@link Kind#RANDOM} orders are deterministic for a fixed seed so a session can be rebuilt
 * with the exact same sequence. The seed is ignored for the date orders.
 *
 * @param kind ordering kind
 * @param seed shuffle seed, only meaningful for {@link Kind#RANDOM}
 * @since 1.0
 */
public record SortOrder(Kind kind, long seed) {

  public enum Kind {
    DATE_DESCENDING,
    DATE_ASCENDING,
    RANDOM
  }

  public SortOrder {
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null.");
    }
    if (kind != Kind.RANDOM) {
      seed = 0L;
    }
  }

  public static SortOrder dateDescending() {
    return new SortOrder(Kind.DATE_DESCENDING, 0L);
  }

  public static SortOrder dateAscending() {
    return new SortOrder(Kind.DATE_ASCENDING, 0L);
  }

  public static SortOrder random(long seed) {
    return new SortOrder(Kind.RANDOM, seed);
  }

  /**
   * Next order in the cycle newest first, oldest first, random, newest first.
   *
   * @param newSeed seed used when the cycle lands on a random order
   * @return next order
   */
  public SortOrder next(long newSeed) {
    switch (kind) {
      case DATE_DESCENDING:
        return dateAscending();
      case DATE_ASCENDING:
        return random(newSeed);
      default:
        return dateDescending();
    }
  }
}
