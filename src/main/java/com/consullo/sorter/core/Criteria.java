package com.consullo.sorter.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved filter predicate applied by the store before pagination.
 *
 * <p>
 * Empty bucket sets and an empty allow-list mean "no constraint", never "match nothing". The only
 * way to express an empty result is {@link #nothing()}.
 * </p>
 */
public final class Criteria {

  /** Added to a day-start end bound when the criteria are not precise (23:59:59.999). */
  public static final long END_OF_DAY_EXTENSION_MILLIS = 86_400_000L - 1L;

  private static final Criteria ALL = builder().build();
  private static final Criteria NOTHING = new Criteria(builder().unsatisfiable());

  private final Set<String> includeBuckets;
  private final Set<String> excludeBuckets;
  private final Long startMillis;
  private final Long endMillis;
  private final List<String> allowList;
  private final Set<String> allowSet;
  private final boolean precise;
  private final boolean unsatisfiable;

  private Criteria(Builder b) {
    this.includeBuckets = Collections.unmodifiableSet(new LinkedHashSet<>(b.includeBuckets));
    this.excludeBuckets = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludeBuckets));
    this.startMillis = b.startMillis;
    this.endMillis = b.endMillis;
    this.allowList = Collections.unmodifiableList(new ArrayList<>(b.allowList));
    this.allowSet = new LinkedHashSet<>(b.allowList);
    this.precise = b.precise;
    this.unsatisfiable = b.unsatisfiable;
  }

  /** Criteria without any constraint. */
  public static Criteria all() {
    return ALL;
  }

  /** Criteria that match no record at all. */
  public static Criteria nothing() {
    return NOTHING;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> getIncludeBuckets() {
    return includeBuckets;
  }

  public Set<String> getExcludeBuckets() {
    return excludeBuckets;
  }

  public Long getStartMillis() {
    return startMillis;
  }

  public Long getEndMillis() {
    return endMillis;
  }

  public List<String> getAllowList() {
    return allowList;
  }

  public boolean isPrecise() {
    return precise;
  }

  public boolean isUnsatisfiable() {
    return unsatisfiable;
  }

  /**
   * End bound as the store must apply it: unchanged when precise, widened to end of day otherwise.
   *
   * @return inclusive end bound or null when open-ended
   */
  public Long getEffectiveEndMillis() {
    if (endMillis == null) {
      return null;
    }
    return precise ? endMillis : endMillis + END_OF_DAY_EXTENSION_MILLIS;
  }

  /**
   * Evaluates the predicate against one record, ignoring its status.
   *
   * @param record record to test
   * @return true if the record satisfies every constraint
   */
  public boolean matches(PhotoRecord record) {
    if (unsatisfiable || record == null) {
      return false;
    }
    if (!allowList.isEmpty() && !allowSet.contains(record.id())) {
      return false;
    }
    if (!includeBuckets.isEmpty() && !includeBuckets.contains(record.bucketId())) {
      return false;
    }
    if (!excludeBuckets.isEmpty() && excludeBuckets.contains(record.bucketId())) {
      return false;
    }
    if (startMillis != null && record.dateTakenMillis() < startMillis) {
      return false;
    }
    Long end = getEffectiveEndMillis();
    return end == null || record.dateTakenMillis() <= end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Criteria)) {
      return false;
    }
    Criteria other = (Criteria) o;
    return precise == other.precise
        && unsatisfiable == other.unsatisfiable
        && includeBuckets.equals(other.includeBuckets)
        && excludeBuckets.equals(other.excludeBuckets)
        && Objects.equals(startMillis, other.startMillis)
        && Objects.equals(endMillis, other.endMillis)
        && allowList.equals(other.allowList);
  }

  @Override
  public int hashCode() {
    return Objects.hash(includeBuckets, excludeBuckets, startMillis, endMillis, allowList, precise, unsatisfiable);
  }

  @Override
  public String toString() {
    if (unsatisfiable) {
      return "Criteria{nothing}";
    }
    return "Criteria{include=" + includeBuckets
        + ", exclude=" + excludeBuckets
        + ", start=" + startMillis
        + ", end=" + endMillis
        + ", allowList=" + allowList.size()
        + ", precise=" + precise + "}";
  }

  public static final class Builder {

    private final Set<String> includeBuckets = new LinkedHashSet<>();
    private final Set<String> excludeBuckets = new LinkedHashSet<>();
    private final Set<String> allowList = new LinkedHashSet<>();
    private Long startMillis;
    private Long endMillis;
    private boolean precise;
    private boolean unsatisfiable;

    private Builder() {
    }

    public Builder includeBuckets(Collection<String> bucketIds) {
      if (bucketIds != null) {
        includeBuckets.addAll(bucketIds);
      }
      return this;
    }

    public Builder excludeBuckets(Collection<String> bucketIds) {
      if (bucketIds != null) {
        excludeBuckets.addAll(bucketIds);
      }
      return this;
    }

    public Builder startMillis(Long startMillis) {
      this.startMillis = startMillis;
      return this;
    }

    public Builder endMillis(Long endMillis) {
      this.endMillis = endMillis;
      return this;
    }

    public Builder allowList(Collection<String> recordIds) {
      if (recordIds != null) {
        for (String id : recordIds) {
          if (id != null) {
            allowList.add(id);
          }
        }
      }
      return this;
    }

    public Builder precise(boolean precise) {
      this.precise = precise;
      return this;
    }

    private Builder unsatisfiable() {
      this.unsatisfiable = true;
      return this;
    }

    public Criteria build() {
      if (startMillis != null && endMillis != null && startMillis > endMillis) {
        throw new IllegalArgumentException("startMillis must not be after endMillis.");
      }
      return new Criteria(this);
    }
  }
}
