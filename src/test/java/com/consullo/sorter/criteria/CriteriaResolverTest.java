package com.consullo.sorter.criteria;

import com.consullo.sorter.core.Criteria;
import com.consullo.sorter.core.FilterMode;
import com.consullo.sorter.core.InPageFilter;
import com.consullo.sorter.core.PhotoRecord;
import com.consullo.sorter.core.RecordStatus;
import com.consullo.sorter.core.SessionFilter;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the filter priority rules.
 *
 * @since 1.0
 */
public class CriteriaResolverTest {

  private static final long DAY_START = 1_700_006_400_000L;
  private static final List<String> CAMERA = List.of("camera");

  @Test
  @DisplayName("Precise id allow-list wins over every other source")
  void resolve_PreciseIds_OverridesInPageAndGlobal() {
    SessionFilter filter = SessionFilter.preciseIds(List.of("a", "b"));
    Criteria c = CriteriaResolver.resolve(InPageFilter.bucket("screenshots"), filter, FilterMode.CAMERA_ONLY, CAMERA);

    assertThat(c.getAllowList()).containsExactly("a", "b");
    assertThat(c.isPrecise()).isTrue();
    assertThat(c.getIncludeBuckets()).isEmpty();
  }

  @Test
  @DisplayName("In-page filter beats a precise date range and widens its end to end of day")
  void resolve_InPageFilter_NonPreciseWidenedEnd() {
    SessionFilter range = SessionFilter.preciseRange(List.of("camera"), 0L, 10L);
    InPageFilter inPage = new InPageFilter(List.of("screenshots"), DAY_START, DAY_START);

    Criteria c = CriteriaResolver.resolve(inPage, range, FilterMode.ALL, CAMERA);

    assertThat(c.getIncludeBuckets()).containsExactly("screenshots");
    assertThat(c.isPrecise()).isFalse();
    assertThat(c.getEffectiveEndMillis()).isEqualTo(DAY_START + 86_400_000L - 1L);
  }

  @Test
  @DisplayName("Precise date range is used exactly as given")
  void resolve_PreciseRange_EndNotWidened() {
    SessionFilter range = SessionFilter.preciseRange(null, DAY_START, DAY_START + 1_000L);

    Criteria c = CriteriaResolver.resolve(null, range, FilterMode.EXCLUDE_CAMERA, CAMERA);

    assertThat(c.isPrecise()).isTrue();
    assertThat(c.getEffectiveEndMillis()).isEqualTo(DAY_START + 1_000L);
    assertThat(c.getExcludeBuckets()).isEmpty();
  }

  @Test
  @DisplayName("CAMERA_ONLY without known camera buckets matches nothing")
  void resolve_CameraOnlyWithoutBuckets_ReturnsNothing() {
    Criteria c = CriteriaResolver.resolve(null, null, FilterMode.CAMERA_ONLY, List.of());

    assertThat(c.isUnsatisfiable()).isTrue();
    assertThat(c.matches(new PhotoRecord("x", 1L, "camera", RecordStatus.UNCLASSIFIED))).isFalse();
  }

  @Test
  @DisplayName("CAMERA_ONLY includes and EXCLUDE_CAMERA excludes the camera buckets")
  void resolve_CameraModes_IncludeOrExcludeBuckets() {
    Criteria only = CriteriaResolver.resolve(null, null, FilterMode.CAMERA_ONLY, CAMERA);
    Criteria excluded = CriteriaResolver.resolve(null, null, FilterMode.EXCLUDE_CAMERA, CAMERA);

    assertThat(only.getIncludeBuckets()).containsExactly("camera");
    assertThat(excluded.getExcludeBuckets()).containsExactly("camera");
  }

  @Test
  @DisplayName("EXCLUDE_CAMERA without camera buckets and ALL impose no constraint")
  void resolve_NoConstraintModes_ReturnAll() {
    assertThat(CriteriaResolver.resolve(null, null, FilterMode.EXCLUDE_CAMERA, null)).isEqualTo(Criteria.all());
    assertThat(CriteriaResolver.resolve(null, null, FilterMode.ALL, CAMERA)).isEqualTo(Criteria.all());
    assertThat(CriteriaResolver.resolve(null, null, null, CAMERA)).isEqualTo(Criteria.all());
  }

  @Test
  @DisplayName("CUSTOM uses the non-precise session filter with a widened end")
  void resolve_Custom_UsesSessionFilter() {
    SessionFilter custom = SessionFilter.custom(List.of("trip"), DAY_START, DAY_START);

    Criteria c = CriteriaResolver.resolve(null, custom, FilterMode.CUSTOM, CAMERA);

    assertThat(c.getIncludeBuckets()).containsExactly("trip");
    assertThat(c.isPrecise()).isFalse();
    assertThat(c.getEffectiveEndMillis()).isEqualTo(DAY_START + Criteria.END_OF_DAY_EXTENSION_MILLIS);
    assertThat(CriteriaResolver.resolve(null, null, FilterMode.CUSTOM, CAMERA)).isEqualTo(Criteria.all());
  }

  @Test
  @DisplayName("Empty lists normalize to no constraint rather than matching nothing")
  void resolve_EmptyInPageLists_NoConstraint() {
    SessionFilter custom = SessionFilter.custom(List.of(), null, null);

    Criteria c = CriteriaResolver.resolve(null, custom, FilterMode.CUSTOM, CAMERA);

    assertThat(c.isUnsatisfiable()).isFalse();
    assertThat(c.matches(new PhotoRecord("x", 1L, "anything", RecordStatus.UNCLASSIFIED))).isTrue();
  }
}
