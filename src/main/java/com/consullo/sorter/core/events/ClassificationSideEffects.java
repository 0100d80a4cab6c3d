package com.consullo.sorter.core.events;

import com.consullo.sorter.core.RecordStatus;
import java.util.Map;

/**
 * Collaborators notified after a classification has been durably written.
 *
 * <p>Calls are fire-and-forget: the engine neither awaits nor retries them, and a failure never
 * rolls the classification back. Undo does not call back into this interface.
 *
 * @since 1.0
 */
public interface ClassificationSideEffects {

  /** Implementation that ignores every notification. */
  ClassificationSideEffects NO_OP = new ClassificationSideEffects() {
  };

  /**
   * Increments the lifetime (achievement) counters.
   *
   * @param status status that was applied
   * @param count number of records classified
   * @throws Exception if the update fails
   */
  default void incrementLifetimeCounters(final RecordStatus status, final int count) throws Exception {
  }

  /**
   * Records a telemetry event.
   *
   * @param event event name
   * @param attributes event attributes
   * @throws Exception if recording fails
   */
  default void recordTelemetry(final String event, final Map<String, Object> attributes) throws Exception {
  }

  /**
   * Asks home-screen widgets to refresh their progress.
   *
   * @throws Exception if the refresh cannot be triggered
   */
  default void refreshWidgets() throws Exception {
  }

  /**
   * Reports the best combo reached so far.
   *
   * @param maxCombo max combo count
   * @throws Exception if the update fails
   */
  default void updateMaxCombo(final int maxCombo) throws Exception {
  }
}
