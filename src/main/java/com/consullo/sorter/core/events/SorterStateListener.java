package com.consullo.sorter.core.events;

import com.consullo.sorter.engine.SorterEngineState;

/**
 * Listener interface for engine state publications.
 *
 * @since 1.0
 */
public interface SorterStateListener {

  /**
   * Called after every change of the UI-facing aggregate, in the order the changes happened.
   *
   * <p>Invoked while the engine holds its state lock; implementations must not block and should
   * hand work off to their own thread if needed.
   *
   * @param state immutable state snapshot
   */
  void onStateChanged(SorterEngineState state);
}
