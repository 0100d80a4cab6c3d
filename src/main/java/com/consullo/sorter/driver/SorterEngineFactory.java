package com.consullo.sorter.driver;

import com.consullo.sorter.core.RecordStore;
import com.consullo.sorter.core.SorterSettings;
import com.consullo.sorter.core.events.ClassificationSideEffects;
import com.consullo.sorter.engine.SorterEngine;
import com.consullo.sorter.engine.SorterEngineConfig;
import com.consullo.sorter.engine.SorterExecutors;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating sorter engines with sensible defaults.
 *
 * <p>
 * This class centralizes:
 * <ul>
 * <li>configuration lookup ({@value #CONFIG_RESOURCE} on the classpath, else built-in defaults)</li>
 * <li>thread ownership (daemon executors closed together with the engine)</li>
 * <li>starting the first session</li>
 * </ul>
 * </p>
 */
public final class SorterEngineFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(SorterEngineFactory.class);

  public static final String CONFIG_RESOURCE = "sorter-engine.properties";

  private SorterEngineFactory() {
  }

  /**
   * Create and start an engine with configuration from the classpath and default executors.
   *
   * @param store record store
   * @param settings user settings
   * @param sideEffects post-write collaborators, may be null
   * @return started engine
   */
  public static SorterEngine createEngine(RecordStore store, SorterSettings settings,
          ClassificationSideEffects sideEffects) {
    if (store == null || settings == null) {
      throw new IllegalArgumentException("store/settings must not be null.");
    }
    return createEngine(store, settings, sideEffects, loadConfig(), SorterExecutors.createDefault());
  }

  /**
   * Create and start an engine.
   *
   * @param store record store
   * @param settings user settings
   * @param sideEffects post-write collaborators, may be null
   * @param config configuration
   * @param executors executors; closed together with the engine
   * @return started engine
   */
  public static SorterEngine createEngine(
          RecordStore store,
          SorterSettings settings,
          ClassificationSideEffects sideEffects,
          SorterEngineConfig config,
          SorterExecutors executors
  ) {
    if (store == null || settings == null) {
      throw new IllegalArgumentException("store/settings must not be null.");
    }
    if (config == null || executors == null) {
      throw new IllegalArgumentException("config/executors must not be null.");
    }

    try {
      SorterEngine engine = new SorterEngine(store, settings, sideEffects, config, executors);
      engine.reload();
      return engine;
    } catch (RuntimeException e) {
      executors.close();
      throw new IllegalStateException("Failed to create sorter engine", e);
    }
  }

  /**
   * Load {@value #CONFIG_RESOURCE} from the classpath.
   *
   * @return configuration, defaults if the resource is absent
   */
  public static SorterEngineConfig loadConfig() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) {
      cl = SorterEngineFactory.class.getClassLoader();
    }
    try (InputStream in = cl.getResourceAsStream(CONFIG_RESOURCE)) {
      if (in == null) {
        LOGGER.debug("No {} on classpath, using defaults", CONFIG_RESOURCE);
        return SorterEngineConfig.defaults();
      }
      Properties props = new Properties();
      props.load(in);
      return SorterEngineConfig.fromProperties(props);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
    }
  }
}
