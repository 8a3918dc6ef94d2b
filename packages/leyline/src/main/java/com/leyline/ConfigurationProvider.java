package com.leyline;

import com.leyline.exception.ConfigException;
import com.leyline.exception.SerializationException;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>Locations: {@code classpath:some/path.yaml}, a {@code file:} URI, or a plain filesystem path.
 * A missing classpath resource yields an empty configuration so defaults apply. Values may use
 * {@code ${env:NAME:-default}}; unset variables fall back to JVM system properties of the same
 * name.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader.getResource(resourceName) == null) {
      log.debug("Classpath resource {} not found; using defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.debug("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return addOns(config);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return addOns(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration addOns(YAMLConfiguration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  /**
   * Environment variable first, then a system property with the same name, then the inline
   * {@code :-} default when the interpolator passes it through.
   */
  private static class FallbackEnvLookup implements Lookup {
    @Override
    public Object lookup(String key) {
      String name = key;
      String fallback = null;
      int idx = key.indexOf(":-");
      if (idx >= 0) {
        name = key.substring(0, idx);
        fallback = key.substring(idx + 2);
      }
      String val = System.getenv(name);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      String prop = System.getProperty(name);
      return prop != null ? prop : fallback;
    }
  }
}
