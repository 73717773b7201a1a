package com.gentoro.pathrag;

import com.gentoro.pathrag.exception.ConfigException;
import com.gentoro.pathrag.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.ConfigurationInterpolator;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), "file:/etc/pathrag.yaml", or an absolute/relative filesystem path. A blank location
 * means "classpath:application.yaml".
 *
 * <p>{@code ${env:NAME}} placeholders resolve against the process environment first and then
 * against a {@code .env.local} file in the working directory; {@code ${env:NAME:-value}} supplies
 * a default.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Empty config keeps every component on its defaults.
      log.warn("Configuration resource {} not found on classpath, using defaults", resourceName);
      return addOns(new YAMLConfiguration());
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
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
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
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
      return loadYamlFromClasspath(DEFAULT_RESOURCE);
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

  private static Configuration addOns(Configuration config) {
    ConfigurationInterpolator interpolator = config.getInterpolator();
    interpolator.registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static class FallbackEnvLookup implements Lookup {
    private volatile Map<String, String> fallback;

    @Override
    public Object lookup(String variable) {
      // NAME:-default
      int sep = variable.indexOf(":-");
      String key = sep < 0 ? variable : variable.substring(0, sep);
      String defaultValue = sep < 0 ? null : variable.substring(sep + 2);
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }

      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            Path path = Paths.get(".env.local");
            if (Files.exists(path)) {
              fallback = readKeyValueFile(path);
            } else {
              log.debug("No .env.local found in {}", path.toAbsolutePath());
              fallback = new HashMap<>();
            }
          }
        }
      }
      String fromFile = fallback.get(key);
      return fromFile != null ? fromFile : defaultValue;
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env.local file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(this::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        log.warn("Could not read {}, ignoring it", path.toAbsolutePath(), e);
        return Collections.emptyMap();
      }
    }

    private Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      String val = line.substring(idx + 1).trim();
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
