package com.gentoro.pathrag;

import com.gentoro.pathrag.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line options of {@link PathRagApp}, given as {@code --name value} pairs.
 *
 * <p>Known options: {@code config-file}, {@code query}, {@code max-paths}, {@code domain}, {@code
 * as-of-version}, {@code as-of-timestamp}, {@code format} (text or json) and {@code help} (no
 * value).
 */
public class StartupParameters {
  static final Set<String> KNOWN =
      Set.of(
          "config-file",
          "query",
          "max-paths",
          "domain",
          "as-of-version",
          "as-of-timestamp",
          "format",
          "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("format", "text");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    for (String name : parameters.keySet()) {
      if (!KNOWN.contains(name)) {
        throw new ValidationException("Unknown option: --" + name);
      }
    }
    if (isHelp()) {
      return;
    }
    if (parameters.get("config-file") == null || parameters.get("config-file").isBlank()) {
      throw new ValidationException("Missing config file location");
    }
    if (parameters.get("query") == null || parameters.get("query").isBlank()) {
      throw new ValidationException("Missing --query");
    }
    String format = parameters.get("format");
    if (!"text".equals(format) && !"json".equals(format)) {
      throw new ValidationException("Invalid format: " + format + " (expected text or json)");
    }
    if (parameters.get("as-of-version") != null && parameters.get("as-of-timestamp") != null) {
      throw new ValidationException("--as-of-version and --as-of-timestamp are exclusive");
    }
    maxPaths();
  }

  public boolean isHelp() {
    return parameters.containsKey("help");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/pathrag.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file").orElse("classpath:application.yaml");
  }

  public String query() {
    return parameters.get("query");
  }

  public Optional<Integer> maxPaths() {
    return getOptionalParameter("max-paths")
        .map(
            v -> {
              try {
                return Integer.parseInt(v.trim());
              } catch (NumberFormatException e) {
                throw new ValidationException("Invalid --max-paths: " + v, e);
              }
            });
  }

  public boolean jsonOutput() {
    return "json".equals(parameters.get("format"));
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
