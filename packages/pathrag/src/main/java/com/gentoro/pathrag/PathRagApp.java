package com.gentoro.pathrag;

import com.gentoro.pathrag.exception.PathRagException;
import com.gentoro.pathrag.graph.VersionConstraint;
import com.gentoro.pathrag.orchestrator.RetrievalRequest;
import com.gentoro.pathrag.orchestrator.RetrievalResponse;
import com.gentoro.pathrag.retrieval.RankedPath;
import com.gentoro.pathrag.utility.JacksonUtility;
import java.io.PrintStream;

/** Runs one retrieval from the command line and prints the result. */
public class PathRagApp {

  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(PathRagApp.class);

  static final String USAGE =
      String.join(
          "\n",
          "Usage: pathrag --query <anchor or text> [options]",
          "  --config-file <location>    classpath:application.yaml (default) or a file path",
          "  --max-paths <n>             number of paths to return (default 5)",
          "  --domain <domain>           only paths ending in this domain",
          "  --as-of-version <version>   graph version to read",
          "  --as-of-timestamp <instant> graph state at this ISO-8601 instant",
          "  --format text|json          output format (default text)",
          "  --help                      print this message");

  public static void main(String[] args) {
    int status;
    try {
      status = run(new StartupParameters(args), System.out);
    } catch (PathRagException e) {
      log.error("PathRAG failed: {}", e.getMessage(), e);
      System.err.println(e.getMessage());
      System.err.println(USAGE);
      status = 2;
    }
    System.exit(status);
  }

  static int run(StartupParameters params, PrintStream out) {
    if (params.isHelp()) {
      out.println(USAGE);
      return 0;
    }
    try (PathRag app = new PathRag(params.configFile())) {
      app.initialize();
      RetrievalRequest request = toRequest(params, app);
      RetrievalResponse response = app.orchestrator().answerContext(request);
      print(response, params.jsonOutput(), out);
      return response.isSuccess() ? 0 : 1;
    }
  }

  static RetrievalRequest toRequest(StartupParameters params, PathRag app) {
    int defaultMaxPaths = app.configuration().getInt("pathrag.retrieval.maxPaths", 5);
    VersionConstraint constraint =
        params
            .getOptionalParameter("as-of-version")
            .map(VersionConstraint::asOfVersion)
            .or(
                () ->
                    params
                        .getOptionalParameter("as-of-timestamp")
                        .map(VersionConstraint::asOfTimestamp))
            .orElse(null);
    return RetrievalRequest.builder(params.query())
        .maxPaths(params.maxPaths().orElse(defaultMaxPaths))
        .domainFilter(params.getOptionalParameter("domain").orElse(null))
        .versionConstraint(constraint)
        .formatForOutput(!params.jsonOutput())
        .build();
  }

  static void print(RetrievalResponse response, boolean json, PrintStream out) {
    if (json) {
      out.println(JacksonUtility.toPrettyJson(response));
      return;
    }
    switch (response.status()) {
      case ERROR:
        out.println("Error (" + response.error() + "): " + response.errorDetails());
        break;
      case EMPTY:
        out.println("No paths found for '" + response.query() + "'.");
        break;
      default:
        out.println(response.formattedContext());
        out.println();
        for (RankedPath path : response.paths()) {
          out.printf("%.4f  %s%n", path.reliability(), path.pathText());
        }
        if (response.fromCache()) {
          out.println("(served from cache)");
        }
    }
  }
}
