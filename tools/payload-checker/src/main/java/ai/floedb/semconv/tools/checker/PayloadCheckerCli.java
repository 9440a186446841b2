/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.semconv.tools.checker;

import ai.floedb.semconv.catalog.SemconvCatalogLoadException;
import ai.floedb.semconv.catalog.SemconvCatalogLoader;
import ai.floedb.semconv.check.CheckerConfigException;
import ai.floedb.semconv.check.CompiledRules;
import ai.floedb.semconv.check.ComplianceChecker;
import ai.floedb.semconv.check.ExitStatus;
import ai.floedb.semconv.check.LoggingComplianceEvents;
import ai.floedb.semconv.check.MatchTableBuilder;
import ai.floedb.semconv.check.Verdict;
import ai.floedb.semconv.config.CheckerSettings;
import ai.floedb.semconv.config.CheckerSettingsLoader;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a captured OTLP metrics export payload against checker rules without running the
 * service. Exits with the same status a one-shot service run would.
 */
public final class PayloadCheckerCli {

  private static final String CHECK = "✔";

  static {
    configureJbossLogging();
  }

  private final boolean useColor =
      System.console() != null && !"false".equalsIgnoreCase(System.getenv("NO_COLOR"));
  private final String successPrefix = colored(CHECK, AnsiColor.GREEN) + " ";
  private final String errorPrefix = colored("✖ ERROR:", AnsiColor.RED_BOLD) + " ";

  public static void main(String[] args) {
    int exit = new PayloadCheckerCli().run(args, System.out, System.err);
    System.exit(exit);
  }

  private static void configureJbossLogging() {
    if (System.getProperty("java.util.logging.manager") == null
        && isClassPresent("org.jboss.logmanager.LogManager")) {
      System.setProperty("java.util.logging.manager", "org.jboss.logmanager.LogManager");
    }
  }

  private static boolean isClassPresent(String name) {
    try {
      Class.forName(name, false, PayloadCheckerCli.class.getClassLoader());
      return true;
    } catch (ClassNotFoundException ignored) {
      return false;
    }
  }

  /** Entry point that is easy to invoke from tests. */
  int run(String[] args, PrintStream out, PrintStream err) {
    CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (HelpRequested e) {
      printUsage(out);
      return ExitStatus.CLEAN.code();
    } catch (IllegalArgumentException e) {
      err.println("ERROR: " + e.getMessage());
      err.println();
      printUsage(err);
      return ExitStatus.USAGE.code();
    }

    CompiledRules rules;
    ExportMetricsServiceRequest request;
    try {
      CheckerSettings settings = new CheckerSettingsLoader().load(options.configPath());
      rules = MatchTableBuilder.build(settings, new SemconvCatalogLoader().load(options.catalog()));
      request = loadPayload(options.payloadPath());
    } catch (IOException | CheckerConfigException | SemconvCatalogLoadException e) {
      err.println("ERROR: " + e.getMessage());
      return ExitStatus.USAGE.code();
    }

    var report = new PayloadReport(new LoggingComplianceEvents());
    Verdict verdict = new ComplianceChecker(rules, report).check(request);
    var summary = PayloadSummary.of(options.payloadPath(), request, rules);

    if (options.json()) {
      emitJson(out, summary, verdict, report);
    } else {
      emitHumanReadable(out, summary, verdict, report);
    }
    return ExitStatus.of(verdict).code();
  }

  private void emitHumanReadable(
      PrintStream out, PayloadSummary summary, Verdict verdict, PayloadReport report) {
    out.printf(
        "%sLoaded payload: %s (%d resources, %d metrics)%n",
        successPrefix, summary.label(), summary.resources(), summary.metrics());
    out.printf(
        "%sRules: %d metric rules against %s%n",
        successPrefix, summary.rules(), summary.schemaUrl());
    report.warnings().forEach(w -> out.println(colored("WARN: " + w, AnsiColor.YELLOW)));
    report.errors().forEach(e -> out.println(errorPrefix + colored(e, AnsiColor.RED_BOLD)));
    out.println();
    if (!verdict.hasViolations()) {
      out.println(colored("ALL CHECKS PASSED.", AnsiColor.GREEN_BOLD));
      return;
    }
    out.println(
        colored(
            "CHECK FAILED ("
                + verdict.violationCount()
                + " missing attributes in scopes "
                + verdict.distinctScopes()
                + ")",
            AnsiColor.RED_BOLD));
  }

  private void emitJson(
      PrintStream out, PayloadSummary summary, Verdict verdict, PayloadReport report) {
    var builder = new StringBuilder();
    builder.append("{\n");
    builder.append("  \"payload\": \"").append(escapeJson(summary.label())).append("\",\n");
    builder.append("  \"compliant\": ").append(!verdict.hasViolations()).append(",\n");
    builder.append("  \"violations\": ").append(verdict.violationCount()).append(",\n");
    builder.append("  \"scopes\": ").append(asJsonArray(verdict.distinctScopes())).append(",\n");
    builder.append("  \"errors\": ").append(asJsonArray(report.errors())).append(",\n");
    builder.append("  \"warnings\": ").append(asJsonArray(report.warnings())).append(",\n");
    builder.append("  \"stats\": {\n");
    builder.append("    \"resources\": ").append(summary.resources()).append(",\n");
    builder.append("    \"metrics\": ").append(summary.metrics()).append(",\n");
    builder.append("    \"rules\": ").append(summary.rules()).append("\n");
    builder.append("  }\n");
    builder.append("}\n");
    out.print(builder);
  }

  private static String asJsonArray(List<String> values) {
    var quoted = new ArrayList<String>(values.size());
    for (String value : values) {
      quoted.add("\"" + escapeJson(value) + "\"");
    }
    return "[" + String.join(", ", quoted) + "]";
  }

  private static String escapeJson(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder builder = new StringBuilder();
    for (char c : value.toCharArray()) {
      switch (c) {
        case '\\' -> builder.append("\\\\");
        case '"' -> builder.append("\\\"");
        case '\n' -> builder.append("\\n");
        case '\r' -> builder.append("\\r");
        case '\t' -> builder.append("\\t");
        default -> builder.append(c);
      }
    }
    return builder.toString();
  }

  /** Reads a binary export request, or protobuf JSON for {@code .json} files and as a fallback. */
  static ExportMetricsServiceRequest loadPayload(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("Payload file does not exist: " + path);
    }
    boolean json = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    if (!json) {
      var binary = parseBinary(Files.readAllBytes(path));
      if (binary != null) {
        return binary;
      }
    }
    var builder = ExportMetricsServiceRequest.newBuilder();
    try {
      JsonFormat.parser()
          .ignoringUnknownFields()
          .merge(Files.readString(path, StandardCharsets.UTF_8), builder);
    } catch (InvalidProtocolBufferException jsonFailure) {
      throw new IOException(
          "Payload is not a valid ExportMetricsServiceRequest (binary or JSON): " + path,
          jsonFailure);
    }
    return builder.build();
  }

  private static ExportMetricsServiceRequest parseBinary(byte[] bytes) {
    try {
      return ExportMetricsServiceRequest.parseFrom(bytes);
    } catch (InvalidProtocolBufferException binaryParseFailure) {
      return null;
    }
  }

  private void printUsage(PrintStream out) {
    out.println(
        "Usage: java -jar semconv-payload-checker.jar <payload.pb|payload.json>"
            + " --config <checker.yaml> [--catalog <location>] [--json]");
  }

  private String colored(String text, AnsiColor color) {
    if (!useColor || color == AnsiColor.NONE) {
      return text;
    }
    return color.code + text + AnsiColor.RESET.code;
  }

  private record PayloadSummary(
      String label, int resources, int metrics, int rules, String schemaUrl) {
    static PayloadSummary of(Path path, ExportMetricsServiceRequest request, CompiledRules rules) {
      int metrics = 0;
      for (var resource : request.getResourceMetricsList()) {
        for (var scope : resource.getScopeMetricsList()) {
          metrics += scope.getMetricsCount();
        }
      }
      return new PayloadSummary(
          path.getFileName().toString(),
          request.getResourceMetricsCount(),
          metrics,
          rules.table().size(),
          rules.resource().expectedVersion());
    }
  }

  /** Parsed CLI flags shared between the entry point and tests. */
  private record CliOptions(Path payloadPath, Path configPath, String catalog, boolean json) {
    static CliOptions parse(String[] args) {
      if (args == null || args.length == 0) {
        throw new IllegalArgumentException("Payload file path is required");
      }
      Path payload = null;
      Path config = null;
      String catalog = SemconvCatalogLoader.DEFAULT_LOCATION;
      boolean json = false;

      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if (arg == null || arg.isBlank()) {
          continue;
        }
        String value = arg.trim();
        if (value.equals("--json")) {
          json = true;
        } else if (value.equals("--help") || value.equals("-h")) {
          throw new HelpRequested();
        } else if (value.equals("--config")) {
          config = Path.of(requireValue(args, ++i, value));
        } else if (value.equals("--catalog")) {
          catalog = requireValue(args, ++i, value);
        } else if (value.startsWith("--")) {
          throw new IllegalArgumentException("Unknown option: " + value);
        } else if (payload == null) {
          payload = Path.of(value);
        } else {
          throw new IllegalArgumentException("Unexpected argument: " + value);
        }
      }

      if (payload == null) {
        throw new IllegalArgumentException("Payload file path is required");
      }
      if (config == null) {
        throw new IllegalArgumentException("--config is required");
      }
      return new CliOptions(payload, config, catalog, json);
    }

    private static String requireValue(String[] args, int index, String option) {
      if (index >= args.length || args[index] == null || args[index].isBlank()) {
        throw new IllegalArgumentException(option + " requires a value");
      }
      return args[index].trim();
    }
  }

  /** Internal signal used to distinguish --help from regular argument errors. */
  private static final class HelpRequested extends RuntimeException {}

  private enum AnsiColor {
    NONE(""),
    RESET("\u001B[0m"),
    GREEN("\u001B[32m"),
    GREEN_BOLD("\u001B[1;32m"),
    RED_BOLD("\u001B[1;31m"),
    YELLOW("\u001B[33m");

    private final String code;

    AnsiColor(String code) {
      this.code = code;
    }
  }
}
