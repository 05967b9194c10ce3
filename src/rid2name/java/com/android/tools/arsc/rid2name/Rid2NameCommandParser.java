// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.rid2name;

import com.android.tools.arsc.DiagnosticsHandler;
import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.resolution.EnvelopeMode;
import com.android.tools.arsc.resolution.ResourceId;
import com.android.tools.arsc.utils.Reporter;
import com.android.tools.arsc.utils.StringDiagnostic;
import com.android.tools.arsc.utils.StringUtils;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.IntConsumer;

public class Rid2NameCommandParser {

  private static final String ENVELOPE_FLAG = "--envelope";
  private static final String FORMAT_FLAG = "--format";
  private static final String LIST_KEYS_FLAG = "--list-keys";
  private static final String LIST_PACKAGES_FLAG = "--list-packages";
  private static final String LIST_TYPES_FLAG = "--list-types";
  private static final String VALIDATE_IDS_FLAG = "--validate-ids";

  private static final Set<String> OPTIONS_WITH_ONE_PARAMETER =
      ImmutableSet.of(ENVELOPE_FLAG, FORMAT_FLAG, LIST_KEYS_FLAG, LIST_TYPES_FLAG);

  private static final String USAGE_MESSAGE =
      StringUtils.lines(
          "Usage: rid2name [options] <resources.arsc> [<resource-id> [fqdn|xmlid|json]]",
          "where options are:",
          "  --format <fqdn|xmlid|json>   # Output format of resolved names (default fqdn).",
          "  --list-packages              # Print the id and name of every package.",
          "  --list-types <package-id>    # Print the types of the package.",
          "  --list-keys <resource-id>    # Print all keys of the type owning the resource id.",
          "  --validate-ids               # Reject package id 0 and type id 0.",
          "  --envelope <fixed|declared>  # How string pool entries are framed (default declared).",
          "  --help                       # Print this message.",
          "  --version                    # Print the version.");

  public static String getUsageMessage() {
    return USAGE_MESSAGE;
  }

  public static Rid2NameCommand.Builder parse(String[] args, Origin origin) {
    return parse(args, origin, Rid2NameCommand.builder());
  }

  public static Rid2NameCommand.Builder parse(
      String[] args, Origin origin, DiagnosticsHandler handler) {
    return parse(args, origin, Rid2NameCommand.builder(handler));
  }

  private static Rid2NameCommand.Builder parse(
      String[] args, Origin origin, Rid2NameCommand.Builder builder) {
    Reporter reporter = builder.getReporter();
    List<String> positionals = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i].trim();
      String nextArg = null;
      if (OPTIONS_WITH_ONE_PARAMETER.contains(arg)) {
        if (++i < args.length) {
          nextArg = args[i];
        } else {
          reporter.error(
              new StringDiagnostic("Missing parameter for " + args[i - 1] + ".", origin));
          break;
        }
      }
      if (arg.isEmpty()) {
        continue;
      } else if (arg.equals("--help")) {
        builder.setPrintHelp(true);
      } else if (arg.equals("--version")) {
        builder.setPrintVersion(true);
      } else if (arg.equals(LIST_PACKAGES_FLAG)) {
        builder.setListPackages();
      } else if (arg.equals(VALIDATE_IDS_FLAG)) {
        builder.setValidateIdentifiers(true);
      } else if (arg.equals(FORMAT_FLAG)) {
        parseFormat(reporter, nextArg, origin, builder);
      } else if (arg.equals(ENVELOPE_FLAG)) {
        try {
          builder.setEnvelopeMode(EnvelopeMode.parse(nextArg));
        } catch (IllegalArgumentException e) {
          reporter.error(new StringDiagnostic(e.getMessage(), origin));
        }
      } else if (arg.equals(LIST_TYPES_FLAG)) {
        parseResourceIdArgument(reporter, LIST_TYPES_FLAG, nextArg, origin, builder::setListTypes);
      } else if (arg.equals(LIST_KEYS_FLAG)) {
        parseResourceIdArgument(reporter, LIST_KEYS_FLAG, nextArg, origin, builder::setListKeys);
      } else if (arg.startsWith("--")) {
        reporter.error(new StringDiagnostic("Unknown option: " + arg, origin));
      } else {
        positionals.add(arg);
      }
    }
    parsePositionals(reporter, positionals, origin, builder);
    return builder;
  }

  private static void parsePositionals(
      Reporter reporter, List<String> positionals, Origin origin, Rid2NameCommand.Builder builder) {
    if (positionals.size() > 3) {
      List<String> unexpected = positionals.subList(3, positionals.size());
      reporter.error(
          new StringDiagnostic("Unexpected arguments: " + String.join(" ", unexpected), origin));
      return;
    }
    if (positionals.size() > 0) {
      builder.setInputPath(Paths.get(positionals.get(0)));
    }
    if (positionals.size() > 1) {
      parseResourceIdArgument(
          reporter, "resource id", positionals.get(1), origin, builder::setResourceId);
    }
    if (positionals.size() > 2) {
      parseFormat(reporter, positionals.get(2), origin, builder);
    }
  }

  private static void parseFormat(
      Reporter reporter, String value, Origin origin, Rid2NameCommand.Builder builder) {
    OutputFormat format = OutputFormat.lookup(value);
    if (format == null) {
      reporter.error(new StringDiagnostic("Unknown output type: " + value, origin));
    } else {
      builder.setOutputFormat(format);
    }
  }

  private static void parseResourceIdArgument(
      Reporter reporter, String what, String value, Origin origin, IntConsumer setter) {
    try {
      setter.accept(ResourceId.parse(value));
    } catch (NumberFormatException e) {
      reporter.error(new StringDiagnostic("Invalid argument to " + what + ": " + value, origin));
    }
  }
}
