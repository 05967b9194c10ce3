// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.rid2name;

import com.android.tools.arsc.DiagnosticsHandler;
import com.android.tools.arsc.ResolutionFailedException;
import com.android.tools.arsc.resolution.EnvelopeMode;
import com.android.tools.arsc.rid2name.Rid2NameOptions.Mode;
import com.android.tools.arsc.utils.ExceptionUtils;
import com.android.tools.arsc.utils.Reporter;
import com.android.tools.arsc.utils.SystemPropertyUtils;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Immutable command for a single run of {@link Rid2Name}. */
public final class Rid2NameCommand {

  static final String ENVELOPE_PROPERTY = "com.android.tools.arsc.envelope";
  static final String VALIDATE_IDS_PROPERTY = "com.android.tools.arsc.validateids";

  private final Path inputPath;
  private final Mode mode;
  private final int resourceId;
  private final int packageId;
  private final OutputFormat outputFormat;
  private final EnvelopeMode envelopeMode;
  private final boolean validateIdentifiers;
  private final PrintStream output;
  private final Reporter reporter;
  private final boolean printHelp;
  private final boolean printVersion;

  private Rid2NameCommand(
      Path inputPath,
      Mode mode,
      int resourceId,
      int packageId,
      OutputFormat outputFormat,
      EnvelopeMode envelopeMode,
      boolean validateIdentifiers,
      PrintStream output,
      Reporter reporter) {
    this.inputPath = inputPath;
    this.mode = mode;
    this.resourceId = resourceId;
    this.packageId = packageId;
    this.outputFormat = outputFormat;
    this.envelopeMode = envelopeMode;
    this.validateIdentifiers = validateIdentifiers;
    this.output = output;
    this.reporter = reporter;
    this.printHelp = false;
    this.printVersion = false;
  }

  private Rid2NameCommand(
      boolean printHelp, boolean printVersion, PrintStream output, Reporter reporter) {
    this.inputPath = null;
    this.mode = null;
    this.resourceId = 0;
    this.packageId = 0;
    this.outputFormat = null;
    this.envelopeMode = null;
    this.validateIdentifiers = false;
    this.output = output;
    this.reporter = reporter;
    this.printHelp = printHelp;
    this.printVersion = printVersion;
  }

  Rid2NameOptions getInternalOptions() {
    return new Rid2NameOptions(
        inputPath,
        mode,
        resourceId,
        packageId,
        outputFormat,
        envelopeMode,
        validateIdentifiers,
        output,
        reporter);
  }

  PrintStream getOutput() {
    return output;
  }

  public Path getInputPath() {
    return inputPath;
  }

  public Mode getMode() {
    return mode;
  }

  public int getResourceId() {
    return resourceId;
  }

  public OutputFormat getOutputFormat() {
    return outputFormat;
  }

  public EnvelopeMode getEnvelopeMode() {
    return envelopeMode;
  }

  public boolean isValidateIdentifiers() {
    return validateIdentifiers;
  }

  public boolean isPrintHelp() {
    return printHelp;
  }

  public boolean isPrintVersion() {
    return printVersion;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Builder builder(DiagnosticsHandler handler) {
    return new Builder(handler);
  }

  public static class Builder {

    private final Reporter reporter;
    private Path inputPath;
    private Mode mode = Mode.RESOLVE;
    private Integer resourceId;
    private int packageId;
    private OutputFormat outputFormat = OutputFormat.FQDN;
    private EnvelopeMode envelopeMode;
    private boolean validateIdentifiers =
        SystemPropertyUtils.parseSystemPropertyOrDefault(VALIDATE_IDS_PROPERTY, false);
    private PrintStream output = System.out;

    private boolean printHelp = false;
    private boolean printVersion = false;

    private Builder() {
      this(new Reporter());
    }

    private Builder(DiagnosticsHandler handler) {
      this.reporter = handler instanceof Reporter ? (Reporter) handler : new Reporter(handler);
    }

    Reporter getReporter() {
      return reporter;
    }

    public Builder setInputPath(Path inputPath) {
      this.inputPath = inputPath;
      return this;
    }

    public Builder setResourceId(int resourceId) {
      this.resourceId = resourceId;
      return this;
    }

    public Builder setOutputFormat(OutputFormat outputFormat) {
      this.outputFormat = outputFormat;
      return this;
    }

    public Builder setEnvelopeMode(EnvelopeMode envelopeMode) {
      this.envelopeMode = envelopeMode;
      return this;
    }

    public Builder setValidateIdentifiers(boolean validateIdentifiers) {
      this.validateIdentifiers = validateIdentifiers;
      return this;
    }

    public Builder setListPackages() {
      this.mode = Mode.LIST_PACKAGES;
      return this;
    }

    public Builder setListTypes(int packageId) {
      this.mode = Mode.LIST_TYPES;
      this.packageId = packageId;
      return this;
    }

    /** List the keys of the type owning {@code resourceId}. */
    public Builder setListKeys(int resourceId) {
      this.mode = Mode.LIST_KEYS;
      this.resourceId = resourceId;
      return this;
    }

    public Builder setOutput(PrintStream output) {
      this.output = output;
      return this;
    }

    public Builder setPrintHelp(boolean printHelp) {
      this.printHelp = printHelp;
      return this;
    }

    public Builder setPrintVersion(boolean printVersion) {
      this.printVersion = printVersion;
      return this;
    }

    public Rid2NameCommand build() throws ResolutionFailedException {
      if (printHelp || printVersion) {
        return new Rid2NameCommand(printHelp, printVersion, output, reporter);
      }
      ExceptionUtils.withResolutionHandler(reporter, this::validate);
      return new Rid2NameCommand(
          inputPath,
          mode,
          resourceId != null ? resourceId : 0,
          packageId,
          outputFormat,
          envelopeMode,
          validateIdentifiers,
          output,
          reporter);
    }

    private void validate() {
      if (envelopeMode == null) {
        try {
          envelopeMode =
              SystemPropertyUtils.parseSystemPropertyOrDefault(
                  ENVELOPE_PROPERTY, EnvelopeMode.DECLARED_LENGTH, EnvelopeMode::parse);
        } catch (IllegalArgumentException e) {
          reporter.error("Invalid value for " + ENVELOPE_PROPERTY + ": " + e.getMessage());
        }
      }
      if (inputPath == null) {
        reporter.error("rid2name requires an input resource table (resources.arsc).");
      } else if (!Files.isRegularFile(inputPath)) {
        reporter.error("File not found: " + inputPath);
      }
      if ((mode == Mode.RESOLVE || mode == Mode.LIST_KEYS) && resourceId == null) {
        reporter.error("rid2name requires a resource id.");
      }
      if (mode == Mode.LIST_TYPES && (packageId < 0 || packageId > 0xff)) {
        reporter.error("Package id does not fit in 8 bits: 0x" + Integer.toHexString(packageId));
      }
      reporter.failIfPendingErrors();
    }
  }
}
