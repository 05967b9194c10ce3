// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.rid2name;

import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.origin.PathOrigin;
import com.android.tools.arsc.resolution.EnvelopeMode;
import com.android.tools.arsc.resolution.PooledStringDecoder;
import com.android.tools.arsc.resolution.ResourceNameResolver;
import com.android.tools.arsc.utils.Reporter;
import java.io.PrintStream;
import java.nio.file.Path;

public class Rid2NameOptions {

  public enum Mode {
    RESOLVE,
    LIST_PACKAGES,
    LIST_TYPES,
    LIST_KEYS
  }

  public final Path inputPath;
  public final Mode mode;
  public final int resourceId;
  public final int packageId;
  public final OutputFormat outputFormat;
  public final EnvelopeMode envelopeMode;
  public final boolean validateIdentifiers;
  public final PrintStream output;
  public final Reporter reporter;

  public Rid2NameOptions(
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
  }

  public Origin getOrigin() {
    return inputPath != null ? new PathOrigin(inputPath) : Origin.unknown();
  }

  public PooledStringDecoder createDecoder() {
    return new PooledStringDecoder(envelopeMode);
  }

  public ResourceNameResolver createResolver() {
    return ResourceNameResolver.builder()
        .setEnvelopeMode(envelopeMode)
        .setValidateIdentifiers(validateIdentifiers)
        .build();
  }
}
