// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.utils;

import com.android.tools.arsc.Diagnostic;
import com.android.tools.arsc.errors.ResourceTableFormatError;
import com.android.tools.arsc.origin.Origin;
import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;

public class ExceptionDiagnostic implements Diagnostic {

  private final Throwable cause;
  private final Origin origin;

  public ExceptionDiagnostic(Throwable cause, Origin origin) {
    this.cause = cause;
    this.origin = origin;
  }

  public ExceptionDiagnostic(ResourceTableFormatError error) {
    this(error, error.getOrigin());
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public String getDiagnosticMessage() {
    String message = cause.getMessage();
    if (cause instanceof NoSuchFileException || cause instanceof FileNotFoundException) {
      return "File not found: " + message;
    }
    return message != null ? message : cause.toString();
  }
}
