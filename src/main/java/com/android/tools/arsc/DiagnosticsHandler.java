// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc;

import com.android.tools.arsc.origin.Origin;
import java.io.PrintStream;

/**
 * A DiagnosticsHandler can be provided to customize handling of diagnostics information.
 *
 * <p>During resolution the tool reports errors, warnings and infos to the handler. The default
 * implementation prints them to the standard streams.
 */
public interface DiagnosticsHandler {

  /**
   * Handle error diagnostics.
   *
   * @param error Diagnostic containing error information.
   */
  default void error(Diagnostic error) {
    printDiagnostic(error, "Error", System.err);
  }

  /**
   * Handle warning diagnostics.
   *
   * @param warning Diagnostic containing warning information.
   */
  default void warning(Diagnostic warning) {
    printDiagnostic(warning, "Warning", System.err);
  }

  /**
   * Handle info diagnostics.
   *
   * @param info Diagnostic containing the information.
   */
  default void info(Diagnostic info) {
    printDiagnostic(info, "Info", System.out);
  }

  private static void printDiagnostic(Diagnostic diagnostic, String kind, PrintStream stream) {
    if (diagnostic.getOrigin() != Origin.unknown()) {
      stream.print(kind + " in " + diagnostic.getOrigin());
      stream.println(":");
    } else {
      stream.print(kind);
      stream.print(": ");
    }
    stream.println(diagnostic.getDiagnosticMessage());
  }
}
