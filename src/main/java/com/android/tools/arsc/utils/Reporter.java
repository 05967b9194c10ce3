// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.utils;

import com.android.tools.arsc.Diagnostic;
import com.android.tools.arsc.DiagnosticsHandler;
import com.android.tools.arsc.origin.Origin;

/**
 * Forwards diagnostics to a {@link DiagnosticsHandler} and keeps track of whether an error was
 * reported, so that a run can be aborted at a well defined point.
 */
public class Reporter implements DiagnosticsHandler {

  private final DiagnosticsHandler clientHandler;
  private int errorCount = 0;
  private Diagnostic lastError;

  public Reporter() {
    this(new DiagnosticsHandler() {});
  }

  public Reporter(DiagnosticsHandler clientHandler) {
    this.clientHandler = clientHandler;
  }

  @Override
  public synchronized void info(Diagnostic info) {
    clientHandler.info(info);
  }

  @Override
  public synchronized void warning(Diagnostic warning) {
    clientHandler.warning(warning);
  }

  @Override
  public synchronized void error(Diagnostic error) {
    clientHandler.error(error);
    lastError = error;
    errorCount++;
  }

  public void error(String message) {
    error(new StringDiagnostic(message));
  }

  public void error(String message, Origin origin) {
    error(new StringDiagnostic(message, origin));
  }

  /** @throws AbortException if any error was reported. */
  public synchronized void failIfPendingErrors() {
    if (errorCount != 0) {
      throw new AbortException();
    }
  }

  public synchronized Diagnostic getLastError() {
    return lastError;
  }
}
