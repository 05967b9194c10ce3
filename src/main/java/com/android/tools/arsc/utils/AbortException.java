// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.utils;

/**
 * Exception thrown to interrupt processing after a fatal error. The exception doesn't carry
 * directly information about the failure, instead it is reported to the {@link Reporter}.
 */
public class AbortException extends RuntimeException {

  public AbortException() {
    super("Aborted, see reported diagnostics");
  }
}
