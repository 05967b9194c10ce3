// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc;

/** Exception thrown when a resolution run fails to complete. */
public class ResolutionFailedException extends Exception {

  public ResolutionFailedException(String message) {
    super(message);
  }

  public ResolutionFailedException(Throwable cause) {
    super("Resolution failed to complete", cause);
  }

  public ResolutionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
