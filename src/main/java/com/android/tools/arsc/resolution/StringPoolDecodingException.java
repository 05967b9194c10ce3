// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

/** A string pool entry or package name could not be turned into text. */
public class StringPoolDecodingException extends RuntimeException {

  public StringPoolDecodingException(String message) {
    super(message);
  }

  public StringPoolDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
