// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.errors;

import com.android.tools.arsc.origin.Origin;

/** Raised when the bytes of a resource table do not follow the chunk layout being decoded. */
public class ResourceTableFormatError extends RuntimeException {

  private final Origin origin;

  public ResourceTableFormatError(String message, Origin origin) {
    super(message);
    this.origin = origin;
  }

  public ResourceTableFormatError(String message, Origin origin, Throwable cause) {
    super(message, cause);
    this.origin = origin;
  }

  public Origin getOrigin() {
    return origin;
  }
}
