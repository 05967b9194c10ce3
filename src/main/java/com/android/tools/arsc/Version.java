// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc;

/** Version of the arsc tools. */
public final class Version {

  public static final String LABEL = "1.0.0-dev";

  private Version() {}

  public static String getVersionString() {
    return LABEL;
  }
}
