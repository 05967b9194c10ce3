// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

/** The package has fewer type spec groups than the requested type id. */
public class TypeGroupNotFoundException extends RuntimeException {

  public TypeGroupNotFoundException(int packageId, int typeId, int groupCount) {
    super(
        "Package 0x"
            + Integer.toHexString(packageId)
            + " has "
            + groupCount
            + " type specs, no type spec for type id "
            + typeId);
  }
}
