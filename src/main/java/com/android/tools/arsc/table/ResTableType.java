// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

/**
 * A configuration specific type chunk. Only the header is retained; entry values and the
 * configuration itself are not decoded.
 */
public final class ResTableType extends ResTableTypeRecord {

  private final int flags;

  public ResTableType(int id, int entryCount) {
    this(id, 0, entryCount);
  }

  ResTableType(int id, int flags, int entryCount) {
    super(new Header(id, entryCount));
    this.flags = flags;
  }

  public int getFlags() {
    return flags;
  }

  @Override
  public boolean isType() {
    return true;
  }

  @Override
  public ResTableType asType() {
    return this;
  }
}
