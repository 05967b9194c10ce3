// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.google.common.primitives.ImmutableIntArray;

/** A type spec chunk: the entry count of a type and the configuration mask of each entry. */
public final class ResTableTypeSpec extends ResTableTypeRecord {

  private final ImmutableIntArray entryFlags;

  public ResTableTypeSpec(int id, int entryCount) {
    this(id, entryCount, ImmutableIntArray.of());
  }

  ResTableTypeSpec(int id, int entryCount, ImmutableIntArray entryFlags) {
    super(new Header(id, entryCount));
    this.entryFlags = entryFlags;
  }

  /** Configuration change flags per entry; empty when the table was not read from a file. */
  public ImmutableIntArray getEntryFlags() {
    return entryFlags;
  }

  @Override
  public boolean isTypeSpec() {
    return true;
  }

  @Override
  public ResTableTypeSpec asTypeSpec() {
    return this;
  }
}
