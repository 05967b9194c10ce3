// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.google.common.base.Preconditions;

/**
 * A chunk declaring a number of entries for one type: either the type spec or one of the
 * configuration specific type chunks following it.
 */
public abstract class ResTableTypeRecord {

  private final Header header;

  ResTableTypeRecord(Header header) {
    this.header = header;
  }

  public Header getHeader() {
    return header;
  }

  public boolean isTypeSpec() {
    return false;
  }

  public ResTableTypeSpec asTypeSpec() {
    return null;
  }

  public boolean isType() {
    return false;
  }

  public ResTableType asType() {
    return null;
  }

  public static final class Header {

    private final int id;
    private final int entryCount;

    Header(int id, int entryCount) {
      Preconditions.checkArgument(entryCount >= 0, "Negative entry count: %s", entryCount);
      this.id = id;
      this.entryCount = entryCount;
    }

    /** The 1-based type id. */
    public int getId() {
      return id;
    }

    public int getEntryCount() {
      return entryCount;
    }
  }
}
