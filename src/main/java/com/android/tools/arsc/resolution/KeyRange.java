// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.google.common.base.Preconditions;
import java.util.Objects;

/** Half-open range {@code [first, last)} of indices into a package's key string pool. */
public class KeyRange {

  private final long first;
  private final long last;

  public KeyRange(long first, long last) {
    Preconditions.checkArgument(0 <= first && first <= last, "Invalid key range");
    this.first = first;
    this.last = last;
  }

  public long getFirst() {
    return first;
  }

  public long getLast() {
    return last;
  }

  /** True if {@code other} starts exactly where this range ends. */
  public boolean isFollowedBy(KeyRange other) {
    return last == other.first;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj instanceof KeyRange) {
      KeyRange other = (KeyRange) obj;
      return first == other.first && last == other.last;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, last);
  }

  @Override
  public String toString() {
    return "[" + first + ", " + last + ")";
  }
}
