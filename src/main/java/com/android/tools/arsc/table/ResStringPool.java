// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A decoded string pool chunk. Entries are kept as raw bytes, each including its length prefix and
 * NUL terminator, and are only turned into text when a caller asks for them.
 */
public final class ResStringPool {

  public static final int SORTED_FLAG = 1;
  public static final int UTF8_FLAG = 1 << 8;

  private static final ResStringPool EMPTY =
      new ResStringPool(new Header(0, 0, UTF8_FLAG, 0), ImmutableList.of());

  private final Header header;
  private final ImmutableList<byte[]> strings;

  ResStringPool(Header header, List<byte[]> strings) {
    this.header = header;
    this.strings = ImmutableList.copyOf(strings);
  }

  public static ResStringPool empty() {
    return EMPTY;
  }

  /** Creates a pool from raw entries, for pools not read from a file. */
  public static ResStringPool create(int flags, List<byte[]> rawEntries) {
    ImmutableList.Builder<byte[]> copies = ImmutableList.builder();
    for (byte[] entry : rawEntries) {
      copies.add(entry.clone());
    }
    return new ResStringPool(new Header(rawEntries.size(), 0, flags, 0), copies.build());
  }

  public Header getHeader() {
    return header;
  }

  public StringPoolEncoding getEncoding() {
    return StringPoolEncoding.fromFlags(header.getFlags());
  }

  public int size() {
    return strings.size();
  }

  /** Returns a copy of the raw bytes of entry {@code index}, envelope included. */
  public byte[] getRawEntry(int index) {
    return strings.get(index).clone();
  }

  /**
   * Returns the raw entries in {@code [from, to)}. Bounds beyond the pool are clamped, so the
   * result may be shorter than requested.
   */
  public List<byte[]> getRawEntries(int from, int to) {
    int start = Math.min(Math.max(from, 0), strings.size());
    int end = Math.min(Math.max(to, start), strings.size());
    return strings.subList(start, end);
  }

  public static final class Header {

    private final int stringCount;
    private final int styleCount;
    private final int flags;
    private final int stringsStart;

    public Header(int stringCount, int styleCount, int flags, int stringsStart) {
      this.stringCount = stringCount;
      this.styleCount = styleCount;
      this.flags = flags;
      this.stringsStart = stringsStart;
    }

    public int getStringCount() {
      return stringCount;
    }

    public int getStyleCount() {
      return styleCount;
    }

    public int getFlags() {
      return flags;
    }

    public int getStringsStart() {
      return stringsStart;
    }
  }
}
