// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A package chunk of a resource table.
 *
 * <p>The key string pool is shared by all types of the package. The type groups are kept in the
 * order they appear in the table, which is ascending type id for tables produced by aapt.
 */
public final class ResTablePackage {

  private final Header header;
  private final ResStringPool typeStrings;
  private final ResStringPool keyStrings;
  private final ImmutableList<ResTableTypeGroup> types;

  private ResTablePackage(
      Header header,
      ResStringPool typeStrings,
      ResStringPool keyStrings,
      ImmutableList<ResTableTypeGroup> types) {
    this.header = header;
    this.typeStrings = typeStrings;
    this.keyStrings = keyStrings;
    this.types = types;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Header getHeader() {
    return header;
  }

  public int getId() {
    return header.getId();
  }

  public ResStringPool getTypeStrings() {
    return typeStrings;
  }

  public ResStringPool getKeyStrings() {
    return keyStrings;
  }

  public List<ResTableTypeGroup> getTypes() {
    return types;
  }

  public static final class Header {

    private final int id;
    private final byte[] name;
    private final int typeStrings;
    private final int keyStrings;

    Header(int id, byte[] name, int typeStrings, int keyStrings) {
      this.id = id;
      this.name = name;
      this.typeStrings = typeStrings;
      this.keyStrings = keyStrings;
    }

    public int getId() {
      return id;
    }

    /** Returns a copy of the fixed size, NUL padded UTF-16 name field. */
    public byte[] getName() {
      return name.clone();
    }

    public int getTypeStrings() {
      return typeStrings;
    }

    public int getKeyStrings() {
      return keyStrings;
    }
  }

  public static class Builder {

    private int id;
    private byte[] name = new byte[ResChunk.PACKAGE_NAME_SIZE];
    private int typeStringsOffset;
    private int keyStringsOffset;
    private ResStringPool typeStrings = ResStringPool.empty();
    private ResStringPool keyStrings = ResStringPool.empty();
    private final ImmutableList.Builder<ResTableTypeGroup> types = ImmutableList.builder();

    private Builder() {}

    public Builder setId(int id) {
      this.id = id;
      return this;
    }

    public Builder setRawName(byte[] name) {
      this.name = name.clone();
      return this;
    }

    Builder setTypeStringsOffset(int typeStringsOffset) {
      this.typeStringsOffset = typeStringsOffset;
      return this;
    }

    Builder setKeyStringsOffset(int keyStringsOffset) {
      this.keyStringsOffset = keyStringsOffset;
      return this;
    }

    public Builder setTypeStrings(ResStringPool typeStrings) {
      this.typeStrings = typeStrings;
      return this;
    }

    public Builder setKeyStrings(ResStringPool keyStrings) {
      this.keyStrings = keyStrings;
      return this;
    }

    public Builder addType(ResTableTypeGroup group) {
      types.add(group);
      return this;
    }

    public ResTablePackage build() {
      Preconditions.checkState(id >= 0 && id <= 0xff, "Invalid package id: %s", id);
      return new ResTablePackage(
          new Header(id, name, typeStringsOffset, keyStringsOffset),
          typeStrings,
          keyStrings,
          types.build());
    }
  }
}
