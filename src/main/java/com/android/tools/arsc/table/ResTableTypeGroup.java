// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * All records of one type id, in file order. The first record is the type spec; the records after
 * it are the type chunks, one per configuration.
 */
public final class ResTableTypeGroup {

  private final ImmutableList<ResTableTypeRecord> records;

  private ResTableTypeGroup(ImmutableList<ResTableTypeRecord> records) {
    this.records = records;
  }

  public static ResTableTypeGroup create(
      ResTableTypeSpec typeSpec, List<ResTableType> configurations) {
    ImmutableList.Builder<ResTableTypeRecord> records = ImmutableList.builder();
    records.add(typeSpec);
    for (ResTableType configuration : configurations) {
      Preconditions.checkArgument(
          configuration.getHeader().getId() == typeSpec.getHeader().getId(),
          "Type chunk with id %s in group of type %s",
          configuration.getHeader().getId(),
          typeSpec.getHeader().getId());
      records.add(configuration);
    }
    return new ResTableTypeGroup(records.build());
  }

  public int getId() {
    return getPrimary().getHeader().getId();
  }

  /** The record whose entry count stands for the whole group. */
  public ResTableTypeRecord getPrimary() {
    return records.get(0);
  }

  public List<ResTableTypeRecord> getRecords() {
    return records;
  }

  public ResTableTypeSpec getTypeSpec() {
    return getPrimary().asTypeSpec();
  }

  public List<ResTableTypeRecord> getConfigurations() {
    return records.subList(1, records.size());
  }
}
