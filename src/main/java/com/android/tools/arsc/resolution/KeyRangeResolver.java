// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.android.tools.arsc.table.ResStringPool;
import com.android.tools.arsc.table.ResTablePackage;
import com.android.tools.arsc.table.ResTableTypeGroup;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Computes which part of a package's shared key string pool belongs to a type.
 *
 * <p>Keys are assumed to be laid out type after type, in ascending type id order, each type taking
 * as many keys as its type spec declares entries. The range of type {@code t} therefore starts at
 * the sum of the entry counts of the types before it.
 */
public class KeyRangeResolver {

  private KeyRangeResolver() {}

  /**
   * @throws IllegalArgumentException if {@code typeId < 1}.
   * @throws TypeGroupNotFoundException if the package has no type spec group for {@code typeId}.
   */
  public static KeyRange getKeyRange(ResTablePackage resTablePackage, int typeId) {
    if (typeId < 1) {
      throw new IllegalArgumentException("Minimum id of a type is 1, " + typeId + " given");
    }
    List<ResTableTypeGroup> groups = resTablePackage.getTypes();
    if (typeId > groups.size()) {
      throw new TypeGroupNotFoundException(resTablePackage.getId(), typeId, groups.size());
    }
    long first = 0;
    for (int i = 0; i < typeId - 1; i++) {
      first += getEntryCount(groups.get(i));
    }
    return new KeyRange(first, first + getEntryCount(groups.get(typeId - 1)));
  }

  private static long getEntryCount(ResTableTypeGroup group) {
    return group.getPrimary().getHeader().getEntryCount();
  }

  /**
   * Returns the raw key entries of {@code range}, clamped to the size of the key pool. Index
   * {@code k} of the result is entry id {@code k} of the type.
   */
  public static List<byte[]> getRawKeys(ResTablePackage resTablePackage, KeyRange range) {
    ResStringPool keyStrings = resTablePackage.getKeyStrings();
    return keyStrings.getRawEntries(clampToInt(range.getFirst()), clampToInt(range.getLast()));
  }

  /**
   * Decodes all keys of {@code range}.
   *
   * @throws StringPoolDecodingException if any key in the range cannot be decoded.
   */
  public static List<String> getKeys(
      ResTablePackage resTablePackage, KeyRange range, PooledStringDecoder decoder) {
    ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (byte[] rawKey : getRawKeys(resTablePackage, range)) {
      keys.add(decoder.decode(rawKey, resTablePackage.getKeyStrings().getEncoding()));
    }
    return keys.build();
  }

  private static int clampToInt(long value) {
    return (int) Math.min(value, Integer.MAX_VALUE);
  }
}
