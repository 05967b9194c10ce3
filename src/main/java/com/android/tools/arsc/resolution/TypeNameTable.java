// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.android.tools.arsc.table.ResStringPool;
import com.android.tools.arsc.table.ResTablePackage;
import com.android.tools.arsc.utils.IntObjConsumer;
import it.unimi.dsi.fastutil.ints.Int2ReferenceLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMap;
import it.unimi.dsi.fastutil.ints.Int2ReferenceMaps;

/** Maps the 1-based type ids of a package to their names. */
public final class TypeNameTable {

  private final Int2ReferenceMap<String> names;

  private TypeNameTable(Int2ReferenceMap<String> names) {
    this.names = names;
  }

  /**
   * Decodes every entry of the package's type string pool. Entry {@code i} names type id {@code i +
   * 1}.
   *
   * @throws StringPoolDecodingException if any type name cannot be decoded.
   */
  public static TypeNameTable build(ResTablePackage resTablePackage, PooledStringDecoder decoder) {
    ResStringPool typeStrings = resTablePackage.getTypeStrings();
    Int2ReferenceMap<String> names = new Int2ReferenceLinkedOpenHashMap<>(typeStrings.size());
    for (int i = 0; i < typeStrings.size(); i++) {
      names.put(i + 1, decoder.decode(typeStrings, i));
    }
    return new TypeNameTable(Int2ReferenceMaps.unmodifiable(names));
  }

  /** Returns the name of {@code typeId}, or null if it is outside {@code [1, size()]}. */
  public String lookup(int typeId) {
    return names.get(typeId);
  }

  public int size() {
    return names.size();
  }

  public void forEach(IntObjConsumer<String> consumer) {
    Int2ReferenceMaps.fastForEach(
        names, entry -> consumer.accept(entry.getIntKey(), entry.getValue()));
  }
}
