// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.arsc.model;

import com.android.tools.arsc.resolution.PooledStringDecoder;
import com.android.tools.arsc.resolution.TypeNameTable;
import com.android.tools.arsc.table.ResTablePackage;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class PackageModel {

  private final ResTablePackage resTablePackage;
  private final PooledStringDecoder decoder;

  private List<TypeModel> types;

  public PackageModel(ResTablePackage resTablePackage, PooledStringDecoder decoder) {
    this.resTablePackage = resTablePackage;
    this.decoder = decoder;
  }

  public ResTablePackage getPackage() {
    return resTablePackage;
  }

  public int getId() {
    return resTablePackage.getId();
  }

  public String getName() {
    return PooledStringDecoder.decodePackageName(resTablePackage.getHeader().getName());
  }

  PooledStringDecoder getDecoder() {
    return decoder;
  }

  /** Types named by the type strings, in type id order. */
  public List<TypeModel> getTypes() {
    if (types == null) {
      ImmutableList.Builder<TypeModel> builder = ImmutableList.builder();
      TypeNameTable.build(resTablePackage, decoder)
          .forEach((typeId, name) -> builder.add(new TypeModel(this, typeId, name)));
      types = builder.build();
    }
    return types;
  }

  /** Returns the type with the given id, or null if the type strings do not name it. */
  public TypeModel getType(int typeId) {
    if (typeId < 1 || typeId > getTypes().size()) {
      return null;
    }
    return getTypes().get(typeId - 1);
  }

  public void forEachType(Consumer<TypeModel> consumer) {
    getTypes().forEach(consumer);
  }
}
