// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.arsc.model;

import com.android.tools.arsc.resolution.KeyRange;
import com.android.tools.arsc.resolution.KeyRangeResolver;
import com.android.tools.arsc.resolution.ResourceId;
import com.android.tools.arsc.table.ResTableTypeGroup;
import com.android.tools.arsc.utils.IntObjConsumer;
import java.util.List;

public class TypeModel {

  private final PackageModel parent;
  private final int typeId;
  private final String name;

  public TypeModel(PackageModel parent, int typeId, String name) {
    this.parent = parent;
    this.typeId = typeId;
    this.name = name;
  }

  public int getId() {
    return typeId;
  }

  public String getName() {
    return name;
  }

  /** True if the package has a type spec for this type, i.e., it declares entries. */
  public boolean hasTypeSpec() {
    return typeId <= parent.getPackage().getTypes().size();
  }

  public int getEntryCount() {
    if (!hasTypeSpec()) {
      return 0;
    }
    ResTableTypeGroup group = parent.getPackage().getTypes().get(typeId - 1);
    return group.getPrimary().getHeader().getEntryCount();
  }

  public KeyRange getKeyRange() {
    return KeyRangeResolver.getKeyRange(parent.getPackage(), typeId);
  }

  public List<String> getKeys() {
    return KeyRangeResolver.getKeys(parent.getPackage(), getKeyRange(), parent.getDecoder());
  }

  /** Calls the consumer with the resource id and key name of every key of this type. */
  public void forEachKey(IntObjConsumer<String> onResourceIdToKey) {
    if (!hasTypeSpec() || typeId > 0xff) {
      return;
    }
    List<String> keys = getKeys();
    for (int entryId = 0; entryId < keys.size() && entryId <= 0xffff; entryId++) {
      onResourceIdToKey.accept(
          ResourceId.compose(parent.getId(), typeId, entryId), keys.get(entryId));
    }
  }
}
