// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.arsc.model;

import com.android.tools.arsc.resolution.PooledStringDecoder;
import com.android.tools.arsc.table.ResTable;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * A named view on top of a decoded resource table to allow for structured iteration. The
 * underlying table has a setup where we have:
 *
 * <pre>
 * ResTable
 *  -> Package (id, name, type strings, key strings)
 *    -> Type group (type spec, type per configuration)
 *    -> ...
 *  -> ...
 * </pre>
 *
 * Every type group corresponds to one type id, whose name is the matching entry of the type
 * strings, and owns a contiguous slice of the key strings. Names are decoded lazily, when a model
 * is asked for them.
 */
public class ResourceTableModel {

  private final List<PackageModel> packages;

  public ResourceTableModel(ResTable resTable, PooledStringDecoder decoder) {
    packages =
        resTable.getPackages().stream()
            .map(resTablePackage -> new PackageModel(resTablePackage, decoder))
            .collect(Collectors.toList());
  }

  public void forEachPackage(Consumer<PackageModel> consumer) {
    packages.forEach(consumer);
  }

  /** Returns the first package with the given id, or null if there is none. */
  public PackageModel getPackage(int packageId) {
    for (PackageModel packageModel : packages) {
      if (packageModel.getId() == packageId) {
        return packageModel;
      }
    }
    return null;
  }

  public List<PackageModel> getPackages() {
    return packages;
  }
}
