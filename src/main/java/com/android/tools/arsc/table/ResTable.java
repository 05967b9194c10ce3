// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A decoded resource table. Instances are immutable and can be shared between threads resolving
 * identifiers concurrently.
 */
public final class ResTable {

  private final ResStringPool globalStrings;
  private final ImmutableList<ResTablePackage> packages;

  private ResTable(ResStringPool globalStrings, ImmutableList<ResTablePackage> packages) {
    this.globalStrings = globalStrings;
    this.packages = packages;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The value string pool shared by all packages. */
  public ResStringPool getGlobalStrings() {
    return globalStrings;
  }

  public List<ResTablePackage> getPackages() {
    return packages;
  }

  /** Returns the first package with the given id, or null if there is none. */
  public ResTablePackage lookupPackage(int packageId) {
    for (ResTablePackage resTablePackage : packages) {
      if (resTablePackage.getId() == packageId) {
        return resTablePackage;
      }
    }
    return null;
  }

  public static class Builder {

    private ResStringPool globalStrings = ResStringPool.empty();
    private final ImmutableList.Builder<ResTablePackage> packages = ImmutableList.builder();

    private Builder() {}

    public Builder setGlobalStrings(ResStringPool globalStrings) {
      this.globalStrings = globalStrings;
      return this;
    }

    public Builder addPackage(ResTablePackage resTablePackage) {
      packages.add(resTablePackage);
      return this;
    }

    public ResTable build() {
      return new ResTable(globalStrings, packages.build());
    }
  }
}
