// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.Objects;

/** The package, type and key names of a resolved resource identifier. */
public final class ResolvedResourceName {

  @Expose
  @SerializedName("package")
  private final String packageName;

  @Expose
  @SerializedName("type")
  private final String typeName;

  @Expose
  @SerializedName("key")
  private final String keyName;

  public ResolvedResourceName(String packageName, String typeName, String keyName) {
    this.packageName = packageName;
    this.typeName = typeName;
    this.keyName = keyName;
  }

  public String getPackageName() {
    return packageName;
  }

  public String getTypeName() {
    return typeName;
  }

  public String getKeyName() {
    return keyName;
  }

  /** Returns the name as written in Java source, e.g. {@code com.example.R.string.app_name}. */
  public String toQualifiedName() {
    return packageName + ".R." + typeName + "." + keyName;
  }

  /** Returns the name as written in resource XML, e.g. {@code @com.example:string/app_name}. */
  public String toXmlReference() {
    return "@" + packageName + ":" + typeName + "/" + keyName;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ResolvedResourceName)) {
      return false;
    }
    ResolvedResourceName other = (ResolvedResourceName) obj;
    return packageName.equals(other.packageName)
        && typeName.equals(other.typeName)
        && keyName.equals(other.keyName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(packageName, typeName, keyName);
  }

  @Override
  public String toString() {
    return toQualifiedName();
  }
}
