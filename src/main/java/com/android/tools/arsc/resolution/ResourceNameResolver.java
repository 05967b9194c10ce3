// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import static com.android.tools.arsc.resolution.ResourceNameResolutionResult.failure;
import static com.android.tools.arsc.resolution.ResourceNameResolutionResult.success;

import com.android.tools.arsc.table.ResTable;
import com.android.tools.arsc.table.ResTablePackage;
import java.util.List;

/**
 * Resolves resource identifiers to their package, type and key names.
 *
 * <p>The resolver holds no state besides its configuration and never modifies the table, so a
 * single instance can resolve identifiers against a shared table from several threads.
 */
public class ResourceNameResolver {

  private final PooledStringDecoder decoder;
  private final boolean validateIdentifiers;

  private ResourceNameResolver(PooledStringDecoder decoder, boolean validateIdentifiers) {
    this.decoder = decoder;
    this.validateIdentifiers = validateIdentifiers;
  }

  public static ResourceNameResolver create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public PooledStringDecoder getDecoder() {
    return decoder;
  }

  public ResourceNameResolutionResult resolve(ResTable table, int resourceId) {
    return resolve(
        table,
        ResourceId.getPackageId(resourceId),
        ResourceId.getTypeId(resourceId),
        ResourceId.getEntryId(resourceId));
  }

  public ResourceNameResolutionResult resolve(
      ResTable table, int packageId, int typeId, int entryId) {
    int resourceId = ResourceId.compose(packageId, typeId, entryId);
    if (validateIdentifiers) {
      if (packageId == 0) {
        return failure(resourceId, FailureKind.MALFORMED_IDENTIFIER, "Package id 0 is reserved");
      }
      if (typeId == 0) {
        return failure(resourceId, FailureKind.MALFORMED_IDENTIFIER, "Type id 0 is reserved");
      }
    }

    ResTablePackage resTablePackage = table.lookupPackage(packageId);
    if (resTablePackage == null) {
      return failure(
          resourceId,
          FailureKind.PACKAGE_NOT_FOUND,
          "Package with id 0x" + Integer.toHexString(packageId) + " not found");
    }

    TypeNameTable typeNames;
    try {
      typeNames = TypeNameTable.build(resTablePackage, decoder);
    } catch (StringPoolDecodingException e) {
      return failure(
          resourceId, FailureKind.STRING_DECODE_ERROR, "Invalid type name: " + e.getMessage());
    }
    String typeName = typeNames.lookup(typeId);
    if (typeName == null) {
      return failure(
          resourceId,
          FailureKind.TYPE_NOT_FOUND,
          "Type with id "
              + typeId
              + " not found, package 0x"
              + Integer.toHexString(packageId)
              + " has "
              + typeNames.size()
              + " types");
    }

    KeyRange keyRange;
    try {
      keyRange = KeyRangeResolver.getKeyRange(resTablePackage, typeId);
    } catch (TypeGroupNotFoundException e) {
      return failure(resourceId, FailureKind.TYPE_NOT_FOUND, e.getMessage());
    }
    List<byte[]> keys = KeyRangeResolver.getRawKeys(resTablePackage, keyRange);
    if (entryId >= keys.size()) {
      return failure(
          resourceId,
          FailureKind.KEY_INDEX_OUT_OF_RANGE,
          "Entry id "
              + entryId
              + " is outside the "
              + keys.size()
              + " keys of type "
              + typeName
              + " at key range "
              + keyRange);
    }

    try {
      String keyName =
          decoder.decode(keys.get(entryId), resTablePackage.getKeyStrings().getEncoding());
      String packageName =
          PooledStringDecoder.decodePackageName(resTablePackage.getHeader().getName());
      return success(resourceId, new ResolvedResourceName(packageName, typeName, keyName));
    } catch (StringPoolDecodingException e) {
      return failure(resourceId, FailureKind.STRING_DECODE_ERROR, e.getMessage());
    }
  }

  public static class Builder {

    private EnvelopeMode envelopeMode = EnvelopeMode.DECLARED_LENGTH;
    private boolean validateIdentifiers = false;

    private Builder() {}

    public Builder setEnvelopeMode(EnvelopeMode envelopeMode) {
      this.envelopeMode = envelopeMode;
      return this;
    }

    /** Reject package id 0 and type id 0 up front instead of failing the lookups. */
    public Builder setValidateIdentifiers(boolean validateIdentifiers) {
      this.validateIdentifiers = validateIdentifiers;
      return this;
    }

    public ResourceNameResolver build() {
      return new ResourceNameResolver(new PooledStringDecoder(envelopeMode), validateIdentifiers);
    }
  }
}
