// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

/**
 * Helpers for 32-bit resource identifiers of the form 0xPPTTEEEE, where PP is the package id, TT
 * the 1-based type id and EEEE the 0-based entry id within the type.
 */
public final class ResourceId {

  private static final int PACKAGE_SHIFT = 24;
  private static final int TYPE_SHIFT = 16;
  private static final int PACKAGE_MASK = 0xff000000;
  private static final int TYPE_MASK = 0x00ff0000;
  private static final int ENTRY_MASK = 0x0000ffff;

  private ResourceId() {}

  public static int getPackageId(int resourceId) {
    return (resourceId & PACKAGE_MASK) >>> PACKAGE_SHIFT;
  }

  public static int getTypeId(int resourceId) {
    return (resourceId & TYPE_MASK) >>> TYPE_SHIFT;
  }

  public static int getEntryId(int resourceId) {
    return resourceId & ENTRY_MASK;
  }

  public static int compose(int packageId, int typeId, int entryId) {
    Preconditions.checkArgument(packageId >= 0 && packageId <= 0xff, "Invalid package id");
    Preconditions.checkArgument(typeId >= 0 && typeId <= 0xff, "Invalid type id");
    Preconditions.checkArgument(entryId >= 0 && entryId <= 0xffff, "Invalid entry id");
    return (packageId << PACKAGE_SHIFT) | (typeId << TYPE_SHIFT) | entryId;
  }

  public static String toHexString(int resourceId) {
    return String.format("0x%08x", resourceId);
  }

  /**
   * Parses an identifier literal. Accepts the prefixes {@code 0x}, {@code 0o} and {@code 0b}
   * (case insensitive) and plain decimal. A decimal literal may only start with 0 if all its digits
   * are 0. The value has to fit in 32 unsigned bits.
   *
   * @throws NumberFormatException if the text is not such a literal.
   */
  public static int parse(String text) {
    String literal = text.trim();
    int radix = 10;
    String digits = literal;
    if (literal.length() > 1 && literal.charAt(0) == '0') {
      char prefix = Character.toLowerCase(literal.charAt(1));
      if (prefix == 'x') {
        radix = 16;
      } else if (prefix == 'o') {
        radix = 8;
      } else if (prefix == 'b') {
        radix = 2;
      } else if (CharMatcher.is('0').matchesAllOf(literal)) {
        return 0;
      } else {
        throw new NumberFormatException("Leading zeros are not allowed: " + text);
      }
      digits = literal.substring(2);
    }
    if (digits.isEmpty() || digits.length() > 32) {
      throw new NumberFormatException("Invalid resource id: " + text);
    }
    for (int i = 0; i < digits.length(); i++) {
      if (Character.digit(digits.charAt(i), radix) < 0) {
        throw new NumberFormatException("Invalid resource id: " + text);
      }
    }
    long value = Long.parseLong(digits, radix);
    if (value > 0xffffffffL) {
      throw new NumberFormatException("Resource id does not fit in 32 bits: " + text);
    }
    return (int) value;
  }
}
