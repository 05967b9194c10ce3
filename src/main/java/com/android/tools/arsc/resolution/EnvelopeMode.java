// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

/** How {@link PooledStringDecoder} locates the text inside a raw string pool entry. */
public enum EnvelopeMode {
  /** Strip a 2 byte prefix and the terminator, regardless of the declared length. */
  FIXED("fixed"),
  /** Read the length prefix of the entry and decode exactly the declared payload. */
  DECLARED_LENGTH("declared");

  private final String flagValue;

  EnvelopeMode(String flagValue) {
    this.flagValue = flagValue;
  }

  public String getFlagValue() {
    return flagValue;
  }

  public static EnvelopeMode parse(String value) {
    for (EnvelopeMode mode : values()) {
      if (mode.flagValue.equals(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException(
        "Unknown string envelope mode: " + value + ", expected fixed or declared");
  }
}
