// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/** Encoding of the entries of a string pool, selected by the pool's {@code UTF8_FLAG}. */
public enum StringPoolEncoding {
  UTF8(StandardCharsets.UTF_8, 1),
  UTF16(StandardCharsets.UTF_16LE, 2);

  private final Charset charset;
  private final int terminatorSize;

  StringPoolEncoding(Charset charset, int terminatorSize) {
    this.charset = charset;
    this.terminatorSize = terminatorSize;
  }

  public Charset getCharset() {
    return charset;
  }

  /** Number of bytes of the NUL terminator following the payload. */
  public int getTerminatorSize() {
    return terminatorSize;
  }

  public static StringPoolEncoding fromFlags(int flags) {
    return (flags & ResStringPool.UTF8_FLAG) != 0 ? UTF8 : UTF16;
  }
}
