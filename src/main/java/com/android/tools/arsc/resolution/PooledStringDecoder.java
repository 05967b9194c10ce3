// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.android.tools.arsc.table.ResStringPool;
import com.android.tools.arsc.table.StringPoolEncoding;
import com.android.tools.arsc.table.StringPoolEntryEnvelope;
import com.google.common.base.CharMatcher;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/** Decodes raw string pool entries into text. Instances are immutable. */
public class PooledStringDecoder {

  private static final int FIXED_PREFIX_SIZE = 2;
  private static final CharMatcher NUL = CharMatcher.is('\0');

  private final EnvelopeMode envelopeMode;

  public PooledStringDecoder(EnvelopeMode envelopeMode) {
    this.envelopeMode = envelopeMode;
  }

  public static PooledStringDecoder create() {
    return new PooledStringDecoder(EnvelopeMode.DECLARED_LENGTH);
  }

  public EnvelopeMode getEnvelopeMode() {
    return envelopeMode;
  }

  public String decode(ResStringPool pool, int index) {
    return decode(pool.getRawEntry(index), pool.getEncoding());
  }

  /**
   * Decodes one raw entry, length prefix and terminator included. Leading and trailing NUL
   * characters are removed from the result.
   *
   * @throws StringPoolDecodingException if the entry is too short for its envelope or the payload
   *     is not valid text in the given encoding.
   */
  public String decode(byte[] rawEntry, StringPoolEncoding encoding) {
    int start;
    int length;
    if (envelopeMode == EnvelopeMode.FIXED) {
      start = FIXED_PREFIX_SIZE;
      length = rawEntry.length - FIXED_PREFIX_SIZE - encoding.getTerminatorSize();
      if (length < 0) {
        throw new StringPoolDecodingException(
            "String pool entry of " + rawEntry.length + " bytes is shorter than its envelope");
      }
      if (encoding == StringPoolEncoding.UTF16 && length % 2 != 0) {
        throw new StringPoolDecodingException(
            "UTF-16 string pool entry has an odd payload size of " + length + " bytes");
      }
    } else {
      StringPoolEntryEnvelope envelope =
          StringPoolEntryEnvelope.parse(rawEntry, 0, rawEntry.length, encoding);
      if (envelope == null) {
        throw new StringPoolDecodingException(
            "Declared length of string pool entry exceeds its " + rawEntry.length + " bytes");
      }
      start = envelope.getPrefixSize();
      length = envelope.getPayloadSize();
    }
    return NUL.trimFrom(decodeStrict(rawEntry, start, length, encoding.getCharset()));
  }

  /**
   * Decodes the name field of a package header: UTF-16LE text up to the first NUL code unit.
   *
   * @throws StringPoolDecodingException if the field has no terminator or is not valid UTF-16.
   */
  public static String decodePackageName(byte[] rawName) {
    for (int i = 0; i + 1 < rawName.length; i += 2) {
      if (rawName[i] == 0 && rawName[i + 1] == 0) {
        return decodeStrict(rawName, 0, i, StandardCharsets.UTF_16LE);
      }
    }
    throw new StringPoolDecodingException("Package name is not NUL terminated");
  }

  private static String decodeStrict(byte[] bytes, int start, int length, Charset charset) {
    try {
      return charset
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes, start, length))
          .toString();
    } catch (CharacterCodingException e) {
      throw new StringPoolDecodingException("Invalid " + charset.name() + " string data", e);
    }
  }
}
