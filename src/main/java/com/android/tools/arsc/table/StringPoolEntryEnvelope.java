// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

/**
 * The length prefix, payload and terminator that frame a single string pool entry.
 *
 * <pre>
 * UTF-8:  len16 (1-2 bytes) len8 (1-2 bytes) payload[len8] 0x00
 * UTF-16: len16 (1-2 units) payload[len16 * 2] 0x0000
 * </pre>
 *
 * A length uses its second byte (UTF-8) or unit (UTF-16) when the high bit of the first is set.
 */
public class StringPoolEntryEnvelope {

  private final int prefixSize;
  private final int payloadSize;
  private final int terminatorSize;

  private StringPoolEntryEnvelope(int prefixSize, int payloadSize, int terminatorSize) {
    this.prefixSize = prefixSize;
    this.payloadSize = payloadSize;
    this.terminatorSize = terminatorSize;
  }

  /**
   * Reads the envelope of the entry starting at {@code offset}.
   *
   * @return the envelope, or null if the prefix or the declared payload does not fit before {@code
   *     limit}.
   */
  public static StringPoolEntryEnvelope parse(
      byte[] data, int offset, int limit, StringPoolEncoding encoding) {
    int position = offset;
    int payloadSize;
    if (encoding == StringPoolEncoding.UTF8) {
      // The UTF-16 length is only informative, the payload is sized by the UTF-8 length.
      int utf16LengthSize = utf8LengthSize(data, position, limit);
      if (utf16LengthSize < 0) {
        return null;
      }
      position += utf16LengthSize;
      int utf8LengthSize = utf8LengthSize(data, position, limit);
      if (utf8LengthSize < 0) {
        return null;
      }
      payloadSize = readUtf8Length(data, position);
      position += utf8LengthSize;
    } else {
      if (position + 2 > limit) {
        return null;
      }
      int first = readU16(data, position);
      position += 2;
      int length;
      if ((first & 0x8000) != 0) {
        if (position + 2 > limit) {
          return null;
        }
        length = ((first & 0x7fff) << 16) | readU16(data, position);
        position += 2;
      } else {
        length = first;
      }
      payloadSize = length * 2;
    }
    int terminatorSize = encoding.getTerminatorSize();
    if (payloadSize < 0 || (long) position + payloadSize + terminatorSize > limit) {
      return null;
    }
    return new StringPoolEntryEnvelope(position - offset, payloadSize, terminatorSize);
  }

  private static int utf8LengthSize(byte[] data, int position, int limit) {
    if (position >= limit) {
      return -1;
    }
    if ((data[position] & 0x80) == 0) {
      return 1;
    }
    return position + 1 < limit ? 2 : -1;
  }

  private static int readUtf8Length(byte[] data, int position) {
    int first = data[position] & 0xff;
    if ((first & 0x80) != 0) {
      return ((first & 0x7f) << 8) | (data[position + 1] & 0xff);
    }
    return first;
  }

  private static int readU16(byte[] data, int position) {
    return (data[position] & 0xff) | ((data[position + 1] & 0xff) << 8);
  }

  public int getPrefixSize() {
    return prefixSize;
  }

  public int getPayloadSize() {
    return payloadSize;
  }

  public int getTerminatorSize() {
    return terminatorSize;
  }

  public int getTotalSize() {
    return prefixSize + payloadSize + terminatorSize;
  }
}
