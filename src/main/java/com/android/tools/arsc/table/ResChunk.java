// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Chunk types and helpers for the binary resource table format.
 *
 * <p>Every chunk starts with a header of: u16 chunkType, u16 headerSize, u32 chunkSize. All values
 * are little endian.
 */
public final class ResChunk {

  public static final int CHUNK_HEADER_SIZE = 8;

  public static final int CHUNK_NULL = 0x0000;
  public static final int CHUNK_STRING_POOL = 0x0001;
  public static final int CHUNK_RESOURCE_TABLE = 0x0002;
  public static final int CHUNK_XML_TREE = 0x0003;

  public static final int CHUNK_RES_TABLE_PACKAGE = 0x0200;
  public static final int CHUNK_RES_TABLE_TYPE = 0x0201;
  public static final int CHUNK_RES_TABLE_TYPE_SPEC = 0x0202;
  public static final int CHUNK_RES_TABLE_LIBRARY = 0x0203;
  public static final int CHUNK_RES_TABLE_OVERLAYABLE = 0x0204;
  public static final int CHUNK_RES_TABLE_OVERLAYABLE_POLICY = 0x0205;
  public static final int CHUNK_RES_TABLE_STAGED_ALIAS = 0x0206;

  /** Size in bytes of the fixed package name field, 128 UTF-16 code units. */
  public static final int PACKAGE_NAME_SIZE = 256;

  private ResChunk() {}

  public static ByteBuffer wrap(byte[] data) {
    ByteBuffer buf = ByteBuffer.wrap(data);
    buf.order(ByteOrder.LITTLE_ENDIAN);
    return buf;
  }

  public static String nameOf(int chunkType) {
    switch (chunkType) {
      case CHUNK_NULL:
        return "NULL";
      case CHUNK_STRING_POOL:
        return "STRING_POOL";
      case CHUNK_RESOURCE_TABLE:
        return "TABLE";
      case CHUNK_XML_TREE:
        return "XML";
      case CHUNK_RES_TABLE_PACKAGE:
        return "TABLE_PACKAGE";
      case CHUNK_RES_TABLE_TYPE:
        return "TABLE_TYPE";
      case CHUNK_RES_TABLE_TYPE_SPEC:
        return "TABLE_TYPE_SPEC";
      case CHUNK_RES_TABLE_LIBRARY:
        return "TABLE_LIBRARY";
      case CHUNK_RES_TABLE_OVERLAYABLE:
        return "TABLE_OVERLAYABLE";
      case CHUNK_RES_TABLE_OVERLAYABLE_POLICY:
        return "TABLE_OVERLAYABLE_POLICY";
      case CHUNK_RES_TABLE_STAGED_ALIAS:
        return "TABLE_STAGED_ALIAS";
      default:
        return "0x" + Integer.toHexString(chunkType);
    }
  }
}
