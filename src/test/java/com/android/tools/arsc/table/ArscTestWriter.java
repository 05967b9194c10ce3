// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Serializes a {@link ResTable} into the binary resources.arsc layout. Raw string pool entries are
 * written as they are, so tables holding malformed entries can be written too.
 */
public class ArscTestWriter {

  private static final int TABLE_HEADER_SIZE = 12;
  private static final int STRING_POOL_HEADER_SIZE = 28;
  // aapt2 writes the 4 byte typeIdOffset field after lastPublicKey.
  private static final int PACKAGE_HEADER_SIZE = 288;
  private static final int TYPE_SPEC_HEADER_SIZE = 16;
  private static final int TYPE_HEADER_SIZE = 20;
  private static final int NO_ENTRY = 0xffffffff;

  private ArscTestWriter() {}

  public static byte[] write(ResTable table) {
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    writeBytes(body, writeStringPool(table.getGlobalStrings()));
    for (ResTablePackage resTablePackage : table.getPackages()) {
      writeBytes(body, writePackage(resTablePackage));
    }
    ByteBuffer header = allocate(TABLE_HEADER_SIZE);
    header.putShort((short) ResChunk.CHUNK_RESOURCE_TABLE);
    header.putShort((short) TABLE_HEADER_SIZE);
    header.putInt(TABLE_HEADER_SIZE + body.size());
    header.putInt(table.getPackages().size());
    return concat(header.array(), body.toByteArray());
  }

  public static byte[] writeStringPool(ResStringPool pool) {
    ByteArrayOutputStream strings = new ByteArrayOutputStream();
    ByteBuffer offsets = allocate(4 * pool.size());
    for (int i = 0; i < pool.size(); i++) {
      offsets.putInt(strings.size());
      writeBytes(strings, pool.getRawEntry(i));
    }
    while (strings.size() % 4 != 0) {
      strings.write(0);
    }
    int stringsStart = STRING_POOL_HEADER_SIZE + offsets.capacity();
    ByteBuffer header = allocate(STRING_POOL_HEADER_SIZE);
    header.putShort((short) ResChunk.CHUNK_STRING_POOL);
    header.putShort((short) STRING_POOL_HEADER_SIZE);
    header.putInt(stringsStart + strings.size());
    header.putInt(pool.size());
    header.putInt(0);
    header.putInt(pool.getHeader().getFlags());
    header.putInt(pool.size() == 0 ? 0 : stringsStart);
    header.putInt(0);
    return concat(header.array(), offsets.array(), strings.toByteArray());
  }

  private static byte[] writePackage(ResTablePackage resTablePackage) {
    byte[] typeStrings = writeStringPool(resTablePackage.getTypeStrings());
    byte[] keyStrings = writeStringPool(resTablePackage.getKeyStrings());
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    writeBytes(body, typeStrings);
    writeBytes(body, keyStrings);
    for (ResTableTypeGroup group : resTablePackage.getTypes()) {
      for (ResTableTypeRecord typeRecord : group.getRecords()) {
        writeBytes(
            body,
            typeRecord.isTypeSpec()
                ? writeTypeSpec(typeRecord.asTypeSpec())
                : writeType(typeRecord.asType()));
      }
    }
    ByteBuffer header = allocate(PACKAGE_HEADER_SIZE);
    header.putShort((short) ResChunk.CHUNK_RES_TABLE_PACKAGE);
    header.putShort((short) PACKAGE_HEADER_SIZE);
    header.putInt(PACKAGE_HEADER_SIZE + body.size());
    header.putInt(resTablePackage.getId());
    header.put(resTablePackage.getHeader().getName(), 0, ResChunk.PACKAGE_NAME_SIZE);
    header.putInt(PACKAGE_HEADER_SIZE);
    header.putInt(resTablePackage.getTypeStrings().size());
    header.putInt(PACKAGE_HEADER_SIZE + typeStrings.length);
    header.putInt(resTablePackage.getKeyStrings().size());
    header.putInt(0);
    return concat(header.array(), body.toByteArray());
  }

  private static byte[] writeTypeSpec(ResTableTypeSpec typeSpec) {
    int entryCount = typeSpec.getHeader().getEntryCount();
    ByteBuffer chunk = allocate(TYPE_SPEC_HEADER_SIZE + 4 * entryCount);
    chunk.putShort((short) ResChunk.CHUNK_RES_TABLE_TYPE_SPEC);
    chunk.putShort((short) TYPE_SPEC_HEADER_SIZE);
    chunk.putInt(chunk.capacity());
    chunk.put((byte) typeSpec.getHeader().getId());
    chunk.put((byte) 0);
    chunk.putShort((short) 0);
    chunk.putInt(entryCount);
    for (int i = 0; i < entryCount; i++) {
      chunk.putInt(i < typeSpec.getEntryFlags().length() ? typeSpec.getEntryFlags().get(i) : 0);
    }
    return chunk.array();
  }

  private static byte[] writeType(ResTableType type) {
    int entryCount = type.getHeader().getEntryCount();
    ByteBuffer chunk = allocate(TYPE_HEADER_SIZE + 4 * entryCount);
    chunk.putShort((short) ResChunk.CHUNK_RES_TABLE_TYPE);
    chunk.putShort((short) TYPE_HEADER_SIZE);
    chunk.putInt(chunk.capacity());
    chunk.put((byte) type.getHeader().getId());
    chunk.put((byte) type.getFlags());
    chunk.putShort((short) 0);
    chunk.putInt(entryCount);
    chunk.putInt(chunk.capacity());
    // Every entry is absent, the table only carries names.
    for (int i = 0; i < entryCount; i++) {
      chunk.putInt(NO_ENTRY);
    }
    return chunk.array();
  }

  private static ByteBuffer allocate(int size) {
    return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
  }

  private static void writeBytes(ByteArrayOutputStream stream, byte[] bytes) {
    stream.write(bytes, 0, bytes.length);
  }

  private static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      writeBytes(stream, part);
    }
    return stream.toByteArray();
  }
}
