// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import com.android.tools.arsc.errors.ResourceTableFormatError;
import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.origin.PathOrigin;
import com.google.common.primitives.ImmutableIntArray;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a compiled resource table (resources.arsc) into a {@link ResTable}.
 *
 * <p>Only the parts needed to name resources are decoded: package headers, the type and key string
 * pools, and the headers of type spec and type chunks. Entry values and configurations are skipped.
 */
public class ArscDecoder {

  private static final int TABLE_HEADER_SIZE = 12;
  private static final int STRING_POOL_HEADER_SIZE = 28;
  private static final int PACKAGE_HEADER_SIZE = 284;
  private static final int TYPE_SPEC_HEADER_SIZE = 16;
  private static final int TYPE_HEADER_SIZE = 20;

  private final byte[] data;
  private final ByteBuffer buffer;
  private final Origin origin;

  private ArscDecoder(byte[] data, Origin origin) {
    this.data = data;
    this.buffer = ResChunk.wrap(data);
    this.origin = origin;
  }

  public static ResTable decode(Path path) throws IOException {
    return decode(Files.readAllBytes(path), new PathOrigin(path));
  }

  public static ResTable decode(byte[] data, Origin origin) {
    return new ArscDecoder(data, origin).decodeTable();
  }

  private ResTable decodeTable() {
    ChunkHeader table = readChunkHeader(0, data.length);
    expectChunk(table, ResChunk.CHUNK_RESOURCE_TABLE, TABLE_HEADER_SIZE);
    int packageCount = readSize(table.offset + 8, "package count");
    ResTable.Builder builder = ResTable.builder();
    boolean seenGlobalStrings = false;
    int packagesRead = 0;
    int offset = table.offset + table.headerSize;
    while (offset < table.end()) {
      ChunkHeader chunk = readChunkHeader(offset, table.end());
      if (chunk.type == ResChunk.CHUNK_STRING_POOL && !seenGlobalStrings) {
        builder.setGlobalStrings(decodeStringPool(chunk));
        seenGlobalStrings = true;
      } else if (chunk.type == ResChunk.CHUNK_RES_TABLE_PACKAGE) {
        builder.addPackage(decodePackage(chunk));
        packagesRead++;
      }
      offset = chunk.end();
    }
    if (packagesRead != packageCount) {
      throw error(
          "Resource table declares " + packageCount + " packages but contains " + packagesRead);
    }
    return builder.build();
  }

  private ResStringPool decodeStringPool(ChunkHeader chunk) {
    expectChunk(chunk, ResChunk.CHUNK_STRING_POOL, STRING_POOL_HEADER_SIZE);
    int stringCount = readSize(chunk.offset + 8, "string count");
    int styleCount = readSize(chunk.offset + 12, "style count");
    int flags = buffer.getInt(chunk.offset + 16);
    int stringsStart = readSize(chunk.offset + 20, "strings start");
    int stylesStart = readSize(chunk.offset + 24, "styles start");
    ResStringPool.Header header =
        new ResStringPool.Header(stringCount, styleCount, flags, stringsStart);
    int indexStart = chunk.offset + chunk.headerSize;
    if ((long) indexStart + 4L * stringCount > chunk.end()) {
      throw error("String pool index of " + stringCount + " entries exceeds its chunk");
    }
    int limit = styleCount > 0 && stylesStart > 0 ? chunk.offset + stylesStart : chunk.end();
    if (limit > chunk.end()) {
      throw error("String pool styles start beyond the end of the chunk");
    }
    StringPoolEncoding encoding = StringPoolEncoding.fromFlags(flags);
    List<byte[]> strings = new ArrayList<>(stringCount);
    for (int i = 0; i < stringCount; i++) {
      long start =
          (long) chunk.offset + stringsStart + readSize(indexStart + 4 * i, "string offset");
      if (start >= limit) {
        throw error("String pool entry " + i + " starts beyond the string data");
      }
      StringPoolEntryEnvelope envelope =
          StringPoolEntryEnvelope.parse(data, (int) start, limit, encoding);
      if (envelope == null) {
        throw error("String pool entry " + i + " is truncated");
      }
      strings.add(Arrays.copyOfRange(data, (int) start, (int) start + envelope.getTotalSize()));
    }
    return new ResStringPool(header, strings);
  }

  private ResTablePackage decodePackage(ChunkHeader chunk) {
    expectChunk(chunk, ResChunk.CHUNK_RES_TABLE_PACKAGE, PACKAGE_HEADER_SIZE);
    int id = readSize(chunk.offset + 8, "package id");
    if (id > 0xff) {
      throw error("Package id " + id + " at offset " + chunk.offset + " does not fit in 8 bits");
    }
    int nameOffset = chunk.offset + 12;
    int typeStringsOffset = readSize(nameOffset + ResChunk.PACKAGE_NAME_SIZE, "type strings");
    int keyStringsOffset = readSize(nameOffset + ResChunk.PACKAGE_NAME_SIZE + 8, "key strings");
    ResTablePackage.Builder builder =
        ResTablePackage.builder()
            .setId(id)
            .setRawName(
                Arrays.copyOfRange(data, nameOffset, nameOffset + ResChunk.PACKAGE_NAME_SIZE))
            .setTypeStringsOffset(typeStringsOffset)
            .setKeyStringsOffset(keyStringsOffset);
    if (typeStringsOffset != 0) {
      builder.setTypeStrings(
          decodeStringPool(readChunkHeader(chunk.offset + typeStringsOffset, chunk.end())));
    }
    if (keyStringsOffset != 0) {
      builder.setKeyStrings(
          decodeStringPool(readChunkHeader(chunk.offset + keyStringsOffset, chunk.end())));
    }
    ResTableTypeSpec currentSpec = null;
    List<ResTableType> currentTypes = new ArrayList<>();
    int offset = chunk.offset + chunk.headerSize;
    while (offset < chunk.end()) {
      ChunkHeader child = readChunkHeader(offset, chunk.end());
      if (child.type == ResChunk.CHUNK_RES_TABLE_TYPE_SPEC) {
        if (currentSpec != null) {
          builder.addType(ResTableTypeGroup.create(currentSpec, currentTypes));
          currentTypes = new ArrayList<>();
        }
        currentSpec = decodeTypeSpec(child);
      } else if (child.type == ResChunk.CHUNK_RES_TABLE_TYPE) {
        ResTableType type = decodeType(child);
        if (currentSpec == null || currentSpec.getHeader().getId() != type.getHeader().getId()) {
          throw error(
              "Type chunk for type "
                  + type.getHeader().getId()
                  + " is not preceded by its type spec");
        }
        currentTypes.add(type);
      }
      // String pools were read through the header offsets, other chunks carry nothing we need.
      offset = child.end();
    }
    if (currentSpec != null) {
      builder.addType(ResTableTypeGroup.create(currentSpec, currentTypes));
    }
    return builder.build();
  }

  private ResTableTypeSpec decodeTypeSpec(ChunkHeader chunk) {
    expectChunk(chunk, ResChunk.CHUNK_RES_TABLE_TYPE_SPEC, TYPE_SPEC_HEADER_SIZE);
    int id = readU8(chunk.offset + 8);
    int entryCount = readSize(chunk.offset + 12, "entry count");
    int flagsStart = chunk.offset + chunk.headerSize;
    if ((long) flagsStart + 4L * entryCount > chunk.end()) {
      throw error("Type spec " + id + " declares more entries than its chunk holds");
    }
    ImmutableIntArray.Builder entryFlags = ImmutableIntArray.builder(entryCount);
    for (int i = 0; i < entryCount; i++) {
      entryFlags.add(buffer.getInt(flagsStart + 4 * i));
    }
    return new ResTableTypeSpec(id, entryCount, entryFlags.build());
  }

  private ResTableType decodeType(ChunkHeader chunk) {
    expectChunk(chunk, ResChunk.CHUNK_RES_TABLE_TYPE, TYPE_HEADER_SIZE);
    return new ResTableType(
        readU8(chunk.offset + 8),
        readU8(chunk.offset + 9),
        readSize(chunk.offset + 12, "entry count"));
  }

  private ChunkHeader readChunkHeader(int offset, int limit) {
    if (offset < 0 || (long) offset + ResChunk.CHUNK_HEADER_SIZE > limit) {
      throw error("Truncated chunk header at offset " + offset);
    }
    int type = buffer.getShort(offset) & 0xffff;
    int headerSize = buffer.getShort(offset + 2) & 0xffff;
    long size = Integer.toUnsignedLong(buffer.getInt(offset + 4));
    if (headerSize < ResChunk.CHUNK_HEADER_SIZE || size < headerSize) {
      throw error("Invalid " + ResChunk.nameOf(type) + " chunk header at offset " + offset);
    }
    if (offset + size > limit) {
      throw error(
          ResChunk.nameOf(type)
              + " chunk at offset "
              + offset
              + " of size "
              + size
              + " exceeds its parent");
    }
    return new ChunkHeader(offset, type, headerSize, (int) size);
  }

  private void expectChunk(ChunkHeader chunk, int type, int minimumHeaderSize) {
    if (chunk.type != type) {
      throw error(
          "Expected "
              + ResChunk.nameOf(type)
              + " chunk at offset "
              + chunk.offset
              + ", found "
              + ResChunk.nameOf(chunk.type));
    }
    if (chunk.headerSize < minimumHeaderSize) {
      throw error(ResChunk.nameOf(type) + " header at offset " + chunk.offset + " is too small");
    }
  }

  private int readU8(int offset) {
    return data[offset] & 0xff;
  }

  private int readSize(int offset, String what) {
    long value = Integer.toUnsignedLong(buffer.getInt(offset));
    if (value > Integer.MAX_VALUE) {
      throw error("Value of " + what + " at offset " + offset + " is out of range: " + value);
    }
    return (int) value;
  }

  private ResourceTableFormatError error(String message) {
    return new ResourceTableFormatError(message, origin);
  }

  private static class ChunkHeader {

    final int offset;
    final int type;
    final int headerSize;
    final int size;

    ChunkHeader(int offset, int type, int headerSize, int size) {
      this.offset = offset;
      this.type = type;
      this.headerSize = headerSize;
      this.size = size;
    }

    int end() {
      return offset + size;
    }
  }
}
