// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.table;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.arsc.TestBase;
import com.android.tools.arsc.errors.ResourceTableFormatError;
import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.origin.PathOrigin;
import com.google.common.base.Strings;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ArscDecoderTest extends TestBase {

  // Table header followed by an empty global string pool.
  private static final int FIRST_PACKAGE_OFFSET = 12 + 28;

  @Parameter(0)
  public StringPoolEncoding encoding;

  @Parameters(name = "{0}")
  public static List<Object[]> data() {
    return buildParameters(StringPoolEncoding.values());
  }

  private ResourceTableTestBuilder builder() {
    return ResourceTableTestBuilder.simpleApp(encoding)
        .addPackage(0x02, "lib", p -> p.setEncoding(encoding).addType("attr", "a", "b", "c"));
  }

  @Test
  public void testDecode() {
    ResTable expected = builder().addGlobalString("value").build();
    ResTable decoded = decode(ArscTestWriter.write(expected));

    assertEquals(1, decoded.getGlobalStrings().size());
    assertArrayEquals(
        expected.getGlobalStrings().getRawEntry(0), decoded.getGlobalStrings().getRawEntry(0));
    assertEquals(expected.getPackages().size(), decoded.getPackages().size());
    for (int i = 0; i < expected.getPackages().size(); i++) {
      ResTablePackage expectedPackage = expected.getPackages().get(i);
      ResTablePackage decodedPackage = decoded.getPackages().get(i);
      assertEquals(expectedPackage.getId(), decodedPackage.getId());
      assertArrayEquals(
          expectedPackage.getHeader().getName(), decodedPackage.getHeader().getName());
      assertSame(encoding, decodedPackage.getKeyStrings().getEncoding());
      assertSame(encoding, decodedPackage.getTypeStrings().getEncoding());
      assertPoolEquals(expectedPackage.getTypeStrings(), decodedPackage.getTypeStrings());
      assertPoolEquals(expectedPackage.getKeyStrings(), decodedPackage.getKeyStrings());
      assertEquals(expectedPackage.getTypes().size(), decodedPackage.getTypes().size());
      for (int j = 0; j < expectedPackage.getTypes().size(); j++) {
        ResTableTypeGroup expectedGroup = expectedPackage.getTypes().get(j);
        ResTableTypeGroup decodedGroup = decodedPackage.getTypes().get(j);
        assertEquals(expectedGroup.getId(), decodedGroup.getId());
        assertTrue(decodedGroup.getPrimary().isTypeSpec());
        assertEquals(
            expectedGroup.getPrimary().getHeader().getEntryCount(),
            decodedGroup.getPrimary().getHeader().getEntryCount());
        assertEquals(
            expectedGroup.getPrimary().getHeader().getEntryCount(),
            decodedGroup.getTypeSpec().getEntryFlags().length());
        assertEquals(1, decodedGroup.getConfigurations().size());
        assertTrue(decodedGroup.getConfigurations().get(0).isType());
      }
      assertTrue(decodedPackage.getHeader().getTypeStrings() > 0);
      assertTrue(
          decodedPackage.getHeader().getKeyStrings()
              > decodedPackage.getHeader().getTypeStrings());
    }
  }

  private static void assertPoolEquals(ResStringPool expected, ResStringPool actual) {
    assertEquals(expected.size(), actual.size());
    for (int i = 0; i < expected.size(); i++) {
      assertArrayEquals(expected.getRawEntry(i), actual.getRawEntry(i));
    }
  }

  @Test
  public void testLongStringsKeepTheirEnvelope() {
    String longKey = Strings.repeat("k", 300);
    ResTable decoded =
        decode(
            ResourceTableTestBuilder.builder()
                .addPackage(
                    0x7f, "app", p -> p.setEncoding(encoding).addType("string", longKey, "x"))
                .buildBytes());
    ResStringPool keys = decoded.getPackages().get(0).getKeyStrings();
    assertArrayEquals(ResourceTableTestBuilder.encodeEntry(longKey, encoding), keys.getRawEntry(0));
    assertArrayEquals(ResourceTableTestBuilder.encodeEntry("x", encoding), keys.getRawEntry(1));
  }

  @Test
  public void testDecodeFromFile() throws Exception {
    Path path = writeTable(builder().buildBytes());
    ResTable decoded = ArscDecoder.decode(path);
    assertEquals(2, decoded.getPackages().size());
    assertEquals(0x02, decoded.lookupPackage(0x02).getId());
  }

  @Test
  public void testMissingFile() {
    Path path = temp.getRoot().toPath().resolve("missing.arsc");
    assertThrows(NoSuchFileException.class, () -> ArscDecoder.decode(path));
  }

  @Test
  public void testEmptyInput() {
    ResourceTableFormatError error =
        assertThrows(ResourceTableFormatError.class, () -> decode(new byte[0]));
    assertThat(error.getMessage(), containsString("Truncated chunk header"));
  }

  @Test
  public void testTruncatedInput() {
    byte[] bytes = builder().buildBytes();
    for (int length : new int[] {4, 12, FIRST_PACKAGE_OFFSET + 20, bytes.length - 1}) {
      assertThrows(ResourceTableFormatError.class, () -> decode(Arrays.copyOf(bytes, length)));
    }
  }

  @Test
  public void testNotAResourceTable() {
    byte[] bytes = builder().buildBytes();
    littleEndian(bytes).putShort(0, (short) ResChunk.CHUNK_XML_TREE);
    ResourceTableFormatError error =
        assertThrows(ResourceTableFormatError.class, () -> decode(bytes));
    assertThat(error.getMessage(), containsString("Expected TABLE chunk at offset 0, found XML"));
  }

  @Test
  public void testChunkSmallerThanHeader() {
    byte[] bytes = builder().buildBytes();
    littleEndian(bytes).putInt(FIRST_PACKAGE_OFFSET + 4, 4);
    assertThrows(ResourceTableFormatError.class, () -> decode(bytes));
  }

  @Test
  public void testPackageCountMismatch() {
    byte[] bytes = builder().buildBytes();
    littleEndian(bytes).putInt(8, 3);
    ResourceTableFormatError error =
        assertThrows(ResourceTableFormatError.class, () -> decode(bytes));
    assertThat(error.getMessage(), containsString("declares 3 packages but contains 2"));
  }

  @Test
  public void testPackageIdTooLarge() {
    byte[] bytes = builder().buildBytes();
    littleEndian(bytes).putInt(FIRST_PACKAGE_OFFSET + 8, 0x100);
    ResourceTableFormatError error =
        assertThrows(ResourceTableFormatError.class, () -> decode(bytes));
    assertThat(error.getMessage(), containsString("does not fit in 8 bits"));
  }

  @Test
  public void testOriginIsReported() throws Exception {
    byte[] bytes = builder().buildBytes();
    Path path = writeTable(Arrays.copyOf(bytes, bytes.length - 1));
    ResourceTableFormatError error =
        assertThrows(ResourceTableFormatError.class, () -> ArscDecoder.decode(path));
    assertEquals(new PathOrigin(path), error.getOrigin());
    ResourceTableFormatError unknownOriginError =
        assertThrows(ResourceTableFormatError.class, () -> decode(new byte[0]));
    assertEquals(Origin.unknown(), unknownOriginError.getOrigin());
  }

  private static ByteBuffer littleEndian(byte[] bytes) {
    return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
  }
}
