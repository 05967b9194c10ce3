// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import static com.android.tools.arsc.table.ResourceTableTestBuilder.encodeEntry;
import static com.android.tools.arsc.table.ResourceTableTestBuilder.encodePackageName;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assume.assumeTrue;

import com.android.tools.arsc.TestBase;
import com.android.tools.arsc.table.ResStringPool;
import com.android.tools.arsc.table.StringPoolEncoding;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class PooledStringDecoderTest extends TestBase {

  @Parameter(0)
  public StringPoolEncoding encoding;

  @Parameter(1)
  public EnvelopeMode envelopeMode;

  @Parameters(name = "{0}, envelope: {1}")
  public static List<Object[]> data() {
    return buildParameters(StringPoolEncoding.values(), EnvelopeMode.values());
  }

  private PooledStringDecoder decoder() {
    return new PooledStringDecoder(envelopeMode);
  }

  @Test
  public void testShortStrings() {
    for (String value : ImmutableList.of("app_name", "a", "", "ic_launcher_foreground")) {
      assertEquals(value, decoder().decode(encodeEntry(value, encoding), encoding));
    }
  }

  @Test
  public void testNonAscii() {
    String value = "café_日本";
    assertEquals(value, decoder().decode(encodeEntry(value, encoding), encoding));
  }

  @Test
  public void testDecodeFromPool() {
    ResStringPool pool =
        ResStringPool.create(
            encoding == StringPoolEncoding.UTF8 ? ResStringPool.UTF8_FLAG : 0,
            ImmutableList.of(encodeEntry("string", encoding), encodeEntry("drawable", encoding)));
    assertEquals("string", decoder().decode(pool, 0));
    assertEquals("drawable", decoder().decode(pool, 1));
  }

  @Test
  public void testLongString() {
    String value = Strings.repeat("x", 200);
    byte[] entry = encodeEntry(value, encoding);
    if (envelopeMode == EnvelopeMode.DECLARED_LENGTH || encoding == StringPoolEncoding.UTF16) {
      // UTF-16 lengths below 0x8000 take a single unit, so the fixed envelope still fits.
      assertEquals(value, decoder().decode(entry, encoding));
    } else {
      // The second byte of each two byte UTF-8 length leaks into the payload.
      assertThrows(StringPoolDecodingException.class, () -> decoder().decode(entry, encoding));
    }
  }

  @Test
  public void testTrailingNulCharactersAreTrimmed() {
    String value = "key\0\0";
    assertEquals("key", decoder().decode(encodeEntry(value, encoding), encoding));
  }

  @Test
  public void testTooShortForEnvelope() {
    assertThrows(
        StringPoolDecodingException.class, () -> decoder().decode(new byte[] {1}, encoding));
  }

  @Test
  public void testDeclaredLengthBeyondEntry() {
    byte[] entry = encodeEntry("icon", encoding);
    byte[] truncated = Arrays.copyOf(entry, entry.length - 3);
    assumeTrue(envelopeMode == EnvelopeMode.DECLARED_LENGTH);
    StringPoolDecodingException e =
        assertThrows(
            StringPoolDecodingException.class, () -> decoder().decode(truncated, encoding));
    assertThat(e.getMessage(), containsString("Declared length"));
  }

  @Test
  public void testMalformedPayload() {
    byte[] entry;
    if (encoding == StringPoolEncoding.UTF8) {
      entry = new byte[] {2, 2, (byte) 0xc3, (byte) 0x28, 0};
    } else {
      // Unpaired high surrogate.
      entry = new byte[] {1, 0, 0x00, (byte) 0xd8, 0, 0};
    }
    assertThrows(StringPoolDecodingException.class, () -> decoder().decode(entry, encoding));
  }

  @Test
  public void testOddUtf16Payload() {
    assumeTrue(encoding == StringPoolEncoding.UTF16 && envelopeMode == EnvelopeMode.FIXED);
    assertThrows(
        StringPoolDecodingException.class,
        () -> decoder().decode(new byte[] {1, 0, 0x61, 0, 0x62, 0, 0}, encoding));
  }

  @Test
  public void testEncodingsAgree() {
    String value = "hello";
    assertEquals(
        decoder().decode(encodeEntry(value, StringPoolEncoding.UTF8), StringPoolEncoding.UTF8),
        decoder().decode(encodeEntry(value, StringPoolEncoding.UTF16), StringPoolEncoding.UTF16));
  }

  @Test
  public void testPackageName() {
    assertEquals(
        "com.example.app",
        PooledStringDecoder.decodePackageName(encodePackageName("com.example.app")));
    assertEquals("", PooledStringDecoder.decodePackageName(encodePackageName("")));
  }

  @Test
  public void testPackageNameWithoutTerminator() {
    byte[] rawName = new byte[8];
    Arrays.fill(rawName, (byte) 0x61);
    assertThrows(
        StringPoolDecodingException.class, () -> PooledStringDecoder.decodePackageName(rawName));
  }

  @Test
  public void testPackageNameStopsAtAlignedTerminator() {
    // "a" followed by U+0100, whose low byte is 0x00, then the terminator.
    byte[] rawName = new byte[] {0x61, 0x00, 0x00, 0x01, 0x00, 0x00, 0x62, 0x00};
    assertEquals("aĀ", PooledStringDecoder.decodePackageName(rawName));
  }
}
