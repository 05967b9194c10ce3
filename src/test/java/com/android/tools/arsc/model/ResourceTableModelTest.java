// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.android.tools.arsc.TestBase;
import com.android.tools.arsc.resolution.KeyRange;
import com.android.tools.arsc.resolution.PooledStringDecoder;
import com.android.tools.arsc.resolution.ResourceId;
import com.android.tools.arsc.table.ResourceTableTestBuilder;
import com.android.tools.arsc.table.StringPoolEncoding;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class ResourceTableModelTest extends TestBase {

  private static ResourceTableModel model() {
    return new ResourceTableModel(
        ResourceTableTestBuilder.simpleApp(StringPoolEncoding.UTF16)
            .addPackage(0x01, "android", p -> p.addType("attr", "theme").addTypeName("id"))
            .build(),
        PooledStringDecoder.create());
  }

  @Test
  public void testPackages() {
    List<String> names = new ArrayList<>();
    model().forEachPackage(p -> names.add(p.getId() + ":" + p.getName()));
    assertThat(names, contains("127:app", "1:android"));
    assertEquals("android", model().getPackage(0x01).getName());
    assertNull(model().getPackage(0x02));
  }

  @Test
  public void testTypes() {
    PackageModel app = model().getPackage(0x7f);
    List<String> types = new ArrayList<>();
    app.forEachType(t -> types.add(t.getId() + ":" + t.getName() + ":" + t.getEntryCount()));
    assertThat(types, contains("1:string:2", "2:drawable:1"));
    assertEquals("drawable", app.getType(2).getName());
    assertNull(app.getType(0));
    assertNull(app.getType(3));
  }

  @Test
  public void testTypeWithoutTypeSpec() {
    TypeModel id = model().getPackage(0x01).getType(2);
    assertEquals("id", id.getName());
    assertFalse(id.hasTypeSpec());
    assertEquals(0, id.getEntryCount());
    List<Integer> resourceIds = new ArrayList<>();
    id.forEachKey((resourceId, key) -> resourceIds.add(resourceId));
    assertTrue(resourceIds.isEmpty());
  }

  @Test
  public void testKeys() {
    TypeModel string = model().getPackage(0x7f).getType(1);
    assertEquals(new KeyRange(0, 2), string.getKeyRange());
    assertThat(string.getKeys(), contains("app_name", "hello"));
    List<String> entries = new ArrayList<>();
    string.forEachKey(
        (resourceId, key) -> entries.add(ResourceId.toHexString(resourceId) + " " + key));
    assertThat(entries, contains("0x7f010000 app_name", "0x7f010001 hello"));
  }
}
