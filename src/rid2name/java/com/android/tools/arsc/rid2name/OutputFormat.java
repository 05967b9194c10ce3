// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.rid2name;

import com.android.tools.arsc.resolution.ResolvedResourceName;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.List;

/** How a resolved name is printed. */
public enum OutputFormat {
  FQDN("fqdn") {
    @Override
    public String format(ResolvedResourceName name) {
      return name.toQualifiedName();
    }
  },
  XMLID("xmlid", "xml") {
    @Override
    public String format(ResolvedResourceName name) {
      return name.toXmlReference();
    }
  },
  JSON("json") {
    @Override
    public String format(ResolvedResourceName name) {
      return GSON.toJson(name);
    }
  };

  private static final Gson GSON =
      new GsonBuilder().excludeFieldsWithoutExposeAnnotation().disableHtmlEscaping().create();

  private final List<String> names;

  OutputFormat(String... names) {
    this.names = ImmutableList.copyOf(names);
  }

  public abstract String format(ResolvedResourceName name);

  public String getName() {
    return names.get(0);
  }

  /** Returns the format with the given name or alias, or null if there is none. */
  public static OutputFormat lookup(String name) {
    for (OutputFormat format : values()) {
      if (format.names.contains(name)) {
        return format;
      }
    }
    return null;
  }
}
