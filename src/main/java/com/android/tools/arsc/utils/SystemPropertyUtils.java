// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.utils;

import java.util.function.Function;

public class SystemPropertyUtils {

  public static boolean parseSystemPropertyOrDefault(String propertyName, boolean defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null) {
      return defaultValue;
    }
    return !propertyValue.equals("false") && !propertyValue.equals("0");
  }

  public static <T> T parseSystemPropertyOrDefault(
      String propertyName, T defaultValue, Function<String, T> parser) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null) {
      return defaultValue;
    }
    return parser.apply(propertyValue);
  }
}
