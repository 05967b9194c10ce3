// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

public enum FailureKind {
  MALFORMED_IDENTIFIER,
  PACKAGE_NOT_FOUND,
  TYPE_NOT_FOUND,
  KEY_INDEX_OUT_OF_RANGE,
  STRING_DECODE_ERROR
}
