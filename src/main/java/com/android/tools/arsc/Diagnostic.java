// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc;

import com.android.tools.arsc.origin.Origin;

/** Interface for all diagnostic messages reported while reading or resolving a resource table. */
public interface Diagnostic {

  /** Origin of the resource causing the problem. */
  Origin getOrigin();

  /** User friendly description of the problem. */
  String getDiagnosticMessage();
}
