// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.errors;

import com.android.tools.arsc.Diagnostic;
import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.resolution.FailureKind;
import com.android.tools.arsc.resolution.ResourceId;

/** Reports that a resource identifier could not be resolved to a name. */
public class ResourceResolutionDiagnostic implements Diagnostic {

  private final int resourceId;
  private final FailureKind failureKind;
  private final String message;
  private final Origin origin;

  ResourceResolutionDiagnostic(
      int resourceId, FailureKind failureKind, String message, Origin origin) {
    this.resourceId = resourceId;
    this.failureKind = failureKind;
    this.message = message;
    this.origin = origin;
  }

  public int getResourceId() {
    return resourceId;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Unable to resolve " + ResourceId.toHexString(resourceId) + ": " + message;
  }

  // To not include ResourceResolutionDiagnostic.<init> in the public API.
  public static class Factory {

    public static ResourceResolutionDiagnostic create(
        int resourceId, FailureKind failureKind, String message, Origin origin) {
      return new ResourceResolutionDiagnostic(resourceId, failureKind, message, origin);
    }
  }
}
