// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.resolution;

import com.android.tools.arsc.errors.ResourceResolutionDiagnostic;
import com.android.tools.arsc.origin.Origin;

/** Result of resolving a resource identifier: either a name or the reason there is none. */
public abstract class ResourceNameResolutionResult {

  private final int resourceId;

  ResourceNameResolutionResult(int resourceId) {
    this.resourceId = resourceId;
  }

  public int getResourceId() {
    return resourceId;
  }

  public boolean isSuccessfulResolution() {
    return false;
  }

  public SuccessfulResolution asSuccessfulResolution() {
    return null;
  }

  public boolean isFailedResolution() {
    return false;
  }

  public FailedResolution asFailedResolution() {
    return null;
  }

  public static SuccessfulResolution success(int resourceId, ResolvedResourceName name) {
    return new SuccessfulResolution(resourceId, name);
  }

  public static FailedResolution failure(int resourceId, FailureKind kind, String message) {
    return new FailedResolution(resourceId, kind, message);
  }

  public static class SuccessfulResolution extends ResourceNameResolutionResult {

    private final ResolvedResourceName name;

    private SuccessfulResolution(int resourceId, ResolvedResourceName name) {
      super(resourceId);
      this.name = name;
    }

    public ResolvedResourceName getName() {
      return name;
    }

    @Override
    public boolean isSuccessfulResolution() {
      return true;
    }

    @Override
    public SuccessfulResolution asSuccessfulResolution() {
      return this;
    }

    @Override
    public String toString() {
      return ResourceId.toHexString(getResourceId()) + " -> " + name;
    }
  }

  public static class FailedResolution extends ResourceNameResolutionResult {

    private final FailureKind kind;
    private final String message;

    private FailedResolution(int resourceId, FailureKind kind, String message) {
      super(resourceId);
      this.kind = kind;
      this.message = message;
    }

    public FailureKind getKind() {
      return kind;
    }

    public String getMessage() {
      return message;
    }

    public ResourceResolutionDiagnostic toDiagnostic(Origin origin) {
      return ResourceResolutionDiagnostic.Factory.create(getResourceId(), kind, message, origin);
    }

    @Override
    public boolean isFailedResolution() {
      return true;
    }

    @Override
    public FailedResolution asFailedResolution() {
      return this;
    }

    @Override
    public String toString() {
      return ResourceId.toHexString(getResourceId()) + " -> " + kind + ": " + message;
    }
  }
}
