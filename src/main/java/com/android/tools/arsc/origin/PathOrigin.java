// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.origin;

import java.nio.file.Path;

/** Origin of a resource table read from a file on disk. */
public class PathOrigin extends Origin {

  private final Path path;

  public PathOrigin(Path path) {
    super(Origin.root());
    assert path != null;
    this.path = path;
  }

  @Override
  public String part() {
    return path.toString();
  }

  public Path getPath() {
    return path;
  }
}
