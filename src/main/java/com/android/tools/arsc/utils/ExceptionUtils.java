// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.utils;

import com.android.tools.arsc.ResolutionFailedException;
import com.android.tools.arsc.errors.ResourceTableFormatError;
import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.resolution.StringPoolDecodingException;
import java.io.IOException;
import java.io.UncheckedIOException;

public class ExceptionUtils {

  public static final int STATUS_ERROR = 1;

  public interface ResolutionAction {
    void run() throws IOException, ResolutionFailedException;
  }

  public interface MainAction {
    void run() throws ResolutionFailedException;
  }

  /**
   * Runs the action and converts any reported error or failure raised while reading the resource
   * table into a {@link ResolutionFailedException}.
   */
  public static void withResolutionHandler(Reporter reporter, ResolutionAction action)
      throws ResolutionFailedException {
    withResolutionHandler(reporter, Origin.unknown(), action);
  }

  public static void withResolutionHandler(
      Reporter reporter, Origin origin, ResolutionAction action) throws ResolutionFailedException {
    try {
      action.run();
      reporter.failIfPendingErrors();
    } catch (AbortException e) {
      throw new ResolutionFailedException(failureMessage(reporter), e);
    } catch (ResourceTableFormatError e) {
      reporter.error(new ExceptionDiagnostic(e));
      throw new ResolutionFailedException(e.getMessage(), e);
    } catch (StringPoolDecodingException e) {
      reporter.error(new ExceptionDiagnostic(e, origin));
      throw new ResolutionFailedException(e.getMessage(), e);
    } catch (IOException e) {
      reporter.error(new ExceptionDiagnostic(e, origin));
      throw new ResolutionFailedException(e);
    } catch (UncheckedIOException e) {
      reporter.error(new ExceptionDiagnostic(e.getCause(), origin));
      throw new ResolutionFailedException(e.getCause());
    }
  }

  private static String failureMessage(Reporter reporter) {
    if (reporter.getLastError() != null) {
      return reporter.getLastError().getDiagnosticMessage();
    }
    return "Resolution failed to complete";
  }

  /**
   * Runs the main program and terminates the JVM with {@link #STATUS_ERROR} if it fails. The
   * failure has already been reported to the diagnostics handler, so only the exit status is left.
   */
  public static void withMainProgramHandler(MainAction action) {
    try {
      action.run();
    } catch (ResolutionFailedException | AbortException e) {
      System.exit(STATUS_ERROR);
    } catch (RuntimeException e) {
      System.err.println("Resolution failed with an internal error.");
      Throwable cause = e.getCause() == null ? e : e.getCause();
      cause.printStackTrace();
      System.exit(STATUS_ERROR);
    }
  }
}
