// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.arsc.rid2name;

import com.android.tools.arsc.ResolutionFailedException;
import com.android.tools.arsc.Version;
import com.android.tools.arsc.model.PackageModel;
import com.android.tools.arsc.model.ResourceTableModel;
import com.android.tools.arsc.model.TypeModel;
import com.android.tools.arsc.origin.CommandLineOrigin;
import com.android.tools.arsc.origin.Origin;
import com.android.tools.arsc.resolution.ResolvedResourceName;
import com.android.tools.arsc.resolution.ResourceId;
import com.android.tools.arsc.resolution.ResourceNameResolutionResult;
import com.android.tools.arsc.table.ArscDecoder;
import com.android.tools.arsc.table.ResTable;
import com.android.tools.arsc.utils.ExceptionUtils;
import java.io.IOException;

/**
 * Command line tool that prints the name of a resource identifier, or lists the packages, types
 * and keys of a compiled resource table.
 */
public class Rid2Name {

  private final Rid2NameOptions options;
  private final Origin origin;

  private Rid2Name(Rid2NameOptions options) {
    this.options = options;
    this.origin = options.getOrigin();
  }

  public static void main(String[] args) {
    ExceptionUtils.withMainProgramHandler(() -> run(args));
  }

  private static void run(String[] args) throws ResolutionFailedException {
    Rid2NameCommand.Builder builder =
        Rid2NameCommandParser.parse(args, CommandLineOrigin.INSTANCE);
    run(builder.build());
  }

  public static void run(Rid2NameCommand command) throws ResolutionFailedException {
    if (command.isPrintHelp()) {
      command.getOutput().print(Rid2NameCommandParser.getUsageMessage());
      return;
    }
    if (command.isPrintVersion()) {
      command.getOutput().println("rid2name " + Version.getVersionString());
      return;
    }
    Rid2NameOptions options = command.getInternalOptions();
    ExceptionUtils.withResolutionHandler(
        options.reporter, options.getOrigin(), () -> new Rid2Name(options).run());
  }

  private void run() throws IOException {
    ResTable table = ArscDecoder.decode(options.inputPath);
    switch (options.mode) {
      case RESOLVE:
        resolve(table);
        break;
      case LIST_PACKAGES:
        listPackages(table);
        break;
      case LIST_TYPES:
        listTypes(table);
        break;
      case LIST_KEYS:
        listKeys(table);
        break;
      default:
        throw new IllegalStateException("Unexpected mode: " + options.mode);
    }
  }

  private void resolve(ResTable table) {
    ResourceNameResolutionResult result =
        options.createResolver().resolve(table, options.resourceId);
    if (result.isFailedResolution()) {
      options.reporter.error(result.asFailedResolution().toDiagnostic(origin));
      return;
    }
    options.output.println(
        options.outputFormat.format(result.asSuccessfulResolution().getName()));
  }

  private void listPackages(ResTable table) {
    createModel(table)
        .forEachPackage(
            packageModel ->
                options.output.println(
                    String.format("0x%02x %s", packageModel.getId(), packageModel.getName())));
  }

  private void listTypes(ResTable table) {
    PackageModel packageModel = createModel(table).getPackage(options.packageId);
    if (packageModel == null) {
      reportMissingPackage(options.packageId);
      return;
    }
    packageModel.forEachType(
        type ->
            options.output.println(
                type.getId() + " " + type.getName() + " " + type.getEntryCount()));
  }

  private void listKeys(ResTable table) {
    int packageId = ResourceId.getPackageId(options.resourceId);
    int typeId = ResourceId.getTypeId(options.resourceId);
    PackageModel packageModel = createModel(table).getPackage(packageId);
    if (packageModel == null) {
      reportMissingPackage(packageId);
      return;
    }
    TypeModel type = packageModel.getType(typeId);
    if (type == null || !type.hasTypeSpec()) {
      options.reporter.error(
          "Type with id "
              + typeId
              + " not found in package 0x"
              + Integer.toHexString(packageId),
          origin);
      return;
    }
    String packageName = packageModel.getName();
    type.forEachKey(
        (resourceId, key) ->
            options.output.println(
                ResourceId.toHexString(resourceId)
                    + " "
                    + options.outputFormat.format(
                        new ResolvedResourceName(packageName, type.getName(), key))));
  }

  private ResourceTableModel createModel(ResTable table) {
    return new ResourceTableModel(table, options.createDecoder());
  }

  private void reportMissingPackage(int packageId) {
    options.reporter.error(
        "Package with id 0x" + Integer.toHexString(packageId) + " not found", origin);
  }
}
