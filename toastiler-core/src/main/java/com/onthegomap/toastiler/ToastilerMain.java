package com.onthegomap.toastiler;

import com.onthegomap.toastiler.config.Arguments;
import com.onthegomap.toastiler.samplers.PlateCarreeSampler;
import java.nio.file.Path;

/**
 * Command-line entry point that builds a pyramid from an all-sky plate carrée image, or rebuilds the upper levels of
 * an existing pyramid.
 * <p>
 * Example: {@code java -jar toastiler.jar input=world.png output=data/toast depth=5 wtml=data/toast.wtml}
 */
public class ToastilerMain {

  private ToastilerMain() {}

  public static void main(String[] args) {
    run(Arguments.fromArgsOrConfigFile(args));
  }

  static PyramidResult run(Arguments args) {
    Arguments arguments = args.withDefault("output", Path.of("data", "toast")).withExactlyOnceLogging();
    Path output = arguments.file("output", "output directory");
    Toastiler toastiler = Toastiler.create(arguments).setOutput(output);
    Path mergeBase = arguments.file("merge_base", "directory of existing tiles to merge instead of sampling", null);
    if (mergeBase != null) {
      toastiler.setMergeBaseDirectory(mergeBase);
    } else {
      toastiler.setSampler(PlateCarreeSampler.fromFile(
        arguments.inputFile("input", "all-sky plate carree image (png or npy)")));
    }
    Path wtml = arguments.file("wtml", "where to write the WTML descriptor", null);
    if (wtml != null) {
      toastiler.setWtmlOutput(wtml, arguments.getString("wtml_url", "base URL of the tiles", output.toString()));
    }
    return toastiler.run();
  }
}
