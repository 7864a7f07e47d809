package com.ttennebkram.cookieflip;

import com.google.gson.JsonParseException;
import com.ttennebkram.cookieflip.config.CookieFlipConfig;
import com.ttennebkram.cookieflip.visualization.FileResultSink;
import com.ttennebkram.cookieflip.visualization.ResultSink;
import org.opencv.core.Core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command-line entry point: trains a classifier on labeled cookie images and
 * classifies the test images.
 *
 * Run with:
 *   mvn -q exec:java -Dexec.args="--classifier kNN --resources resources --output output"
 */
public class CookieFlipApp {

    private static final String USAGE = String.join("\n",
            "Usage: CookieFlipApp [options]",
            "  --config <file>       JSON configuration (default: bundled cookieflip.json)",
            "  --classifier <type>   SVM, kNN or Bayes",
            "  --resources <dir>     Directory holding Train/ and Test/ images",
            "  --output <dir>        Directory for rendered frames (\"\" disables)",
            "  --delay <ms>          Pause between visualization steps",
            "  --help                Show this help");

    public static void main(String[] args) {
        CookieFlipConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        } catch (IOException | JsonParseException e) {
            System.err.println("ERROR: Could not read configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        if (config == null) {
            System.out.println(USAGE);
            return;
        }

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();
        System.out.println("OpenCV Version: " + Core.VERSION);

        ResultSink sink = config.output.dir == null || config.output.dir.isEmpty()
                ? ResultSink.NONE
                : new FileResultSink(Path.of(config.output.dir));
        try {
            new CookieFlipPipeline(config, sink).run();
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Build the configuration from command-line arguments.
     *
     * @return null if help was requested
     */
    static CookieFlipConfig parseArgs(String[] args) throws IOException {
        Path configPath = null;
        String classifier = null;
        String resources = null;
        String output = null;
        Long delay = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    configPath = Path.of(requireValue(args, ++i, "--config"));
                    break;
                case "--classifier":
                    classifier = requireValue(args, ++i, "--classifier");
                    break;
                case "--resources":
                    resources = requireValue(args, ++i, "--resources");
                    break;
                case "--output":
                    output = requireValue(args, ++i, "--output");
                    break;
                case "--delay":
                    try {
                        delay = Long.parseLong(requireValue(args, ++i, "--delay"));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--delay needs a number of milliseconds");
                    }
                    break;
                case "--help":
                case "-h":
                    return null;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        CookieFlipConfig config = configPath != null ? CookieFlipConfig.load(configPath) : CookieFlipConfig.loadDefault();
        if (classifier != null) config.classifier.type = classifier;
        if (resources != null) config.data.resourceDir = resources;
        if (output != null) config.output.dir = output;
        if (delay != null) config.output.delayMs = delay;
        return config;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }
}
