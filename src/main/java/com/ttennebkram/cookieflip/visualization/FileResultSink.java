package com.ttennebkram.cookieflip.visualization;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes each frame as a numbered PNG into a directory.
 */
public class FileResultSink implements ResultSink {

    private final Path directory;
    private int frameIndex = 0;

    public FileResultSink(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void present(String title, Mat frame) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            System.err.println("[FileResultSink] WARNING: could not create output directory "
                    + directory + ": " + e.getMessage());
            return;
        }
        frameIndex++;
        String fileName = String.format(Locale.ROOT, "%03d_%s.png", frameIndex, slug(title));
        Path file = directory.resolve(fileName);
        if (!Imgcodecs.imwrite(file.toString(), frame)) {
            System.err.println("[FileResultSink] WARNING: could not write " + file);
            return;
        }
        System.out.println("[FileResultSink] Wrote " + file);
    }

    private static String slug(String title) {
        String s = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        s = s.replaceAll("^_+|_+$", "");
        return s.isEmpty() ? "frame" : s;
    }
}
