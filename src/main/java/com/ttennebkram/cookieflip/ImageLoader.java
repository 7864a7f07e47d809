package com.ttennebkram.cookieflip;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads images relative to a resource directory.
 */
public class ImageLoader {

    private final Path resourceDir;

    public ImageLoader(Path resourceDir) {
        this.resourceDir = resourceDir;
    }

    public Path getResourceDir() {
        return resourceDir;
    }

    public Path resolve(String relativePath) {
        return resourceDir.resolve(relativePath);
    }

    /**
     * Load an image unchanged (grayscale stays single-channel).
     *
     * @throws IOException if the file is missing or OpenCV cannot decode it
     */
    public Mat load(String relativePath) throws IOException {
        Path path = resolve(relativePath);
        if (!Files.isRegularFile(path)) {
            throw new FileNotFoundException("Image not found: " + path);
        }
        Mat image = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_ANYCOLOR);
        if (image.empty()) {
            image.release();
            throw new IOException("Could not decode image: " + path);
        }
        return image;
    }
}
