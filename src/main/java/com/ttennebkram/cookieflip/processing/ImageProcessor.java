package com.ttennebkram.cookieflip.processing;

import org.opencv.core.Mat;

/**
 * Interface for pure OpenCV image processing operations.
 * Takes a Mat and returns a processed Mat.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * Process an input image and return the result.
     *
     * @param input The input image (caller owns this Mat)
     * @return The processed output image (caller must release when done)
     */
    Mat process(Mat input);

    /**
     * Chain this processor with another one. The intermediate Mat is released.
     */
    default ImageProcessor andThen(ImageProcessor next) {
        return input -> {
            Mat intermediate = process(input);
            try {
                return next.process(intermediate);
            } finally {
                if (intermediate != input) {
                    intermediate.release();
                }
            }
        };
    }
}
