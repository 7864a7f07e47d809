package com.ttennebkram.cookieflip.processing;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Abstract base class for processors.
 * Provides common functionality and helper methods.
 */
public abstract class ProcessorBase implements ImageProcessor {

    /**
     * Name from the {@link ProcessorInfo} annotation, or the class name.
     */
    public String getName() {
        ProcessorInfo info = getClass().getAnnotation(ProcessorInfo.class);
        return info != null ? info.name() : getClass().getSimpleName();
    }

    /**
     * Standard null/empty check for input validation.
     * Call at the start of process() method.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Return a single-channel copy of the input (caller releases).
     */
    protected Mat toGray(Mat input) {
        Mat gray = new Mat();
        if (input.channels() == 3) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (input.channels() == 4) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            input.copyTo(gray);
        }
        return gray;
    }
}
