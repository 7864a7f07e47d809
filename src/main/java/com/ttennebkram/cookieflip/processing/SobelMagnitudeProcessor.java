package com.ttennebkram.cookieflip.processing;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Sobel gradient magnitude processor.
 * Output is a single-channel CV_32F image holding sqrt(dx^2 + dy^2).
 */
@ProcessorInfo(name = "SobelMagnitude")
public class SobelMagnitudeProcessor extends ProcessorBase {

    private static final int[] KERNEL_SIZES = {1, 3, 5, 7};

    // Properties with defaults
    private int kernelSize = 3;

    public SobelMagnitudeProcessor() {
    }

    public SobelMagnitudeProcessor(int kernelSize) {
        setKernelSize(kernelSize);
    }

    public int getKernelSize() { return kernelSize; }

    public void setKernelSize(int kernelSize) {
        for (int k : KERNEL_SIZES) {
            if (k == kernelSize) {
                this.kernelSize = kernelSize;
                return;
            }
        }
        throw new IllegalArgumentException("Sobel kernel size must be 1, 3, 5 or 7, got " + kernelSize);
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }

        Mat gray = toGray(input);
        Mat gradX = new Mat();
        Mat gradY = new Mat();
        try {
            Imgproc.Sobel(gray, gradX, CvType.CV_32F, 1, 0, kernelSize);
            Imgproc.Sobel(gray, gradY, CvType.CV_32F, 0, 1, kernelSize);
            Mat magnitude = new Mat();
            Core.magnitude(gradX, gradY, magnitude);
            return magnitude;
        } finally {
            gray.release();
            gradX.release();
            gradY.release();
        }
    }

    @Override
    public String toString() {
        return getName() + " ksize=" + kernelSize;
    }
}
