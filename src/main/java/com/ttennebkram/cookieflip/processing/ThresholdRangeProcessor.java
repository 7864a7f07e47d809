package com.ttennebkram.cookieflip.processing;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Range threshold processor.
 * Pixels whose intensity lies in [low, high] (inclusive) become 255, all others 0.
 */
@ProcessorInfo(name = "ThresholdRange")
public class ThresholdRangeProcessor extends ProcessorBase {

    // Properties with defaults
    private int low = 0;
    private int high = 110;

    public ThresholdRangeProcessor() {
    }

    public ThresholdRangeProcessor(int low, int high) {
        setRange(low, high);
    }

    public int getLow() { return low; }
    public int getHigh() { return high; }

    public void setRange(int low, int high) {
        if (low > high) {
            throw new IllegalArgumentException("Threshold low " + low + " is above high " + high);
        }
        this.low = low;
        this.high = high;
    }

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }

        Mat gray = toGray(input);
        Mat binary = new Mat();
        Core.inRange(gray, new Scalar(low), new Scalar(high), binary);
        gray.release();
        return binary;
    }

    @Override
    public String toString() {
        return getName() + " [" + low + ", " + high + "]";
    }
}
