package com.ttennebkram.cookieflip.processing;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Fill holes processor.
 * Background pixels of a binary image that cannot be reached from the image
 * border become foreground.
 */
@ProcessorInfo(name = "FillHoles")
public class FillHolesProcessor extends ProcessorBase {

    @Override
    public Mat process(Mat input) {
        if (isInvalidInput(input)) {
            return input;
        }

        Mat binary = null;
        Mat padded = null;
        Mat floodMask = null;
        Mat holes = null;

        try {
            binary = toGray(input);
            if (binary.type() != CvType.CV_8UC1) {
                binary.convertTo(binary, CvType.CV_8UC1);
            }

            // 1 px background frame so the seed at (0,0) reaches the whole outside.
            // Background 4-connected, foreground 8-connected
            padded = new Mat();
            Core.copyMakeBorder(binary, padded, 1, 1, 1, 1, Core.BORDER_CONSTANT, new Scalar(0));
            floodMask = Mat.zeros(padded.rows() + 2, padded.cols() + 2, CvType.CV_8UC1);
            Imgproc.floodFill(padded, floodMask, new Point(0, 0), new Scalar(255), new Rect(),
                    new Scalar(0), new Scalar(0), 4);

            // Whatever the flood did not reach is a hole
            holes = new Mat();
            Core.bitwise_not(padded.submat(1, padded.rows() - 1, 1, padded.cols() - 1), holes);

            Mat output = new Mat();
            Core.bitwise_or(binary, holes, output);
            return output;
        } finally {
            if (binary != null) binary.release();
            if (padded != null) padded.release();
            if (floodMask != null) floodMask.release();
            if (holes != null) holes.release();
        }
    }

    @Override
    public String toString() {
        return getName();
    }
}
