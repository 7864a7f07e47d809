package com.ttennebkram.cookieflip.model;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Rect;
import org.opencv.core.RotatedRect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * A connected region of an image, stored as a full-size binary mask (CV_8UC1, 255 inside).
 * The region owns its mask; call release() when done.
 */
public class PixelRegion {

    private final Mat mask;
    private final int area;
    private final Rect boundingBox;

    public PixelRegion(Mat mask) {
        if (mask == null || mask.empty() || mask.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("Region mask must be a non-empty CV_8UC1 Mat");
        }
        this.mask = mask;
        this.area = Core.countNonZero(mask);
        this.boundingBox = area > 0 ? Imgproc.boundingRect(mask) : new Rect();
    }

    public Mat getMask() { return mask; }
    public int getArea() { return area; }
    public Rect getBoundingBox() { return boundingBox; }

    public boolean isEmpty() {
        return area == 0;
    }

    /**
     * Shrink the region with an elliptical structuring element of the given size.
     *
     * @param kernelSize Structuring element diameter in pixels (made odd)
     * @return A new region; this region is unchanged
     */
    public PixelRegion erode(int kernelSize) {
        if (kernelSize < 1) {
            throw new IllegalArgumentException("Erosion size must be positive, got " + kernelSize);
        }
        int ksize = (kernelSize % 2 == 0) ? kernelSize + 1 : kernelSize;

        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(ksize, ksize));
        Mat eroded = new Mat();
        // Constant 0 border so regions touching the image edge shrink there too
        Imgproc.erode(mask, eroded, kernel, new org.opencv.core.Point(-1, -1), 1,
                Core.BORDER_CONSTANT, new org.opencv.core.Scalar(0));
        kernel.release();
        return new PixelRegion(eroded);
    }

    /**
     * Statistics of a single-channel image over the pixels of this region.
     * An empty region yields {@link RegionStatistics#EMPTY}.
     */
    public RegionStatistics getStatistics(Mat image) {
        if (image == null || image.empty() || image.channels() != 1) {
            throw new IllegalArgumentException("Statistics need a non-empty single-channel image");
        }
        if (image.rows() != mask.rows() || image.cols() != mask.cols()) {
            throw new IllegalArgumentException("Image size " + image.size() + " does not match region mask " + mask.size());
        }
        if (isEmpty()) {
            return RegionStatistics.EMPTY;
        }

        Core.MinMaxLocResult minMax = Core.minMaxLoc(image, mask);
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stdDev = new MatOfDouble();
        try {
            Core.meanStdDev(image, mean, stdDev, mask);
            return new RegionStatistics(minMax.minVal, minMax.maxVal,
                    mean.toArray()[0], stdDev.toArray()[0], area);
        } finally {
            mean.release();
            stdDev.release();
        }
    }

    /**
     * Minimum-area rotated rectangle around the region's outer contour.
     */
    public RotatedRect getOrientedBoundingBox() {
        List<MatOfPoint> contours = new ArrayList<>();
        Mat hierarchy = new Mat();
        Mat work = mask.clone();
        try {
            Imgproc.findContours(work, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_NONE);
            List<org.opencv.core.Point> points = new ArrayList<>();
            for (MatOfPoint contour : contours) {
                points.addAll(contour.toList());
            }
            if (points.isEmpty()) {
                return new RotatedRect();
            }
            MatOfPoint2f all = new MatOfPoint2f();
            all.fromList(points);
            RotatedRect box = Imgproc.minAreaRect(all);
            all.release();
            return box;
        } finally {
            work.release();
            hierarchy.release();
            for (MatOfPoint contour : contours) {
                contour.release();
            }
        }
    }

    public void release() {
        mask.release();
    }

    @Override
    public String toString() {
        return "PixelRegion{area=" + area + ", box=" + boundingBox + "}";
    }
}
