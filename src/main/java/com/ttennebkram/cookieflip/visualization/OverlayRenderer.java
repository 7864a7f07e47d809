package com.ttennebkram.cookieflip.visualization;

import com.ttennebkram.cookieflip.ml.CookieLabel;
import com.ttennebkram.cookieflip.model.PixelRegion;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.RotatedRect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws pass/fail boxes and captions onto a color copy of an image.
 * Colors are BGR.
 */
public class OverlayRenderer {

    public static final Scalar PASS_COLOR = new Scalar(0, 255, 0);
    public static final Scalar FAIL_COLOR = new Scalar(0, 0, 255);
    public static final Scalar TEXT_COLOR = new Scalar(255, 0, 0);

    private static final int LINE_WIDTH = 10;
    private static final double FILL_ALPHA = 40.0 / 255.0;
    private static final Point TEXT_POSITION = new Point(20, 100);
    private static final double TEXT_SCALE = 3.0;
    private static final int TEXT_THICKNESS = 5;

    /**
     * Color copy of the image with a caption (caller releases).
     */
    public Mat renderCaption(Mat image, String caption) {
        Mat canvas = toColor(image);
        drawCaption(canvas, caption);
        return canvas;
    }

    /**
     * Color copy of the image with one box per cookie: green for not flipped,
     * red for flipped (caller releases).
     *
     * @param labels One label per cookie, same order
     */
    public Mat renderClassification(Mat image, List<PixelRegion> cookies, int[] labels, String caption) {
        if (cookies.size() != labels.length) {
            throw new IllegalArgumentException(cookies.size() + " cookies but " + labels.length + " labels");
        }
        Mat canvas = toColor(image);
        Mat fill = canvas.clone();
        try {
            List<MatOfPoint> passBoxes = new ArrayList<>();
            List<MatOfPoint> failBoxes = new ArrayList<>();
            for (int c = 0; c < cookies.size(); c++) {
                MatOfPoint box = toPolygon(cookies.get(c).getOrientedBoundingBox());
                if (CookieLabel.isFlipped(labels[c])) {
                    failBoxes.add(box);
                } else {
                    passBoxes.add(box);
                }
            }

            // Translucent fill first, outlines on top
            if (!passBoxes.isEmpty()) Imgproc.fillPoly(fill, passBoxes, PASS_COLOR);
            if (!failBoxes.isEmpty()) Imgproc.fillPoly(fill, failBoxes, FAIL_COLOR);
            Core.addWeighted(fill, FILL_ALPHA, canvas, 1.0 - FILL_ALPHA, 0, canvas);
            if (!passBoxes.isEmpty()) Imgproc.polylines(canvas, passBoxes, true, PASS_COLOR, LINE_WIDTH);
            if (!failBoxes.isEmpty()) Imgproc.polylines(canvas, failBoxes, true, FAIL_COLOR, LINE_WIDTH);

            for (MatOfPoint box : passBoxes) box.release();
            for (MatOfPoint box : failBoxes) box.release();

            drawCaption(canvas, caption);
            return canvas;
        } finally {
            fill.release();
        }
    }

    private void drawCaption(Mat canvas, String caption) {
        if (caption != null && !caption.isEmpty()) {
            Imgproc.putText(canvas, caption, TEXT_POSITION, Imgproc.FONT_HERSHEY_SIMPLEX,
                    TEXT_SCALE, TEXT_COLOR, TEXT_THICKNESS);
        }
    }

    private static MatOfPoint toPolygon(RotatedRect rect) {
        Point[] corners = new Point[4];
        rect.points(corners);
        return new MatOfPoint(corners);
    }

    private static Mat toColor(Mat image) {
        Mat color = new Mat();
        if (image.channels() == 1) {
            Imgproc.cvtColor(image, color, Imgproc.COLOR_GRAY2BGR);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, color, Imgproc.COLOR_BGRA2BGR);
        } else {
            image.copyTo(color);
        }
        return color;
    }
}
