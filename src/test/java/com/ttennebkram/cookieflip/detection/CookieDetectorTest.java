package com.ttennebkram.cookieflip.detection;

import com.ttennebkram.cookieflip.TestImages;
import com.ttennebkram.cookieflip.config.DetectionConfig;
import com.ttennebkram.cookieflip.model.PixelRegion;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CookieDetectorTest {

    private CookieDetector detector;

    @BeforeAll
    static void loadOpenCV() {
        TestImages.loadOpenCV();
    }

    @BeforeEach
    void setUp() {
        detector = new CookieDetector(new DetectionConfig());
    }

    @Test
    void testFindsEveryCookieInRasterOrder() {
        Mat image = TestImages.cookies(11, false, true, true, false);
        List<PixelRegion> cookies = detector.detectCookies(image);
        try {
            assertEquals(4, cookies.size());
            for (int i = 0; i < cookies.size(); i++) {
                Point center = TestImages.CENTERS[i];
                PixelRegion cookie = cookies.get(i);
                assertEquals(center.x, cookie.getBoundingBox().x + cookie.getBoundingBox().width / 2.0, 3.0);
                assertEquals(center.y, cookie.getBoundingBox().y + cookie.getBoundingBox().height / 2.0, 3.0);
            }
        } finally {
            TestImages.release(cookies);
            image.release();
        }
    }

    @Test
    void testEmptyImageYieldsNoCookies() {
        Mat image = TestImages.blank();

        List<PixelRegion> cookies = detector.detectCookies(image);

        assertTrue(cookies.isEmpty());
        image.release();
    }

    @Test
    void testBlobsOutsideAreaRangeAreIgnored() {
        Mat image = TestImages.blank();
        // Area ~ 1250 px, well below the minimum
        Imgproc.circle(image, new Point(60, 60), 20, new Scalar(50), -1);
        Imgproc.circle(image, TestImages.CENTERS[3], TestImages.RADIUS, new Scalar(50), -1);

        List<PixelRegion> cookies = detector.detectCookies(image);
        try {
            assertEquals(1, cookies.size());
            assertTrue(cookies.get(0).getArea() >= detector.getMinArea());
        } finally {
            TestImages.release(cookies);
            image.release();
        }
    }

    @Test
    void testBrightSpotInsideCookieIsFilled() {
        Mat image = TestImages.blank();
        Imgproc.circle(image, TestImages.CENTERS[0], TestImages.RADIUS, new Scalar(50), -1);
        Imgproc.circle(image, TestImages.CENTERS[0], 20, new Scalar(200), -1);

        List<PixelRegion> cookies = detector.detectCookies(image);
        try {
            assertEquals(1, cookies.size());
            double fullDisc = Math.PI * TestImages.RADIUS * TestImages.RADIUS;
            assertEquals(fullDisc, cookies.get(0).getArea(), fullDisc * 0.03);
        } finally {
            TestImages.release(cookies);
            image.release();
        }
    }

    @Test
    void testInvalidAreaRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CookieDetector(0, 110, 500, 100));
    }

    @Test
    void testDescribesProcessingChain() {
        CookieDetector custom = new CookieDetector(5, 90, 100, 2000);

        assertEquals("ThresholdRange [5, 90] -> FillHoles, area [100, 2000]", custom.toString());
    }
}
