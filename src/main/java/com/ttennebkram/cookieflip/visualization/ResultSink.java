package com.ttennebkram.cookieflip.visualization;

import org.opencv.core.Mat;

/**
 * Receives rendered frames.
 */
@FunctionalInterface
public interface ResultSink {

    /** Discards every frame. */
    ResultSink NONE = (title, frame) -> { };

    /**
     * Present a frame.
     *
     * @param title Short name of the step that produced the frame
     * @param frame The frame (caller owns it; do not release)
     */
    void present(String title, Mat frame);
}
