package com.ttennebkram.cookieflip.config;

/**
 * Visualization output and demonstration pacing.
 */
public class OutputConfig {
    /** Directory for rendered frames; empty disables frame output */
    public String dir = "output";
    /** Pause between visualization steps in ms */
    public long delayMs = 1000;
}
