package com.ttennebkram.cookieflip.processing;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for processor classes to declare their metadata.
 *
 * Example usage:
 * <pre>
 * {@literal @}ProcessorInfo(name = "ThresholdRange")
 * public class ThresholdRangeProcessor extends ProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ProcessorInfo {

    /**
     * The processor name (e.g., "ThresholdRange", "FillHoles").
     * Shown when a detector or extractor describes its processing chain.
     */
    String name();
}
