package com.ttennebkram.cookieflip;

import com.ttennebkram.cookieflip.config.CookieFlipConfig;
import com.ttennebkram.cookieflip.config.TrainingSetConfig;
import com.ttennebkram.cookieflip.detection.CookieDetector;
import com.ttennebkram.cookieflip.features.CookieFeatureExtractor;
import com.ttennebkram.cookieflip.features.FeatureMatrix;
import com.ttennebkram.cookieflip.ml.AccuracyReport;
import com.ttennebkram.cookieflip.ml.ClassifierFactory;
import com.ttennebkram.cookieflip.ml.CookieClassifier;
import com.ttennebkram.cookieflip.ml.TrainingDataSet;
import com.ttennebkram.cookieflip.model.PixelRegion;
import com.ttennebkram.cookieflip.visualization.OverlayRenderer;
import com.ttennebkram.cookieflip.visualization.ResultSink;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Train-then-classify run: build a training set from labeled images, fit the
 * classifier, then classify the test images and render pass/fail overlays.
 */
public class CookieFlipPipeline {

    private final CookieFlipConfig config;
    private final ImageLoader loader;
    private final CookieDetector detector;
    private final CookieFeatureExtractor extractor;
    private final CookieClassifier classifier;
    private final OverlayRenderer renderer = new OverlayRenderer();
    private final ResultSink sink;
    private final TrainingDataSet trainingData = new TrainingDataSet();

    public CookieFlipPipeline(CookieFlipConfig config, ResultSink sink) {
        this(config,
             new ImageLoader(Path.of(config.data.resourceDir)),
             new CookieDetector(config.detection),
             new CookieFeatureExtractor(config.features),
             ClassifierFactory.create(config.classifier),
             sink);
    }

    public CookieFlipPipeline(CookieFlipConfig config, ImageLoader loader, CookieDetector detector,
                              CookieFeatureExtractor extractor, CookieClassifier classifier, ResultSink sink) {
        this.config = config;
        this.loader = loader;
        this.detector = detector;
        this.extractor = extractor;
        this.classifier = classifier;
        this.sink = sink != null ? sink : ResultSink.NONE;
    }

    public TrainingDataSet getTrainingData() {
        return trainingData;
    }

    public CookieClassifier getClassifier() {
        return classifier;
    }

    /**
     * Run all three stages. Classification is skipped if training fails.
     */
    public List<ClassificationResult> run() {
        createTrainingData();
        List<ClassificationResult> results = new ArrayList<>();
        if (trainClassifier()) {
            results = classify();
        }
        System.out.println("App finished.");
        return results;
    }

    /**
     * Load every configured training image and append its cookie features.
     */
    public void createTrainingData() {
        System.out.println("[CookieFlip] Detection: " + detector);
        System.out.println("[CookieFlip] Features: " + extractor);
        for (TrainingSetConfig set : config.data.trainingSets) {
            for (int i = 1; i <= set.count; i++) {
                String name = String.format(Locale.ROOT, set.pattern, i);
                Mat img;
                try {
                    img = loader.load(name);
                } catch (IOException e) {
                    System.err.println("[CookieFlip] ERROR: " + e.getMessage());
                    continue;
                }
                try {
                    addTrainingSamples(img, set.label);
                    Mat frame = renderer.renderCaption(img, set.title);
                    sink.present(set.title, frame);
                    frame.release();
                } finally {
                    img.release();
                }
                pause();
            }
        }
        System.out.println(trainingData);
    }

    /**
     * Detect cookies and append their features with the given label.
     *
     * @return number of samples appended
     */
    public int addTrainingSamples(Mat img, int label) {
        List<PixelRegion> cookies = detector.detectCookies(img);
        try {
            if (cookies.isEmpty()) {
                System.out.println("[CookieFlip] No cookies found in training image");
                return 0;
            }
            FeatureMatrix features = extractor.computeCookieFeatures(img, cookies);
            trainingData.append(features, label);
            return features.rows();
        } finally {
            releaseAll(cookies);
        }
    }

    /**
     * Fit the classifier on the accumulated training data.
     *
     * @return false if training failed
     */
    public boolean trainClassifier() {
        boolean success = classifier.train(trainingData);
        if (!success) {
            System.out.println("Training failed");
            return false;
        }
        AccuracyReport report = classifier.getAccuracy(trainingData);
        System.out.println("Trained classifier with accuracy: " + (report.accuracy * 100) + " %");
        System.out.println("Confusion matrix = \n" + report.confusionMatrix);
        return true;
    }

    /**
     * Classify the configured test images.
     * Images without cookies are skipped. Stops early if the classifier is not trained.
     */
    public List<ClassificationResult> classify() {
        List<ClassificationResult> results = new ArrayList<>();
        for (int i = 1; i <= config.data.testCount; i++) {
            String name = String.format(Locale.ROOT, config.data.testPattern, i);
            Mat currentImage;
            try {
                currentImage = loader.load(name);
            } catch (IOException e) {
                System.err.println("[CookieFlip] ERROR: " + e.getMessage());
                continue;
            }
            try {
                ClassificationResult result = classifyImage(name, currentImage);
                if (result == null && !classifier.isTrained()) {
                    return results;
                }
                if (result != null) {
                    results.add(result);
                }
            } finally {
                currentImage.release();
            }
            pause();
        }
        return results;
    }

    /**
     * Classify the cookies of one image.
     *
     * @return null if the image has no cookies or the classifier is not trained
     */
    public ClassificationResult classifyImage(String name, Mat currentImage) {
        long tic = System.currentTimeMillis();
        List<PixelRegion> cookies = detector.detectCookies(currentImage);
        try {
            if (cookies.isEmpty()) {
                System.out.println("No cookies in image");
                return null;
            }
            if (!classifier.isTrained()) {
                System.out.println("Classifier was not trained");
                return null;
            }

            FeatureMatrix features = extractor.computeCookieFeatures(currentImage, cookies);
            int[] labels = classifier.predict(features);
            long procTime = System.currentTimeMillis() - tic;
            System.out.println("Processing time = " + procTime + " ms");

            ClassificationResult result = new ClassificationResult(name, labels, procTime);
            Mat frame = renderer.renderClassification(currentImage, cookies, labels, "Classify");
            sink.present("Classify", frame);
            frame.release();

            System.out.println(result.getFlippedCount() + " out of " + result.getCookieCount() + " cookies are flipped");
            return result;
        } finally {
            releaseAll(cookies);
        }
    }

    private void pause() {
        long delay = config.output.delayMs;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void releaseAll(List<PixelRegion> regions) {
        for (PixelRegion region : regions) {
            region.release();
        }
    }
}
