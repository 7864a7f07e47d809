package com.ttennebkram.cookieflip;

import com.ttennebkram.cookieflip.config.CookieFlipConfig;
import com.ttennebkram.cookieflip.detection.CookieDetector;
import com.ttennebkram.cookieflip.features.CookieFeatureExtractor;
import com.ttennebkram.cookieflip.features.FeatureMatrix;
import com.ttennebkram.cookieflip.ml.CookieClassifier;
import com.ttennebkram.cookieflip.ml.KnnClassifier;
import com.ttennebkram.cookieflip.ml.TrainingDataSet;
import com.ttennebkram.cookieflip.model.PixelRegion;
import com.ttennebkram.cookieflip.visualization.FileResultSink;
import com.ttennebkram.cookieflip.visualization.ResultSink;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CookieFlipPipelineTest {

    @TempDir
    Path tempDir;

    private Path resources;
    private CookieFlipConfig config;

    @BeforeAll
    static void loadOpenCV() {
        TestImages.loadOpenCV();
    }

    @BeforeEach
    void setUp() throws Exception {
        resources = tempDir.resolve("resources");
        TestImages.writeDataSet(resources);
        config = new CookieFlipConfig();
        config.data.resourceDir = resources.toString();
        config.output.delayMs = 0;
    }

    /**
     * Records what reaches the feature extractor.
     */
    static class CountingExtractor extends CookieFeatureExtractor {
        int calls = 0;

        CountingExtractor() {
            super(21);
        }

        @Override
        public FeatureMatrix computeCookieFeatures(Mat image, List<PixelRegion> cookies) {
            calls++;
            return super.computeCookieFeatures(image, cookies);
        }
    }

    /**
     * Delegating classifier that records predict calls.
     */
    static class CountingClassifier implements CookieClassifier {
        final CookieClassifier delegate = new KnnClassifier(4, true);
        final List<Integer> predictedRows = new ArrayList<>();

        @Override
        public String getName() {
            return "counting";
        }

        @Override
        public boolean train(TrainingDataSet data) {
            return delegate.train(data);
        }

        @Override
        public boolean isTrained() {
            return delegate.isTrained();
        }

        @Override
        public int[] predict(FeatureMatrix features) {
            predictedRows.add(features.rows());
            return delegate.predict(features);
        }
    }

    private CookieFlipPipeline pipeline(CookieFeatureExtractor extractor, CookieClassifier classifier, ResultSink sink) {
        return new CookieFlipPipeline(config, new ImageLoader(resources),
                new CookieDetector(config.detection), extractor, classifier, sink);
    }

    @Test
    void testFullRunClassifiesMixedImages() throws Exception {
        Path output = tempDir.resolve("output");
        config.output.dir = output.toString();
        CookieFlipPipeline pipeline = new CookieFlipPipeline(config, new FileResultSink(output));

        List<ClassificationResult> results = pipeline.run();

        assertEquals(16, pipeline.getTrainingData().size());
        assertTrue(pipeline.getClassifier().isTrained());
        assertEquals(2, results.size());
        assertArrayEquals(new int[]{1, 2, 2, 1}, results.get(0).getLabels());
        assertArrayEquals(new int[]{2, 1, 1, 2}, results.get(1).getLabels());
        assertEquals(2, results.get(0).getFlippedCount());
        assertEquals("Test/mix_1.png", results.get(0).imageName);

        // 4 training frames + 2 classification frames
        try (Stream<Path> files = Files.list(output)) {
            assertEquals(6, files.count());
        }
    }

    @Test
    void testEveryClassifierTypeRuns() {
        for (String type : new String[]{"SVM", "kNN", "Bayes"}) {
            config.classifier.type = type;
            CookieFlipPipeline pipeline = new CookieFlipPipeline(config, ResultSink.NONE);

            List<ClassificationResult> results = pipeline.run();

            assertEquals(2, results.size(), type);
            assertArrayEquals(new int[]{1, 2, 2, 1}, results.get(0).getLabels(), type);
        }
    }

    @Test
    void testTrainingSetGrowsByDetectedCookies() {
        CookieFlipPipeline pipeline = pipeline(new CookieFeatureExtractor(21), new KnnClassifier(4, true), ResultSink.NONE);

        Mat negatives = TestImages.cookies(41, false, false, false, false);
        Mat positives = TestImages.cookies(42, true, true);
        Mat blank = TestImages.blank();
        try {
            assertEquals(4, pipeline.addTrainingSamples(negatives, 1));
            assertEquals(2, pipeline.addTrainingSamples(positives, 2));
            assertEquals(0, pipeline.addTrainingSamples(blank, 2));
        } finally {
            TestImages.release(negatives, positives, blank);
        }

        assertEquals(6, pipeline.getTrainingData().size());
    }

    @Test
    void testEmptyDetectionSkipsFeaturesAndClassification() throws Exception {
        TestImages.write(resources.resolve("Test/mix_1.png"), TestImages.blank());
        CountingExtractor extractor = new CountingExtractor();
        CountingClassifier classifier = new CountingClassifier();
        CookieFlipPipeline pipeline = pipeline(extractor, classifier, ResultSink.NONE);
        pipeline.createTrainingData();
        assertTrue(pipeline.trainClassifier());
        int trainingCalls = extractor.calls;
        // Accuracy reporting predicted the training set
        classifier.predictedRows.clear();

        List<ClassificationResult> results = pipeline.classify();

        // mix_1 is skipped, mix_2 is still classified
        assertEquals(1, results.size());
        assertEquals("Test/mix_2.png", results.get(0).imageName);
        assertEquals(trainingCalls + 1, extractor.calls);
        assertEquals(List.of(4), classifier.predictedRows);
    }

    @Test
    void testClassifyImageWithoutCookiesReturnsNull() {
        CountingExtractor extractor = new CountingExtractor();
        CountingClassifier classifier = new CountingClassifier();
        CookieFlipPipeline pipeline = pipeline(extractor, classifier, ResultSink.NONE);

        Mat blank = TestImages.blank();

        assertNull(pipeline.classifyImage("blank", blank));
        assertEquals(0, extractor.calls);
        blank.release();
        assertTrue(classifier.predictedRows.isEmpty());
    }

    @Test
    void testUntrainedClassifierStopsClassification() {
        CountingExtractor extractor = new CountingExtractor();
        CountingClassifier classifier = new CountingClassifier();
        CookieFlipPipeline pipeline = pipeline(extractor, classifier, ResultSink.NONE);

        List<ClassificationResult> results = pipeline.classify();

        assertTrue(results.isEmpty());
        assertEquals(0, extractor.calls);
        assertTrue(classifier.predictedRows.isEmpty());
    }

    @Test
    void testTrainingFailureSkipsClassification() throws Exception {
        // Only negatives: a single class cannot be trained
        Files.delete(resources.resolve("Train/positives_1.png"));
        Files.delete(resources.resolve("Train/positives_2.png"));
        CountingClassifier classifier = new CountingClassifier();
        CookieFlipPipeline pipeline = pipeline(new CookieFeatureExtractor(21), classifier, ResultSink.NONE);

        List<ClassificationResult> results = pipeline.run();

        assertEquals(8, pipeline.getTrainingData().size());
        assertFalse(classifier.isTrained());
        assertTrue(results.isEmpty());
        assertTrue(classifier.predictedRows.isEmpty());
    }

    @Test
    void testUnusableOutputDirectoryDoesNotStopTheRun() throws Exception {
        Path occupied = tempDir.resolve("occupied");
        Files.write(occupied, new byte[]{1});
        CookieFlipPipeline pipeline = pipeline(new CookieFeatureExtractor(21), new KnnClassifier(4, true),
                new FileResultSink(occupied.resolve("frames")));

        List<ClassificationResult> results = pipeline.run();

        assertEquals(2, results.size());
        assertArrayEquals(new int[]{1, 2, 2, 1}, results.get(0).getLabels());
        assertTrue(Files.isRegularFile(occupied));
    }

    @Test
    void testResultLabelsCannotBeModified() {
        ClassificationResult result = new ClassificationResult("mix", new int[]{2, 1}, 5);

        result.getLabels()[1] = 2;

        assertArrayEquals(new int[]{2, 1}, result.getLabels());
        assertEquals(1, result.getFlippedCount());
    }
}
