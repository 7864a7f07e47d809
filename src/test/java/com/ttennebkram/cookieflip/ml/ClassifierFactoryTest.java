package com.ttennebkram.cookieflip.ml;

import com.ttennebkram.cookieflip.config.ClassifierConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClassifierFactoryTest {

    @Test
    void testParsesTypeNamesIgnoringCase() {
        assertEquals(ClassifierType.SVM, ClassifierType.parse("SVM"));
        assertEquals(ClassifierType.KNN, ClassifierType.parse("kNN"));
        assertEquals(ClassifierType.KNN, ClassifierType.parse("KNN"));
        assertEquals(ClassifierType.BAYES, ClassifierType.parse(" bayes "));
    }

    @Test
    void testUnknownTypeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ClassifierType.parse("forest"));
        assertThrows(IllegalArgumentException.class, () -> ClassifierType.parse(null));
    }

    @Test
    void testCreatesConfiguredClassifier() {
        ClassifierConfig config = new ClassifierConfig();

        config.type = "SVM";
        config.svmKernel = "rbf";
        CookieClassifier svm = ClassifierFactory.create(config);
        assertTrue(svm instanceof SvmClassifier);
        assertEquals(SvmClassifier.Kernel.RBF, ((SvmClassifier) svm).getKernel());

        config.type = "kNN";
        config.knnK = 7;
        CookieClassifier knn = ClassifierFactory.create(config);
        assertEquals(7, ((KnnClassifier) knn).getK());

        config.type = "Bayes";
        assertEquals("Bayes", ClassifierFactory.create(config).getName());
    }

    @Test
    void testCookieLabels() {
        assertEquals(CookieLabel.FLIPPED, CookieLabel.fromId(2));
        assertTrue(CookieLabel.isFlipped(2));
        assertFalse(CookieLabel.isFlipped(1));
        assertThrows(IllegalArgumentException.class, () -> CookieLabel.fromId(3));
    }
}
