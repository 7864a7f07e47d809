package com.ttennebkram.cookieflip.ml;

import org.opencv.core.TermCriteria;
import org.opencv.ml.SVM;
import org.opencv.ml.StatModel;

/**
 * C-SVC support vector machine.
 */
public class SvmClassifier extends OpenCvClassifier {

    public static final double DEFAULT_C = 1.0;

    public enum Kernel {
        LINEAR(SVM.LINEAR),
        RBF(SVM.RBF),
        POLY(SVM.POLY),
        SIGMOID(SVM.SIGMOID);

        final int cvKernel;

        Kernel(int cvKernel) {
            this.cvKernel = cvKernel;
        }

        public static Kernel parse(String name) {
            for (Kernel kernel : values()) {
                if (kernel.name().equalsIgnoreCase(name)) {
                    return kernel;
                }
            }
            throw new IllegalArgumentException("Unknown SVM kernel: " + name);
        }
    }

    private final double c;
    private final Kernel kernel;

    public SvmClassifier(double c, Kernel kernel, boolean standardize) {
        super(standardize);
        this.c = c > 0 ? c : DEFAULT_C;
        this.kernel = kernel;
    }

    public double getC() { return c; }
    public Kernel getKernel() { return kernel; }

    @Override
    public String getName() {
        return "SVM";
    }

    @Override
    protected StatModel createModel() {
        SVM svm = SVM.create();
        svm.setType(SVM.C_SVC);
        svm.setKernel(kernel.cvKernel);
        svm.setC(c);
        if (kernel == Kernel.POLY) {
            svm.setDegree(3);
        }
        svm.setTermCriteria(new TermCriteria(TermCriteria.MAX_ITER + TermCriteria.EPS, 10000, 1e-6));
        return svm;
    }
}
