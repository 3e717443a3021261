package com.privatedocs.qa.service.index;

public final class VectorMath {

    private VectorMath() {
    }

    public static double cosine(float[] left, float[] right) {
        if (left == null || right == null) {
            return 0.0;
        }
        if (left.length != right.length) {
            throw new IllegalArgumentException("Vector dimensions differ: " + left.length + " vs " + right.length);
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += (double) left[i] * right[i];
            leftNorm += (double) left[i] * left[i];
            rightNorm += (double) right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
