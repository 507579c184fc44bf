package com.whereq.modelhub.capability;

import java.util.Arrays;

/**
 * Weights of a linear regression {@code y = w.x + b}. Inference and training both
 * lock the instance so a prediction never sees a half-applied update.
 */
public class LinearModel {

    private final double[] weights;
    private double bias;

    public LinearModel(double[] weights, double bias) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("Linear model needs at least one weight");
        }
        this.weights = weights.clone();
        this.bias = bias;
    }

    public int inputSize() {
        return weights.length;
    }

    public synchronized double predict(double[] features) {
        checkSize(features);
        double y = bias;
        for (int i = 0; i < weights.length; i++) {
            y += weights[i] * features[i];
        }
        return y;
    }

    /**
     * One full-batch gradient descent step on squared error
     *
     * @return mean squared error after the update
     */
    public synchronized double step(double[][] features, double[] labels, double learningRate) {
        int n = labels.length;
        double[] gradW = new double[weights.length];
        double gradB = 0;

        for (int row = 0; row < n; row++) {
            double residual = predictUnlocked(features[row]) - labels[row];
            for (int i = 0; i < weights.length; i++) {
                gradW[i] += residual * features[row][i];
            }
            gradB += residual;
        }

        for (int i = 0; i < weights.length; i++) {
            weights[i] -= learningRate * 2.0 * gradW[i] / n;
        }
        bias -= learningRate * 2.0 * gradB / n;

        double sse = 0;
        for (int row = 0; row < n; row++) {
            double residual = predictUnlocked(features[row]) - labels[row];
            sse += residual * residual;
        }
        return sse / n;
    }

    public synchronized double[] getWeights() {
        return weights.clone();
    }

    public synchronized double getBias() {
        return bias;
    }

    private double predictUnlocked(double[] features) {
        checkSize(features);
        double y = bias;
        for (int i = 0; i < weights.length; i++) {
            y += weights[i] * features[i];
        }
        return y;
    }

    private void checkSize(double[] features) {
        if (features.length != weights.length) {
            throw new IllegalArgumentException("Expected " + weights.length + " features but got "
                + features.length);
        }
    }

    @Override
    public String toString() {
        return "LinearModel{weights=" + Arrays.toString(getWeights()) + ", bias=" + getBias() + "}";
    }
}
