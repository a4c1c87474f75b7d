package com.example.Bess_Analytics_Platform.service;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Isolation forest outlier scorer (Liu, Ting, Zhou 2008).
 *
 * Each tree isolates a random subsample by splitting on a random feature at a
 * random value between the node's min and max. Outliers are isolated in fewer
 * splits, so the score 2^(-E[h(x)] / c(psi)) approaches 1 for them and stays
 * around or below 0.5 for inliers.
 *
 * A new random generator is seeded per call, so identical input always gives
 * identical scores and concurrent calls share no state.
 */
public class IsolationForestScorer implements OutlierScorer {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int trees;
    private final int subsampleSize;
    private final long seed;

    public IsolationForestScorer(int trees, int subsampleSize, long seed) {
        if (trees < 1) {
            throw new IllegalArgumentException("Isolation forest needs at least one tree");
        }
        if (subsampleSize < 2) {
            throw new IllegalArgumentException("Subsample size must be at least 2");
        }
        this.trees = trees;
        this.subsampleSize = subsampleSize;
        this.seed = seed;
    }

    @Override
    public String name() {
        return "isolation_forest";
    }

    @Override
    public double[] score(double[][] features) {
        int n = features.length;
        double[] scores = new double[n];
        if (n < 2) {
            Arrays.fill(scores, 0.5);
            return scores;
        }

        int psi = Math.min(subsampleSize, n);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        SplittableRandom random = new SplittableRandom(seed);

        double[] totalPathLength = new double[n];
        int[] indices = new int[n];
        for (int t = 0; t < trees; t++) {
            for (int i = 0; i < n; i++) {
                indices[i] = i;
            }
            // Partial Fisher-Yates: the first psi entries become the subsample
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(n - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
            }
            int[] subsample = Arrays.copyOf(indices, psi);
            Node root = build(features, subsample, 0, heightLimit, random);
            for (int i = 0; i < n; i++) {
                totalPathLength[i] += pathLength(features[i], root, 0);
            }
        }

        double normalizer = averagePathLength(psi);
        for (int i = 0; i < n; i++) {
            double meanPath = totalPathLength[i] / trees;
            scores[i] = Math.pow(2.0, -meanPath / normalizer);
        }
        return scores;
    }

    private Node build(double[][] features, int[] rows, int depth, int heightLimit, SplittableRandom random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }

        int dimensions = features[rows[0]].length;
        double[] min = new double[dimensions];
        double[] max = new double[dimensions];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (int row : rows) {
            for (int d = 0; d < dimensions; d++) {
                min[d] = Math.min(min[d], features[row][d]);
                max[d] = Math.max(max[d], features[row][d]);
            }
        }

        // Only features that still vary inside this node can split it
        int[] splittable = new int[dimensions];
        int splittableCount = 0;
        for (int d = 0; d < dimensions; d++) {
            if (max[d] > min[d]) {
                splittable[splittableCount++] = d;
            }
        }
        if (splittableCount == 0) {
            return Node.leaf(rows.length);
        }

        int attribute = splittable[random.nextInt(splittableCount)];
        double splitValue = min[attribute] + random.nextDouble() * (max[attribute] - min[attribute]);

        int leftCount = 0;
        for (int row : rows) {
            if (features[row][attribute] < splitValue) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int r = 0;
        for (int row : rows) {
            if (features[row][attribute] < splitValue) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }

        return Node.split(attribute, splitValue,
                build(features, left, depth + 1, heightLimit, random),
                build(features, right, depth + 1, heightLimit, random));
    }

    private double pathLength(double[] point, Node node, int depth) {
        Node current = node;
        int length = depth;
        while (!current.isLeaf()) {
            current = point[current.attribute] < current.splitValue ? current.left : current.right;
            length++;
        }
        return length + averagePathLength(current.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of n nodes; normalizes path lengths.
     */
    static double averagePathLength(int n) {
        if (n > 2) {
            double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
            return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
        }
        return n == 2 ? 1.0 : 0.0;
    }

    private static final class Node {
        private final int attribute;
        private final double splitValue;
        private final Node left;
        private final Node right;
        private final int size;

        private Node(int attribute, double splitValue, Node left, Node right, int size) {
            this.attribute = attribute;
            this.splitValue = splitValue;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int attribute, double splitValue, Node left, Node right) {
            return new Node(attribute, splitValue, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
