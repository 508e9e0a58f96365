package com.cloud.costspike.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

/**
 * One isolation tree, stored as a flat arena of nodes addressed by index.
 * Node 0 is the root. A node with {@code left == LEAF} is external and keeps the
 * number of training points that reached it.
 */
public class IsolationTree {

    static final int LEAF = -1;

    private static final double EULER_GAMMA = 0.5772156649;

    private int[] splitFeature;
    private double[] splitValue;
    private int[] left;
    private int[] right;
    private int[] size;
    private int nodeCount;

    private IsolationTree(int initialCapacity) {
        splitFeature = new int[initialCapacity];
        splitValue = new double[initialCapacity];
        left = new int[initialCapacity];
        right = new int[initialCapacity];
        size = new int[initialCapacity];
    }

    /**
     * Grow a tree on {@code data} (already sub-sampled). Points are referenced, never copied.
     */
    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        IsolationTree tree = new IsolationTree(Math.max(1, 2 * data.length - 1));
        int[] rows = new int[data.length];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        tree.buildNode(data, rows, 0, rows.length, 0, maxDepth, random);
        return tree;
    }

    // rows[from, to) are the points in this node; partitioned in place
    private int buildNode(double[][] data, int[] rows, int from, int to,
                          int depth, int maxDepth, Random random) {
        int n = to - from;
        int node = allocate(n);

        if (n <= 1 || depth >= maxDepth) {
            return node;
        }

        int numFeatures = data[rows[from]].length;
        double[] min = new double[numFeatures];
        double[] max = new double[numFeatures];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (int i = from; i < to; i++) {
            double[] row = data[rows[i]];
            for (int f = 0; f < numFeatures; f++) {
                if (row[f] < min[f]) min[f] = row[f];
                if (row[f] > max[f]) max[f] = row[f];
            }
        }

        // Only features that still vary inside this node can split it
        int[] candidates = new int[numFeatures];
        int candidateCount = 0;
        for (int f = 0; f < numFeatures; f++) {
            if (min[f] < max[f]) candidates[candidateCount++] = f;
        }
        if (candidateCount == 0) {
            return node;
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double threshold = min[feature] + random.nextDouble() * (max[feature] - min[feature]);
        // Rounding can land on max when the range is a few ulps wide; keep it in [min, max)
        if (threshold >= max[feature]) {
            threshold = min[feature];
        }

        int mid = partition(data, rows, from, to, feature, threshold);

        splitFeature[node] = feature;
        splitValue[node] = threshold;
        int l = buildNode(data, rows, from, mid, depth + 1, maxDepth, random);
        int r = buildNode(data, rows, mid, to, depth + 1, maxDepth, random);
        left[node] = l;
        right[node] = r;
        return node;
    }

    // Moves rows with value < threshold to the front; returns the first ">=" position
    private static int partition(double[][] data, int[] rows, int from, int to,
                                 int feature, double threshold) {
        int store = from;
        for (int i = from; i < to; i++) {
            if (data[rows[i]][feature] < threshold) {
                int tmp = rows[store];
                rows[store] = rows[i];
                rows[i] = tmp;
                store++;
            }
        }
        return store;
    }

    private int allocate(int pointCount) {
        if (nodeCount == left.length) {
            int capacity = left.length * 2;
            splitFeature = Arrays.copyOf(splitFeature, capacity);
            splitValue = Arrays.copyOf(splitValue, capacity);
            left = Arrays.copyOf(left, capacity);
            right = Arrays.copyOf(right, capacity);
            size = Arrays.copyOf(size, capacity);
        }
        int node = nodeCount++;
        left[node] = LEAF;
        right[node] = LEAF;
        size[node] = pointCount;
        return node;
    }

    /**
     * Edges from the root to the leaf holding {@code point}, plus the expected remaining
     * depth c(size) of the subtree that was cut off at that leaf.
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (left[node] != LEAF) {
            node = point[splitFeature[node]] < splitValue[node] ? left[node] : right[node];
            depth++;
        }
        return depth + averagePathLength(size[node]);
    }

    /**
     * Average path length of unsuccessful search in a BST (Equation 1 from the IF paper).
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public int getNodeCount() { return nodeCount; }

    int leafSize(int node) { return size[node]; }

    boolean isLeaf(int node) { return left[node] == LEAF; }

    int leftChild(int node) { return left[node]; }

    int rightChild(int node) { return right[node]; }

    int splitFeature(int node) { return splitFeature[node]; }
}
