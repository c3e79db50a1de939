package com.demo.trends.service.clustering;

/**
 * Raw pipeline output, indexed by position in the clustered sample.
 *
 * @param labels          cluster id of each sampled item, in [0, centroids.length)
 * @param originalIndices dataset index of each sampled item
 * @param centroids       cluster centres in reduced space
 * @param labelHints      per-cluster display label, or null when the dataset carries no class labels
 */
public record ClusterAssignment(int[] labels, int[] originalIndices, double[][] centroids, String[] labelHints) {

    public ClusterAssignment {
        if (labels.length != originalIndices.length) {
            throw new IllegalArgumentException("labels and originalIndices differ in length");
        }
        if (labelHints != null && labelHints.length != centroids.length) {
            throw new IllegalArgumentException("one label hint per cluster expected");
        }
    }

    public int clusterCount() {
        return centroids.length;
    }

    public int sampled() {
        return labels.length;
    }
}
