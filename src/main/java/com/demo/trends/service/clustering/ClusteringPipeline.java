package com.demo.trends.service.clustering;

/** Dataset + dimensionality reduction + partitioning, as one capability. */
public interface ClusteringPipeline {

    boolean isAvailable();

    String name();

    ClusterAssignment run(int nClusters, int sampleLimit) throws Exception;
}
