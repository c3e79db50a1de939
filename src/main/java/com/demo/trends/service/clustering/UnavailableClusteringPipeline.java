package com.demo.trends.service.clustering;

public class UnavailableClusteringPipeline implements ClusteringPipeline {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String name() {
        return "none";
    }

    @Override
    public ClusterAssignment run(int nClusters, int sampleLimit) {
        throw new IllegalStateException("clustering pipeline not configured");
    }
}
