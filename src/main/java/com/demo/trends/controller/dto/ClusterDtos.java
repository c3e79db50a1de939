package com.demo.trends.controller.dto;

import com.demo.trends.service.dto.ClusterRun;
import com.demo.trends.service.dto.ClusterSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

public final class ClusterDtos {
    private ClusterDtos() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Meta {
        @JsonProperty("n_clusters")
        public int nClusters;
        public String source;       // live | mock | fallback_error
        public Integer sampled;     // live path only
    }

    public static class ClusterItem {
        @JsonProperty("cluster_id")
        public int clusterId;
        public int count;
        @JsonProperty("sample_indices")
        public List<Integer> sampleIndices;
        @JsonProperty("label_hint")
        public String labelHint;
        @JsonProperty("centroid_norm")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public Double centroidNorm;

        public static ClusterItem from(ClusterSummary s) {
            ClusterItem i = new ClusterItem();
            i.clusterId = s.clusterId();
            i.count = s.count();
            i.sampleIndices = s.sampleRefs();
            i.labelHint = s.labelHint();
            i.centroidNorm = s.centroidNorm();
            return i;
        }
    }

    public static class ClustersResponse {
        public Meta meta;
        public List<ClusterItem> clusters;

        public static ClustersResponse from(int nClusters, ClusterRun run) {
            ClustersResponse r = new ClustersResponse();
            r.meta = new Meta();
            r.meta.nClusters = nClusters;
            r.meta.source = run.source().wire();
            r.meta.sampled = run.sampled();
            r.clusters = run.clusters().stream().map(ClusterItem::from).collect(Collectors.toList());
            return r;
        }
    }
}
