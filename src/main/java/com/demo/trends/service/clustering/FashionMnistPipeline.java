package com.demo.trends.service.clustering;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.stat.correlation.Covariance;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * PCA + k-means over Fashion-MNIST read from local IDX files.
 *
 * Pixels are scaled to [0,1]; sampling, PCA and k-means++ seeding all use seed 42, so the same
 * (n_clusters, sample_limit) over the same files gives the same partition.
 */
@Slf4j
public class FashionMnistPipeline implements ClusteringPipeline {

    static final long SEED = 42L;
    static final int MAX_COMPONENTS = 50;
    static final int KMEANS_TRIALS = 10;
    static final int KMEANS_MAX_ITERATIONS = 300;

    static final String[] CLASS_NAMES = {
            "T-shirt/top", "Trouser", "Pullover", "Dress", "Coat",
            "Sandal", "Shirt", "Sneaker", "Bag", "Ankle boot"
    };

    private final IdxDatasetReader reader;
    private final Path imagesPath;
    private final Path labelsPath;

    public FashionMnistPipeline(IdxDatasetReader reader, Path imagesPath, Path labelsPath) {
        this.reader = reader;
        this.imagesPath = imagesPath;
        this.labelsPath = labelsPath;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String name() {
        return "fashion-mnist:" + imagesPath;
    }

    @Override
    public ClusterAssignment run(int nClusters, int sampleLimit) throws Exception {
        IdxDatasetReader.ImageSet images = reader.readImages(imagesPath);
        int[] classes = readClasses(images.count());

        int[] idx = sampleIndices(images.count(), sampleLimit);
        if (idx.length < nClusters) {
            throw new IllegalArgumentException("cannot form " + nClusters + " clusters from " + idx.length + " items");
        }
        log.info("Clustering {} of {} items into {} clusters", idx.length, images.count(), nClusters);

        double[][] x = new double[idx.length][];
        for (int i = 0; i < idx.length; i++) x[i] = images.features(idx[i]);
        int components = Math.min(MAX_COMPONENTS, Math.min(images.featureCount(), idx.length));
        double[][] z = pcaReduce(x, components);

        List<IndexedPoint> points = IntStream.range(0, z.length)
                .mapToObj(i -> new IndexedPoint(i, z[i]))
                .toList();
        JDKRandomGenerator rng = new JDKRandomGenerator();
        rng.setSeed(SEED);
        KMeansPlusPlusClusterer<IndexedPoint> kmeans = new KMeansPlusPlusClusterer<>(
                nClusters, KMEANS_MAX_ITERATIONS, new EuclideanDistance(), rng);
        List<CentroidCluster<IndexedPoint>> found =
                new MultiKMeansPlusPlusClusterer<>(kmeans, KMEANS_TRIALS).cluster(points);

        int[] labels = new int[idx.length];
        double[][] centroids = new double[found.size()][];
        for (int c = 0; c < found.size(); c++) {
            centroids[c] = found.get(c).getCenter().getPoint();
            for (IndexedPoint p : found.get(c).getPoints()) labels[p.position] = c;
        }
        String[] hints = (classes == null) ? null : majorityClassNames(labels, idx, classes, found.size());
        return new ClusterAssignment(labels, idx, centroids, hints);
    }

    private int[] readClasses(int expected) throws Exception {
        if (labelsPath == null || !Files.exists(labelsPath)) return null;
        int[] classes = reader.readLabels(labelsPath);
        if (classes.length != expected) {
            throw new IllegalStateException("label count " + classes.length + " does not match image count " + expected);
        }
        return classes;
    }

    /** Up to {@code limit} distinct indices drawn without replacement (seeded), or every index when the set is small enough. */
    static int[] sampleIndices(int count, int limit) {
        int[] all = IntStream.range(0, count).toArray();
        if (count <= limit) return all;
        Random rnd = new Random(SEED);
        for (int i = 0; i < limit; i++) {
            int j = i + rnd.nextInt(count - i);
            int t = all[i];
            all[i] = all[j];
            all[j] = t;
        }
        return Arrays.copyOf(all, limit);
    }

    /** Projects rows onto the top principal axes of their covariance. */
    static double[][] pcaReduce(double[][] x, int components) {
        int n = x.length;
        int d = x[0].length;
        double[] mean = new double[d];
        for (double[] row : x) {
            for (int j = 0; j < d; j++) mean[j] += row[j];
        }
        for (int j = 0; j < d; j++) mean[j] /= n;

        double[][] centered = new double[n][d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) centered[i][j] = x[i][j] - mean[j];
        }

        RealMatrix cov = (n > 1) ? new Covariance(x).getCovarianceMatrix() : new Array2DRowRealMatrix(d, d);
        EigenDecomposition eig = new EigenDecomposition(cov);
        double[] values = eig.getRealEigenvalues();
        Integer[] order = IntStream.range(0, values.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());

        RealMatrix basis = new Array2DRowRealMatrix(d, components);
        for (int c = 0; c < components; c++) {
            basis.setColumnVector(c, eig.getEigenvector(order[c]));
        }
        return new Array2DRowRealMatrix(centered, false).multiply(basis).getData();
    }

    private static String[] majorityClassNames(int[] labels, int[] idx, int[] classes, int k) {
        int[][] votes = new int[k][CLASS_NAMES.length];
        for (int i = 0; i < labels.length; i++) {
            int cls = classes[idx[i]];
            if (cls >= 0 && cls < CLASS_NAMES.length) votes[labels[i]][cls]++;
        }
        String[] out = new String[k];
        for (int c = 0; c < k; c++) {
            int best = -1;
            for (int cls = 0; cls < CLASS_NAMES.length; cls++) {
                if (votes[c][cls] > 0 && (best < 0 || votes[c][cls] > votes[c][best])) best = cls;
            }
            out[c] = (best < 0) ? null : CLASS_NAMES[best];
        }
        return out;
    }

    private record IndexedPoint(int position, double[] point) implements Clusterable {
        @Override
        public double[] getPoint() {
            return point;
        }
    }
}
