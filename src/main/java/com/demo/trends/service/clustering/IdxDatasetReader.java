package com.demo.trends.service.clustering;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Reader for the IDX files Fashion-MNIST ships as (train-images-idx3-ubyte[.gz], train-labels-idx1-ubyte[.gz]).
 * Big-endian header: magic, dimension sizes, then unsigned bytes.
 */
public class IdxDatasetReader {

    static final int IMAGES_MAGIC = 0x00000803;
    static final int LABELS_MAGIC = 0x00000801;

    public ImageSet readImages(Path path) throws IOException {
        try (DataInputStream in = open(path)) {
            int magic = in.readInt();
            if (magic != IMAGES_MAGIC) {
                throw new IOException("Not an IDX image file (magic " + Integer.toHexString(magic) + "): " + path);
            }
            int count = in.readInt();
            int rows = in.readInt();
            int cols = in.readInt();
            if (count < 0 || rows <= 0 || cols <= 0) {
                throw new IOException("Bad IDX image dimensions " + count + "x" + rows + "x" + cols);
            }
            byte[] pixels = new byte[Math.multiplyExact(count, rows * cols)];
            in.readFully(pixels);
            return new ImageSet(count, rows * cols, pixels);
        }
    }

    public int[] readLabels(Path path) throws IOException {
        try (DataInputStream in = open(path)) {
            int magic = in.readInt();
            if (magic != LABELS_MAGIC) {
                throw new IOException("Not an IDX label file (magic " + Integer.toHexString(magic) + "): " + path);
            }
            int count = in.readInt();
            byte[] raw = new byte[count];
            in.readFully(raw);
            int[] labels = new int[count];
            for (int i = 0; i < count; i++) labels[i] = raw[i] & 0xff;
            return labels;
        }
    }

    private DataInputStream open(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        if (path.getFileName().toString().endsWith(".gz")) {
            in = new GZIPInputStream(in);
        }
        return new DataInputStream(in);
    }

    /** Row-major unsigned pixel bytes. */
    public record ImageSet(int count, int featureCount, byte[] pixels) {

        /** Pixels of one image scaled to [0,1]. */
        public double[] features(int index) {
            double[] out = new double[featureCount];
            int off = index * featureCount;
            for (int j = 0; j < featureCount; j++) {
                out[j] = (pixels[off + j] & 0xff) / 255.0;
            }
            return out;
        }
    }
}
