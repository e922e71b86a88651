package eu.bde.sarchannel.rasterreader;

import java.awt.Rectangle;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import eu.bde.sarchannel.model.SampleWindow;

/**
 * Reads blocks of a flat binary raster through a Hadoop {@link FileSystem}, so both {@code hdfs://}
 * and {@code file://} paths work. Every read opens its own stream and uses positional reads.
 */
public class HDFSRasterReader implements RasterReader {

    private static final Logger log = Logger.getLogger(HDFSRasterReader.class);

    private final RasterFileInfo fileInfo;
    private final FileSystem fs;
    private final Path path;

    public HDFSRasterReader(RasterFileInfo fileInfo) throws IOException {
        this(fileInfo, new Configuration());
    }

    public HDFSRasterReader(RasterFileInfo fileInfo, Configuration conf) throws IOException {
        this.fileInfo = fileInfo;
        this.path = new Path(fileInfo.getHdfsPath());
        this.fs = FileSystem.get(URI.create(fileInfo.getHdfsPath()), conf);
        log.info("raster reader on " + fileInfo);
    }

    @Override
    public SampleWindow read(Rectangle block, double scale) throws IOException {
        if (block.x < 0 || block.y < 0 || block.x + block.width > fileInfo.getSamples()
                || block.y + block.height > fileInfo.getLines()) {
            throw new IOException("block " + block + " outside " + fileInfo);
        }
        final SampleFormat format = fileInfo.getFormat();
        final double[] real = new double[block.width * block.height];
        final double[] imaginary = format.isComplex() ? new double[real.length] : null;
        final byte[] lineBytes = new byte[block.width * format.getBytesPerSample()];

        try (FSDataInputStream in = fs.open(path)) {
            int idx = 0;
            for (int line = block.y; line < block.y + block.height; line++) {
                in.readFully(fileInfo.getOffset(line, block.x), lineBytes);
                final ByteBuffer buffer = ByteBuffer.wrap(lineBytes).order(ByteOrder.BIG_ENDIAN);
                for (int s = 0; s < block.width; s++) {
                    real[idx] = buffer.getFloat() * scale;
                    if (imaginary != null) {
                        imaginary[idx] = buffer.getFloat() * scale;
                    }
                    idx++;
                }
            }
        }
        log.debug("read " + block + " from " + path);
        return new SampleWindow(block, real, imaginary);
    }

    public RasterFileInfo getFileInfo() {
        return fileInfo;
    }
}
