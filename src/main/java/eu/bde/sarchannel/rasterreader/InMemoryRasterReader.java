package eu.bde.sarchannel.rasterreader;

import java.awt.Rectangle;
import java.io.IOException;

import eu.bde.sarchannel.model.SampleWindow;

/**
 * Reader over a raster already held in memory, row-major.
 */
public class InMemoryRasterReader implements RasterReader {

	private final int lines;
	private final int samples;
	private final double[] real;
	private final double[] imaginary;

	public InMemoryRasterReader(int lines, int samples, double[] real) {
		this(lines, samples, real, null);
	}

	public InMemoryRasterReader(int lines, int samples, double[] real, double[] imaginary) {
		if (real.length != (long) lines * samples || (imaginary != null && imaginary.length != real.length)) {
			throw new IllegalArgumentException("buffers do not match a " + lines + "x" + samples + " raster");
		}
		this.lines = lines;
		this.samples = samples;
		this.real = real;
		this.imaginary = imaginary;
	}

	@Override
	public SampleWindow read(Rectangle block, double scale) throws IOException {
		if (block.x < 0 || block.y < 0 || block.x + block.width > samples || block.y + block.height > lines) {
			throw new IOException("block " + block + " outside " + lines + "x" + samples + " raster");
		}
		final double[] outReal = new double[block.width * block.height];
		final double[] outImaginary = imaginary != null ? new double[outReal.length] : null;
		int idx = 0;
		for (int line = block.y; line < block.y + block.height; line++) {
			final int offset = line * samples;
			for (int sample = block.x; sample < block.x + block.width; sample++) {
				outReal[idx] = real[offset + sample] * scale;
				if (outImaginary != null) {
					outImaginary[idx] = imaginary[offset + sample] * scale;
				}
				idx++;
			}
		}
		return new SampleWindow(block, outReal, outImaginary);
	}
}
