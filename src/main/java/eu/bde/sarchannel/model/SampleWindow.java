package eu.bde.sarchannel.model;

import java.awt.Rectangle;
import java.io.Serializable;
import java.util.Arrays;

/**
 * A rectangular block of raster samples. Samples are amplitudes, stored row-major (line by line);
 * complex rasters carry an imaginary buffer as well.
 */
public class SampleWindow implements Serializable {

	private static final long serialVersionUID = 1L;

	private final int firstLine;
	private final int firstSample;
	private final int lines;
	private final int samples;
	private final double[] real;
	private final double[] imaginary;

	public SampleWindow(Rectangle block, double[] real, double[] imaginary) {
		this.firstLine = block.y;
		this.firstSample = block.x;
		this.lines = block.height;
		this.samples = block.width;
		if (real.length != lines * samples) {
			throw new IllegalArgumentException("real buffer holds " + real.length + " samples, block needs " + lines * samples);
		}
		if (imaginary != null && imaginary.length != real.length) {
			throw new IllegalArgumentException("imaginary buffer size differs from real buffer size");
		}
		this.real = real;
		this.imaginary = imaginary;
	}

	public SampleWindow(Rectangle block, double[] real) {
		this(block, real, null);
	}

	/**
	 * @return a new window over the same block whose samples are multiplied by the per-range-sample factors
	 */
	public SampleWindow scaleBySample(double[] factors) {
		if (factors.length != samples) {
			throw new IllegalArgumentException("expected " + samples + " factors, got " + factors.length);
		}
		final double[] scaledReal = new double[real.length];
		final double[] scaledImaginary = imaginary != null ? new double[imaginary.length] : null;
		final WindowIndex index = new WindowIndex(this);
		final int maxLine = firstLine + lines;
		final int maxSample = firstSample + samples;
		for (int line = firstLine; line < maxLine; ++line) {
			index.calculateStride(line);
			for (int sample = firstSample; sample < maxSample; ++sample) {
				final int idx = index.getIndex(sample);
				final double factor = factors[sample - firstSample];
				scaledReal[idx] = real[idx] * factor;
				if (scaledImaginary != null) {
					scaledImaginary[idx] = imaginary[idx] * factor;
				}
			}
		}
		return new SampleWindow(getRectangle(), scaledReal, scaledImaginary);
	}

	public double getReal(int line, int sample) {
		return real[bufferIndex(line, sample)];
	}

	public double getImaginary(int line, int sample) {
		return imaginary == null ? 0.0 : imaginary[bufferIndex(line, sample)];
	}

	public double getAmplitude(int line, int sample) {
		final double re = getReal(line, sample);
		final double im = getImaginary(line, sample);
		return Math.sqrt(re * re + im * im);
	}

	private int bufferIndex(int line, int sample) {
		if (line < firstLine || line >= firstLine + lines || sample < firstSample || sample >= firstSample + samples) {
			throw new IndexOutOfBoundsException("(" + line + ", " + sample + ") outside " + getRectangle());
		}
		return (line - firstLine) * samples + (sample - firstSample);
	}

	public boolean isComplex() {
		return imaginary != null;
	}

	public int getFirstLine() {
		return firstLine;
	}

	public int getFirstSample() {
		return firstSample;
	}

	public int getLines() {
		return lines;
	}

	public int getSamples() {
		return samples;
	}

	public final Rectangle getRectangle() {
		return new Rectangle(firstSample, firstLine, samples, lines);
	}

	public double[] getReal() {
		return real;
	}

	public double[] getImaginary() {
		return imaginary;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SampleWindow)) {
			return false;
		}
		SampleWindow that = (SampleWindow) o;
		return firstLine == that.firstLine && firstSample == that.firstSample && lines == that.lines
				&& samples == that.samples && Arrays.equals(real, that.real) && Arrays.equals(imaginary, that.imaginary);
	}

	@Override
	public int hashCode() {
		int result = getRectangle().hashCode();
		result = 31 * result + Arrays.hashCode(real);
		return 31 * result + Arrays.hashCode(imaginary);
	}
}
