package eu.bde.sarchannel.rasterreader;

import java.awt.Rectangle;
import java.io.IOException;

import eu.bde.sarchannel.model.SampleWindow;

/**
 * Reads raw sample blocks of one raster.
 */
public interface RasterReader {

    /**
     * @param block x = first range sample, y = first line, width = samples, height = lines
     * @param scale calibration factor every sample is multiplied with
     */
    SampleWindow read(Rectangle block, double scale) throws IOException;
}
