package eu.bde.sarchannel.calibration;

import java.io.Serializable;

import eu.bde.sarchannel.metadata.RadiometricQuantity;
import eu.bde.sarchannel.model.SampleWindow;

/**
 * Converts a window of samples between radiometric quantities.
 */
public interface RadiometricConverter extends Serializable {

	/**
	 * @param incidenceAngles incidence angle in radians of every range sample of the window
	 */
	SampleWindow convert(SampleWindow window, double[] incidenceAngles, RadiometricQuantity input,
			RadiometricQuantity output);
}
