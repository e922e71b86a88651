package eu.bde.sarchannel.product;

import java.io.IOException;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import eu.bde.sarchannel.geometry.Trajectory;
import eu.bde.sarchannel.metadata.ImageType;
import eu.bde.sarchannel.metadata.OrbitDirection;
import eu.bde.sarchannel.metadata.Polarization;
import eu.bde.sarchannel.metadata.RadiometricQuantity;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.metadata.SideLooking;
import eu.bde.sarchannel.metadata.SwstChange;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.model.LocationData;
import eu.bde.sarchannel.model.PixelCoordinate;
import eu.bde.sarchannel.model.SampleWindow;
import eu.bde.sarchannel.model.TimeCoordinate;
import eu.bde.sarchannel.polynomial.DopplerPolynomial;

/**
 * One channel of a SAR product, the same regardless of the satellite format it was read from.
 */
public interface SarChannel {

	String getChannelId();

	String getSwathName();

	SarProjection getProjection();

	Polarization getPolarization();

	OrbitDirection getOrbitDirection();

	ImageType getImageType();

	SideLooking getLookingSide();

	RadiometricQuantity getRadiometricQuantity();

	double getCarrierFrequency();

	/**
	 * @return carrier wavelength in meters
	 */
	double getWavelength();

	double getPulseRate();

	/**
	 * @return range sample spacing in meters, slant or ground depending on the projection
	 */
	double getRangeStepMeters();

	double getAzimuthStepSeconds();

	AzimuthTime getMidAzimuthTime();

	/**
	 * @return slant range time at the middle of the swath
	 */
	double getMidRangeTime();

	AzimuthTime[] getAzimuthAxis();

	double[] getRangeAxis();

	double[] getSlantRangeAxis();

	int[] getLinesPerBurst();

	List<SwstChange> getSwstChanges();

	TimeCoordinate getMidBurstTimes(int burst);

	double getSteeringRate(AzimuthTime azimuthTime);

	double getSteeringRate(AzimuthTime azimuthTime, int burst);

	DopplerPolynomial getDopplerCentroid();

	DopplerPolynomial getDopplerRate();

	Trajectory getTrajectory();

	LocationData getLocationData(AzimuthTime azimuthTime, double rangeTime);

	TimeCoordinate pixelToTime(double azimuthIndex, double rangeIndex);

	TimeCoordinate pixelToTime(double azimuthIndex, double rangeIndex, int burst);

	PixelCoordinate timeToPixel(AzimuthTime azimuthTime, double rangeTime);

	PixelCoordinate timeToPixel(AzimuthTime azimuthTime, double rangeTime, int burst);

	int timeToBurst(AzimuthTime azimuthTime);

	int pixelToBurst(double azimuthIndex);

	BurstAssociation groundPointToBursts(Vector3D groundPoint);

	List<BurstAssociation> groundPointsToBursts(List<Vector3D> groundPoints);

	SampleWindow readWindow(int azimuthIndex, int rangeIndex, int width, int height,
			RadiometricQuantity outputQuantity) throws IOException;

	SampleWindow readWindow(int azimuthIndex, int rangeIndex, int width, int height,
			RadiometricQuantity outputQuantity, int burst) throws IOException;
}
