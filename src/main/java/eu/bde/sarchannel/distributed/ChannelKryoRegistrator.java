package eu.bde.sarchannel.distributed;

import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.spark.serializer.KryoRegistrator;
import org.objenesis.strategy.StdInstantiatorStrategy;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.serializers.JavaSerializer;

import de.javakaffee.kryoserializers.ArraysAsListSerializer;
import de.javakaffee.kryoserializers.CollectionsEmptyListSerializer;
import de.javakaffee.kryoserializers.CollectionsSingletonListSerializer;
import de.javakaffee.kryoserializers.UnmodifiableCollectionsSerializer;
import de.javakaffee.kryoserializers.guava.ImmutableListSerializer;
import de.javakaffee.kryoserializers.guava.ImmutableMapSerializer;
import eu.bde.sarchannel.geometry.MonostaticInverseGeocoder;
import eu.bde.sarchannel.geometry.StateVector;
import eu.bde.sarchannel.geometry.StateVectorTrajectory;
import eu.bde.sarchannel.metadata.BurstInfo;
import eu.bde.sarchannel.metadata.GeocodingMetadata;
import eu.bde.sarchannel.metadata.RasterInfo;
import eu.bde.sarchannel.metadata.SarProjection;
import eu.bde.sarchannel.model.AzimuthTime;
import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.model.BurstRectangle;
import eu.bde.sarchannel.model.TimeCoordinate;
import eu.bde.sarchannel.operator.BurstAssociator;
import eu.bde.sarchannel.operator.BurstLayout;
import eu.bde.sarchannel.polynomial.GenericPoly;
import eu.bde.sarchannel.polynomial.PolynomialGroundSlantConversion;
import eu.bde.sarchannel.polynomial.SortedPolyList;

public class ChannelKryoRegistrator implements KryoRegistrator {

	@Override
	public void registerClasses(Kryo kryo) {
		kryo.setInstantiatorStrategy(new Kryo.DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
		kryo.register(AzimuthTime.class);
		kryo.register(AzimuthTime[].class);
		kryo.register(TimeCoordinate.class);
		kryo.register(BurstRectangle.class);
		// fastutil sets serialize themselves
		kryo.register(BurstAssociation.class, new JavaSerializer());
		kryo.register(RasterInfo.class);
		kryo.register(BurstInfo.class);
		kryo.register(SarProjection.class);
		kryo.register(GeocodingMetadata.class);
		kryo.register(BurstLayout.class);
		kryo.register(BurstAssociator.class);
		kryo.register(MonostaticInverseGeocoder.class);
		kryo.register(StateVector.class);
		kryo.register(StateVectorTrajectory.class);
		kryo.register(GenericPoly.class);
		kryo.register(SortedPolyList.class);
		kryo.register(PolynomialGroundSlantConversion.class);
		kryo.register(Vector3D.class);
		kryo.register(Arrays.asList("").getClass(), new ArraysAsListSerializer());
		kryo.register(Collections.EMPTY_LIST.getClass(), new CollectionsEmptyListSerializer());
		kryo.register(Collections.singletonList("").getClass(), new CollectionsSingletonListSerializer());
		UnmodifiableCollectionsSerializer.registerSerializers(kryo);
		// guava ImmutableList, ImmutableMap
		ImmutableListSerializer.registerSerializers(kryo);
		ImmutableMapSerializer.registerSerializers(kryo);
	}
}
