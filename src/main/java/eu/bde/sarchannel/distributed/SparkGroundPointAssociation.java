package eu.bde.sarchannel.distributed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.log4j.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaPairRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;

import eu.bde.sarchannel.config.EngineConfiguration;
import eu.bde.sarchannel.distributed.mappers.AssociationMappers;
import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.operator.BurstAssociator;
import eu.bde.sarchannel.product.GenericSarChannel;
import scala.Tuple2;

/**
 * Ground point to burst association spread over a Spark cluster. The associator is broadcast once,
 * points are shipped with their position in the input list and the results come back in input order.
 */
public class SparkGroundPointAssociation {

	private static final Logger log = Logger.getLogger(SparkGroundPointAssociation.class);

	private final JavaSparkContext sc;
	private final int partitions;

	public SparkGroundPointAssociation(JavaSparkContext sc, int partitions) {
		this.sc = sc;
		this.partitions = partitions;
	}

	public SparkGroundPointAssociation(JavaSparkContext sc, EngineConfiguration configuration) {
		this(sc, configuration.getSparkPartitions());
	}

	public static SparkConf createConf(EngineConfiguration configuration) {
		SparkConf conf = new SparkConf().setMaster(configuration.getSparkMaster())
				.setAppName(configuration.getSparkAppName());
		// configure spark to use Kryo serializer instead of the java
		conf.set("spark.serializer", "org.apache.spark.serializer.KryoSerializer");
		conf.set("spark.kryo.registrator", ChannelKryoRegistrator.class.getName());
		return conf;
	}

	public List<BurstAssociation> associate(GenericSarChannel channel, List<Vector3D> groundPoints) {
		log.info("associating " + groundPoints.size() + " ground points with channel " + channel.getChannelId());
		return associate(channel.getBurstAssociator(), groundPoints);
	}

	public List<BurstAssociation> associate(BurstAssociator associator, List<Vector3D> groundPoints) {
		long start = System.currentTimeMillis();
		List<Tuple2<Long, Vector3D>> indexed = new ArrayList<Tuple2<Long, Vector3D>>(groundPoints.size());
		for (int i = 0; i < groundPoints.size(); i++) {
			indexed.add(new Tuple2<Long, Vector3D>((long) i, groundPoints.get(i)));
		}

		Broadcast<BurstAssociator> associatorB = sc.broadcast(associator);
		JavaPairRDD<Long, BurstAssociation> associations = sc.parallelize(indexed, partitions)
				.mapPartitionsToPair(iterator -> AssociationMappers.associateGroundPoints(iterator, associatorB.value()));
		List<Tuple2<Long, BurstAssociation>> collected = associations.collect();
		associatorB.destroy();

		BurstAssociation[] ordered = new BurstAssociation[groundPoints.size()];
		int associated = 0;
		for (Tuple2<Long, BurstAssociation> tuple : collected) {
			ordered[tuple._1.intValue()] = tuple._2;
			if (tuple._2.isAssociated()) {
				associated++;
			}
		}
		log.info(associated + " of " + groundPoints.size() + " ground points associated in "
				+ (System.currentTimeMillis() - start) + " ms");
		return Arrays.asList(ordered);
	}
}
