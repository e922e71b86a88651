package eu.bde.sarchannel.distributed.mappers;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import com.google.common.collect.Lists;

import eu.bde.sarchannel.model.BurstAssociation;
import eu.bde.sarchannel.operator.BurstAssociator;
import scala.Tuple2;

public class AssociationMappers {

	/**
	 * Associates one partition of indexed ground points, keeping the index of every point.
	 */
	public static Iterator<Tuple2<Long, BurstAssociation>> associateGroundPoints(
			Iterator<Tuple2<Long, Vector3D>> iterator, BurstAssociator associator) {
		List<Tuple2<Long, Vector3D>> points = Lists.newArrayList(iterator);
		List<Tuple2<Long, BurstAssociation>> associations = new ArrayList<Tuple2<Long, BurstAssociation>>(
				points.size());
		for (int i = 0; i < points.size(); i++) {
			Tuple2<Long, Vector3D> point = points.get(i);
			associations.add(new Tuple2<Long, BurstAssociation>(point._1, associator.groundPointToBursts(point._2)));
		}
		return associations.iterator();
	}
}
