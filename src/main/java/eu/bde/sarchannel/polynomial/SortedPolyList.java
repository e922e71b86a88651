package eu.bde.sarchannel.polynomial;

import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import eu.bde.sarchannel.model.AzimuthTime;

/**
 * Time-tagged sequence of polynomials. A query is answered by the last polynomial whose reference
 * azimuth time is not after the query time, or by the first one when the query precedes them all.
 * An empty list evaluates to zero.
 */
public class SortedPolyList implements CoordinateFunction {

    private static final long serialVersionUID = 1L;

    private final ImmutableList<GenericPoly> polynomials;

    public SortedPolyList() {
        this.polynomials = ImmutableList.of();
    }

    public SortedPolyList(List<GenericPoly> polynomials) {
        this.polynomials = Ordering.from(new Comparator<GenericPoly>() {
            @Override
            public int compare(GenericPoly p1, GenericPoly p2) {
                return p1.getReferenceAzimuthTime().compareTo(p2.getReferenceAzimuthTime());
            }
        }).immutableSortedCopy(polynomials);
    }

    @Override
    public double evaluate(AzimuthTime azimuthTime, double rangeTime) {
        if (polynomials.isEmpty()) {
            return 0.0;
        }
        return select(azimuthTime).evaluate(azimuthTime, rangeTime);
    }

    GenericPoly select(AzimuthTime azimuthTime) {
        GenericPoly selected = polynomials.get(0);
        for (GenericPoly poly : polynomials) {
            if (poly.getReferenceAzimuthTime().isAfter(azimuthTime)) {
                break;
            }
            selected = poly;
        }
        return selected;
    }

    public boolean isEmpty() {
        return polynomials.isEmpty();
    }

    public int size() {
        return polynomials.size();
    }

    public List<GenericPoly> getPolynomials() {
        return polynomials;
    }
}
