package eu.bde.sarchannel.model;

import java.io.Serializable;

import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/**
 * Outcome of associating one ground point with the bursts of a channel: either the set of every
 * burst observing the point, or no association at all.
 */
public final class BurstAssociation implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final BurstAssociation NONE = new BurstAssociation(null);

    private final IntSortedSet bursts;

    private BurstAssociation(IntSortedSet bursts) {
        this.bursts = bursts;
    }

    public static BurstAssociation none() {
        return NONE;
    }

    public static BurstAssociation of(int... bursts) {
        if (bursts.length == 0) {
            return NONE;
        }
        return new BurstAssociation(IntSortedSets.unmodifiable(new IntAVLTreeSet(bursts)));
    }

    public static BurstAssociation of(IntSortedSet bursts) {
        if (bursts.isEmpty()) {
            return NONE;
        }
        return new BurstAssociation(IntSortedSets.unmodifiable(new IntAVLTreeSet(bursts)));
    }

    public boolean isAssociated() {
        return bursts != null;
    }

    /**
     * @return associated burst indices in ascending order
     * @throws IllegalStateException if there is no association
     */
    public IntSortedSet getBursts() {
        if (bursts == null) {
            throw new IllegalStateException("ground point has no burst association");
        }
        return bursts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BurstAssociation)) {
            return false;
        }
        BurstAssociation that = (BurstAssociation) o;
        return bursts == null ? that.bursts == null : bursts.equals(that.bursts);
    }

    @Override
    public int hashCode() {
        return bursts == null ? 0 : bursts.hashCode();
    }

    private Object readResolve() {
        return bursts == null ? NONE : this;
    }

    @Override
    public String toString() {
        return bursts == null ? "no association" : "bursts " + bursts;
    }
}
