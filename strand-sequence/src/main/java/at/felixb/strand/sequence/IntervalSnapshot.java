package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.PropertySet;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * An interval as stored in a snapshot. Bounds are kept as anchors into the snapshot's segment
 * list rather than positions, so a bound on a tombstone is restored on that tombstone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntervalSnapshot(String id, IntervalType intervalType, Anchor start, Anchor end, PropertySet props) {

    /**
     * @param segment index into {@link SharedStringSnapshot#segments()}, or one of
     *                {@link #START_OF_DOCUMENT} and {@link #DETACHED}
     */
    public record Anchor(int segment, int offset) {

        public static final int START_OF_DOCUMENT = -1;
        public static final int DETACHED = -2;
    }
}
