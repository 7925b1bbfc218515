package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.SerializedSegment;

import java.util.List;
import java.util.Map;

/**
 * Acknowledged state of a {@link SharedString} at {@code sequenceNumber}: the ordered segments,
 * tombstones above the minimum sequence number included, and the intervals per collection label.
 */
public record SharedStringSnapshot(int sequenceNumber,
                                   int minimumSequenceNumber,
                                   List<SerializedSegment> segments,
                                   Map<String, List<IntervalSnapshot>> intervalCollections) {
}
