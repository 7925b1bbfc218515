package at.felixb.strand.mergetree;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

import static at.felixb.strand.mergetree.SequenceNumbers.*;

/**
 * Flat, acknowledged form of a segment as it appears in a snapshot.
 * Removal fields are null for live segments.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SerializedSegment(String text,
                                boolean marker,
                                PropertySet props,
                                int seq,
                                int clientId,
                                Integer removedSeq,
                                Integer removedClientId,
                                List<Integer> removedClientOverlap) {

    public static SerializedSegment of(Segment segment) {
        if (!segment.isAcked() || (segment.isRemoved() && !segment.isRemovalAcked())) {
            throw new IllegalStateException("cannot serialize pending segment " + segment);
        }
        String text = segment instanceof TextSegment textSegment ? textSegment.getText() : null;
        PropertySet props = segment.properties == null || segment.properties.isEmpty() ? null : segment.properties.copy();
        if (!segment.isRemoved()) {
            return new SerializedSegment(text, segment instanceof Marker, props, segment.seq, segment.clientId,
                    null, null, null);
        }
        List<Integer> overlap = segment.getRemovedClientOverlap();
        return new SerializedSegment(text, segment instanceof Marker, props, segment.seq, segment.clientId,
                segment.removedSeq, segment.removedClientId, overlap.isEmpty() ? null : List.copyOf(overlap));
    }

    public Segment toSegment() {
        Segment segment = Segment.fromInsertOp(new InsertOp(0, text, marker, props));
        segment.stamp(seq, clientId);
        if (removedSeq != null) {
            segment.restoreRemoval(removedSeq, removedClientId == null ? NON_COLLAB_CLIENT : removedClientId,
                    removedClientOverlap);
        }
        return segment;
    }
}
