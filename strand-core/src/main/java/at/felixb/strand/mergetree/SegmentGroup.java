package at.felixb.strand.mergetree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The segments touched by one pending local op, in document order.
 * Split tails join the group of their head.
 */
public final class SegmentGroup {

    private final List<Segment> segments = new ArrayList<>();
    private final int localSeq;

    SegmentGroup(int localSeq) {
        this.localSeq = localSeq;
    }

    public List<Segment> getSegments() {
        return Collections.unmodifiableList(segments);
    }

    public int getLocalSeq() {
        return localSeq;
    }

    void add(Segment segment) {
        segments.add(segment);
        segment.segmentGroups.add(this);
    }

    void addAfter(Segment existing, Segment tail) {
        int i = segments.indexOf(existing);
        segments.add(i + 1, tail);
        tail.segmentGroups.add(this);
    }

    void release() {
        for (Segment segment : segments) {
            segment.segmentGroups.remove(this);
        }
    }
}
