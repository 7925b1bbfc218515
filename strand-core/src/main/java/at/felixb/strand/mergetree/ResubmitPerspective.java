package at.felixb.strand.mergetree;

import static at.felixb.strand.mergetree.SequenceNumbers.UNASSIGNED_SEQ;

/**
 * Acknowledged state plus the pending local ops already regenerated in the current resubmit pass,
 * i.e. what peers will have applied when the next regenerated op reaches them.
 */
record ResubmitPerspective(int passStart) implements Perspective {

    @Override
    public int lengthOf(Segment segment) {
        boolean inserted = segment.seq != UNASSIGNED_SEQ || segment.localSeq >= passStart;
        if (!inserted) {
            return 0;
        }
        if (segment.isRemoved()
                && (segment.removedSeq != UNASSIGNED_SEQ || segment.localRemovedSeq >= passStart)) {
            return 0;
        }
        return segment.getLength();
    }

    @Override
    public boolean usesCachedLength(MergeBlock block) {
        return block.maxSeq != Integer.MAX_VALUE;
    }

    boolean isKnownToPeers(Segment segment) {
        return segment.seq != UNASSIGNED_SEQ || segment.localSeq >= passStart;
    }
}
