package at.felixb.strand.mergetree;

import static at.felixb.strand.mergetree.SequenceNumbers.UNASSIGNED_SEQ;

record RemotePerspective(int refSeq, int clientId) implements Perspective {

    @Override
    public int lengthOf(Segment segment) {
        return segment.lengthFor(refSeq, clientId);
    }

    @Override
    public boolean usesCachedLength(MergeBlock block) {
        return block.maxSeq <= refSeq;
    }

    // local segments not yet sequenced come after every remote insert at the same gap
    @Override
    public boolean insertsBefore(Segment zeroLengthSegment) {
        return zeroLengthSegment.seq == UNASSIGNED_SEQ;
    }
}
