package at.felixb.strand.mergetree;

/**
 * A local op that has been applied to the tree and waits for its sequence number.
 */
public record LocalEdit(MergeTreeOp op, SegmentGroup segmentGroup) {
}
