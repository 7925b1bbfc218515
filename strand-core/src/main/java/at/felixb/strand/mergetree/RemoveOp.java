package at.felixb.strand.mergetree;

/**
 * Removes the half-open range {@code [start, end)}.
 */
public record RemoveOp(int start, int end) implements MergeTreeOp {
}
