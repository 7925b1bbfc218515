package at.felixb.strand.mergetree;

/**
 * Node of the merge tree: either an internal {@link MergeBlock} or a {@link Segment} leaf.
 */
public sealed interface MergeNode permits MergeBlock, Segment {

    boolean isLeaf();

    MergeBlock getParent();

    int getIndex();

    /** Length in the local view. */
    int localLength();

    /** Highest insert/remove stamp in this subtree; unassigned stamps count as {@link Integer#MAX_VALUE}. */
    int maxSeq();
}
