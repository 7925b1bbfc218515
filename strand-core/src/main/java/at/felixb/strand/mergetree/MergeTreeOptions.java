package at.felixb.strand.mergetree;

/**
 * Tuning knobs of a merge tree.
 *
 * @param maxNodesInBlock     maximum number of children of a block, at least 4
 * @param packOnMinSeqAdvance compact the tree whenever the minimum sequence number advances
 */
public record MergeTreeOptions(int maxNodesInBlock, boolean packOnMinSeqAdvance) {

    public static final MergeTreeOptions DEFAULT = new MergeTreeOptions(8, true);

    public MergeTreeOptions {
        if (maxNodesInBlock < 4) {
            throw new IllegalArgumentException("maxNodesInBlock must be >= 4");
        }
    }

    public MergeTreeOptions withMaxNodesInBlock(int maxNodesInBlock) {
        return new MergeTreeOptions(maxNodesInBlock, packOnMinSeqAdvance);
    }

    public MergeTreeOptions withPackOnMinSeqAdvance(boolean packOnMinSeqAdvance) {
        return new MergeTreeOptions(maxNodesInBlock, packOnMinSeqAdvance);
    }
}
