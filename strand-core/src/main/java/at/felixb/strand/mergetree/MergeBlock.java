package at.felixb.strand.mergetree;

import java.util.ArrayList;
import java.util.List;

/**
 * Internal node of the merge tree. Caches the local length and the highest stamp of its subtree
 * so that queries can skip whole blocks.
 */
public final class MergeBlock implements MergeNode {

    final List<MergeNode> children = new ArrayList<>();

    MergeBlock parent;
    int index;

    int cachedLength;   // local view length of the subtree
    int maxSeq;

    MergeBlock() {
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public MergeBlock getParent() {
        return parent;
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public int localLength() {
        return cachedLength;
    }

    @Override
    public int maxSeq() {
        return maxSeq;
    }

    void reindexFrom(int start) {
        for (int i = start; i < children.size(); i++) {
            MergeNode child = children.get(i);
            if (child instanceof MergeBlock block) {
                block.parent = this;
                block.index = i;
            } else if (child instanceof Segment segment) {
                segment.parent = this;
                segment.index = i;
            }
        }
    }

    void update() {
        int length = 0;
        int max = SequenceNumbers.UNIVERSAL_SEQ;
        for (MergeNode child : children) {
            length += child.localLength();
            max = Math.max(max, child.maxSeq());
        }
        this.cachedLength = length;
        this.maxSeq = max;
    }
}
