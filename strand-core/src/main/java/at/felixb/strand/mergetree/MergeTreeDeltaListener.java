package at.felixb.strand.mergetree;

@FunctionalInterface
public interface MergeTreeDeltaListener {
    void onDelta(MergeTreeDeltaEvent event);
}
