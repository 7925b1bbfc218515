package at.felixb.strand.mergetree;

import java.util.List;

public record MergeTreeDeltaEvent(MergeTreeDeltaType deltaType, List<Segment> segments, boolean local, int clientId) {
    public enum MergeTreeDeltaType {
        INSERT, REMOVE, ANNOTATE
    }
}
