package at.felixb.strand.mergetree;

public record SegmentOffset(Segment segment, int offset) {
}
