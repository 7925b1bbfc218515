package at.felixb.strand.sequence;

public record IntervalDeleteOp(String label, String id) implements IntervalOp {
}
