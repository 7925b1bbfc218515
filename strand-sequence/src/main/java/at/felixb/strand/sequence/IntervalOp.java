package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.DocumentOp;

/**
 * An op on one interval of the collection named {@link #label()}.
 */
public sealed interface IntervalOp extends DocumentOp permits IntervalAddOp, IntervalChangeOp, IntervalDeleteOp {

    String label();

    String id();
}
