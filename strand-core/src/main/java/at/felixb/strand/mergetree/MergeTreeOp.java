package at.felixb.strand.mergetree;

public sealed interface MergeTreeOp extends DocumentOp permits InsertOp, RemoveOp, AnnotateOp {
}
