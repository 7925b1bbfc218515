package at.felixb.strand.mergetree;

/**
 * Atomic element of length one, e.g. a paragraph mark. Markers never split or merge and render
 * as nothing in plain text.
 */
public final class Marker extends Segment {

    public static final String TYPE = "marker";

    /** Stands in for a marker where positions and text must line up. */
    public static final char PLACEHOLDER = '\uFFFC';

    public Marker() {
    }

    public Marker(PropertySet props) {
        if (props != null && !props.isEmpty()) {
            this.properties = new PropertySet().merge(props);
        }
    }

    @Override
    public int getLength() {
        return 1;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    Segment createSplitSegmentAt(int pos) {
        throw new UnsupportedOperationException("markers cannot be split");
    }

    @Override
    public boolean canAppend(Segment other) {
        return false;
    }

    @Override
    void appendContent(Segment other) {
        throw new UnsupportedOperationException("markers cannot be merged");
    }

    @Override
    InsertOp toInsertOp(int pos) {
        return new InsertOp(pos, null, true, properties == null ? null : properties.copy());
    }

    @Override
    public String toString() {
        return "Marker{seq=" + seq + ", client=" + clientId + (isRemoved() ? ", removedSeq=" + removedSeq : "") + '}';
    }
}
