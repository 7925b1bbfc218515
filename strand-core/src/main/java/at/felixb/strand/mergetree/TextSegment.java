package at.felixb.strand.mergetree;

public final class TextSegment extends Segment {

    public static final String TYPE = "text";

    private String text;

    public TextSegment(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public int getLength() {
        return text.length();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    Segment createSplitSegmentAt(int pos) {
        TextSegment tail = new TextSegment(text.substring(pos));
        this.text = text.substring(0, pos);
        return tail;
    }

    @Override
    public boolean canAppend(Segment other) {
        return other instanceof TextSegment && super.canAppend(other);
    }

    @Override
    void appendContent(Segment other) {
        this.text = text + ((TextSegment) other).text;
    }

    @Override
    InsertOp toInsertOp(int pos) {
        return new InsertOp(pos, text, false, properties == null ? null : properties.copy());
    }

    @Override
    public String toString() {
        return "TextSegment{'" + text + "', seq=" + seq + ", client=" + clientId
                + (isRemoved() ? ", removedSeq=" + removedSeq : "") + '}';
    }
}
