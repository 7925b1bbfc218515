package at.felixb.strand.mergetree;

enum LocalPerspective implements Perspective {
    INSTANCE;

    @Override
    public int lengthOf(Segment segment) {
        return segment.localLength();
    }

    @Override
    public boolean usesCachedLength(MergeBlock block) {
        return true;
    }
}
