package at.felixb.strand.mergetree;

import java.util.*;

import static at.felixb.strand.mergetree.SequenceNumbers.*;

/**
 * Leaf of the merge tree: a run of elements inserted by one op.
 * <p>
 * A segment carries the stamp of the op that inserted it ({@code seq}, {@code clientId}) and, once
 * removed, the stamp of the first removal plus every other client that removed it concurrently.
 * Stamps only move forward: local, acknowledged, removed locally, removed and acknowledged.
 */
public abstract sealed class Segment implements MergeNode permits TextSegment, Marker {

    int seq = UNIVERSAL_SEQ;
    int clientId = NON_COLLAB_CLIENT;
    int localSeq;

    int removedSeq = NOT_REMOVED;
    int removedClientId = NON_COLLAB_CLIENT;
    int localRemovedSeq;
    List<Integer> removedClientOverlap;

    PropertySet properties;
    private Map<String, Integer> pendingPropertyCounts;

    final List<SegmentGroup> segmentGroups = new ArrayList<>(1);
    private LocalReferenceCollection localRefs;

    MergeBlock parent;
    int index;

    public abstract int getLength();

    public abstract String getType();

    /** Truncates this segment to {@code [0, pos)} and returns a segment holding the rest of the content. */
    abstract Segment createSplitSegmentAt(int pos);

    abstract void appendContent(Segment other);

    abstract InsertOp toInsertOp(int pos);

    static Segment fromInsertOp(InsertOp op) {
        Segment segment = op.marker() ? new Marker() : new TextSegment(op.text());
        if (op.props() != null && !op.props().isEmpty()) {
            segment.properties = new PropertySet().merge(op.props());
        }
        return segment;
    }

    // -------------------------------------------------
    //  Stamps
    // -------------------------------------------------

    public int getSeq() {
        return seq;
    }

    public int getClientId() {
        return clientId;
    }

    public int getRemovedSeq() {
        return removedSeq;
    }

    public int getRemovedClientId() {
        return removedClientId;
    }

    public List<Integer> getRemovedClientOverlap() {
        return removedClientOverlap == null ? List.of() : Collections.unmodifiableList(removedClientOverlap);
    }

    public boolean isAcked() {
        return seq != UNASSIGNED_SEQ;
    }

    public boolean isRemoved() {
        return removedSeq != NOT_REMOVED;
    }

    boolean isRemovalAcked() {
        return isRemoved() && removedSeq != UNASSIGNED_SEQ;
    }

    public boolean wasRemovedBy(int client) {
        if (!isRemoved()) {
            return false;
        }
        return removedClientId == client || (removedClientOverlap != null && removedClientOverlap.contains(client));
    }

    /**
     * Stamps a removal. The earliest acknowledged removal keeps the stamp; later removers only join
     * the overlap list. A pending local removal gives way to an acknowledged remote one.
     *
     * @return true if the segment was live before
     */
    boolean markRemoved(int seq, int clientId) {
        if (!isRemoved()) {
            this.removedSeq = seq;
            this.removedClientId = clientId;
            return true;
        }
        if (removedSeq == UNASSIGNED_SEQ && seq != UNASSIGNED_SEQ) {
            int pendingRemover = removedClientId;
            this.removedSeq = seq;
            this.removedClientId = clientId;
            addRemovedClient(pendingRemover);
            return false;
        }
        addRemovedClient(clientId);
        return false;
    }

    void restoreRemoval(int removedSeq, int removedClientId, List<Integer> overlap) {
        this.removedSeq = removedSeq;
        this.removedClientId = removedClientId;
        this.removedClientOverlap = overlap == null || overlap.isEmpty() ? null : new ArrayList<>(overlap);
    }

    void stamp(int seq, int clientId) {
        this.seq = seq;
        this.clientId = clientId;
    }

    private void addRemovedClient(int client) {
        if (client == removedClientId) {
            return;
        }
        if (removedClientOverlap == null) {
            removedClientOverlap = new ArrayList<>(2);
        }
        if (!removedClientOverlap.contains(client)) {
            removedClientOverlap.add(client);
        }
    }

    /**
     * Length as seen by {@code viewerClientId} after applying every op up to {@code refSeq}.
     */
    int lengthFor(int refSeq, int viewerClientId) {
        boolean inserted = seq == UNIVERSAL_SEQ
                || clientId == viewerClientId
                || (seq != UNASSIGNED_SEQ && seq <= refSeq);
        if (!inserted) {
            return 0;
        }
        if (isRemoved()
                && (wasRemovedBy(viewerClientId) || (removedSeq != UNASSIGNED_SEQ && removedSeq <= refSeq))) {
            return 0;
        }
        return getLength();
    }

    // -------------------------------------------------
    //  MergeNode
    // -------------------------------------------------

    @Override
    public boolean isLeaf() {
        return true;
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
        return isRemoved() ? 0 : getLength();
    }

    @Override
    public int maxSeq() {
        int max = seqKey(seq);
        if (isRemoved()) {
            max = Math.max(max, seqKey(removedSeq));
        }
        return max;
    }

    private static int seqKey(int seq) {
        return seq == UNASSIGNED_SEQ ? Integer.MAX_VALUE : seq;
    }

    // -------------------------------------------------
    //  Split / append
    // -------------------------------------------------

    /**
     * Splits this segment at {@code pos}. This segment keeps {@code [0, pos)}; the returned tail
     * gets the rest together with all stamps, properties, group memberships and the references at
     * or after {@code pos}. The caller links the tail into the tree.
     */
    public Segment splitAt(int pos) {
        if (pos <= 0 || pos >= getLength()) {
            throw new IndexOutOfBoundsException("split offset: " + pos + ", length: " + getLength());
        }

        Segment tail = createSplitSegmentAt(pos);
        tail.seq = seq;
        tail.clientId = clientId;
        tail.localSeq = localSeq;
        tail.removedSeq = removedSeq;
        tail.removedClientId = removedClientId;
        tail.localRemovedSeq = localRemovedSeq;
        if (removedClientOverlap != null) {
            tail.removedClientOverlap = new ArrayList<>(removedClientOverlap);
        }
        if (properties != null) {
            tail.properties = properties.copy();
        }
        if (pendingPropertyCounts != null) {
            tail.pendingPropertyCounts = new HashMap<>(pendingPropertyCounts);
        }
        for (SegmentGroup group : segmentGroups) {
            group.addAfter(this, tail);
        }
        if (localRefs != null) {
            localRefs.split(pos, tail);
        }
        return tail;
    }

    /**
     * Whether {@code other} may be merged into this segment: both live and acknowledged with the
     * same stamp and properties, nothing pending on either, and no reference parked after this
     * segment's last element.
     */
    public boolean canAppend(Segment other) {
        return !isRemoved() && !other.isRemoved()
                && isAcked() && other.isAcked()
                && seq == other.seq && clientId == other.clientId
                && segmentGroups.isEmpty() && other.segmentGroups.isEmpty()
                && !hasPendingProperties() && !other.hasPendingProperties()
                && Objects.equals(propertiesOrEmpty(), other.propertiesOrEmpty())
                && (localRefs == null || !localRefs.hasReferenceAt(getLength()));
    }

    void append(Segment other) {
        int shift = getLength();
        appendContent(other);
        if (other.localRefs != null && !other.localRefs.isEmpty()) {
            localReferences().absorb(other.localRefs, shift);
        }
    }

    // -------------------------------------------------
    //  Properties
    // -------------------------------------------------

    public PropertySet getProperties() {
        return propertiesOrEmpty().copy();
    }

    private PropertySet propertiesOrEmpty() {
        return properties == null ? new PropertySet() : properties;
    }

    /**
     * Applies an annotate patch. A remote write skips keys with a pending local write, which will
     * be sequenced later and win.
     */
    void annotate(PropertySet patch, boolean local) {
        if (properties == null) {
            properties = new PropertySet();
        }
        for (Map.Entry<String, Object> entry : patch.asMap().entrySet()) {
            String key = entry.getKey();
            if (local) {
                if (pendingPropertyCounts == null) {
                    pendingPropertyCounts = new HashMap<>();
                }
                pendingPropertyCounts.merge(key, 1, Integer::sum);
            } else if (pendingPropertyCounts != null && pendingPropertyCounts.containsKey(key)) {
                continue;
            }
            properties.set(key, entry.getValue());
        }
    }

    void ackAnnotate(PropertySet patch) {
        if (pendingPropertyCounts == null) {
            return;
        }
        for (String key : patch.keySet()) {
            pendingPropertyCounts.computeIfPresent(key, (k, count) -> count > 1 ? count - 1 : null);
        }
        if (pendingPropertyCounts.isEmpty()) {
            pendingPropertyCounts = null;
        }
    }

    boolean hasPendingProperties() {
        return pendingPropertyCounts != null && !pendingPropertyCounts.isEmpty();
    }

    // -------------------------------------------------
    //  References / groups
    // -------------------------------------------------

    LocalReferenceCollection localReferences() {
        if (localRefs == null) {
            localRefs = new LocalReferenceCollection(this);
        }
        return localRefs;
    }

    public boolean hasLocalReferences() {
        return localRefs != null && !localRefs.isEmpty();
    }

    public List<LocalReference> getLocalReferences() {
        if (localRefs == null) {
            return List.of();
        }
        List<LocalReference> refs = new ArrayList<>(localRefs.size());
        localRefs.forEach(refs::add);
        return refs;
    }

    public List<SegmentGroup> getSegmentGroups() {
        return Collections.unmodifiableList(segmentGroups);
    }
}
