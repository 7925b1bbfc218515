package at.felixb.strand.mergetree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static at.felixb.strand.mergetree.SequenceNumbers.*;

/**
 * One peer's replica of a merge tree.
 * <p>
 * Local edits apply immediately and return a {@link LocalEdit} for the caller to send. Sequenced
 * ops from other clients are applied in their author's perspective; the echo of a local op
 * acknowledges its segment group. After a reconnect every pending op is regenerated against the
 * acknowledged state instead of being replayed.
 */
public class Client {

    private static final Logger logger = LoggerFactory.getLogger(Client.class);

    private static final int NO_PASS = -1;

    private final int clientId;
    private final MergeTreeOptions options;
    private final MergeTree mergeTree;

    private int currentSeq = UNIVERSAL_SEQ;
    private int minSeq = UNIVERSAL_SEQ;
    private int localSeq = 0;
    private int resubmitPassStart = NO_PASS;

    public Client(int clientId) {
        this(clientId, MergeTreeOptions.DEFAULT);
    }

    public Client(int clientId, MergeTreeOptions options) {
        if (clientId < 0) {
            throw new IllegalArgumentException("clientId must be >= 0");
        }
        this.clientId = clientId;
        this.options = options;
        this.mergeTree = new MergeTree(options);
    }

    public int getClientId() {
        return clientId;
    }

    public int getCurrentSeq() {
        return currentSeq;
    }

    public int getMinSeq() {
        return minSeq;
    }

    public MergeTree getMergeTree() {
        return mergeTree;
    }

    public boolean hasPendingEdits() {
        return !mergeTree.pendingSegmentGroups.isEmpty();
    }

    // #### Local edits

    public LocalEdit insertTextLocal(int pos, String text, PropertySet props) {
        TextSegment segment = new TextSegment(text);
        return insertLocal(pos, segment, props);
    }

    public LocalEdit insertMarkerLocal(int pos, PropertySet props) {
        return insertLocal(pos, new Marker(), props);
    }

    private LocalEdit insertLocal(int pos, Segment segment, PropertySet props) {
        int length = getLength();
        if (pos < 0 || pos > length) {
            throw new IndexOutOfBoundsException("position: " + pos + ", length: " + length);
        }
        if (props != null && !props.isEmpty()) {
            segment.properties = new PropertySet().merge(props);
        }

        SegmentGroup group = new SegmentGroup(++localSeq);
        segment.stamp(UNASSIGNED_SEQ, clientId);
        segment.localSeq = group.getLocalSeq();
        group.add(segment);
        mergeTree.pendingSegmentGroups.addLast(group);

        InsertOp op = segment.toInsertOp(pos);
        mergeTree.insertSegment(pos, segment, Perspective.local());
        return new LocalEdit(op, group);
    }

    /**
     * Removes {@code [start, end)} locally.
     *
     * @return the edit to send, or null if the range was empty
     */
    public LocalEdit removeRangeLocal(int start, int end) {
        SegmentGroup group = new SegmentGroup(localSeq + 1);
        mergeTree.markRangeRemoved(start, end, Perspective.local(), UNASSIGNED_SEQ, clientId, group);
        if (group.getSegments().isEmpty()) {
            return null;
        }
        localSeq++;
        mergeTree.pendingSegmentGroups.addLast(group);
        return new LocalEdit(new RemoveOp(start, end), group);
    }

    /**
     * Merges {@code props} into {@code [start, end)} locally.
     *
     * @return the edit to send, or null if the range was empty
     */
    public LocalEdit annotateRangeLocal(int start, int end, PropertySet props) {
        if (props == null || props.isEmpty()) {
            throw new IllegalArgumentException("props must not be empty");
        }
        SegmentGroup group = new SegmentGroup(localSeq + 1);
        PropertySet patch = props.copy();
        mergeTree.annotateRange(start, end, patch, Perspective.local(), UNASSIGNED_SEQ, clientId, group);
        if (group.getSegments().isEmpty()) {
            return null;
        }
        localSeq++;
        mergeTree.pendingSegmentGroups.addLast(group);
        return new LocalEdit(new AnnotateOp(start, end, patch), group);
    }

    // #### Sequenced ops

    /**
     * Applies an op of another client in the perspective it was created in.
     */
    public void applyRemoteOp(MergeTreeOp op, int seq, int opClientId, int refSeq) {
        Perspective perspective = Perspective.remote(refSeq, opClientId);
        if (op instanceof InsertOp insertOp) {
            Segment segment = Segment.fromInsertOp(insertOp);
            segment.stamp(seq, opClientId);
            mergeTree.insertSegment(insertOp.pos(), segment, perspective);
        } else if (op instanceof RemoveOp removeOp) {
            mergeTree.markRangeRemoved(removeOp.start(), removeOp.end(), perspective, seq, opClientId, null);
        } else if (op instanceof AnnotateOp annotateOp) {
            mergeTree.annotateRange(annotateOp.start(), annotateOp.end(), annotateOp.props(), perspective, seq,
                    opClientId, null);
        } else {
            throw new IllegalArgumentException("Unsupported op type: " + op.getClass());
        }
    }

    /**
     * Rewrites the unassigned stamps of the oldest pending edit to {@code seq}.
     */
    public void ackPendingOp(MergeTreeOp op, SegmentGroup group, int seq) {
        if (mergeTree.pendingSegmentGroups.peekFirst() != group) {
            throw new IllegalStateException("ack for seq " + seq + " does not match the oldest pending edit");
        }
        mergeTree.pendingSegmentGroups.removeFirst();
        if (op instanceof InsertOp) {
            mergeTree.ackInsert(group, seq);
        } else if (op instanceof RemoveOp) {
            mergeTree.ackRemove(group, seq);
        } else if (op instanceof AnnotateOp annotateOp) {
            mergeTree.ackAnnotate(group, annotateOp.props());
        }
        group.release();
    }

    /**
     * Advances the sequence numbers after a sequenced message has been processed. Packs the tree
     * when the minimum sequence number moved and the options ask for it.
     */
    public void updateSeqNumbers(int seq, int minSeq) {
        if (seq < currentSeq) {
            throw new IllegalStateException("sequence number went backwards: " + seq + " < " + currentSeq);
        }
        this.currentSeq = seq;
        if (minSeq > this.minSeq) {
            this.minSeq = minSeq;
            if (options.packOnMinSeqAdvance()) {
                mergeTree.pack(minSeq);
            }
        }
    }

    /**
     * Starts from a snapshot: the given segments are the acknowledged state at {@code seq}.
     */
    public void load(List<SerializedSegment> segments, int seq, int minSeq) {
        List<Segment> loaded = new ArrayList<>(segments.size());
        for (SerializedSegment serialized : segments) {
            loaded.add(serialized.toSegment());
        }
        mergeTree.reloadFromSegments(loaded);
        this.currentSeq = seq;
        this.minSeq = minSeq;
    }

    /**
     * The acknowledged segments in order, tombstones included.
     */
    public List<SerializedSegment> serializeSegments() {
        if (hasPendingEdits()) {
            throw new IllegalStateException("cannot serialize with pending local edits");
        }
        List<SerializedSegment> serialized = new ArrayList<>();
        mergeTree.forEachSegment(segment -> serialized.add(SerializedSegment.of(segment)));
        return serialized;
    }

    public void pack() {
        mergeTree.pack(minSeq);
    }

    // #### Resubmission

    /**
     * Opens a resubmit pass. All pending edits are about to be regenerated in order with
     * {@link #regeneratePendingOp}.
     */
    public void startResubmitPass() {
        resubmitPassStart = localSeq + 1;
        mergeTree.pendingSegmentGroups.clear();
        logger.debug("Client {} starts resubmit pass at localSeq {}", clientId, resubmitPassStart);
    }

    public void endResubmitPass() {
        resubmitPassStart = NO_PASS;
    }

    /**
     * The perspective peers will have once the ops regenerated so far are applied.
     */
    public Perspective resubmitPerspective() {
        if (resubmitPassStart == NO_PASS) {
            throw new IllegalStateException("no resubmit pass in progress");
        }
        return new ResubmitPerspective(resubmitPassStart);
    }

    /**
     * Recomputes a pending edit against the acknowledged state. Produces one op per segment still
     * in its group; targets another client removed in the meantime are dropped.
     */
    public List<LocalEdit> regeneratePendingOp(MergeTreeOp op, SegmentGroup group) {
        ResubmitPerspective perspective = (ResubmitPerspective) resubmitPerspective();
        List<Segment> segments = new ArrayList<>(group.getSegments());
        group.release();

        List<LocalEdit> edits = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (op instanceof InsertOp) {
                SegmentGroup regenerated = new SegmentGroup(++localSeq);
                segment.localSeq = regenerated.getLocalSeq();
                alignWithSequencedOrder(segment, perspective);
                int pos = mergeTree.getPosition(segment, perspective);
                regenerated.add(segment);
                edits.add(new LocalEdit(segment.toInsertOp(pos), regenerated));
            } else if (op instanceof RemoveOp) {
                if (segment.removedSeq != UNASSIGNED_SEQ) {
                    logger.warn("Client {} drops resubmitted remove: content already removed at seq {}",
                            clientId, segment.removedSeq);
                    continue;
                }
                int pos = mergeTree.getPosition(segment, perspective);
                SegmentGroup regenerated = new SegmentGroup(++localSeq);
                segment.localRemovedSeq = regenerated.getLocalSeq();
                regenerated.add(segment);
                edits.add(new LocalEdit(new RemoveOp(pos, pos + segment.getLength()), regenerated));
            } else if (op instanceof AnnotateOp annotateOp) {
                if (perspective.lengthOf(segment) == 0) {
                    logger.warn("Client {} drops resubmitted annotate: content already removed", clientId);
                    segment.ackAnnotate(annotateOp.props());
                    continue;
                }
                int pos = mergeTree.getPosition(segment, perspective);
                SegmentGroup regenerated = new SegmentGroup(++localSeq);
                regenerated.add(segment);
                edits.add(new LocalEdit(new AnnotateOp(pos, pos + segment.getLength(), annotateOp.props()), regenerated));
            }
        }

        for (LocalEdit edit : edits) {
            mergeTree.pendingSegmentGroups.addLast(edit.segmentGroup());
        }
        return edits;
    }

    /**
     * A resubmitted insert lands behind every zero-length segment peers know at its gap. Moves those
     * that sit behind the segment here in front of it, so both replicas keep the same order.
     */
    private void alignWithSequencedOrder(Segment segment, ResubmitPerspective perspective) {
        List<Segment> known = new ArrayList<>();
        for (Segment next = mergeTree.nextSegment(segment);
             next != null && perspective.lengthOf(next) == 0;
             next = mergeTree.nextSegment(next)) {
            if (perspective.isKnownToPeers(next)) {
                known.add(next);
            }
        }
        for (Segment moved : known) {
            mergeTree.moveBefore(moved, segment);
        }
    }

    // #### Queries

    public String getText() {
        return mergeTree.getText();
    }

    public String getText(int start, int end) {
        return mergeTree.getText(Perspective.local(), start, end);
    }

    public String getText(int refSeq, int viewerClientId, int start, int end) {
        return mergeTree.getText(Perspective.remote(refSeq, viewerClientId), start, end);
    }

    public String getTextWithPlaceholders() {
        return mergeTree.getText(Perspective.local(), 0, getLength(), Marker.PLACEHOLDER);
    }

    public int getLength() {
        return mergeTree.getLength();
    }

    public int getLength(int refSeq, int viewerClientId) {
        return mergeTree.getLength(Perspective.remote(refSeq, viewerClientId));
    }

    public Optional<SegmentOffset> getContainingSegment(int pos) {
        return mergeTree.getContainingSegment(pos, Perspective.local());
    }

    public Optional<SegmentOffset> getContainingSegment(int pos, int refSeq, int viewerClientId) {
        return mergeTree.getContainingSegment(pos, Perspective.remote(refSeq, viewerClientId));
    }

    public int getPosition(Segment segment) {
        return mergeTree.getPosition(segment, Perspective.local());
    }

    public Optional<SearchResult> searchFromPos(int pos, Pattern pattern) {
        return mergeTree.searchFromPos(pos, pattern);
    }

    public List<Segment> getSegments() {
        return mergeTree.getSegments();
    }

    // #### References

    public LocalReference createLocalReferencePosition(int pos, ReferenceType refType) {
        return mergeTree.createLocalReferencePosition(pos, refType, Perspective.local());
    }

    public LocalReference createLocalReferencePosition(int pos, ReferenceType refType, Perspective perspective) {
        return mergeTree.createLocalReferencePosition(pos, refType, perspective);
    }

    public LocalReference createDetachedReference(ReferenceType refType) {
        return mergeTree.createDetachedReference(refType);
    }

    public int localReferencePositionToPosition(LocalReference ref) {
        return mergeTree.localReferenceToPosition(ref, Perspective.local());
    }

    public int localReferencePositionToPosition(LocalReference ref, Perspective perspective) {
        return mergeTree.localReferenceToPosition(ref, perspective);
    }

    public void removeLocalReferencePosition(LocalReference ref) {
        mergeTree.removeLocalReference(ref);
    }

    public void addDeltaListener(MergeTreeDeltaListener listener) {
        mergeTree.addDeltaListener(listener);
    }
}
