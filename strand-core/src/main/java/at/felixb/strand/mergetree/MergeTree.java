package at.felixb.strand.mergetree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static at.felixb.strand.mergetree.MergeTreeDeltaEvent.MergeTreeDeltaType;
import static at.felixb.strand.mergetree.SequenceNumbers.*;

/**
 * Ordered segments in a tree of {@link MergeBlock}s.
 * <p>
 * Blocks cache the local length of their subtree, so positions in the local view cost
 * O(height * fan-out). For other perspectives a block is skipped whole when all of its stamps are
 * covered by the perspective's refSeq; otherwise its segments are counted one by one.
 */
public class MergeTree {

    private static final Logger logger = LoggerFactory.getLogger(MergeTree.class);

    private final MergeTreeOptions options;
    private final List<MergeTreeDeltaListener> deltaListeners = new ArrayList<>();

    /** Segment groups of local ops waiting for their ack, oldest first. */
    final Deque<SegmentGroup> pendingSegmentGroups = new ArrayDeque<>();

    private MergeBlock root = new MergeBlock();

    public MergeTree() {
        this(MergeTreeOptions.DEFAULT);
    }

    public MergeTree(MergeTreeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    // -------------------------------------------------
    //  Lengths & positions
    // -------------------------------------------------

    public int getLength() {
        return root.cachedLength;
    }

    public int getLength(Perspective perspective) {
        return nodeLength(root, perspective);
    }

    /**
     * Number of elements before {@code segment} in the given perspective.
     */
    public int getPosition(Segment segment, Perspective perspective) {
        if (segment.parent == null) {
            throw new IllegalArgumentException("segment is not part of this tree");
        }
        int pos = 0;
        MergeNode node = segment;
        MergeBlock parent = node.getParent();
        while (parent != null) {
            for (int i = 0; i < node.getIndex(); i++) {
                pos += nodeLength(parent.children.get(i), perspective);
            }
            node = parent;
            parent = parent.parent;
        }
        return pos;
    }

    /**
     * The segment holding the element at {@code pos} and the element's offset inside it.
     * Segments of length zero in the perspective are never returned.
     */
    public Optional<SegmentOffset> getContainingSegment(int pos, Perspective perspective) {
        if (pos < 0) {
            return Optional.empty();
        }
        MergeBlock block = root;
        int remaining = pos;
        descend:
        while (true) {
            for (MergeNode child : block.children) {
                int len = nodeLength(child, perspective);
                if (remaining < len) {
                    if (child instanceof Segment segment) {
                        return Optional.of(new SegmentOffset(segment, remaining));
                    }
                    block = (MergeBlock) child;
                    continue descend;
                }
                remaining -= len;
            }
            return Optional.empty();
        }
    }

    private int nodeLength(MergeNode node, Perspective perspective) {
        if (node instanceof Segment segment) {
            return perspective.lengthOf(segment);
        }
        MergeBlock block = (MergeBlock) node;
        if (perspective.usesCachedLength(block)) {
            return block.cachedLength;
        }
        int length = 0;
        for (MergeNode child : block.children) {
            length += nodeLength(child, perspective);
        }
        return length;
    }

    // -------------------------------------------------
    //  Text
    // -------------------------------------------------

    public String getText() {
        return getText(Perspective.local(), 0, getLength(), null);
    }

    public String getText(Perspective perspective, int start, int end) {
        return getText(perspective, start, end, null);
    }

    /**
     * Visible text of {@code [start, end)}. Markers render as {@code markerPlaceholder}, or as
     * nothing when it is null.
     */
    public String getText(Perspective perspective, int start, int end, Character markerPlaceholder) {
        checkRange(start, end, getLength(perspective));
        StringBuilder sb = new StringBuilder(end - start);
        appendText(root, 0, start, end, perspective, markerPlaceholder, sb);
        return sb.toString();
    }

    private int appendText(MergeBlock block, int blockStart, int start, int end, Perspective perspective,
                           Character markerPlaceholder, StringBuilder out) {
        int pos = blockStart;
        for (MergeNode child : block.children) {
            if (pos >= end) {
                break;
            }
            int len = nodeLength(child, perspective);
            if (len > 0 && pos + len > start) {
                if (child instanceof MergeBlock childBlock) {
                    appendText(childBlock, pos, start, end, perspective, markerPlaceholder, out);
                } else if (child instanceof TextSegment text) {
                    int from = Math.max(0, start - pos);
                    int to = Math.min(len, end - pos);
                    out.append(text.getText(), from, to);
                } else if (markerPlaceholder != null) {
                    out.append(markerPlaceholder.charValue());
                }
            }
            pos += len;
        }
        return pos;
    }

    /**
     * Finds the first match of {@code pattern} in the local text starting at {@code pos}.
     * Segments are read only as far as the matcher gets; nothing is kept between calls.
     */
    public Optional<SearchResult> searchFromPos(int pos, Pattern pattern) {
        int length = getLength();
        if (pos < 0 || pos > length) {
            throw new IndexOutOfBoundsException("position: " + pos + ", length: " + length);
        }
        CharSequence text = getContainingSegment(pos, Perspective.local())
                .<CharSequence>map(first -> new ChunkedText(first, length - pos))
                .orElse("");
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new SearchResult(matcher.group(), pos + matcher.start()));
    }

    // -------------------------------------------------
    //  Mutations
    // -------------------------------------------------

    /**
     * Inserts a stamped segment at {@code pos} of the given perspective.
     * At a run of zero-length segments the new segment goes behind the last acknowledged one and
     * in front of the first segment after it that the perspective asks it to precede.
     */
    public void insertSegment(int pos, Segment segment, Perspective perspective) {
        if (pos < 0) {
            throw new IndexOutOfBoundsException("position: " + pos);
        }
        int[] remaining = {pos};
        Segment[] tieBreak = {null};
        Segment before = findInsertionPoint(root, remaining, perspective, tieBreak);
        if (before == null && remaining[0] == 0) {
            before = tieBreak[0];
        }
        if (before != null) {
            insertChild(before.parent, before.index, segment);
        } else {
            if (remaining[0] != 0) {
                throw new IndexOutOfBoundsException("position: " + pos + ", length: " + (pos - remaining[0]));
            }
            MergeBlock last = lastLeafBlock();
            insertChild(last, last.children.size(), segment);
        }
        logger.trace("Inserted {} at {}", segment, pos);
        fireDelta(new MergeTreeDeltaEvent(MergeTreeDeltaType.INSERT, List.of(segment),
                segment.seq == UNASSIGNED_SEQ, segment.clientId));
    }

    private Segment findInsertionPoint(MergeBlock block, int[] remaining, Perspective perspective,
                                       Segment[] tieBreak) {
        for (int i = 0; i < block.children.size(); i++) {
            MergeNode child = block.children.get(i);
            int len = nodeLength(child, perspective);

            if (child instanceof MergeBlock childBlock) {
                if (remaining[0] > len) {
                    remaining[0] -= len;
                    continue;
                }
                Segment found = findInsertionPoint(childBlock, remaining, perspective, tieBreak);
                if (found != null) {
                    return found;
                }
                continue;
            }

            Segment segment = (Segment) child;
            if (remaining[0] < len) {
                if (remaining[0] == 0) {
                    return tieBreak[0] != null ? tieBreak[0] : segment;
                }
                Segment tail = segment.splitAt(remaining[0]);
                insertChild(block, i + 1, tail);
                return tail;
            }
            if (len == 0 && remaining[0] == 0) {
                if (!perspective.insertsBefore(segment)) {
                    tieBreak[0] = null;
                } else if (tieBreak[0] == null) {
                    tieBreak[0] = segment;
                }
            }
            remaining[0] -= len;
        }
        return null;
    }

    /**
     * Stamps every segment of {@code [start, end)} in the given perspective as removed.
     *
     * @return the segments that were live in the local view before
     */
    public List<Segment> markRangeRemoved(int start, int end, Perspective perspective, int seq, int clientId,
                                          SegmentGroup group) {
        List<Segment> segments = segmentsInRange(start, end, perspective);
        List<Segment> removed = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (segment.markRemoved(seq, clientId)) {
                removed.add(segment);
            }
            if (group != null) {
                segment.localRemovedSeq = group.getLocalSeq();
                group.add(segment);
            }
            updateUpwards(segment.parent);
        }
        if (!removed.isEmpty()) {
            fireDelta(new MergeTreeDeltaEvent(MergeTreeDeltaType.REMOVE, removed, seq == UNASSIGNED_SEQ, clientId));
        }
        return removed;
    }

    /**
     * Merges {@code props} into every segment of {@code [start, end)} in the given perspective.
     */
    public List<Segment> annotateRange(int start, int end, PropertySet props, Perspective perspective, int seq,
                                       int clientId, SegmentGroup group) {
        List<Segment> segments = segmentsInRange(start, end, perspective);
        boolean local = seq == UNASSIGNED_SEQ;
        for (Segment segment : segments) {
            segment.annotate(props, local);
            if (group != null) {
                group.add(segment);
            }
        }
        if (!segments.isEmpty()) {
            fireDelta(new MergeTreeDeltaEvent(MergeTreeDeltaType.ANNOTATE, segments, local, clientId));
        }
        return segments;
    }

    private List<Segment> segmentsInRange(int start, int end, Perspective perspective) {
        checkRange(start, end, getLength(perspective));
        if (start == end) {
            return List.of();
        }
        splitAt(start, perspective);
        splitAt(end, perspective);
        List<Segment> segments = new ArrayList<>();
        collectSegments(root, 0, start, end, perspective, segments);
        return segments;
    }

    private int collectSegments(MergeBlock block, int blockStart, int start, int end, Perspective perspective,
                                List<Segment> out) {
        int pos = blockStart;
        for (MergeNode child : block.children) {
            if (pos >= end) {
                break;
            }
            int len = nodeLength(child, perspective);
            if (len > 0 && pos + len > start) {
                if (child instanceof MergeBlock childBlock) {
                    collectSegments(childBlock, pos, start, end, perspective, out);
                } else if (pos >= start && pos + len <= end) {
                    out.add((Segment) child);
                }
            }
            pos += len;
        }
        return pos;
    }

    private void splitAt(int pos, Perspective perspective) {
        getContainingSegment(pos, perspective).ifPresent(found -> {
            if (found.offset() > 0) {
                Segment segment = found.segment();
                Segment tail = segment.splitAt(found.offset());
                insertChild(segment.parent, segment.index + 1, tail);
            }
        });
    }

    // -------------------------------------------------
    //  Acknowledgement
    // -------------------------------------------------

    void ackInsert(SegmentGroup group, int seq) {
        for (Segment segment : group.getSegments()) {
            segment.seq = seq;
            updateUpwards(segment.parent);
        }
    }

    void ackRemove(SegmentGroup group, int seq) {
        for (Segment segment : group.getSegments()) {
            // an acknowledged remote removal may already have taken over
            if (segment.removedSeq == UNASSIGNED_SEQ) {
                segment.removedSeq = seq;
                updateUpwards(segment.parent);
            }
        }
    }

    void ackAnnotate(SegmentGroup group, PropertySet props) {
        for (Segment segment : group.getSegments()) {
            segment.ackAnnotate(props);
        }
    }

    // -------------------------------------------------
    //  Local references
    // -------------------------------------------------

    public LocalReference createLocalReference(Segment segment, int offset, ReferenceType refType) {
        if (segment.parent == null) {
            throw new IllegalArgumentException("segment is not part of this tree");
        }
        if (offset < 0 || offset > segment.getLength()) {
            throw new IndexOutOfBoundsException("offset: " + offset + ", length: " + segment.getLength());
        }
        LocalReference ref = new LocalReference(refType);
        segment.localReferences().add(ref, offset);
        return ref;
    }

    /**
     * Creates a reference on the element at {@code pos} of the given perspective. At the end of the
     * sequence the reference goes after the last visible element; in an empty sequence it marks the
     * start of the document.
     */
    public LocalReference createLocalReferencePosition(int pos, ReferenceType refType, Perspective perspective) {
        int length = getLength(perspective);
        if (pos < 0 || pos > length) {
            throw new IndexOutOfBoundsException("position: " + pos + ", length: " + length);
        }
        LocalReference ref = new LocalReference(refType);
        if (pos < length) {
            SegmentOffset found = getContainingSegment(pos, perspective).orElseThrow();
            found.segment().localReferences().add(ref, found.offset());
        } else {
            Segment last = lastVisibleSegment(root, perspective);
            if (last != null) {
                last.localReferences().add(ref, last.getLength());
            }
        }
        return ref;
    }

    /**
     * A reference without content, e.g. the bound of an interval whose anchor was lost before the
     * op creating it could be sent.
     */
    public LocalReference createDetachedReference(ReferenceType refType) {
        LocalReference ref = new LocalReference(refType);
        ref.detach();
        return ref;
    }

    /** A reference in front of all content, e.g. restored from a snapshot. */
    public LocalReference createStartOfDocumentReference(ReferenceType refType) {
        return new LocalReference(refType);
    }

    public void removeLocalReference(LocalReference ref) {
        if (ref.segment != null) {
            ref.segment.localReferences().remove(ref);
        }
    }

    /**
     * Resolves a reference. A reference whose content is not visible in the perspective resolves to
     * the position the content would occupy, i.e. it slides to the next visible element; a
     * {@link ReferenceType#SIMPLE} reference on removed content resolves to {@link SequenceNumbers#DETACHED_POSITION}.
     */
    public int localReferenceToPosition(LocalReference ref, Perspective perspective) {
        if (ref.detached) {
            return DETACHED_POSITION;
        }
        Segment segment = ref.segment;
        if (segment == null) {
            return 0;
        }
        int segmentPos = getPosition(segment, perspective);
        if (perspective.lengthOf(segment) == 0) {
            if (segment.isRemoved() && ref.getRefType() == ReferenceType.SIMPLE) {
                return DETACHED_POSITION;
            }
            return segmentPos;
        }
        return segmentPos + ref.offset;
    }

    private Segment lastVisibleSegment(MergeBlock block, Perspective perspective) {
        for (int i = block.children.size() - 1; i >= 0; i--) {
            MergeNode child = block.children.get(i);
            if (nodeLength(child, perspective) == 0) {
                continue;
            }
            if (child instanceof Segment segment) {
                return segment;
            }
            return lastVisibleSegment((MergeBlock) child, perspective);
        }
        return null;
    }

    // -------------------------------------------------
    //  Traversal
    // -------------------------------------------------

    public void forEachSegment(Consumer<Segment> consumer) {
        forEachSegment(root, consumer);
    }

    private void forEachSegment(MergeBlock block, Consumer<Segment> consumer) {
        for (MergeNode child : block.children) {
            if (child instanceof MergeBlock childBlock) {
                forEachSegment(childBlock, consumer);
            } else {
                consumer.accept((Segment) child);
            }
        }
    }

    /** All segments in order, tombstones included. */
    public List<Segment> getSegments() {
        List<Segment> segments = new ArrayList<>();
        forEachSegment(segments::add);
        return segments;
    }

    public Segment nextSegment(Segment segment) {
        MergeNode node = segment;
        while (node.getParent() != null) {
            MergeBlock parent = node.getParent();
            if (node.getIndex() + 1 < parent.children.size()) {
                return firstSegment(parent.children.get(node.getIndex() + 1));
            }
            node = parent;
        }
        return null;
    }

    private static Segment firstSegment(MergeNode node) {
        while (node instanceof MergeBlock block) {
            if (block.children.isEmpty()) {
                return null;
            }
            node = block.children.get(0);
        }
        return (Segment) node;
    }

    /**
     * Moves {@code moved} right in front of {@code target}. References travel with the segment.
     */
    void moveBefore(Segment moved, Segment target) {
        removeChild(moved);
        insertChild(target.parent, target.index, moved);
    }

    // -------------------------------------------------
    //  Compaction
    // -------------------------------------------------

    /**
     * Compacts the tree below {@code minSeq}: drops tombstones whose removal every client has seen,
     * normalises old stamps to {@link SequenceNumbers#UNIVERSAL_SEQ}, merges adjacent segments and
     * rebuilds the blocks. Text and resolved reference positions do not change.
     * <p>
     * References on a dropped tombstone move to the end of the nearest preceding retained segment
     * (or the start of the document); simple references are detached. While local ops are pending,
     * tombstones carrying references are kept.
     */
    public void pack(int minSeq) {
        boolean relocate = pendingSegmentGroups.isEmpty();
        List<Segment> segments = getSegments();
        List<Segment> kept = new ArrayList<>(segments.size());
        int dropped = 0;
        int merged = 0;

        for (Segment segment : segments) {
            Segment previous = kept.isEmpty() ? null : kept.get(kept.size() - 1);

            if (segment.isRemovalAcked() && segment.removedSeq <= minSeq && segment.segmentGroups.isEmpty()) {
                if (segment.hasLocalReferences()) {
                    if (!relocate) {
                        kept.add(segment);
                        continue;
                    }
                    relocateReferences(segment, previous);
                }
                segment.parent = null;
                dropped++;
                continue;
            }

            if (segment.isAcked() && segment.seq <= minSeq) {
                segment.stamp(UNIVERSAL_SEQ, NON_COLLAB_CLIENT);
            }
            if (previous != null && previous.canAppend(segment)) {
                previous.append(segment);
                segment.parent = null;
                merged++;
                continue;
            }
            kept.add(segment);
        }

        rebuild(kept);
        logger.debug("Packed merge tree at minSeq {}: dropped {} tombstones, merged {} segments, {} left",
                minSeq, dropped, merged, kept.size());
    }

    private void relocateReferences(Segment tombstone, Segment target) {
        for (LocalReference ref : tombstone.localReferences().drain()) {
            if (ref.getRefType() == ReferenceType.SIMPLE) {
                ref.detach();
            } else if (target == null) {
                ref.segment = null;
                ref.offset = 0;
            } else {
                target.localReferences().add(ref, target.getLength());
            }
        }
    }

    /**
     * Replaces the whole content with {@code segments}, e.g. when loading a snapshot.
     */
    public void reloadFromSegments(List<Segment> segments) {
        if (!pendingSegmentGroups.isEmpty()) {
            throw new IllegalStateException("cannot reload with pending local ops");
        }
        rebuild(segments);
    }

    private void rebuild(List<Segment> segments) {
        int max = options.maxNodesInBlock();
        List<MergeNode> level = new ArrayList<>(segments);
        if (level.isEmpty()) {
            root = new MergeBlock();
            return;
        }
        do {
            List<MergeNode> next = new ArrayList<>((level.size() + max - 1) / max);
            for (int i = 0; i < level.size(); i += max) {
                MergeBlock block = new MergeBlock();
                block.children.addAll(level.subList(i, Math.min(i + max, level.size())));
                block.reindexFrom(0);
                block.update();
                next.add(block);
            }
            level = next;
        } while (level.size() > 1);
        root = (MergeBlock) level.get(0);
        root.parent = null;
        root.index = 0;
    }

    // -------------------------------------------------
    //  Block internals
    // -------------------------------------------------

    private void insertChild(MergeBlock block, int index, MergeNode node) {
        block.children.add(index, node);
        block.reindexFrom(index);
        if (block.children.size() > options.maxNodesInBlock()) {
            splitBlock(block);
        } else {
            updateUpwards(block);
        }
    }

    private void splitBlock(MergeBlock block) {
        int mid = block.children.size() / 2;
        MergeBlock right = new MergeBlock();
        List<MergeNode> moved = block.children.subList(mid, block.children.size());
        right.children.addAll(moved);
        moved.clear();
        right.reindexFrom(0);
        block.update();
        right.update();

        MergeBlock parent = block.parent;
        if (parent == null) {
            MergeBlock newRoot = new MergeBlock();
            newRoot.children.add(block);
            newRoot.children.add(right);
            newRoot.reindexFrom(0);
            newRoot.update();
            root = newRoot;
            return;
        }
        insertChild(parent, block.index + 1, right);
    }

    private void removeChild(MergeNode node) {
        MergeBlock block = node.getParent();
        int index = node.getIndex();
        block.children.remove(index);
        block.reindexFrom(index);

        // leere Blöcke aushängen
        while (block.children.isEmpty() && block.parent != null) {
            MergeBlock parent = block.parent;
            parent.children.remove(block.index);
            parent.reindexFrom(block.index);
            block.parent = null;
            block = parent;
        }
        updateUpwards(block);
    }

    private void updateUpwards(MergeBlock block) {
        for (MergeBlock b = block; b != null; b = b.parent) {
            b.update();
        }
    }

    private MergeBlock lastLeafBlock() {
        MergeBlock block = root;
        while (!block.children.isEmpty() && block.children.get(block.children.size() - 1) instanceof MergeBlock last) {
            block = last;
        }
        return block;
    }

    private static void checkRange(int start, int end, int length) {
        if (start < 0 || end > length || start > end) {
            throw new IndexOutOfBoundsException("range: [" + start + ", " + end + "), length: " + length);
        }
    }

    // -------------------------------------------------
    //  Listeners
    // -------------------------------------------------

    public void addDeltaListener(MergeTreeDeltaListener listener) {
        deltaListeners.add(listener);
    }

    public void removeDeltaListener(MergeTreeDeltaListener listener) {
        deltaListeners.remove(listener);
    }

    private void fireDelta(MergeTreeDeltaEvent event) {
        for (MergeTreeDeltaListener listener : List.copyOf(deltaListeners)) {
            listener.onDelta(event);
        }
    }

    // -------------------------------------------------
    //  VALIDATION
    // -------------------------------------------------

    public void validate() {
        List<String> errors = new ArrayList<>();
        if (root.parent != null) {
            errors.add("root has a parent");
        }
        int[] leafDepthHolder = new int[]{-1};
        validateBlock(root, true, 0, leafDepthHolder, errors);

        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("MergeTree validation failed:\n");
            for (String e : errors) {
                sb.append(" - ").append(e).append('\n');
            }
            throw new IllegalStateException(sb.toString());
        }
    }

    public boolean isValid() {
        try {
            validate();
            return true;
        } catch (IllegalStateException ex) {
            return false;
        }
    }

    private void validateBlock(MergeBlock block, boolean isRoot, int depth, int[] leafDepthHolder, List<String> errors) {
        if (!isRoot && block.children.isEmpty()) {
            errors.add("non-root block at depth " + depth + " has no children");
        }
        if (block.children.size() > options.maxNodesInBlock()) {
            errors.add("block at depth " + depth + " has " + block.children.size() + " children (max "
                    + options.maxNodesInBlock() + ")");
        }

        int length = 0;
        int max = UNIVERSAL_SEQ;
        for (int i = 0; i < block.children.size(); i++) {
            MergeNode child = block.children.get(i);
            if (child.getParent() != block) {
                errors.add("child.parent mismatch at depth " + depth + " index " + i);
            }
            if (child.getIndex() != i) {
                errors.add("child.index mismatch at depth " + depth + " index " + i + " (found " + child.getIndex() + ")");
            }
            if (child instanceof MergeBlock childBlock) {
                validateBlock(childBlock, false, depth + 1, leafDepthHolder, errors);
            } else {
                if (leafDepthHolder[0] == -1) {
                    leafDepthHolder[0] = depth + 1;
                } else if (leafDepthHolder[0] != depth + 1) {
                    errors.add("segment at depth " + (depth + 1) + " but previous segment at depth " + leafDepthHolder[0]);
                }
            }
            length += child.localLength();
            max = Math.max(max, child.maxSeq());
        }

        if (block.cachedLength != length) {
            errors.add("block at depth " + depth + " has cachedLength = " + block.cachedLength + " but children sum to " + length);
        }
        if (block.maxSeq != max) {
            errors.add("block at depth " + depth + " has maxSeq = " + block.maxSeq + " but children give " + max);
        }
    }

    // -------------------------------------------------
    //  Text view
    // -------------------------------------------------

    /**
     * Local text from a segment offset on. Segments are read only when the matcher gets to them.
     */
    private final class ChunkedText implements CharSequence {

        private final List<String> chunks = new ArrayList<>();
        private final List<Integer> starts = new ArrayList<>();
        private final int length;

        private Segment next;
        private int firstOffset;
        private int loaded = 0;

        ChunkedText(SegmentOffset start, int length) {
            this.next = start.segment();
            this.firstOffset = start.offset();
            this.length = length;
        }

        @Override
        public int length() {
            return length;
        }

        @Override
        public char charAt(int index) {
            if (index < 0 || index >= length) {
                throw new IndexOutOfBoundsException("index: " + index + ", length: " + length);
            }
            while (index >= loaded) {
                loadNext();
            }
            int chunk = Collections.binarySearch(starts, index);
            if (chunk < 0) {
                chunk = -chunk - 2;
            }
            return chunks.get(chunk).charAt(index - starts.get(chunk));
        }

        private void loadNext() {
            while (next != null && next.localLength() == 0) {
                next = nextSegment(next);
            }
            if (next == null) {
                throw new IllegalStateException("text ended after " + loaded + " of " + length + " chars");
            }
            String content = next instanceof TextSegment text ? text.getText() : String.valueOf(Marker.PLACEHOLDER);
            if (firstOffset > 0) {
                content = content.substring(firstOffset);
                firstOffset = 0;
            }
            starts.add(loaded);
            chunks.add(content);
            loaded += content.length();
            next = nextSegment(next);
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            StringBuilder sb = new StringBuilder(end - start);
            for (int i = start; i < end; i++) {
                sb.append(charAt(i));
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return subSequence(0, length).toString();
        }
    }
}
