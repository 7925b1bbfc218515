package at.felixb.strand.mergetree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

import static at.felixb.strand.mergetree.MergeTreeDeltaEvent.MergeTreeDeltaType;
import static org.junit.jupiter.api.Assertions.*;

class MergeTreeTest {

    private final MergeTree tree = new MergeTree(new MergeTreeOptions(4, false));

    private void insert(int pos, String text) {
        tree.insertSegment(pos, new TextSegment(text), Perspective.local());
    }

    @Test
    void insertSegment_buildsText() {
        insert(0, "hello");
        insert(5, " world");
        insert(5, ",");

        assertEquals("hello, world", tree.getText());
        assertEquals(12, tree.getLength());
        tree.validate();
    }

    @Test
    void insertSegment_insideSegment_splitsIt() {
        insert(0, "held");
        insert(3, "lo worl");

        assertEquals("hello world", tree.getText());
        assertEquals(3, tree.getSegments().size());
    }

    @Test
    void insertSegment_pastEnd_throws() {
        insert(0, "abc");

        assertThrows(IndexOutOfBoundsException.class, () -> insert(4, "x"));
        assertThrows(IndexOutOfBoundsException.class, () -> insert(-1, "x"));
    }

    @Test
    void getContainingSegment_returnsSegmentAndOffset() {
        insert(0, "hello");
        insert(5, ",");
        insert(6, " world");

        SegmentOffset found = tree.getContainingSegment(7, Perspective.local()).orElseThrow();

        assertEquals(" world", ((TextSegment) found.segment()).getText());
        assertEquals(1, found.offset());
        assertTrue(tree.getContainingSegment(12, Perspective.local()).isEmpty());
    }

    @Test
    void getPosition_countsPrecedingElements() {
        insert(0, "abc");
        TextSegment def = new TextSegment("def");
        tree.insertSegment(3, def, Perspective.local());
        insert(6, "ghi");

        assertEquals(3, tree.getPosition(def, Perspective.local()));
    }

    @Test
    void markers_countInLengthButNotInText() {
        insert(0, "ab");
        tree.insertSegment(1, new Marker(), Perspective.local());

        assertEquals(3, tree.getLength());
        assertEquals("ab", tree.getText());
        assertEquals("a" + Marker.PLACEHOLDER + "b", tree.getText(Perspective.local(), 0, 3, Marker.PLACEHOLDER));
        assertEquals("b", tree.getText(Perspective.local(), 1, 3));
    }

    @Test
    void searchFromPos_findsMatchAfterPosition() {
        insert(0, "hello ");
        insert(6, "world");

        SearchResult first = tree.searchFromPos(0, Pattern.compile("o")).orElseThrow();
        SearchResult second = tree.searchFromPos(5, Pattern.compile("o")).orElseThrow();
        SearchResult across = tree.searchFromPos(0, Pattern.compile("o w")).orElseThrow();

        assertEquals(new SearchResult("o", 4), first);
        assertEquals(new SearchResult("o", 7), second);
        assertEquals(4, across.pos());
        assertTrue(tree.searchFromPos(8, Pattern.compile("o")).isEmpty());
    }

    @Test
    void searchFromPos_startingInsideSegment_skipsRemovedContent() {
        insert(0, "abcdef");
        insert(6, "xyz");
        tree.markRangeRemoved(4, 7, Perspective.local(), 1, 0, null);

        assertEquals("abcdyz", tree.getText());
        assertEquals(new SearchResult("dy", 3), tree.searchFromPos(2, Pattern.compile("dy")).orElseThrow());
        assertTrue(tree.searchFromPos(4, Pattern.compile("d")).isEmpty());
        assertEquals(6, tree.searchFromPos(6, Pattern.compile("$")).orElseThrow().pos());
    }

    @Test
    void searchFromPos_positionsCountMarkers() {
        insert(0, "ab");
        tree.insertSegment(2, new Marker(), Perspective.local());
        insert(3, "cd");

        assertEquals(3, tree.searchFromPos(0, Pattern.compile("c")).orElseThrow().pos());
    }

    @Test
    void markRangeRemoved_hidesRangeAndKeepsTombstones() {
        insert(0, "abcdef");

        List<Segment> removed = tree.markRangeRemoved(1, 3, Perspective.local(), 1, 0, null);

        assertEquals("adef", tree.getText());
        assertEquals(1, removed.size());
        assertEquals("bc", ((TextSegment) removed.get(0)).getText());
        assertEquals(3, tree.getSegments().size());
        tree.validate();
    }

    @Test
    void markRangeRemoved_emptyRange_removesNothing() {
        insert(0, "abc");

        assertTrue(tree.markRangeRemoved(1, 1, Perspective.local(), 1, 0, null).isEmpty());
        assertThrows(IndexOutOfBoundsException.class,
                () -> tree.markRangeRemoved(2, 5, Perspective.local(), 1, 0, null));
    }

    @Test
    void annotateRange_mergesPropertiesIntoRange() {
        insert(0, "abcdef");

        tree.annotateRange(2, 4, PropertySet.of("bold", true), Perspective.local(), 1, 0, null);

        SegmentOffset inside = tree.getContainingSegment(2, Perspective.local()).orElseThrow();
        SegmentOffset outside = tree.getContainingSegment(4, Perspective.local()).orElseThrow();
        assertEquals(true, inside.segment().getProperties().get("bold"));
        assertFalse(outside.segment().getProperties().containsKey("bold"));
        assertEquals("abcdef", tree.getText());
    }

    @Test
    void remotePerspective_seesOnlyOpsUpToRefSeq() {
        TextSegment early = new TextSegment("abc");
        early.stamp(1, 0);
        tree.insertSegment(0, early, Perspective.local());
        TextSegment late = new TextSegment("xyz");
        late.stamp(2, 1);
        tree.insertSegment(3, late, Perspective.local());

        assertEquals(3, tree.getLength(Perspective.remote(1, 2)));
        assertEquals(6, tree.getLength(Perspective.remote(1, 1)));
        assertEquals(6, tree.getLength(Perspective.remote(2, 2)));
        assertEquals("abc", tree.getText(Perspective.remote(1, 2), 0, 3));
    }

    @Test
    void deltaListener_receivesEvents() {
        List<MergeTreeDeltaEvent> events = new ArrayList<>();
        tree.addDeltaListener(events::add);

        insert(0, "abc");
        tree.markRangeRemoved(0, 1, Perspective.local(), 1, 0, null);
        tree.annotateRange(0, 2, PropertySet.of("k", 1), Perspective.local(), 2, 0, null);

        assertEquals(List.of(MergeTreeDeltaType.INSERT, MergeTreeDeltaType.REMOVE, MergeTreeDeltaType.ANNOTATE),
                events.stream().map(MergeTreeDeltaEvent::deltaType).toList());
    }

    @Test
    void deltaListener_removedInsideCallback_othersStillNotified() {
        List<String> calls = new ArrayList<>();
        MergeTreeDeltaListener once = new MergeTreeDeltaListener() {
            @Override
            public void onDelta(MergeTreeDeltaEvent event) {
                calls.add("once");
                tree.removeDeltaListener(this);
            }
        };
        tree.addDeltaListener(once);
        tree.addDeltaListener(event -> calls.add("always"));

        insert(0, "ab");
        insert(2, "c");

        assertEquals(List.of("once", "always", "always"), calls);
    }

    @Test
    void randomEdits_matchModelAndKeepTreeValid() {
        Random random = new Random(42);
        StringBuilder model = new StringBuilder();
        int seq = 0;

        for (int i = 0; i < 400; i++) {
            if (model.length() > 0 && random.nextInt(3) == 0) {
                int start = random.nextInt(model.length());
                int end = start + 1 + random.nextInt(Math.min(5, model.length() - start));
                tree.markRangeRemoved(start, end, Perspective.local(), ++seq, 0, null);
                model.delete(start, end);
            } else {
                int pos = random.nextInt(model.length() + 1);
                String text = "t" + i;
                TextSegment segment = new TextSegment(text);
                segment.stamp(++seq, 0);
                tree.insertSegment(pos, segment, Perspective.local());
                model.insert(pos, text);
            }
            assertEquals(model.toString(), tree.getText());
            tree.validate();
        }

        tree.pack(seq);
        assertEquals(model.toString(), tree.getText());
        tree.validate();
    }

    @Test
    void validate_detectsCorruptedCache() {
        insert(0, "abc");
        assertTrue(tree.isValid());

        MergeBlock root = (MergeBlock) tree.getSegments().get(0).getParent();
        root.cachedLength = 99;

        assertFalse(tree.isValid());
        IllegalStateException ex = assertThrows(IllegalStateException.class, tree::validate);
        assertTrue(ex.getMessage().startsWith("MergeTree validation failed"));
    }
}
