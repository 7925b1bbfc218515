package at.felixb.strand.mergetree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static at.felixb.strand.mergetree.SequenceNumbers.*;
import static org.junit.jupiter.api.Assertions.*;

class SegmentTest {

    @Test
    void splitAt_carriesStampsPropertiesAndTail() {
        TextSegment segment = new TextSegment("hello");
        segment.stamp(7, 3);
        segment.properties = PropertySet.of("bold", true);

        Segment tail = segment.splitAt(2);

        assertEquals("he", segment.getText());
        assertEquals("llo", ((TextSegment) tail).getText());
        assertEquals(7, tail.getSeq());
        assertEquals(3, tail.getClientId());
        assertEquals(PropertySet.of("bold", true), tail.getProperties());
        assertFalse(tail.isRemoved());
    }

    @Test
    void splitAt_outOfRange_throws() {
        TextSegment segment = new TextSegment("abc");

        assertThrows(IndexOutOfBoundsException.class, () -> segment.splitAt(0));
        assertThrows(IndexOutOfBoundsException.class, () -> segment.splitAt(3));
        assertThrows(IndexOutOfBoundsException.class, () -> new Marker().splitAt(1));
    }

    @Test
    void splitAt_movesReferencesAtOrAfterOffset() {
        MergeTree tree = new MergeTree();
        TextSegment segment = new TextSegment("abcdef");
        tree.insertSegment(0, segment, Perspective.local());

        LocalReference onB = tree.createLocalReference(segment, 1, ReferenceType.SLIDE_ON_REMOVE);
        LocalReference onD = tree.createLocalReference(segment, 3, ReferenceType.SLIDE_ON_REMOVE);
        LocalReference atEnd = tree.createLocalReference(segment, 6, ReferenceType.SLIDE_ON_REMOVE);

        Segment tail = segment.splitAt(3);

        assertSame(segment, onB.getSegment());
        assertEquals(1, onB.getOffset());
        assertSame(tail, onD.getSegment());
        assertEquals(0, onD.getOffset());
        assertSame(tail, atEnd.getSegment());
        assertEquals(3, atEnd.getOffset());
    }

    @Test
    void splitAt_tailJoinsSegmentGroupRightAfterHead() {
        TextSegment segment = new TextSegment("abcd");
        TextSegment other = new TextSegment("xy");
        SegmentGroup group = new SegmentGroup(1);
        group.add(segment);
        group.add(other);

        Segment tail = segment.splitAt(2);

        assertEquals(List.of(segment, tail, other), group.getSegments());
        assertEquals(List.of(group), tail.getSegmentGroups());
    }

    @Test
    void canAppend_requiresSameAckedStampAndProperties() {
        TextSegment a = new TextSegment("ab");
        TextSegment b = new TextSegment("cd");
        a.stamp(4, 1);
        b.stamp(4, 1);
        assertTrue(a.canAppend(b));

        b.stamp(5, 1);
        assertFalse(a.canAppend(b));

        b.stamp(4, 1);
        b.properties = PropertySet.of("italic", true);
        assertFalse(a.canAppend(b));

        b.properties = null;
        a.stamp(UNASSIGNED_SEQ, 1);
        b.stamp(UNASSIGNED_SEQ, 1);
        assertFalse(a.canAppend(b));

        assertFalse(new Marker().canAppend(new Marker()));
    }

    @Test
    void canAppend_refusesRemovedSegments() {
        TextSegment a = new TextSegment("ab");
        TextSegment b = new TextSegment("cd");
        b.markRemoved(3, 2);

        assertFalse(a.canAppend(b));
        assertFalse(b.canAppend(a));
    }

    @Test
    void append_shiftsReferencesOfAppendedSegment() {
        MergeTree tree = new MergeTree();
        TextSegment a = new TextSegment("ab");
        TextSegment b = new TextSegment("cd");
        tree.insertSegment(0, a, Perspective.local());
        tree.insertSegment(2, b, Perspective.local());
        LocalReference onD = tree.createLocalReference(b, 1, ReferenceType.SLIDE_ON_REMOVE);

        a.append(b);

        assertEquals("abcd", a.getText());
        assertSame(a, onD.getSegment());
        assertEquals(3, onD.getOffset());
    }

    @Test
    void markRemoved_keepsEarliestAckedRemovalAndRecordsOverlap() {
        TextSegment segment = new TextSegment("x");

        assertTrue(segment.markRemoved(5, 1));
        assertFalse(segment.markRemoved(6, 2));

        assertEquals(5, segment.getRemovedSeq());
        assertEquals(1, segment.getRemovedClientId());
        assertEquals(List.of(2), segment.getRemovedClientOverlap());
        assertTrue(segment.wasRemovedBy(1));
        assertTrue(segment.wasRemovedBy(2));
        assertFalse(segment.wasRemovedBy(3));
    }

    @Test
    void markRemoved_remoteAckedRemovalTakesOverPendingLocalOne() {
        TextSegment segment = new TextSegment("x");
        segment.markRemoved(UNASSIGNED_SEQ, 0);

        segment.markRemoved(9, 4);

        assertEquals(9, segment.getRemovedSeq());
        assertEquals(4, segment.getRemovedClientId());
        assertTrue(segment.wasRemovedBy(0));
    }

    @Test
    void lengthFor_followsInsertAndRemoveStamps() {
        TextSegment segment = new TextSegment("abc");
        segment.stamp(5, 1);

        assertEquals(0, segment.lengthFor(4, 2));
        assertEquals(3, segment.lengthFor(4, 1));
        assertEquals(3, segment.lengthFor(5, 2));

        segment.markRemoved(8, 3);
        assertEquals(3, segment.lengthFor(7, 2));
        assertEquals(0, segment.lengthFor(7, 3));
        assertEquals(0, segment.lengthFor(8, 2));
    }

    @Test
    void annotate_remoteWriteSkipsKeysWithPendingLocalWrite() {
        TextSegment segment = new TextSegment("abc");

        segment.annotate(PropertySet.of("color", "red"), true);
        segment.annotate(PropertySet.of("color", "blue").put("size", 12), false);

        assertEquals("red", segment.getProperties().get("color"));
        assertEquals(12, segment.getProperties().get("size"));

        segment.ackAnnotate(PropertySet.of("color", "red"));
        segment.annotate(PropertySet.of("color", "green"), false);
        assertEquals("green", segment.getProperties().get("color"));
    }

    @Test
    void annotate_nullValueDeletesKey() {
        TextSegment segment = new TextSegment("abc");
        segment.annotate(PropertySet.of("color", "red"), false);

        segment.annotate(PropertySet.of("color", null), false);

        assertFalse(segment.getProperties().containsKey("color"));
    }
}
