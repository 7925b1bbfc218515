package at.felixb.strand.mergetree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The references hosted by one segment. Does not own them: whoever created a reference removes it.
 */
public final class LocalReferenceCollection implements Iterable<LocalReference> {

    private final Segment segment;
    private final List<LocalReference> refs = new ArrayList<>();

    LocalReferenceCollection(Segment segment) {
        this.segment = segment;
    }

    void add(LocalReference ref, int offset) {
        ref.segment = segment;
        ref.offset = offset;
        ref.detached = false;
        refs.add(ref);
    }

    boolean remove(LocalReference ref) {
        return refs.remove(ref);
    }

    /**
     * Moves every reference at or after {@code pos} to the split-off tail.
     */
    void split(int pos, Segment tail) {
        Iterator<LocalReference> it = refs.iterator();
        while (it.hasNext()) {
            LocalReference ref = it.next();
            if (ref.offset >= pos) {
                it.remove();
                tail.localReferences().add(ref, ref.offset - pos);
            }
        }
    }

    /**
     * Takes over the references of an appended segment.
     */
    void absorb(LocalReferenceCollection other, int shift) {
        for (LocalReference ref : other.refs) {
            add(ref, ref.offset + shift);
        }
        other.refs.clear();
    }

    List<LocalReference> drain() {
        List<LocalReference> drained = new ArrayList<>(refs);
        refs.clear();
        return drained;
    }

    boolean hasReferenceAt(int offset) {
        for (LocalReference ref : refs) {
            if (ref.offset == offset) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return refs.isEmpty();
    }

    public int size() {
        return refs.size();
    }

    @Override
    public Iterator<LocalReference> iterator() {
        return Collections.unmodifiableList(refs).iterator();
    }
}
