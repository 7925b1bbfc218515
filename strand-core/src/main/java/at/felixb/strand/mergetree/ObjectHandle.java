package at.felixb.strand.mergetree;

import java.util.Objects;

/**
 * Reference to another shared object, stored as a property value.
 * The embedder's garbage collector treats every handle reachable from a sequence as live.
 */
public record ObjectHandle(String absolutePath) {

    public ObjectHandle {
        Objects.requireNonNull(absolutePath, "absolutePath");
        if (!absolutePath.startsWith("/")) {
            throw new IllegalArgumentException("handle path must be absolute: " + absolutePath);
        }
    }

    public static ObjectHandle of(String absolutePath) {
        return new ObjectHandle(absolutePath);
    }
}
