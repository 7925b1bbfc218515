package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.ObjectHandle;

import java.util.Optional;

@FunctionalInterface
public interface HandleResolver {

    Optional<Object> resolve(ObjectHandle handle);
}
