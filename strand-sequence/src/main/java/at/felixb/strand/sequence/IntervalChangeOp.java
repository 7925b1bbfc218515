package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.PropertySet;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Moves the supplied bounds and/or patches properties. A null bound is left as is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntervalChangeOp(String label,
                               String id,
                               Integer start,
                               Integer end,
                               PropertySet props) implements IntervalOp {

    public boolean changesBounds() {
        return start != null || end != null;
    }

    public boolean changesProperties() {
        return props != null && !props.isEmpty();
    }
}
