package at.felixb.strand.sequence;

import at.felixb.strand.mergetree.PropertySet;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Bounds are positions in the author's view; {@code -1} stands for a bound that was detached
 * before the op could be sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntervalAddOp(String label,
                            String id,
                            int start,
                            int end,
                            IntervalType intervalType,
                            PropertySet props) implements IntervalOp {
}
