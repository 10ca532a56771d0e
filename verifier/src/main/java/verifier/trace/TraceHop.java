package verifier.trace;

import verifier.model.HeapObjectRef;
import verifier.model.ReferenceSlot;

import java.util.Locale;

/**
 * One line of a root trace.
 *
 * @param level distance from the top of the trace, 0 for the first line
 * @param object the object at this hop, or null for the shared string table marker
 * @param slot the slot on {@code object} that refers to the next hop, or null
 */
public record TraceHop(int level, HeapObjectRef object, ReferenceSlot slot) {

    /** Marker printed above a string root that was reached through the shared string table. */
    public static final String STRING_TABLE_LABEL = "(shared string table)";

    /** Creates the marker hop for a string root. */
    static TraceHop stringTable(int level) {
        return new TraceHop(level, null, null);
    }

    /** Returns true if this is the shared string table marker rather than an object. */
    public boolean isStringTableMarker() {
        return object == null;
    }

    /**
     * Renders this hop, e.g. {@code [ 1] 0x1b6d3586 java/util/ArrayList::elementData}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "[%2d] ", level));
        if (isStringTableMarker()) {
            return sb.append(STRING_TABLE_LABEL).toString();
        }
        sb.append(object.identity()).append(' ').append(object.ownerClass().internalName());
        if (slot != null) {
            sb.append(slot.label());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
