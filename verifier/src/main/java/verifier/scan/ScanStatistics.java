package verifier.scan;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable counters from one {@link ClassFieldScanner} pass.
 *
 * @param classesVisited number of classes enumerated from the registry
 * @param rootClassesSkipped number of classes skipped wholesale as root classes
 * @param fieldsExamined number of static object-typed fields examined
 * @param skips per-rule count of fields that were not indexed
 * @param fieldsIndexed number of fields whose value was put into the index
 * @param originsOverwritten number of puts that replaced an earlier origin for the same object
 */
public record ScanStatistics(
        int classesVisited,
        int rootClassesSkipped,
        int fieldsExamined,
        Map<SkipReason, Integer> skips,
        int fieldsIndexed,
        int originsOverwritten
) {
    public ScanStatistics {
        EnumMap<SkipReason, Integer> copy = new EnumMap<>(SkipReason.class);
        for (SkipReason r : SkipReason.values()) {
            copy.put(r, 0);
        }
        if (skips != null) {
            copy.putAll(skips);
        }
        skips = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns how many fields were skipped for the given reason. For
     * {@link SkipReason#ROOT_CLASS} this counts classes, since their fields are never examined.
     */
    public int skipped(SkipReason reason) {
        return skips.getOrDefault(reason, 0);
    }

    /**
     * Returns a single-line key=value rendering suitable for structured logs.
     */
    public String summary() {
        return String.format(Locale.ROOT,
                "classes=%d root_classes=%d fields=%d indexed=%d overwritten=%d excluded=%d null=%d literal=%d mirror=%d enum=%d",
                classesVisited, rootClassesSkipped, fieldsExamined, fieldsIndexed, originsOverwritten,
                skipped(SkipReason.EXCLUDED),
                skipped(SkipReason.NULL_VALUE),
                skipped(SkipReason.STRING_LITERAL),
                skipped(SkipReason.MIRROR),
                skipped(SkipReason.ARCHIVED_ENUM));
    }
}
