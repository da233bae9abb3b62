package com.healthtrack.query;

import com.healthtrack.model.WireEnum;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns {@code GROUP BY} rows of {@code [enumValue, count]} into a map keyed by
 * wire value. Groups without rows are simply absent; callers read a missing
 * key as zero.
 */
public final class SparseCounts {

    private SparseCounts() {
    }

    public static <E extends Enum<E> & WireEnum> Map<String, Long> of(Class<E> type, List<Object[]> rows) {
        EnumMap<E, Long> counts = new EnumMap<>(type);
        for (Object[] row : rows) {
            if (row[0] == null) {
                continue;
            }
            long count = ((Number) row[1]).longValue();
            if (count > 0) {
                counts.merge(type.cast(row[0]), count, Long::sum);
            }
        }
        // EnumMap iterates in declaration order
        Map<String, Long> sparse = new LinkedHashMap<>();
        counts.forEach((key, count) -> sparse.put(key.wireValue(), count));
        return sparse;
    }

    public static long total(Map<String, Long> counts) {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
