package com.historian.anomaly.engine;

import com.historian.anomaly.model.AnomalyRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges anomaly lists from several detectors into one list with no two entries
 * sharing a (timestamp, value) pair, ascending by timestamp.
 * When two detectors flag the same pair, the more severe record wins; on a tie the
 * first one seen is kept.
 */
public final class AnomalyMerger {

    private static final Comparator<AnomalyRecord> CHRONOLOGICAL = Comparator
            .comparing(AnomalyRecord::getTimestamp)
            .thenComparingDouble(AnomalyRecord::getValue);

    private AnomalyMerger() {}

    @SafeVarargs
    public static List<AnomalyRecord> merge(Collection<AnomalyRecord>... sources) {
        Map<Key, AnomalyRecord> unique = new LinkedHashMap<>();
        for (Collection<AnomalyRecord> source : sources) {
            for (AnomalyRecord anomaly : source) {
                Key key = new Key(anomaly.getTimestamp(), anomaly.getValue());
                AnomalyRecord existing = unique.get(key);
                if (existing == null || anomaly.getSeverity().isMoreSevereThan(existing.getSeverity())) {
                    unique.put(key, anomaly);
                }
            }
        }

        List<AnomalyRecord> merged = new ArrayList<>(unique.values());
        merged.sort(CHRONOLOGICAL);
        return merged;
    }

    private static final class Key {
        private final Instant timestamp;
        private final long valueBits;

        private Key(Instant timestamp, double value) {
            this.timestamp = timestamp;
            // -0.0 and 0.0 are the same reading
            this.valueBits = Double.doubleToLongBits(value == 0.0 ? 0.0 : value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return valueBits == other.valueBits && timestamp.equals(other.timestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(timestamp, valueBits);
        }
    }
}
