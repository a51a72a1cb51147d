import java.util.*;

/**
 * Merges the phase outputs into the final table: exact duplicates removed (first kept),
 * then a stable natural sort on the destination so rows with equal keys stay in
 * phase and scan order.
 */
public class L5XResultConsolidator {

    public List<MappingRecord> consolidate(List<PhaseResult> phases) {
        Set<MappingRecord> unique = new LinkedHashSet<>();
        for (PhaseResult phase : phases) {
            unique.addAll(phase.getRecords());
        }

        List<MappingRecord> ordered = new ArrayList<>(unique);
        ordered.sort(Comparator.comparing((MappingRecord record) -> TagIdentifier.sortKey(record.getDestination())));
        return ordered;
    }
}
