import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second resolution phase: for each unresolved INT or DINT tag, reports every bit
 * of {@code base[index]} that some rung drives with an OTE. A bit nothing drives is
 * never reported.
 */
public class L5XBitOutputSweep {

    private static final Logger logger = LoggerFactory.getLogger(L5XBitOutputSweep.class);

    private static final Map<String, Integer> BIT_WIDTHS = Map.of(
        "INT", 16,
        "DINT", 32
    );

    private final ProgramIndex index;
    private final RungScanResult scan;
    // consulted in order, first hit wins
    private final List<Map<String, String>> commentSources;

    public L5XBitOutputSweep(ProgramIndex index, RungScanResult scan) {
        this.index = index;
        this.scan = scan;
        this.commentSources = List.of(index.getBitComments(), scan.getRungComments());
    }

    public PhaseResult sweep(MonitoredTags monitored, Set<String> alreadyResolved) {
        List<MappingRecord> records = new ArrayList<>();
        Set<String> resolved = new LinkedHashSet<>();

        for (String tag : monitored.sorted()) {
            if (alreadyResolved.contains(tag)) continue;

            TagIdentifier id = TagIdentifier.split(tag);
            String dataType = index.getDataType(id.getBase());
            Integer width = BIT_WIDTHS.get(dataType);
            if (width == null) continue;

            String baseDescription = index.getDescription(id.getBase());
            boolean emitted = false;
            for (int bit = 0; bit < width; bit++) {
                String operand = id.bit(bit);
                List<CoilOccurrence> occurrences = scan.getCoilOccurrences().get(operand);
                if (occurrences == null || occurrences.isEmpty()) continue;

                CoilOccurrence first = occurrences.get(0);
                records.add(new MappingRecord(operand, describe(operand, baseDescription), dataType,
                    first.getProgramName(), first.getRoutineName(), first.getRungNumber(),
                    InstructionKind.BOOLEAN_OUTPUT, null, ""));
                emitted = true;
            }

            if (emitted) {
                resolved.add(tag);
            }
        }

        logger.info("Bit sweep: {} bit records, {} tags resolved", records.size(), resolved.size());
        return new PhaseResult(records, resolved);
    }

    private String describe(String operand, String fallback) {
        for (Map<String, String> source : commentSources) {
            String comment = source.get(operand);
            if (comment != null) {
                return comment;
            }
        }
        return fallback;
    }
}
