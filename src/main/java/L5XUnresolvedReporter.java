import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resolution phase: one "Not Found" record per monitored tag nothing resolved,
 * so every monitored tag appears in the output.
 */
public class L5XUnresolvedReporter {

    private static final Logger logger = LoggerFactory.getLogger(L5XUnresolvedReporter.class);

    private final ProgramIndex index;

    public L5XUnresolvedReporter(ProgramIndex index) {
        this.index = index;
    }

    public PhaseResult report(MonitoredTags monitored, Set<String> alreadyResolved) {
        List<MappingRecord> records = new ArrayList<>();
        Set<String> resolved = new LinkedHashSet<>();

        for (String tag : monitored.sorted()) {
            if (alreadyResolved.contains(tag)) continue;
            String base = TagIdentifier.split(tag).getBase();
            records.add(MappingRecord.notFound(tag, index.getDescription(base), index.getDataType(base)));
            resolved.add(tag);
        }

        if (!records.isEmpty()) {
            logger.info("{} monitored tags not found in the program", records.size());
        }
        return new PhaseResult(records, resolved);
    }
}
