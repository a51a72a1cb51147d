import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First resolution phase. Walks every rung in document order and
 * <ol>
 *   <li>records each coil operand with its (program, routine, rung), appending per operand</li>
 *   <li>keeps rung-level operand comments that have no earlier rung-level entry</li>
 *   <li>expands COP/CPS, MOV, FFL and message requests into mapping records</li>
 *   <li>collects every destination that received a record</li>
 * </ol>
 * Message requests declared on MESSAGE tags are attributed to each rung that calls MSG on the tag.
 */
public class L5XRungScanner {

    private static final Logger logger = LoggerFactory.getLogger(L5XRungScanner.class);

    private final ProgramIndex index;
    private final L5XIndexExpander expander;
    private final L5XInstructionMatcher matcher;

    public L5XRungScanner(ProgramIndex index, MonitoredTags monitored) {
        this(index, monitored, new L5XInstructionMatcher());
    }

    public L5XRungScanner(ProgramIndex index, MonitoredTags monitored, L5XInstructionMatcher matcher) {
        this.index = index;
        this.expander = new L5XIndexExpander(index, monitored);
        this.matcher = matcher;
    }

    public RungScanResult scan() {
        List<MappingRecord> records = new ArrayList<>();
        Map<String, List<CoilOccurrence>> coilOccurrences = new LinkedHashMap<>();
        Map<String, String> rungComments = new LinkedHashMap<>();
        int fallbackRungs = 0;

        for (RungContext rung : index.getRungs()) {
            List<InstructionCall> calls = matcher.match(rung.getText());
            if (matcher.usedFallback()) {
                fallbackRungs++;
            }

            // 1. coil occurrences
            for (InstructionCall call : calls) {
                if (call.getKind() == InstructionKind.BOOLEAN_OUTPUT) {
                    coilOccurrences.computeIfAbsent(call.getOperand(0), k -> new ArrayList<>())
                        .add(CoilOccurrence.of(rung));
                }
            }

            // 2. rung-level comments; declaration-level comments are consulted first by the sweep
            for (OperandComment comment : rung.getOperandComments()) {
                if (!index.getBitComments().containsKey(comment.getOperand())) {
                    rungComments.putIfAbsent(comment.getOperand(), comment.getText());
                }
            }

            // 3. value transfers, one family at a time
            for (InstructionCall call : calls) {
                if (call.getKind() == InstructionKind.BLOCK_COPY) {
                    records.addAll(expander.expandBlockCopy(call, rung));
                }
            }
            for (InstructionCall call : calls) {
                if (call.getKind() == InstructionKind.MOVE) {
                    records.addAll(expander.expandMove(call, rung));
                }
            }
            for (InstructionCall call : calls) {
                if (call.getKind() == InstructionKind.FIFO_LOAD) {
                    records.addAll(expander.expandFifoLoad(call, rung));
                }
            }
            for (MessageRequest request : rung.getMessageRequests()) {
                records.addAll(expander.expandMessage(request, rung));
            }
            for (InstructionCall call : calls) {
                if (call.getKind() != InstructionKind.MESSAGE) continue;
                List<MessageRequest> declared = index.getMessageTags().get(TagIdentifier.stripIndex(call.getOperand(0)));
                if (declared == null) continue;
                for (MessageRequest request : declared) {
                    records.addAll(expander.expandMessage(request, rung));
                }
            }
        }

        // 4. resolved destinations
        Set<String> resolved = new LinkedHashSet<>();
        for (MappingRecord record : records) {
            resolved.add(record.getDestination());
        }

        logger.info("Scanned {} rungs: {} records, {} tags resolved, {} coil operands, {} rungs via fallback patterns",
            index.getRungs().size(), records.size(), resolved.size(), coilOccurrences.size(), fallbackRungs);
        return new RungScanResult(records, resolved, coilOccurrences, rungComments, fallbackRungs);
    }
}
