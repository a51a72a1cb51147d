import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one length-bearing transfer into per-element mapping records.
 * For a destination {@code D[b]}, source {@code S[a]} and count n, element k maps
 * {@code D[b+k]} from {@code S[a+k]}; only monitored destinations produce records.
 */
public class L5XIndexExpander {

    private static final Logger logger = LoggerFactory.getLogger(L5XIndexExpander.class);

    private final ProgramIndex index;
    private final MonitoredTags monitored;

    public L5XIndexExpander(ProgramIndex index, MonitoredTags monitored) {
        this.index = index;
        this.monitored = monitored;
    }

    // =====================================================================
    // INSTRUCTION FAMILIES
    // =====================================================================

    /** COP / CPS with an inline literal length. */
    public List<MappingRecord> expandBlockCopy(InstructionCall call, RungContext rung) {
        Integer length = TagIdentifier.parseIndex(call.getOperand(2));
        if (length == null) {
            logger.debug("{} length '{}' is not a usable integer at {}", call.getMnemonic(), call.getOperand(2), rung);
            return Collections.emptyList();
        }
        TagIdentifier source = TagIdentifier.split(call.getOperand(0));
        TagIdentifier destination = TagIdentifier.split(call.getOperand(1));
        return expand(source, destination, length, rung, InstructionKind.BLOCK_COPY, call.getMnemonic());
    }

    /** MOV is a single-element transfer; the destination must be monitored verbatim. */
    public List<MappingRecord> expandMove(InstructionCall call, RungContext rung) {
        String destination = call.getOperand(1);
        if (!monitored.contains(destination)) {
            return Collections.emptyList();
        }
        String base = TagIdentifier.split(destination).getBase();
        return Collections.singletonList(record(destination, base, rung, InstructionKind.MOVE,
            call.getMnemonic(), call.getOperand(0)));
    }

    /**
     * FFL takes its element count from the control tag's LEN. The source is a single
     * value pushed into the queue, so it is reported unexpanded.
     */
    public List<MappingRecord> expandFifoLoad(InstructionCall call, RungContext rung) {
        String controlBase = TagIdentifier.stripIndex(call.getOperand(2));
        Integer length = index.getControlLength(controlBase);
        if (length == null || length <= 0) {
            logger.debug("FFL control {} has no usable LEN at {}; not expanded", controlBase, rung);
            return Collections.emptyList();
        }

        TagIdentifier destination = TagIdentifier.split(call.getOperand(1));
        String source = call.getOperand(0);
        List<MappingRecord> records = new ArrayList<>();
        for (int element : monitored.elementsInRange(destination.getBase(), destination.getIndex(), length)) {
            String target = destination.element(element - destination.getIndex());
            records.add(record(target, destination.getBase(), rung, InstructionKind.FIFO_LOAD,
                call.getMnemonic(), source));
        }
        return records;
    }

    /**
     * Message read/write request: the local element (its own index, else LocalIndex) is
     * the destination, the remote element the source, RequestedLength the count.
     */
    public List<MappingRecord> expandMessage(MessageRequest request, RungContext rung) {
        String localElement = request.getLocalElement();
        String requestedLength = request.getRequestedLength();
        if (localElement == null || localElement.isEmpty() || requestedLength == null || requestedLength.isEmpty()) {
            return Collections.emptyList();
        }

        Integer length = TagIdentifier.parseIndex(requestedLength);
        Integer localIndex = request.getLocalIndex() == null ? Integer.valueOf(0)
            : TagIdentifier.parseIndex(request.getLocalIndex());
        if (localIndex != null && localIndex < 0) {
            localIndex = null;
        }
        if (length == null) {
            logger.debug("Message {} has non-numeric RequestedLength; not expanded", request);
            return Collections.emptyList();
        }

        TagIdentifier destination = explicitIndex(localElement, localIndex);
        if (destination == null) {
            logger.debug("Message {} has non-numeric LocalIndex; not expanded", request);
            return Collections.emptyList();
        }

        String remoteElement = request.getRemoteElement();
        TagIdentifier source = null;
        if (remoteElement != null && !remoteElement.isEmpty()) {
            source = explicitIndex(remoteElement, localIndex);
            if (source == null) {
                logger.debug("Message {} has non-numeric LocalIndex for its remote element; not expanded", request);
                return Collections.emptyList();
            }
        }

        if (source == null) {
            List<MappingRecord> records = new ArrayList<>();
            for (int element : monitored.elementsInRange(destination.getBase(), destination.getIndex(), length)) {
                records.add(record(destination.element(element - destination.getIndex()), destination.getBase(),
                    rung, InstructionKind.MESSAGE, null, ""));
            }
            return records;
        }
        return expand(source, destination, length, rung, InstructionKind.MESSAGE, null);
    }

    // =====================================================================
    // CORE EXPANSION
    // =====================================================================

    private List<MappingRecord> expand(TagIdentifier source, TagIdentifier destination, int count,
                                       RungContext rung, InstructionKind kind, String mnemonic) {
        List<MappingRecord> records = new ArrayList<>();
        for (Map.Entry<String, String> pair : pairs(source, destination, count, monitored).entrySet()) {
            records.add(record(pair.getKey(), destination.getBase(), rung, kind, mnemonic, pair.getValue()));
        }
        return records;
    }

    /**
     * Monitored destination elements in ascending order, each with its offset-matched source element.
     */
    static LinkedHashMap<String, String> pairs(TagIdentifier source, TagIdentifier destination,
                                               int count, MonitoredTags monitored) {
        LinkedHashMap<String, String> pairs = new LinkedHashMap<>();
        for (int element : monitored.elementsInRange(destination.getBase(), destination.getIndex(), count)) {
            int offset = element - destination.getIndex();
            pairs.put(destination.element(offset), source.element(offset));
        }
        return pairs;
    }

    /** Element with its own bracket index, else base plus the fallback index; null if that is unknown. */
    private static TagIdentifier explicitIndex(String element, Integer fallbackIndex) {
        TagIdentifier split = TagIdentifier.split(element);
        if (split.element(0).equals(element)) {
            return split;
        }
        if (fallbackIndex == null) {
            return null;
        }
        return TagIdentifier.of(element, fallbackIndex);
    }

    private MappingRecord record(String destination, String base, RungContext rung,
                                 InstructionKind kind, String mnemonic, String source) {
        return new MappingRecord(destination, index.getDescription(base), index.getDataType(base),
            rung.getProgramName(), rung.getRoutineName(), rung.getRungNumber(), kind, mnemonic, source);
    }
}
