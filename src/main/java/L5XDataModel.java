import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// =====================================================================
// TAG IDENTIFIERS AND INSTRUCTION KINDS
// =====================================================================

/**
 * Closed set of ways a monitored tag can be resolved.
 * Block copy covers both COP and CPS; the mnemonic actually seen is kept on the record.
 */
enum InstructionKind {
    BLOCK_COPY("COP"),
    MOVE("MOV"),
    FIFO_LOAD("FFL"),
    MESSAGE("MESSAGE"),
    BOOLEAN_OUTPUT("OTE"),
    NOT_FOUND("Not Found");

    private final String defaultMnemonic;

    InstructionKind(String defaultMnemonic) {
        this.defaultMnemonic = defaultMnemonic;
    }

    public String getDefaultMnemonic() { return defaultMnemonic; }

    public static InstructionKind forMnemonic(String mnemonic) {
        if (mnemonic == null) return null;
        switch (mnemonic.toUpperCase(Locale.ROOT)) {
            case "COP":
            case "CPS":
                return BLOCK_COPY;
            case "MOV":
                return MOVE;
            case "FFL":
                return FIFO_LOAD;
            case "OTE":
                return BOOLEAN_OUTPUT;
            case "MSG":
                return MESSAGE;
            default:
                return null;
        }
    }
}

/**
 * Helpers for the textual tag form {@code Base[Index].Bit}.
 * A split always yields a base and an index, the index defaulting to 0 when no trailing
 * {@code [n]} is present.
 */
final class TagIdentifier {

    private static final Pattern INDEXED = Pattern.compile("^(.+?)\\[(\\d+)\\]$");
    private static final Pattern TRAILING_INDEX = Pattern.compile("\\[\\d+\\]$");
    private static final Pattern NATURAL = Pattern.compile("^(.*?)(?:\\[(\\d+)\\])?(?:\\.(\\d+))?$", Pattern.DOTALL);

    /** Orders identifiers by (base, array index, bit) with absent parts as -1. */
    public static final Comparator<String> NATURAL_ORDER =
        Comparator.comparing(TagIdentifier::sortKey);

    private final String base;
    private final int index;

    private TagIdentifier(String base, int index) {
        this.base = base;
        this.index = index;
    }

    public static TagIdentifier split(String tag) {
        String text = tag == null ? "" : tag;
        Matcher matcher = INDEXED.matcher(text);
        if (matcher.matches()) {
            Integer parsed = parseIndex(matcher.group(2));
            if (parsed != null) {
                return new TagIdentifier(matcher.group(1), parsed);
            }
        }
        return new TagIdentifier(text, 0);
    }

    public static TagIdentifier of(String base, int index) {
        return new TagIdentifier(base, index);
    }

    public static String stripIndex(String tag) {
        if (tag == null) return "";
        return TRAILING_INDEX.matcher(tag).replaceFirst("");
    }

    public static SortKey sortKey(String tag) {
        String text = tag == null ? "" : tag;
        Matcher matcher = NATURAL.matcher(text);
        if (!matcher.matches()) {
            return new SortKey(text, -1, -1);
        }
        return new SortKey(matcher.group(1), toLong(matcher.group(2)), toLong(matcher.group(3)));
    }

    static Integer parseIndex(String digits) {
        if (digits == null) return null;
        try {
            return Integer.valueOf(digits.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long toLong(String digits) {
        if (digits == null) return -1L;
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    public String getBase() { return base; }
    public int getIndex() { return index; }

    /** Element {@code base[index + offset]}, summed in long so indexes near the int limit do not wrap. */
    public String element(int offset) {
        return base + "[" + ((long) index + offset) + "]";
    }

    /** Bit operand {@code base[index].bit}. */
    public String bit(int bit) {
        return base + "[" + index + "]." + bit;
    }

    @Override
    public String toString() {
        return base + "[" + index + "]";
    }

    /**
     * Natural sort key of one identifier.
     */
    static final class SortKey implements Comparable<SortKey> {
        private final String base;
        private final long index;
        private final long bit;

        SortKey(String base, long index, long bit) {
            this.base = base;
            this.index = index;
            this.bit = bit;
        }

        @Override
        public int compareTo(SortKey other) {
            int byBase = base.compareTo(other.base);
            if (byBase != 0) return byBase;
            int byIndex = Long.compare(index, other.index);
            if (byIndex != 0) return byIndex;
            return Long.compare(bit, other.bit);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SortKey)) return false;
            SortKey that = (SortKey) o;
            return index == that.index && bit == that.bit && base.equals(that.base);
        }

        @Override
        public int hashCode() {
            return Objects.hash(base, index, bit);
        }

        @Override
        public String toString() {
            return String.format("SortKey{base='%s', index=%d, bit=%d}", base, index, bit);
        }
    }
}

// =====================================================================
// PROGRAM INDEX - DECLARATIONS, RUNGS, MESSAGE REQUESTS
// =====================================================================

/**
 * One declared tag. Type is upper-cased; length is only set for CONTROL tags with a numeric LEN.
 */
class TagDeclaration {
    private final String dataType;
    private final String description;
    private final Integer length;

    public TagDeclaration(String dataType, String description, Integer length) {
        this.dataType = dataType == null ? "" : dataType;
        this.description = description == null ? "" : description;
        this.length = length;
    }

    public String getDataType() { return dataType; }
    public String getDescription() { return description; }
    public Integer getLength() { return length; }
}

/**
 * Raw attributes of a MessageParameters element. Values are kept as text and
 * interpreted by the expander.
 */
class MessageRequest {
    private final String localElement;
    private final String localIndex;
    private final String remoteElement;
    private final String requestedLength;

    public MessageRequest(String localElement, String localIndex, String remoteElement, String requestedLength) {
        this.localElement = localElement;
        this.localIndex = localIndex;
        this.remoteElement = remoteElement;
        this.requestedLength = requestedLength;
    }

    public String getLocalElement() { return localElement; }
    public String getLocalIndex() { return localIndex; }
    public String getRemoteElement() { return remoteElement; }
    public String getRequestedLength() { return requestedLength; }

    @Override
    public String toString() {
        return String.format("MessageRequest{local='%s', localIndex='%s', remote='%s', length='%s'}",
            localElement, localIndex, remoteElement, requestedLength);
    }
}

/**
 * Comment attached to an operand inside a rung's structured element tree.
 */
class OperandComment {
    private final String operand;
    private final String text;

    public OperandComment(String operand, String text) {
        this.operand = operand;
        this.text = text;
    }

    public String getOperand() { return operand; }
    public String getText() { return text; }
}

/**
 * Snapshot of one rung as read from the document.
 */
class RungContext {
    private final String programName;
    private final String routineName;
    private final String rungNumber;
    private final String text;
    private final List<OperandComment> operandComments;
    private final List<MessageRequest> messageRequests;

    public RungContext(String programName, String routineName, String rungNumber, String text,
                       List<OperandComment> operandComments, List<MessageRequest> messageRequests) {
        this.programName = programName == null ? "" : programName;
        this.routineName = routineName == null ? "" : routineName;
        this.rungNumber = rungNumber == null ? "" : rungNumber;
        this.text = text == null ? "" : text;
        this.operandComments = Collections.unmodifiableList(new ArrayList<>(operandComments));
        this.messageRequests = Collections.unmodifiableList(new ArrayList<>(messageRequests));
    }

    public RungContext(String programName, String routineName, String rungNumber, String text) {
        this(programName, routineName, rungNumber, text, Collections.emptyList(), Collections.emptyList());
    }

    public String getProgramName() { return programName; }
    public String getRoutineName() { return routineName; }
    public String getRungNumber() { return rungNumber; }
    public String getText() { return text; }
    public List<OperandComment> getOperandComments() { return operandComments; }
    public List<MessageRequest> getMessageRequests() { return messageRequests; }

    @Override
    public String toString() {
        return String.format("Rung{%s/%s/%s}", programName, routineName, rungNumber);
    }
}

/**
 * Read-only tables built once per run from the L5X document.
 */
class ProgramIndex {
    private final Map<String, TagDeclaration> declarations;
    private final Map<String, String> bitComments;
    private final List<RungContext> rungs;
    private final Map<String, List<MessageRequest>> messageTags;
    private final boolean recovered;

    public ProgramIndex(Map<String, TagDeclaration> declarations, Map<String, String> bitComments,
                        List<RungContext> rungs, Map<String, List<MessageRequest>> messageTags,
                        boolean recovered) {
        this.declarations = Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
        this.bitComments = Collections.unmodifiableMap(new LinkedHashMap<>(bitComments));
        this.rungs = Collections.unmodifiableList(new ArrayList<>(rungs));
        Map<String, List<MessageRequest>> messages = new LinkedHashMap<>();
        messageTags.forEach((tag, requests) ->
            messages.put(tag, Collections.unmodifiableList(new ArrayList<>(requests))));
        this.messageTags = Collections.unmodifiableMap(messages);
        this.recovered = recovered;
    }

    public Map<String, TagDeclaration> getDeclarations() { return declarations; }
    public Map<String, String> getBitComments() { return bitComments; }
    public List<RungContext> getRungs() { return rungs; }
    public Map<String, List<MessageRequest>> getMessageTags() { return messageTags; }
    public boolean isRecovered() { return recovered; }

    // Lookups keyed by base name; absent entries read as empty

    public String getDataType(String base) {
        TagDeclaration declaration = declarations.get(base);
        return declaration == null ? "" : declaration.getDataType();
    }

    public String getDescription(String base) {
        TagDeclaration declaration = declarations.get(base);
        return declaration == null ? "" : declaration.getDescription();
    }

    public Integer getControlLength(String base) {
        TagDeclaration declaration = declarations.get(base);
        return declaration == null ? null : declaration.getLength();
    }
}

// =====================================================================
// INSTRUCTIONS, OCCURRENCES AND OUTPUT RECORDS
// =====================================================================

/**
 * One instruction recognized in rung text, operands kept as raw trimmed text.
 */
class InstructionCall {
    private final String mnemonic;
    private final List<String> operands;

    public InstructionCall(String mnemonic, List<String> operands) {
        this.mnemonic = mnemonic.toUpperCase(Locale.ROOT);
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public String getMnemonic() { return mnemonic; }
    public List<String> getOperands() { return operands; }

    public String getOperand(int position) {
        return position < operands.size() ? operands.get(position) : "";
    }

    public InstructionKind getKind() {
        return InstructionKind.forMnemonic(mnemonic);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstructionCall)) return false;
        InstructionCall that = (InstructionCall) o;
        return mnemonic.equals(that.mnemonic) && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mnemonic, operands);
    }

    @Override
    public String toString() {
        return mnemonic + "(" + String.join(",", operands) + ")";
    }
}

/**
 * Where a coil drives an operand.
 */
class CoilOccurrence {
    private final String programName;
    private final String routineName;
    private final String rungNumber;

    public CoilOccurrence(String programName, String routineName, String rungNumber) {
        this.programName = programName;
        this.routineName = routineName;
        this.rungNumber = rungNumber;
    }

    public static CoilOccurrence of(RungContext rung) {
        return new CoilOccurrence(rung.getProgramName(), rung.getRoutineName(), rung.getRungNumber());
    }

    public String getProgramName() { return programName; }
    public String getRoutineName() { return routineName; }
    public String getRungNumber() { return rungNumber; }
}

/**
 * One output row. Equality covers every field so exact duplicates collapse.
 */
class MappingRecord {
    private final String destination;
    private final String description;
    private final String dataType;
    private final String programName;
    private final String routineName;
    private final String rungNumber;
    private final InstructionKind kind;
    private final String mnemonic;
    private final String source;

    public MappingRecord(String destination, String description, String dataType,
                         String programName, String routineName, String rungNumber,
                         InstructionKind kind, String mnemonic, String source) {
        this.destination = destination;
        this.description = nvl(description);
        this.dataType = nvl(dataType);
        this.programName = nvl(programName);
        this.routineName = nvl(routineName);
        this.rungNumber = nvl(rungNumber);
        this.kind = kind;
        this.mnemonic = mnemonic == null ? kind.getDefaultMnemonic() : mnemonic;
        this.source = nvl(source);
    }

    public static MappingRecord notFound(String destination, String description, String dataType) {
        return new MappingRecord(destination, description, dataType, "", "", "",
            InstructionKind.NOT_FOUND, null, "");
    }

    private static String nvl(String s) { return s == null ? "" : s; }

    public String getDestination() { return destination; }
    public String getDescription() { return description; }
    public String getDataType() { return dataType; }
    public String getProgramName() { return programName; }
    public String getRoutineName() { return routineName; }
    public String getRungNumber() { return rungNumber; }
    public InstructionKind getKind() { return kind; }
    public String getMnemonic() { return mnemonic; }
    public String getSource() { return source; }

    public List<String> toRow() {
        return Arrays.asList(destination, description, dataType, programName, routineName,
            rungNumber, mnemonic, source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MappingRecord)) return false;
        MappingRecord that = (MappingRecord) o;
        return destination.equals(that.destination)
            && description.equals(that.description)
            && dataType.equals(that.dataType)
            && programName.equals(that.programName)
            && routineName.equals(that.routineName)
            && rungNumber.equals(that.rungNumber)
            && kind == that.kind
            && mnemonic.equals(that.mnemonic)
            && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destination, description, dataType, programName, routineName,
            rungNumber, kind, mnemonic, source);
    }

    @Override
    public String toString() {
        return String.format("MappingRecord{%s <- %s %s @ %s/%s/%s}",
            destination, mnemonic, source, programName, routineName, rungNumber);
    }
}

// =====================================================================
// PHASE HAND-OFF
// =====================================================================

/**
 * Output of one resolution phase: the records it produced and the monitored tags it resolved.
 */
class PhaseResult {
    private final List<MappingRecord> records;
    private final Set<String> resolved;

    public PhaseResult(List<MappingRecord> records, Set<String> resolved) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.resolved = Collections.unmodifiableSet(new LinkedHashSet<>(resolved));
    }

    public List<MappingRecord> getRecords() { return records; }
    public Set<String> getResolved() { return resolved; }
}

/**
 * Rung scan output, which also carries the coil occurrences and rung-level comments
 * consumed by the bit sweep.
 */
class RungScanResult extends PhaseResult {
    private final Map<String, List<CoilOccurrence>> coilOccurrences;
    private final Map<String, String> rungComments;
    private final int fallbackRungs;

    public RungScanResult(List<MappingRecord> records, Set<String> resolved,
                          Map<String, List<CoilOccurrence>> coilOccurrences,
                          Map<String, String> rungComments, int fallbackRungs) {
        super(records, resolved);
        Map<String, List<CoilOccurrence>> coils = new LinkedHashMap<>();
        coilOccurrences.forEach((operand, occurrences) ->
            coils.put(operand, Collections.unmodifiableList(new ArrayList<>(occurrences))));
        this.coilOccurrences = Collections.unmodifiableMap(coils);
        this.rungComments = Collections.unmodifiableMap(new LinkedHashMap<>(rungComments));
        this.fallbackRungs = fallbackRungs;
    }

    public Map<String, List<CoilOccurrence>> getCoilOccurrences() { return coilOccurrences; }
    public Map<String, String> getRungComments() { return rungComments; }
    public int getFallbackRungs() { return fallbackRungs; }
}

/**
 * The monitored tag list: a set for membership and a naturally sorted sequence for the sweeps.
 */
class MonitoredTags {
    private final Set<String> tagSet;
    private final List<String> sorted;
    // base -> indexes of monitored elements written exactly as base[index]
    private final Map<String, NavigableSet<Integer>> elementIndexes;

    public MonitoredTags(Collection<String> tags) {
        Set<String> set = new HashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isEmpty()) {
                set.add(tag);
            }
        }
        List<String> ordered = new ArrayList<>(set);
        ordered.sort(TagIdentifier.NATURAL_ORDER.thenComparing(Comparator.naturalOrder()));

        Map<String, NavigableSet<Integer>> indexes = new HashMap<>();
        for (String tag : ordered) {
            TagIdentifier id = TagIdentifier.split(tag);
            if (id.element(0).equals(tag)) {
                indexes.computeIfAbsent(id.getBase(), b -> new TreeSet<>()).add(id.getIndex());
            }
        }

        this.tagSet = Collections.unmodifiableSet(set);
        this.sorted = Collections.unmodifiableList(ordered);
        this.elementIndexes = indexes;
    }

    public boolean contains(String tag) { return tagSet.contains(tag); }

    /**
     * Monitored element indexes of {@code base} within [first, first + count), ascending.
     */
    public NavigableSet<Integer> elementsInRange(String base, int first, int count) {
        NavigableSet<Integer> indexes = elementIndexes.get(base);
        if (indexes == null || count <= 0) {
            return Collections.emptyNavigableSet();
        }
        long last = (long) first + count - 1;
        int upper = (int) Math.min(Integer.MAX_VALUE, last);
        return Collections.unmodifiableNavigableSet(indexes.subSet(first, true, upper, true));
    }

    public Set<String> asSet() { return tagSet; }
    public List<String> sorted() { return sorted; }
    public int size() { return tagSet.size(); }
}

/**
 * Final consolidated table plus run statistics.
 */
class TagTraceResult {
    private final List<MappingRecord> records;
    private final int monitoredTags;
    private final int declaredTags;
    private final int rungsScanned;
    private final int fallbackRungs;
    private final boolean documentRecovered;

    public TagTraceResult(List<MappingRecord> records, int monitoredTags, int declaredTags,
                          int rungsScanned, int fallbackRungs, boolean documentRecovered) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.monitoredTags = monitoredTags;
        this.declaredTags = declaredTags;
        this.rungsScanned = rungsScanned;
        this.fallbackRungs = fallbackRungs;
        this.documentRecovered = documentRecovered;
    }

    public List<MappingRecord> getRecords() { return records; }
    public int getMonitoredTags() { return monitoredTags; }
    public int getDeclaredTags() { return declaredTags; }
    public int getRungsScanned() { return rungsScanned; }
    public int getFallbackRungs() { return fallbackRungs; }
    public boolean isDocumentRecovered() { return documentRecovered; }

    public Map<String, Integer> getInstructionCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        for (MappingRecord record : records) {
            counts.merge(record.getMnemonic(), 1, Integer::sum);
        }
        return counts;
    }
}

/**
 * Command line settings for one run.
 */
class TracerOptions {
    public static final String DEFAULT_COLUMN = "Col45";
    public static final String DEFAULT_TOPIC = "Main";
    public static final String DEFAULT_OUTPUT_NAME = "Tag Mapping.xlsx";

    private final Path tagsPath;
    private final Path programPath;
    private final Path outputPath;
    private final String column;
    private final String topic;
    private final boolean quiet;

    public TracerOptions(Path tagsPath, Path programPath, Path outputPath,
                         String column, String topic, boolean quiet) {
        this.tagsPath = tagsPath;
        this.programPath = programPath;
        this.outputPath = outputPath;
        this.column = column == null ? DEFAULT_COLUMN : column;
        this.topic = topic == null ? DEFAULT_TOPIC : topic;
        this.quiet = quiet;
    }

    public Path getTagsPath() { return tagsPath; }
    public Path getProgramPath() { return programPath; }
    public Path getOutputPath() { return outputPath; }
    public String getColumn() { return column; }
    public String getTopic() { return topic; }
    public boolean isQuiet() { return quiet; }
}
