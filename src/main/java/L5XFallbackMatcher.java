import java.util.*;
import java.util.regex.*;

/**
 * Fallback regex-based instruction matching for rung text the grammar rejects.
 * One pattern per instruction family; operands are runs without whitespace, commas
 * or closing parentheses, so only plain tag references and literals are recognized.
 */
public class L5XFallbackMatcher {

    static final Pattern BLOCK_COPY_PATTERN = Pattern.compile(
        "\\b(?<mnemonic>COP|CPS)\\s*\\(\\s*"
            + "(?<source>[^,\\s)]+)\\s*,\\s*"
            + "(?<destination>[^,\\s)]+)\\s*,\\s*"
            + "(?<length>\\d+)\\s*\\)",
        Pattern.CASE_INSENSITIVE
    );

    static final Pattern MOVE_PATTERN = Pattern.compile(
        "\\b(?<mnemonic>MOV)\\s*\\(\\s*"
            + "(?<source>[^,\\s)]+)\\s*,\\s*"
            + "(?<destination>[^,\\s)]+)\\s*\\)",
        Pattern.CASE_INSENSITIVE
    );

    // FFL(Source, FIFO, Control, Length, Position); only the first three are read
    static final Pattern FIFO_LOAD_PATTERN = Pattern.compile(
        "\\b(?<mnemonic>FFL)\\s*\\(\\s*"
            + "(?<source>[^,\\s)]+)\\s*,\\s*"
            + "(?<destination>[^,\\s)]+)\\s*,\\s*"
            + "(?<control>[^,\\s)]+)",
        Pattern.CASE_INSENSITIVE
    );

    static final Pattern COIL_PATTERN = Pattern.compile(
        "\\b(?<mnemonic>OTE)\\s*\\(\\s*(?<operand>[^\\s)]+)\\s*\\)",
        Pattern.CASE_INSENSITIVE
    );

    static final Pattern MESSAGE_PATTERN = Pattern.compile(
        "\\b(?<mnemonic>MSG)\\s*\\(\\s*(?<operand>[^,\\s)]+)\\s*\\)",
        Pattern.CASE_INSENSITIVE
    );

    /**
     * Returns every recognized call in textual order.
     */
    public List<InstructionCall> match(String rungText) {
        if (rungText == null || rungText.isEmpty()) {
            return Collections.emptyList();
        }

        TreeMap<Integer, InstructionCall> byPosition = new TreeMap<>();

        Matcher blockCopy = BLOCK_COPY_PATTERN.matcher(rungText);
        while (blockCopy.find()) {
            byPosition.put(blockCopy.start(), new InstructionCall(blockCopy.group("mnemonic"),
                Arrays.asList(blockCopy.group("source"), blockCopy.group("destination"), blockCopy.group("length"))));
        }

        Matcher move = MOVE_PATTERN.matcher(rungText);
        while (move.find()) {
            byPosition.put(move.start(), new InstructionCall(move.group("mnemonic"),
                Arrays.asList(move.group("source"), move.group("destination"))));
        }

        Matcher fifoLoad = FIFO_LOAD_PATTERN.matcher(rungText);
        while (fifoLoad.find()) {
            byPosition.put(fifoLoad.start(), new InstructionCall(fifoLoad.group("mnemonic"),
                Arrays.asList(fifoLoad.group("source"), fifoLoad.group("destination"), fifoLoad.group("control"))));
        }

        Matcher coil = COIL_PATTERN.matcher(rungText);
        while (coil.find()) {
            String operand = coil.group("operand").trim();
            if (!operand.isEmpty()) {
                byPosition.put(coil.start(), new InstructionCall(coil.group("mnemonic"),
                    Collections.singletonList(operand)));
            }
        }

        Matcher message = MESSAGE_PATTERN.matcher(rungText);
        while (message.find()) {
            byPosition.put(message.start(), new InstructionCall(message.group("mnemonic"),
                Collections.singletonList(message.group("operand"))));
        }

        return new ArrayList<>(byPosition.values());
    }
}
