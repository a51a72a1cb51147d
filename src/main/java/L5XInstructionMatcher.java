import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.tree.*;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes the value-transfer and coil instructions in one rung's text.
 * The RungText grammar is tried first; a rung with any lexer or parser error is
 * re-read by {@link L5XFallbackMatcher}. Only calls of a known family with a usable
 * operand shape are returned:
 * <ul>
 *   <li>COP / CPS (source, destination, literal length)</li>
 *   <li>MOV (source, destination)</li>
 *   <li>FFL (source, destination, control, ...)</li>
 *   <li>OTE (operand)</li>
 *   <li>MSG (message tag)</li>
 * </ul>
 */
public class L5XInstructionMatcher {

    private static final Logger logger = LoggerFactory.getLogger(L5XInstructionMatcher.class);

    private static final Pattern LITERAL_LENGTH = Pattern.compile("\\d+");

    private final L5XFallbackMatcher fallbackMatcher = new L5XFallbackMatcher();
    private boolean usedFallback;

    public List<InstructionCall> match(String rungText) {
        usedFallback = false;
        if (rungText == null || rungText.trim().isEmpty()) {
            return Collections.emptyList();
        }

        List<InstructionCall> calls = parseWithGrammar(rungText);
        if (calls == null) {
            usedFallback = true;
            calls = fallbackMatcher.match(rungText);
        }

        return calls.stream()
            .filter(L5XInstructionMatcher::isRecognized)
            .collect(Collectors.toList());
    }

    /**
     * Returns null when the text does not conform to the grammar.
     */
    private List<InstructionCall> parseWithGrammar(String rungText) {
        List<String> errors = new ArrayList<>();
        BaseErrorListener listener = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                    int line, int charPositionInLine, String msg, RecognitionException e) {
                errors.add(charPositionInLine + ": " + msg);
            }
        };

        RungTextLexer lexer = new RungTextLexer(CharStreams.fromString(rungText));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        RungTextParser parser = new RungTextParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        ParseTree tree = parser.rung();
        if (!errors.isEmpty()) {
            logger.debug("Rung text rejected by grammar at {}; using fallback patterns for: {}",
                errors.get(0), rungText);
            return null;
        }

        L5XRungTextVisitor visitor = new L5XRungTextVisitor();
        visitor.visit(tree);
        return visitor.getCalls();
    }

    static boolean isRecognized(InstructionCall call) {
        InstructionKind kind = call.getKind();
        if (kind == null) {
            return false;
        }
        List<String> operands = call.getOperands();
        switch (kind) {
            case BLOCK_COPY:
                return operands.size() == 3
                    && !operands.get(0).isEmpty()
                    && !operands.get(1).isEmpty()
                    && LITERAL_LENGTH.matcher(operands.get(2)).matches();
            case MOVE:
                return operands.size() == 2
                    && !operands.get(0).isEmpty()
                    && !operands.get(1).isEmpty();
            case FIFO_LOAD:
                return operands.size() >= 3
                    && !operands.get(0).isEmpty()
                    && !operands.get(1).isEmpty()
                    && !operands.get(2).isEmpty();
            case BOOLEAN_OUTPUT:
            case MESSAGE:
                return operands.size() == 1 && !operands.get(0).isEmpty();
            default:
                return false;
        }
    }

    public boolean usedFallback() { return usedFallback; }
}
