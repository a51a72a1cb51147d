import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.*;
import java.util.*;

/**
 * Grammar-tier visitor over one rung's neutral text.
 * Collects every instruction call, including those nested in branches, in textual order.
 */
public class L5XRungTextVisitor extends RungTextBaseVisitor<Void> {

    private final List<InstructionCall> calls = new ArrayList<>();

    public List<InstructionCall> getCalls() { return calls; }

    @Override
    public Void visitInstruction(RungTextParser.InstructionContext ctx) {
        if (ctx.IDENT() == null) {
            return null;
        }
        calls.add(new InstructionCall(ctx.IDENT().getText(), operandsOf(ctx.operandList())));
        // operands never contain instructions, so the subtree is not visited
        return null;
    }

    private List<String> operandsOf(RungTextParser.OperandListContext list) {
        List<String> operands = new ArrayList<>();
        if (list == null || list.getChildCount() == 0) {
            return operands;
        }

        String pending = "";
        for (int i = 0; i < list.getChildCount(); i++) {
            ParseTree child = list.getChild(i);
            if (child instanceof RungTextParser.OperandContext) {
                pending = originalText((RungTextParser.OperandContext) child);
            } else if (child instanceof TerminalNode
                    && ((TerminalNode) child).getSymbol().getType() == RungTextLexer.COMMA) {
                operands.add(pending);
                pending = "";
            }
        }
        operands.add(pending);
        return operands;
    }

    /** Source text of a rule, whitespace inside the operand preserved. */
    private static String originalText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (start == null || stop == null || stop.getStopIndex() < start.getStartIndex()) {
            return ctx.getText();
        }
        CharStream input = start.getInputStream();
        return input.getText(Interval.of(start.getStartIndex(), stop.getStopIndex())).trim();
    }
}
