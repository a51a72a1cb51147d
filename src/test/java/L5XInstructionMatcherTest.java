import static org.junit.Assert.*;

import java.util.*;

import org.junit.Before;
import org.junit.Test;

/**
 * Rung text tables run through the grammar tier, with the fallback tier on malformed text.
 */
public class L5XInstructionMatcherTest {

    private L5XInstructionMatcher matcher;

    @Before
    public void setUp() {
        matcher = new L5XInstructionMatcher();
    }

    private static InstructionCall call(String mnemonic, String... operands) {
        return new InstructionCall(mnemonic, Arrays.asList(operands));
    }

    @Test
    public void testMatch_RecognizedFamiliesOnly() {
        Map<String, List<InstructionCall>> table = new LinkedHashMap<>();
        table.put("XIC(Start)COP(Z[5],Y[0],3);",
            Arrays.asList(call("COP", "Z[5]", "Y[0]", "3")));
        table.put("CPS(Src[0],Dst[2],10);",
            Arrays.asList(call("CPS", "Src[0]", "Dst[2]", "10")));
        table.put("[XIC(Auto) ,XIO(Manual) ]MOV(SpeedRef,Speed);",
            Arrays.asList(call("MOV", "SpeedRef", "Speed")));
        table.put("FFL(NewValue,Queue[0],QueueCtl,3,0);",
            Arrays.asList(call("FFL", "NewValue", "Queue[0]", "QueueCtl", "3", "0")));
        table.put("XIC(Trigger)MSG(ReadMsg);",
            Arrays.asList(call("MSG", "ReadMsg")));
        table.put("XIC(Level)OTE(Alarms[1].3);",
            Arrays.asList(call("OTE", "Alarms[1].3")));
        table.put("XIC(A)XIO(B)TON(Timer1,?,?);",
            Collections.emptyList());
        table.put("NOP();",
            Collections.emptyList());

        for (Map.Entry<String, List<InstructionCall>> row : table.entrySet()) {
            assertEquals(row.getKey(), row.getValue(), matcher.match(row.getKey()));
            assertFalse(row.getKey(), matcher.usedFallback());
        }
    }

    @Test
    public void testMatch_NestedBranches() {
        List<InstructionCall> calls = matcher.match("[[XIC(a),XIC(b)]OTE(c),XIO(d)OTE(e)]MOV(f,g);");

        assertEquals(Arrays.asList(call("OTE", "c"), call("OTE", "e"), call("MOV", "f", "g")), calls);
        assertFalse(matcher.usedFallback());
    }

    @Test
    public void testMatch_ExpressionOperandsKeptAsText() {
        assertEquals(Arrays.asList(call("MOV", "Src[Idx+1]", "Dst")),
            matcher.match("MOV(Src[Idx+1],Dst);"));
        assertEquals(Arrays.asList(call("MOV", "Grid[1,2]", "Cell")),
            matcher.match("MOV(Grid[1,2],Cell);"));
        assertEquals(Arrays.asList(call("MOV", "Local:1:I.Data.0", "Raw")),
            matcher.match("MOV(Local:1:I.Data.0,Raw);"));
    }

    @Test
    public void testMatch_NonLiteralCopyLengthRejected() {
        assertTrue(matcher.match("COP(S[0],D[0],Len);").isEmpty());
    }

    @Test
    public void testMatch_MalformedTextUsesFallback() {
        List<InstructionCall> calls = matcher.match("XIC(A) COP(Z[5],Y[0],3) ))) OTE(Out);");

        assertTrue(matcher.usedFallback());
        assertEquals(Arrays.asList(call("COP", "Z[5]", "Y[0]", "3"), call("OTE", "Out")), calls);
    }

    @Test
    public void testMatch_RepeatedMalformedRungsKeepNoState() {
        for (int i = 0; i < 1000; i++) {
            assertEquals(Arrays.asList(call("MOV", "A", "B")), matcher.match("MOV(A,B)))"));
            assertTrue(matcher.usedFallback());
        }

        assertEquals(Arrays.asList(call("MOV", "C", "D")), matcher.match("MOV(C,D);"));
        assertFalse(matcher.usedFallback());
    }

    @Test
    public void testMatch_FallbackFlagResetPerRung() {
        matcher.match("MOV(A,B)))");
        assertTrue(matcher.usedFallback());

        matcher.match("MOV(A,B);");
        assertFalse(matcher.usedFallback());
    }

    @Test
    public void testMatch_BlankText() {
        assertTrue(matcher.match("   ").isEmpty());
        assertTrue(matcher.match(null).isEmpty());
    }
}
