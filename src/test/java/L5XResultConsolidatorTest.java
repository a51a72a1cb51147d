import static org.junit.Assert.*;

import java.util.*;

import org.junit.Test;

public class L5XResultConsolidatorTest {

    private static MappingRecord copy(String destination, String source, String rung) {
        return new MappingRecord(destination, "", "DINT", "P", "R", rung, InstructionKind.BLOCK_COPY, "COP", source);
    }

    @Test
    public void testConsolidate_DuplicatesRemovedFirstKept() {
        MappingRecord a = copy("D[1]", "S[1]", "0");
        PhaseResult first = new PhaseResult(Arrays.asList(a, copy("D[1]", "S[1]", "0")), Collections.singleton("D[1]"));
        PhaseResult second = new PhaseResult(Collections.singletonList(copy("D[1]", "S[1]", "0")), Collections.emptySet());

        List<MappingRecord> records = new L5XResultConsolidator().consolidate(Arrays.asList(first, second));

        assertEquals(1, records.size());
        assertSame(a, records.get(0));
    }

    @Test
    public void testConsolidate_NaturalOrderStableForTies() {
        MappingRecord x10 = copy("X[10]", "S[10]", "0");
        MappingRecord x2a = copy("X[2]", "S[2]", "5");
        MappingRecord x2b = copy("X[2]", "T[2]", "1");
        MappingRecord bit = MappingRecord.notFound("X[2].3", "", "");
        MappingRecord plain = MappingRecord.notFound("X", "", "");

        List<MappingRecord> records = new L5XResultConsolidator().consolidate(Arrays.asList(
            new PhaseResult(Arrays.asList(x10, x2a, x2b), Collections.emptySet()),
            new PhaseResult(Arrays.asList(bit, plain), Collections.emptySet())));

        assertEquals(Arrays.asList(plain, x2a, x2b, bit, x10), records);
    }

    @Test
    public void testConsolidate_Empty() {
        assertTrue(new L5XResultConsolidator().consolidate(Collections.emptyList()).isEmpty());
    }
}
