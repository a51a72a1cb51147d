import static org.junit.Assert.*;

import java.util.*;

import org.junit.Test;

public class TagIdentifierTest {

    @Test
    public void testSplit_IndexedTag() {
        TagIdentifier id = TagIdentifier.split("Y[12]");
        assertEquals("Y", id.getBase());
        assertEquals(12, id.getIndex());
    }

    @Test
    public void testSplit_PlainTagDefaultsToIndexZero() {
        TagIdentifier id = TagIdentifier.split("Speed");
        assertEquals("Speed", id.getBase());
        assertEquals(0, id.getIndex());
        assertEquals("Speed[0]", id.element(0));
    }

    @Test
    public void testSplit_OnlyTrailingIndexIsSplit() {
        TagIdentifier id = TagIdentifier.split("Line[2].Data[5]");
        assertEquals("Line[2].Data", id.getBase());
        assertEquals(5, id.getIndex());

        // bit-qualified operands have no trailing index
        TagIdentifier bit = TagIdentifier.split("B[0].5");
        assertEquals("B[0].5", bit.getBase());
        assertEquals(0, bit.getIndex());
    }

    @Test
    public void testElementAndBit() {
        TagIdentifier id = TagIdentifier.split("Z[5]");
        assertEquals("Z[7]", id.element(2));
        assertEquals("Z[5].15", id.bit(15));
        assertEquals("Msg[3]", TagIdentifier.of("Msg", 3).element(0));
    }

    @Test
    public void testStripIndex() {
        assertEquals("QueueCtl", TagIdentifier.stripIndex("QueueCtl[2]"));
        assertEquals("QueueCtl", TagIdentifier.stripIndex("QueueCtl"));
        assertEquals("", TagIdentifier.stripIndex(null));
    }

    @Test
    public void testParseIndex_NonNumericIsUnknown() {
        assertEquals(Integer.valueOf(3), TagIdentifier.parseIndex(" 3 "));
        assertNull(TagIdentifier.parseIndex("Len"));
        assertNull(TagIdentifier.parseIndex(""));
        assertNull(TagIdentifier.parseIndex("99999999999"));
        assertNull(TagIdentifier.parseIndex(null));
    }

    @Test
    public void testNaturalOrder() {
        List<String> tags = new ArrayList<>(Arrays.asList("X[10]", "X[2].3", "X", "X[2]"));
        tags.sort(TagIdentifier.NATURAL_ORDER);
        assertEquals(Arrays.asList("X", "X[2]", "X[2].3", "X[10]"), tags);
    }

    @Test
    public void testNaturalOrder_BaseComparedFirst() {
        List<String> tags = new ArrayList<>(Arrays.asList("B[1]", "A[20]", "A[3]"));
        tags.sort(TagIdentifier.NATURAL_ORDER);
        assertEquals(Arrays.asList("A[3]", "A[20]", "B[1]"), tags);
    }
}
