import static org.junit.Assert.*;

import java.util.*;

import org.junit.Test;

public class L5XBitOutputSweepTest {

    private static PhaseResult sweep(ProgramIndex index, MonitoredTags monitored, Set<String> resolved) {
        RungScanResult scan = new L5XRungScanner(index, monitored).scan();
        return new L5XBitOutputSweep(index, scan).sweep(monitored, resolved);
    }

    @Test
    public void testSweep_PlantAlarmBits() throws Exception {
        MonitoredTags monitored = L5XFixtures.monitored("Alarms[1]");

        PhaseResult result = sweep(L5XFixtures.plantIndex(), monitored, Collections.emptySet());

        assertEquals(Arrays.asList("Alarms[1].3", "Alarms[1].7"), L5XFixtures.destinations(result.getRecords()));
        assertEquals(Collections.singleton("Alarms[1]"), result.getResolved());

        MappingRecord level = result.getRecords().get(0);
        assertEquals("High level", level.getDescription());
        assertEquals("INT", level.getDataType());
        assertEquals("MainProgram", level.getProgramName());
        assertEquals("Outputs", level.getRoutineName());
        assertEquals("0", level.getRungNumber());
        assertEquals("OTE", level.getMnemonic());
        assertEquals(InstructionKind.BOOLEAN_OUTPUT, level.getKind());
        assertEquals("", level.getSource());

        MappingRecord door = result.getRecords().get(1);
        assertEquals("Door open", door.getDescription());
        assertEquals("1", door.getRungNumber());
    }

    @Test
    public void testSweep_BaseDescriptionWhenBitUncommented() throws Exception {
        String xml = L5XFixtures.controller(L5XFixtures.tag("W", "DINT", "Status word"), "XIC(A)OTE(W[0].31);");

        PhaseResult result = sweep(L5XFixtures.index(xml), L5XFixtures.monitored("W"), Collections.emptySet());

        assertEquals(Arrays.asList("W[0].31"), L5XFixtures.destinations(result.getRecords()));
        assertEquals("Status word", result.getRecords().get(0).getDescription());
        assertEquals(Collections.singleton("W"), result.getResolved());
    }

    @Test
    public void testSweep_BitsBeyondWidthIgnored() throws Exception {
        String xml = L5XFixtures.controller(L5XFixtures.tag("W", "INT"), "OTE(W[0].16);");

        PhaseResult result = sweep(L5XFixtures.index(xml), L5XFixtures.monitored("W[0]"), Collections.emptySet());

        assertTrue(result.getRecords().isEmpty());
        assertTrue(result.getResolved().isEmpty());
    }

    @Test
    public void testSweep_OnlyIntAndDintTypes() throws Exception {
        String tags = L5XFixtures.tag("B", "BOOL") + L5XFixtures.tag("S", "SINT") + L5XFixtures.tag("R", "REAL");
        String xml = L5XFixtures.controller(tags, "OTE(B[0].0);", "OTE(S[0].0);", "OTE(R[0].0);", "OTE(U[0].0);");

        PhaseResult result = sweep(L5XFixtures.index(xml), L5XFixtures.monitored("B[0]", "S[0]", "R[0]", "U[0]"),
            Collections.emptySet());

        assertTrue(result.getRecords().isEmpty());
    }

    @Test
    public void testSweep_AlreadyResolvedTagsSkipped() throws Exception {
        String xml = L5XFixtures.controller(L5XFixtures.tag("W", "INT"), "OTE(W[2].0);");

        PhaseResult result = sweep(L5XFixtures.index(xml), L5XFixtures.monitored("W[2]"), Collections.singleton("W[2]"));

        assertTrue(result.getRecords().isEmpty());
    }

    @Test
    public void testSweep_BitQualifiedMonitoredTagNotSwept() throws Exception {
        String xml = L5XFixtures.controller(L5XFixtures.tag("W", "INT"), "OTE(W[0].5);");

        PhaseResult result = sweep(L5XFixtures.index(xml), L5XFixtures.monitored("W[0].5"), Collections.emptySet());

        assertTrue(result.getRecords().isEmpty());
    }
}
