import static org.junit.Assert.*;

import java.util.*;

import org.junit.Test;

public class L5XRungScannerTest {

    @Test
    public void testScan_PlantTransfers() throws Exception {
        MonitoredTags monitored = L5XFixtures.monitored("Y[0]", "Y[1]", "Y[2]", "Speed",
            "Queue[0]", "Queue[1]", "Queue[2]", "Queue[3]", "Hist[0]", "Remote[4]", "Remote[5]", "Alarms[1]");

        RungScanResult result = new L5XRungScanner(L5XFixtures.plantIndex(), monitored).scan();

        assertEquals(Arrays.asList("Y[0]", "Y[1]", "Y[2]", "Speed", "Queue[0]", "Queue[1]", "Queue[2]",
            "Remote[4]", "Remote[5]"), L5XFixtures.destinations(result.getRecords()));
        assertEquals(new LinkedHashSet<>(L5XFixtures.destinations(result.getRecords())), result.getResolved());
        assertFalse(result.getResolved().contains("Hist[0]"));
        assertFalse(result.getResolved().contains("Alarms[1]"));
        assertEquals(0, result.getFallbackRungs());

        MappingRecord message = result.getRecords().get(7);
        assertEquals("PeerData[10]", message.getSource());
        assertEquals("Transfers", message.getRoutineName());
        assertEquals("4", message.getRungNumber());
        assertEquals("Remote data", message.getDescription());
    }

    @Test
    public void testScan_CoilOccurrencesAppendedPerOperand() throws Exception {
        RungScanResult result = new L5XRungScanner(L5XFixtures.plantIndex(), L5XFixtures.monitored()).scan();

        List<CoilOccurrence> level = result.getCoilOccurrences().get("Alarms[1].3");
        assertEquals(2, level.size());
        assertEquals("0", level.get(0).getRungNumber());
        assertEquals("2", level.get(1).getRungNumber());
        assertEquals("Outputs", level.get(0).getRoutineName());
        assertEquals(1, result.getCoilOccurrences().get("Alarms[1].7").size());
    }

    @Test
    public void testScan_RungCommentsSkipDeclaredOperandsAndKeepFirst() throws Exception {
        String xml = "<RSLogix5000Content><Controller Name=\"C\"><Tags>"
            + "<Tag Name=\"W\" DataType=\"INT\"><Comments><Comment Operand=\"[0].1\">Declared</Comment></Comments></Tag>"
            + "</Tags><Programs><Program Name=\"P\"><Routines><Routine Name=\"R\"><RLLContent>"
            + "<Rung Number=\"0\"><Text>OTE(W[0].1);</Text>"
            + "<Operand Operand=\"W[0].1\"><Comment>Rung one</Comment></Operand>"
            + "<Operand Operand=\"W[0].2\"><Comment>First</Comment></Operand></Rung>"
            + "<Rung Number=\"1\"><Text>OTE(W[0].2);</Text>"
            + "<Operand Operand=\"W[0].2\"><Comment>Second</Comment></Operand></Rung>"
            + "</RLLContent></Routine></Routines></Program></Programs></Controller></RSLogix5000Content>";

        RungScanResult result = new L5XRungScanner(L5XFixtures.index(xml), L5XFixtures.monitored("W[0]")).scan();

        assertFalse(result.getRungComments().containsKey("W[0].1"));
        assertEquals("First", result.getRungComments().get("W[0].2"));
    }

    @Test
    public void testScan_FamiliesProcessedInOrderWithinRung() throws Exception {
        String tags = L5XFixtures.tag("D", "DINT")
            + "<Tag Name=\"Ctl\" DataType=\"CONTROL\"><Data><Structure>"
            + "<DataValueMember Name=\"LEN\" Value=\"1\"/></Structure></Data></Tag>";
        String xml = L5XFixtures.controller(tags, "FFL(F,D[0],Ctl,1,0)MOV(M,D[0])COP(C[0],D[0],1);");

        RungScanResult result = new L5XRungScanner(L5XFixtures.index(xml), L5XFixtures.monitored("D[0]")).scan();

        List<String> mnemonics = new ArrayList<>();
        for (MappingRecord record : result.getRecords()) {
            mnemonics.add(record.getMnemonic());
        }
        assertEquals(Arrays.asList("COP", "MOV", "FFL"), mnemonics);
    }

    @Test
    public void testScan_FallbackRungsCounted() throws Exception {
        String xml = L5XFixtures.controller(L5XFixtures.tag("D", "DINT"),
            "MOV(A,D[0])));", "MOV(B,D[1]);");

        RungScanResult result = new L5XRungScanner(L5XFixtures.index(xml), L5XFixtures.monitored("D[0]", "D[1]")).scan();

        assertEquals(1, result.getFallbackRungs());
        assertEquals(Arrays.asList("D[0]", "D[1]"), L5XFixtures.destinations(result.getRecords()));
    }

    @Test
    public void testScan_UnknownMessageTagIgnored() throws Exception {
        String xml = L5XFixtures.controller(L5XFixtures.tag("D", "DINT"), "MSG(NoSuchMsg);");

        RungScanResult result = new L5XRungScanner(L5XFixtures.index(xml), L5XFixtures.monitored("D[0]")).scan();

        assertTrue(result.getRecords().isEmpty());
        assertTrue(result.getResolved().isEmpty());
    }
}
