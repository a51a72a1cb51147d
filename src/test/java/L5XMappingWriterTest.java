import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.zip.ZipFile;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class L5XMappingWriterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static List<MappingRecord> records() {
        return Arrays.asList(
            new MappingRecord("Y[0]", "Pump, speed \"A\"", "DINT", "MainProgram", "Transfers", "0",
                InstructionKind.BLOCK_COPY, "CPS", "Z[5]"),
            MappingRecord.notFound("Flag", "Unused <flag> & spare", "BOOL"));
    }

    @Test
    public void testHeader_NamedAfterTagColumn() {
        assertEquals(Arrays.asList("ItemName", "Description", "DataType", "Program", "Routine", "Rung",
            "Instruction", "Source"), new L5XMappingWriter("ItemName").header());
    }

    @Test
    public void testWrite_Csv() throws Exception {
        Path out = folder.getRoot().toPath().resolve("mapping.csv");

        new L5XMappingWriter("Col45").write(records(), out);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("Col45,Description,DataType,Program,Routine,Rung,Instruction,Source", lines.get(0));
        assertEquals("Y[0],\"Pump, speed \"\"A\"\"\",DINT,MainProgram,Transfers,0,CPS,Z[5]", lines.get(1));
        assertEquals("Flag,Unused <flag> & spare,BOOL,,,,Not Found,", lines.get(2));
    }

    @Test
    public void testWrite_WorkbookReadableAsTagList() throws Exception {
        Path out = folder.getRoot().toPath().resolve("nested").resolve("Tag Mapping.xlsx");

        new L5XMappingWriter("Col45").write(records(), out);

        try (ZipFile zip = new ZipFile(out.toFile())) {
            assertNotNull(zip.getEntry("[Content_Types].xml"));
            assertNotNull(zip.getEntry("xl/styles.xml"));
            String workbook = new String(zip.getInputStream(zip.getEntry("xl/workbook.xml")).readAllBytes(),
                StandardCharsets.UTF_8);
            assertTrue(workbook.contains("name=\"Tag Mapping\""));
            String sheet = new String(zip.getInputStream(zip.getEntry("xl/worksheets/sheet1.xml")).readAllBytes(),
                StandardCharsets.UTF_8);
            assertTrue(sheet.contains("state=\"frozen\""));
            assertTrue(sheet.contains("<autoFilter ref=\"A1:H1\"/>"));
            assertTrue(sheet.contains("Unused &lt;flag&gt; &amp; spare"));
        }

        MonitoredTags written = new L5XTagListLoader("Col45", "").load(out);
        assertEquals(Arrays.asList("Flag", "Y[0]"), written.sorted());

        MonitoredTags sources = new L5XTagListLoader("Source", "").load(out);
        assertEquals(Collections.singletonList("Z[5]"), sources.sorted());
    }

    @Test
    public void testXmlEscape_DropsControlCharacters() {
        assertEquals("ab\tc", L5XMappingWriter.xmlEscape("a\u0001b\tc"));
    }
}
