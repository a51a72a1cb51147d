import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the consolidated mapping table. The format follows the output extension:
 * .csv gives a comma separated file, anything else a single-sheet workbook.
 */
public class L5XMappingWriter {

    private static final Logger logger = LoggerFactory.getLogger(L5XMappingWriter.class);

    public static final String SHEET_NAME = "Tag Mapping";
    public static final List<String> TRAILING_COLUMNS = Collections.unmodifiableList(Arrays.asList(
        "Description", "DataType", "Program", "Routine", "Rung", "Instruction", "Source"));

    private final String tagColumn;

    public L5XMappingWriter(String tagColumn) {
        this.tagColumn = tagColumn;
    }

    public List<String> header() {
        List<String> header = new ArrayList<>();
        header.add(tagColumn);
        header.addAll(TRAILING_COLUMNS);
        return header;
    }

    public void write(List<MappingRecord> records, Path out) throws L5XInputException {
        List<List<String>> table = new ArrayList<>();
        table.add(header());
        for (MappingRecord record : records) {
            table.add(record.toRow());
        }

        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (out.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
                writeCsv(table, out);
            } else {
                writeWorkbookXlsx(table, out);
            }
        } catch (IOException e) {
            throw new L5XInputException("Output could not be written: " + out + " (" + e.getMessage() + ")", e);
        }
        logger.info("Wrote {} rows to {}", records.size(), out);
    }

    // =====================================================================
    // CSV
    // =====================================================================

    private static void writeCsv(List<List<String>> table, Path out) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            for (List<String> row : table) {
                StringBuilder sb = new StringBuilder();
                for (int c = 0; c < row.size(); c++) {
                    if (c > 0) sb.append(',');
                    sb.append(escCsv(row.get(c)));
                }
                writer.write(sb.toString());
                writer.write("\r\n");
            }
        }
    }

    static String escCsv(String s) {
        if (s == null) return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            return '"' + s.replace("\"", "\"\"") + '"';
        }
        return s;
    }

    // =====================================================================
    // XLSX
    // =====================================================================

    private static void writeWorkbookXlsx(List<List<String>> table, Path out) throws IOException {
        try (ZipOutputStream zos = new ZipOutputStream(Files.newOutputStream(out))) {
            putEntry(zos, "[Content_Types].xml", contentTypesXml());
            putEntry(zos, "_rels/.rels", relsRelsXml());
            putEntry(zos, "xl/workbook.xml", workbookXml());
            putEntry(zos, "xl/_rels/workbook.xml.rels", workbookRelsXml());
            putEntry(zos, "xl/styles.xml", stylesXml());
            putEntry(zos, "xl/worksheets/sheet1.xml", sheetXml(table));
        }
    }

    private static void putEntry(ZipOutputStream zos, String name, String xml) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        byte[] b = xml.getBytes(StandardCharsets.UTF_8);
        zos.write(b, 0, b.length);
        zos.closeEntry();
    }

    private static String contentTypesXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
            + "<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
            + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
            + "<Override PartName=\"/xl/workbook.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml\"/>"
            + "<Override PartName=\"/xl/styles.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.styles+xml\"/>"
            + "<Override PartName=\"/xl/worksheets/sheet1.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml\"/>"
            + "</Types>";
    }

    private static String relsRelsXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
            + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument\" Target=\"xl/workbook.xml\"/>"
            + "</Relationships>";
    }

    private static String workbookXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\""
            + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\">"
            + "<sheets><sheet name=\"" + xmlEscape(SHEET_NAME) + "\" sheetId=\"1\" r:id=\"rId1\"/></sheets>"
            + "</workbook>";
    }

    private static String workbookRelsXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
            + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/worksheet\" Target=\"worksheets/sheet1.xml\"/>"
            + "<Relationship Id=\"rId2\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/styles\" Target=\"styles.xml\"/>"
            + "</Relationships>";
    }

    /** All cells are inline strings so tag names and rung numbers keep their exact text. */
    private static String sheetXml(List<List<String>> data) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<worksheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\">");
        sb.append("<sheetViews><sheetView workbookViewId=\"0\">");
        sb.append("<pane ySplit=\"1\" topLeftCell=\"A2\" activePane=\"bottomLeft\" state=\"frozen\"/>");
        sb.append("</sheetView></sheetViews>");

        int cols = data.get(0).size();
        int[] maxLen = new int[cols];
        for (List<String> row : data) {
            for (int c = 0; c < row.size() && c < cols; c++) {
                String v = row.get(c);
                maxLen[c] = Math.max(maxLen[c], v == null ? 0 : v.length());
            }
        }
        sb.append("<cols>");
        for (int c = 0; c < cols; c++) {
            int w = Math.max(10, Math.min(80, (int) Math.round(maxLen[c] * 1.1) + 2));
            sb.append("<col min=\"").append(c + 1).append("\" max=\"").append(c + 1)
              .append("\" width=\"").append(w).append("\" customWidth=\"1\"/>");
        }
        sb.append("</cols>");

        sb.append("<sheetData>");
        for (int r = 0; r < data.size(); r++) {
            List<String> row = data.get(r);
            String styleAttr = r == 0 ? " s=\"1\"" : "";
            sb.append("<row r=\"").append(r + 1).append("\">");
            for (int c = 0; c < row.size(); c++) {
                sb.append("<c r=\"").append(colRef(c + 1)).append(r + 1).append("\" t=\"inlineStr\"")
                  .append(styleAttr).append("><is><t xml:space=\"preserve\">")
                  .append(xmlEscape(row.get(c))).append("</t></is></c>");
            }
            sb.append("</row>");
        }
        sb.append("</sheetData>");
        sb.append("<autoFilter ref=\"A1:").append(colRef(cols)).append("1\"/>");
        sb.append("</worksheet>");
        return sb.toString();
    }

    private static String stylesXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<styleSheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\">"
            + "<fonts count=\"2\">"
            + "<font><sz val=\"11\"/><name val=\"Calibri\"/></font>"
            + "<font><b/><sz val=\"11\"/><name val=\"Calibri\"/></font>"
            + "</fonts>"
            + "<fills count=\"2\">"
            + "<fill><patternFill patternType=\"none\"/></fill>"
            + "<fill><patternFill patternType=\"gray125\"/></fill>"
            + "</fills>"
            + "<borders count=\"1\"><border/></borders>"
            + "<cellStyleXfs count=\"1\"><xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\"/></cellStyleXfs>"
            + "<cellXfs count=\"2\">"
            + "<xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\" xfId=\"0\"/>"
            + "<xf numFmtId=\"0\" fontId=\"1\" fillId=\"0\" borderId=\"0\" xfId=\"0\" applyFont=\"1\"/>"
            + "</cellXfs>"
            + "</styleSheet>";
    }

    private static String colRef(int idx) {
        StringBuilder sb = new StringBuilder();
        while (idx > 0) {
            idx--;
            sb.insert(0, (char) ('A' + (idx % 26)));
            idx /= 26;
        }
        return sb.toString();
    }

    /** Escapes markup and drops characters XML 1.0 cannot carry. */
    static String xmlEscape(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                default:
                    if (c >= 0x20 || c == '\t' || c == '\n' || c == '\r') {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }
}
