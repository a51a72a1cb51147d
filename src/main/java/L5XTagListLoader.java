import java.io.*;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Loads the monitored tag identifiers from one column of a tabular source.
 * <ul>
 *   <li>.xlsx: first worksheet, first row holds the column names</li>
 *   <li>.csv: raw SCADA tag database export; blank rows and ':' section headers are
 *       skipped, rows are kept when their second cell equals the topic, and columns
 *       are named Col1..ColN</li>
 * </ul>
 */
public class L5XTagListLoader {

    private static final Logger logger = LoggerFactory.getLogger(L5XTagListLoader.class);

    private final String column;
    private final String topic;

    public L5XTagListLoader(String column, String topic) {
        this.column = column;
        this.topic = topic == null ? "" : topic;
    }

    public MonitoredTags load(Path path) throws L5XInputException {
        List<List<String>> table;
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx")) {
            table = readWorkbook(path);
        } else {
            table = readExport(path);
        }

        if (table.isEmpty()) {
            throw new L5XInputException("Tags file has no rows: " + path);
        }
        List<String> header = table.get(0);
        int columnIndex = header.indexOf(column);
        if (columnIndex < 0) {
            throw new L5XInputException("'" + column + "' column not found in " + path + ". Available: " + header);
        }

        List<String> tags = new ArrayList<>();
        for (List<String> row : table.subList(1, table.size())) {
            if (columnIndex >= row.size()) continue;
            String value = row.get(columnIndex);
            if (value != null && !value.trim().isEmpty()) {
                tags.add(value.trim());
            }
        }

        MonitoredTags monitored = new MonitoredTags(tags);
        logger.info("Loaded {} monitored tags ({} distinct) from {}", tags.size(), monitored.size(), path);
        return monitored;
    }

    // =====================================================================
    // CSV EXPORT
    // =====================================================================

    /** Header row of generated column names followed by the kept rows, padded to equal width. */
    List<List<String>> readExport(Path path) throws L5XInputException {
        List<List<String>> matches = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path),
                StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) continue;
                List<String> row = parseCsvLine(line);
                if (row.isEmpty() || row.get(0).startsWith(":")) continue;
                if (!topic.isEmpty()) {
                    if (row.size() < 2 || !topic.equals(row.get(1))) continue;
                }
                matches.add(row);
            }
        } catch (IOException e) {
            throw new L5XInputException("Tags file could not be read: " + path + " (" + e.getMessage() + ")", e);
        }

        if (matches.isEmpty()) {
            throw new L5XInputException(topic.isEmpty()
                ? "Tags file has no data rows: " + path
                : "No rows with topic \"" + topic + "\" in second column of " + path);
        }

        int width = 0;
        for (List<String> row : matches) width = Math.max(width, row.size());

        List<List<String>> table = new ArrayList<>();
        List<String> header = new ArrayList<>();
        for (int i = 1; i <= width; i++) header.add("Col" + i);
        table.add(header);
        for (List<String> row : matches) {
            List<String> padded = new ArrayList<>(row);
            while (padded.size() < width) padded.add("");
            table.add(padded);
        }
        logger.debug("Kept {} export rows ({} columns) from {}", matches.size(), width, path);
        return table;
    }

    static List<String> parseCsvLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        sb.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    sb.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                out.add(sb.toString());
                sb.setLength(0);
            } else {
                sb.append(c);
            }
        }
        out.add(sb.toString());
        return out;
    }

    // =====================================================================
    // XLSX WORKBOOK
    // =====================================================================

    List<List<String>> readWorkbook(Path path) throws L5XInputException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            DocumentBuilder builder = newDocumentBuilder();
            List<String> sharedStrings = readSharedStrings(zip, builder);
            String sheetEntry = firstSheetEntry(zip, builder);
            ZipEntry entry = zip.getEntry(sheetEntry);
            if (entry == null) {
                throw new L5XInputException("Workbook has no worksheet '" + sheetEntry + "': " + path);
            }
            try (InputStream in = zip.getInputStream(entry)) {
                return readSheetRows(builder.parse(in), sharedStrings);
            }
        } catch (IOException | SAXException e) {
            throw new L5XInputException("Tags workbook could not be read: " + path + " (" + e.getMessage() + ")", e);
        }
    }

    private static List<String> readSharedStrings(ZipFile zip, DocumentBuilder builder) throws IOException, SAXException {
        List<String> strings = new ArrayList<>();
        ZipEntry entry = zip.getEntry("xl/sharedStrings.xml");
        if (entry == null) return strings;
        try (InputStream in = zip.getInputStream(entry)) {
            Document document = builder.parse(in);
            NodeList items = document.getElementsByTagName("si");
            for (int i = 0; i < items.getLength(); i++) {
                strings.add(joinText((Element) items.item(i)));
            }
        }
        return strings;
    }

    /** Entry name of the first sheet listed in the workbook, resolved through its relationships. */
    private static String firstSheetEntry(ZipFile zip, DocumentBuilder builder) throws IOException, SAXException {
        String fallback = "xl/worksheets/sheet1.xml";
        ZipEntry workbook = zip.getEntry("xl/workbook.xml");
        ZipEntry rels = zip.getEntry("xl/_rels/workbook.xml.rels");
        if (workbook == null || rels == null) return fallback;

        String relationId;
        try (InputStream in = zip.getInputStream(workbook)) {
            NodeList sheets = builder.parse(in).getElementsByTagName("sheet");
            if (sheets.getLength() == 0) return fallback;
            relationId = ((Element) sheets.item(0)).getAttribute("r:id");
        }
        try (InputStream in = zip.getInputStream(rels)) {
            NodeList relations = builder.parse(in).getElementsByTagName("Relationship");
            for (int i = 0; i < relations.getLength(); i++) {
                Element relation = (Element) relations.item(i);
                if (!relationId.equals(relation.getAttribute("Id"))) continue;
                String target = relation.getAttribute("Target");
                return target.startsWith("/") ? target.substring(1) : "xl/" + target;
            }
        }
        return fallback;
    }

    private static List<List<String>> readSheetRows(Document sheet, List<String> sharedStrings) {
        List<List<String>> out = new ArrayList<>();
        NodeList rows = sheet.getElementsByTagName("row");
        for (int i = 0; i < rows.getLength(); i++) {
            Element r = (Element) rows.item(i);
            NodeList cells = r.getElementsByTagName("c");
            List<String> row = new ArrayList<>();
            int colPos = 0;
            for (int j = 0; j < cells.getLength(); j++) {
                Element c = (Element) cells.item(j);
                int idx = excelColIndex(c.getAttribute("r"), colPos);
                while (colPos < idx) {
                    row.add("");
                    colPos++;
                }
                row.add(cellValue(c, sharedStrings));
                colPos++;
            }
            out.add(row);
        }
        return out;
    }

    private static String cellValue(Element c, List<String> sharedStrings) {
        String type = c.getAttribute("t");
        if ("inlineStr".equals(type)) {
            NodeList inline = c.getElementsByTagName("is");
            return inline.getLength() > 0 ? joinText((Element) inline.item(0)) : "";
        }
        NodeList values = c.getElementsByTagName("v");
        String raw = values.getLength() > 0 ? values.item(0).getTextContent() : "";
        if ("s".equals(type)) {
            Integer position = TagIdentifier.parseIndex(raw);
            return (position != null && position >= 0 && position < sharedStrings.size())
                ? sharedStrings.get(position) : "";
        }
        return raw == null ? "" : raw;
    }

    /** Concatenated text runs, skipping phonetic runs. */
    private static String joinText(Element parent) {
        StringBuilder sb = new StringBuilder();
        NodeList runs = parent.getElementsByTagName("t");
        for (int i = 0; i < runs.getLength(); i++) {
            Element t = (Element) runs.item(i);
            if (t.getParentNode() instanceof Element && "rPh".equals(((Element) t.getParentNode()).getTagName())) {
                continue;
            }
            sb.append(t.getTextContent());
        }
        return sb.toString();
    }

    private static int excelColIndex(String cellRef, int current) {
        if (cellRef == null || cellRef.isEmpty()) return current;
        int i = 0;
        while (i < cellRef.length() && Character.isLetter(cellRef.charAt(i))) i++;
        String col = cellRef.substring(0, i).toUpperCase(Locale.ROOT);
        int idx = 0;
        for (int k = 0; k < col.length(); k++) idx = idx * 26 + (col.charAt(k) - 'A' + 1);
        return Math.max(0, idx - 1);
    }

    private static DocumentBuilder newDocumentBuilder() throws L5XInputException {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new L5XInputException("XML parser unavailable: " + e.getMessage(), e);
        }
    }
}
