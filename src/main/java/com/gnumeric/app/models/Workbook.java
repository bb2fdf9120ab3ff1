package com.gnumeric.app.models;

import com.gnumeric.app.exceptions.DuplicateTitleException;
import com.gnumeric.app.exceptions.SheetNotFoundException;
import com.gnumeric.app.exceptions.WorkbookFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * A Gnumeric workbook: owns the XML document and hands out {@link Sheet} views on it.
 *
 * The sheet list lives in two parallel places: gnm:SheetNameIndex (titles, type, capacity)
 * and gnm:Sheets (content). Entries are paired by position.
 */
public class Workbook {

    private static final Logger logger = LoggerFactory.getLogger(Workbook.class);

    public static final String DEFAULT_VERSION = "1.12.28";
    public static final int DEFAULT_ROWS = 65536;
    public static final int DEFAULT_COLUMNS = 256;

    private final Document document;
    // one Sheet per gnm:Sheet element, so handles compare by identity
    private final Map<Element, Sheet> sheetCache = new IdentityHashMap<>();

    /**
     * Creates an empty workbook with no sheets.
     */
    public Workbook() {
        this(newDocument());
    }

    private Workbook(Document document) {
        this.document = document;
        // handles are built up front so later lookups never write to the cache
        getSheets();
    }

    private static Document newDocument() {
        Document document = newDocumentBuilder().newDocument();
        Element root = GnumericXml.createElement(document, "Workbook");
        document.appendChild(root);

        Element version = GnumericXml.appendChild(root, "Version");
        version.setAttribute("Epoch", "1");
        version.setAttribute("Major", "12");
        version.setAttribute("Minor", "28");
        version.setAttribute("Full", DEFAULT_VERSION);

        GnumericXml.appendChild(root, "SheetNameIndex");
        GnumericXml.appendChild(root, "Sheets");
        return document;
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        // uploaded documents are untrusted: no DTDs, no entity expansion
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            // a fully built tree can be read from several threads without being modified
            factory.setFeature("http://apache.org/xml/features/dom/defer-node-expansion", false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Reads a workbook from plain or gzip-compressed XML. The stream is not closed.
     *
     * @throws WorkbookFormatException if the content is not a Gnumeric workbook
     */
    public static Workbook load(InputStream in) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(in);
        buffered.mark(2);
        int first = buffered.read();
        int second = buffered.read();
        buffered.reset();

        boolean compressed = first == 0x1f && second == 0x8b;
        InputStream source = compressed ? new GZIPInputStream(buffered) : buffered;
        logger.debug("Loading {} workbook", compressed ? "compressed" : "plain");

        Document document;
        try {
            document = newDocumentBuilder().parse(source);
        } catch (SAXException e) {
            throw new WorkbookFormatException("Malformed workbook XML: " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        if (!GnumericXml.isElement(root, "Workbook")) {
            throw new WorkbookFormatException("Not a Gnumeric workbook: root element is " + root.getNodeName());
        }
        if (GnumericXml.getChild(root, "SheetNameIndex") == null || GnumericXml.getChild(root, "Sheets") == null) {
            throw new WorkbookFormatException("Workbook has no sheet index");
        }
        Workbook workbook = new Workbook(document);
        logger.debug("Loaded workbook with sheets {}", workbook.getSheetNames());
        return workbook;
    }

    /**
     * Writes the workbook, compacting every worksheet first. The stream is not closed.
     */
    public void save(OutputStream out, boolean compress) throws IOException {
        for (Sheet sheet : getWorksheets()) {
            sheet.compactBeforeSave();
        }

        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            if (compress) {
                GZIPOutputStream gzip = new GZIPOutputStream(out);
                transformer.transform(new DOMSource(document), new StreamResult(gzip));
                gzip.finish();
            } else {
                transformer.transform(new DOMSource(document), new StreamResult(out));
            }
        } catch (TransformerException e) {
            throw new IOException("Failed to write workbook", e);
        }
        logger.debug("Saved workbook ({} sheets, compressed={})", size(), compress);
    }

    public String getVersion() {
        Element version = GnumericXml.getChild(document.getDocumentElement(), "Version");
        return version == null ? null : GnumericXml.getAttribute(version, "Full");
    }

    // ------------------------
    // Sheets
    // ------------------------

    /**
     * Appends a regular worksheet of default size.
     */
    public Sheet createSheet(String title) {
        return createSheet(title, SheetType.REGULAR, DEFAULT_ROWS, DEFAULT_COLUMNS);
    }

    /**
     * Appends a new sheet.
     *
     * @throws DuplicateTitleException if a sheet with the title already exists
     */
    public Sheet createSheet(String title, SheetType type, int rows, int columns) {
        if (getSheetNames().contains(title)) {
            throw new DuplicateTitleException("Workbook already contains a sheet titled \"" + title + "\"");
        }
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Sheet size must be positive: " + rows + "x" + columns);
        }

        Element sheetName = GnumericXml.appendChild(sheetNameIndex(), "SheetName");
        if (type == SheetType.OBJECT) {
            GnumericXml.setQualifiedAttribute(sheetName, "SheetType", "object");
        }
        GnumericXml.setQualifiedAttribute(sheetName, "Cols", Integer.toString(columns));
        GnumericXml.setQualifiedAttribute(sheetName, "Rows", Integer.toString(rows));

        Element sheet = GnumericXml.appendChild(sheetsElement(), "Sheet");
        sheet.setAttribute("Visibility", "GNM_SHEET_VISIBILITY_VISIBLE");
        GnumericXml.appendChild(sheet, "Name");
        GnumericXml.setText(GnumericXml.appendChild(sheet, "MaxCol"), "-1");
        GnumericXml.setText(GnumericXml.appendChild(sheet, "MaxRow"), "-1");

        Element region = GnumericXml.appendChild(GnumericXml.appendChild(sheet, "Styles"), "StyleRegion");
        region.setAttribute("startCol", "0");
        region.setAttribute("startRow", "0");
        region.setAttribute("endCol", Integer.toString(columns - 1));
        region.setAttribute("endRow", Integer.toString(rows - 1));
        GnumericXml.appendChild(region, "Style").setAttribute("Format", "General");

        if (type == SheetType.REGULAR) {
            GnumericXml.appendChild(sheet, "Cells");
        }

        Sheet created = sheetFor(sheetName, sheet);
        created.setTitle(title);
        logger.debug("Created {} sheet \"{}\" ({} rows, {} columns)", type, title, rows, columns);
        return created;
    }

    /**
     * All sheets in workbook order, worksheets and chartsheets alike.
     */
    public List<Sheet> getSheets() {
        List<Element> names = GnumericXml.getChildren(sheetNameIndex(), "SheetName");
        List<Element> sheets = GnumericXml.getChildren(sheetsElement(), "Sheet");
        if (names.size() != sheets.size()) {
            throw new WorkbookFormatException("Sheet index lists " + names.size() + " sheets but workbook holds "
                    + sheets.size());
        }
        List<Sheet> result = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            result.add(sheetFor(names.get(i), sheets.get(i)));
        }
        return result;
    }

    public List<Sheet> getWorksheets() {
        return getSheets().stream().filter(s -> s.getType() == SheetType.REGULAR).collect(Collectors.toList());
    }

    public List<Sheet> getChartsheets() {
        return getSheets().stream().filter(s -> s.getType() == SheetType.OBJECT).collect(Collectors.toList());
    }

    public List<String> getSheetNames() {
        return getSheets().stream().map(Sheet::getTitle).collect(Collectors.toList());
    }

    public int size() {
        return GnumericXml.getChildren(sheetNameIndex(), "SheetName").size();
    }

    /**
     * @throws SheetNotFoundException if no sheet has the title (titles are case-sensitive)
     */
    public Sheet getSheetByName(String title) {
        return getSheets().stream()
                .filter(s -> title.equals(s.getTitle()))
                .findFirst()
                .orElseThrow(() -> new SheetNotFoundException("Sheet not found: " + title));
    }

    /**
     * Negative indexes count from the end.
     *
     * @throws SheetNotFoundException if the index is out of range
     */
    public Sheet getSheetByIndex(int index) {
        List<Sheet> sheets = getSheets();
        int position = index < 0 ? sheets.size() + index : index;
        if (position < 0 || position >= sheets.size()) {
            throw new SheetNotFoundException("Sheet index " + index + " out of range for " + sheets.size() + " sheets");
        }
        return sheets.get(position);
    }

    private Sheet sheetFor(Element sheetName, Element sheet) {
        return sheetCache.computeIfAbsent(sheet, s -> new Sheet(sheetName, s, this));
    }

    private Element sheetNameIndex() {
        return GnumericXml.getChild(document.getDocumentElement(), "SheetNameIndex");
    }

    private Element sheetsElement() {
        return GnumericXml.getChild(document.getDocumentElement(), "Sheets");
    }
}
