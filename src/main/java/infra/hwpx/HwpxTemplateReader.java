package infra.hwpx;

import domain.grid.CellRoleClassifier;
import domain.grid.Grid;
import domain.grid.GridCell;
import domain.grid.GridReadException;
import domain.grid.TemplateDocument;
import domain.grid.TemplateGridReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * HWPX(zip) 양식 → 표 목록.
 *
 * <p>{@code Contents/section0.xml} 만 본다. 요소 이름은 prefix({@code hp:}) 를 떼고 local name 으로 비교한다.
 * 표 셀 좌표는 {@code cellAddr} 를 그대로 쓰므로 origin=0.</p>
 */
public final class HwpxTemplateReader implements TemplateGridReader {

    private static final Logger log = LoggerFactory.getLogger(HwpxTemplateReader.class);

    static final String SECTION_ENTRY = "Contents/section0.xml";

    private static final Pattern SECTION_TITLE = Pattern.compile("^\\d+\\.\\s*.+", Pattern.DOTALL);

    private final CellRoleClassifier classifier;

    public HwpxTemplateReader() {
        this(new HwpxCellRoleClassifier());
    }

    public HwpxTemplateReader(CellRoleClassifier classifier) {
        this.classifier = classifier == null ? new HwpxCellRoleClassifier() : classifier;
    }

    @Override
    public TemplateDocument read(byte[] bytes, String fileName) {
        byte[] xml = sectionXml(bytes, fileName);
        Document doc = parse(xml, fileName);

        List<Grid> tables = new ArrayList<>();
        Set<String> titles = new LinkedHashSet<>();
        walk(doc.getDocumentElement(), tables, titles);

        log.info("[TEMPLATE] {} -> tables={}, sections={}", fileName, tables.size(), titles.size());
        return new TemplateDocument(fileName, tables, new ArrayList<>(titles));
    }

    private static byte[] sectionXml(byte[] bytes, String fileName) {
        if (bytes == null || bytes.length == 0) {
            throw new GridReadException("Template is empty: " + fileName);
        }
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry e;
            while ((e = zis.getNextEntry()) != null) {
                if (SECTION_ENTRY.equals(e.getName())) {
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    zis.transferTo(out);
                    return out.toByteArray();
                }
            }
        } catch (IOException e) {
            throw new GridReadException("Failed to open template: " + fileName, e);
        }
        throw new GridReadException(SECTION_ENTRY + " not found in template: " + fileName);
    }

    private static Document parse(byte[] xml, String fileName) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();

            // 외부 DTD / 엔티티 차단
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);

            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);
            factory.setValidating(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));

            return builder.parse(new ByteArrayInputStream(xml));
        } catch (Exception e) {
            throw new GridReadException("Failed to parse: " + fileName, e);
        }
    }

    /** 문서 순서대로 표와 섹션 제목을 모은다. 표 안의 표도 별도 표로 센다. */
    private void walk(Element el, List<Grid> tables, Set<String> titles) {
        String name = localName(el);
        if ("tbl".equals(name)) {
            tables.add(toGrid(el));
        } else if ("t".equals(name)) {
            String t = el.getTextContent() == null ? "" : el.getTextContent().trim();
            if (SECTION_TITLE.matcher(t).matches()) titles.add(t);
        }

        NodeList kids = el.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node n = kids.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) walk((Element) n, tables, titles);
        }
    }

    private Grid toGrid(Element tbl) {
        int declaredRows = intAttr(tbl, "rowCnt", 0);
        int declaredCols = intAttr(tbl, "colCnt", 0);

        List<GridCell> cells = new ArrayList<>();
        int rowIndex = 0;
        for (Element tr : children(tbl, "tr")) {
            int colOffset = 0;
            for (Element tc : children(tr, "tc")) {
                Element addr = firstChild(tc, "cellAddr");
                Element span = firstChild(tc, "cellSpan");

                int col = addr == null ? colOffset : intAttr(addr, "colAddr", colOffset);
                int row = addr == null ? rowIndex : intAttr(addr, "rowAddr", rowIndex);
                int colSpan = Math.max(1, span == null ? 1 : intAttr(span, "colSpan", 1));
                int rowSpan = Math.max(1, span == null ? 1 : intAttr(span, "rowSpan", 1));

                String text = cellText(tc);
                int fill = intAttr(tc, "borderFillIDRef", 0);
                boolean header = classifier.isHeader(text, fill);

                log.debug("[TEMPLATE] cell [{},{}] text='{}' fill={} header={}", row, col, text, fill, header);
                cells.add(new GridCell(row, col, text, header, rowSpan, colSpan));
                colOffset = col + colSpan;
            }
            rowIndex++;
        }

        int rows = declaredRows;
        int cols = declaredCols;
        for (GridCell c : cells) {
            rows = Math.max(rows, c.getEndRow() + 1);
            cols = Math.max(cols, c.getEndCol() + 1);
        }

        try {
            return Grid.builder().origin(0).size(rows, cols).addAll(cells).build();
        } catch (IllegalArgumentException e) {
            throw new GridReadException("Malformed table: " + e.getMessage(), e);
        }
    }

    /** tc 안의 t 텍스트를 이어 붙인다. 중첩 표의 텍스트는 제외. */
    private static String cellText(Element tc) {
        StringBuilder sb = new StringBuilder();
        appendText(tc, sb);
        return sb.toString().trim();
    }

    private static void appendText(Element el, StringBuilder sb) {
        NodeList kids = el.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node n = kids.item(i);
            if (n.getNodeType() != Node.ELEMENT_NODE) continue;
            Element child = (Element) n;
            String name = localName(child);
            if ("tbl".equals(name)) continue;
            if ("t".equals(name)) {
                sb.append(child.getTextContent() == null ? "" : child.getTextContent());
            } else {
                appendText(child, sb);
            }
        }
    }

    private static List<Element> children(Element parent, String local) {
        List<Element> out = new ArrayList<>();
        NodeList kids = parent.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node n = kids.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && local.equals(localName((Element) n))) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static Element firstChild(Element parent, String local) {
        List<Element> found = children(parent, local);
        return found.isEmpty() ? null : found.get(0);
    }

    private static String localName(Element el) {
        String tag = el.getTagName();
        int idx = tag.indexOf(':');
        return idx < 0 ? tag : tag.substring(idx + 1);
    }

    private static int intAttr(Element el, String attr, int def) {
        String v = el.getAttribute(attr);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
