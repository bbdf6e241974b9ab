package pl.marcinmilkowski.drama_network.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import pl.marcinmilkowski.drama_network.model.PlayMetadata;
import pl.marcinmilkowski.drama_network.model.PlayRecord;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reader for plays in LINA XML.
 *
 * Relevant structure (namespaces are ignored):
 * <pre>
 * &lt;lina id="..."&gt;
 *   &lt;header&gt;
 *     &lt;title&gt;..&lt;/title&gt; &lt;subtitle&gt;..&lt;/subtitle&gt; &lt;genretitle&gt;..&lt;/genretitle&gt;
 *     &lt;author&gt;..&lt;/author&gt; &lt;source&gt;..&lt;/source&gt;
 *     &lt;date type="print|written|premiere" when="1779"/&gt;
 *   &lt;/header&gt;
 *   &lt;personae&gt;
 *     &lt;character&gt;&lt;name&gt;Nathan&lt;/name&gt;&lt;alias xml:id="nathan"/&gt;&lt;/character&gt;
 *   &lt;/personae&gt;
 *   &lt;text&gt;
 *     &lt;div&gt;&lt;head&gt;Erster Auftritt&lt;/head&gt;&lt;sp who="#nathan #daja"&gt;..&lt;/sp&gt;&lt;/div&gt;
 *   &lt;/text&gt;
 * &lt;/lina&gt;
 * </pre>
 *
 * Every distinct parent of {@code sp} elements becomes one segment, holding the
 * canonical names of everyone speaking in it.
 */
public class LinaReader {

    private static final Logger logger = LoggerFactory.getLogger(LinaReader.class);

    private static final String XML_NS = "http://www.w3.org/XML/1998/namespace";
    private static final String[] SCENE_SUFFIXES = {"ne", "ne.", "tt", "tt."};

    private final DocumentBuilderFactory factory;

    public LinaReader() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    public PlayRecord read(Path file) throws IOException {
        Document document;
        try (InputStream in = Files.newInputStream(file)) {
            DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(in);
        } catch (SAXException e) {
            throw new CorpusFormatException("Malformed XML in " + file + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML parser", e);
        }
        return read(document, baseName(file));
    }

    PlayRecord read(Document document, String filename) {
        Element root = document.getDocumentElement();
        String id = root.getAttribute("id");
        if (id.isBlank()) {
            throw new CorpusFormatException("Missing 'id' attribute on root element of " + filename);
        }

        Element header = requireChild(root, "header", filename);
        Element personae = requireChild(root, "personae", filename);
        Element text = requireChild(root, "text", filename);

        Map<String, List<String>> characters = extractPersonae(personae, filename);
        Map<String, String> aliasMap = createAliasMap(characters);

        List<Element> segmentElements = extractStructure(text);
        List<Set<String>> segments = extractSpeakers(segmentElements, aliasMap, filename);
        if (segments.isEmpty()) {
            throw new CorpusFormatException("No speakers found in " + filename);
        }

        PlayMetadata metadata = extractMetadata(header, filename, segments.size(), countType(segmentElements));
        logger.debug("Read {} ({}): {} characters, {} segments", id, filename, characters.size(), segments.size());
        return new PlayRecord(id, metadata, new ArrayList<>(characters.keySet()), segments);
    }

    PlayMetadata extractMetadata(Element header, String filename, int segmentCount, String countType) {
        String title = childText(header, "title");
        if (title == null) {
            throw new CorpusFormatException("Missing title in " + filename);
        }
        return new PlayMetadata(
            title,
            orEmpty(childText(header, "subtitle")),
            orEmpty(childText(header, "genretitle")),
            orEmpty(childText(header, "author")),
            orEmpty(childText(header, "source")),
            date(header, "print"),
            date(header, "written"),
            date(header, "premiere"),
            filename,
            segmentCount,
            countType
        );
    }

    /**
     * Canonical name to aliases, in document order. A character without a name
     * is known by its first alias.
     */
    Map<String, List<String>> extractPersonae(Element personae, String filename) {
        Map<String, List<String>> characters = new LinkedHashMap<>();
        for (Element character : childElements(personae, null)) {
            List<String> aliases = new ArrayList<>();
            for (Element alias : childElements(character, "alias")) {
                String aliasId = alias.getAttributeNS(XML_NS, "id");
                if (!aliasId.isBlank()) {
                    aliases.add(aliasId);
                }
            }
            String name = childText(character, "name");
            if (name == null || name.isBlank()) {
                if (aliases.isEmpty()) {
                    throw new CorpusFormatException("Character without name or alias in " + filename);
                }
                name = aliases.get(0);
            }
            characters.computeIfAbsent(name, k -> new ArrayList<>()).addAll(aliases);
        }
        if (characters.isEmpty()) {
            throw new CorpusFormatException("Empty personae list in " + filename);
        }
        return characters;
    }

    static Map<String, String> createAliasMap(Map<String, List<String>> characters) {
        Map<String, String> aliasMap = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : characters.entrySet()) {
            for (String alias : entry.getValue()) {
                aliasMap.put(alias, entry.getKey());
            }
        }
        return aliasMap;
    }

    /**
     * Distinct parents of all speech elements, in document order.
     */
    static List<Element> extractStructure(Element text) {
        List<Element> parents = new ArrayList<>();
        Set<Node> seen = new LinkedHashSet<>();
        NodeList speeches = text.getElementsByTagNameNS("*", "sp");
        for (int i = 0; i < speeches.getLength(); i++) {
            Node parent = speeches.item(i).getParentNode();
            if (parent instanceof Element && seen.add(parent)) {
                parents.add((Element) parent);
            }
        }
        return parents;
    }

    static List<Set<String>> extractSpeakers(List<Element> segmentElements, Map<String, String> aliasMap,
                                             String filename) {
        List<Set<String>> segments = new ArrayList<>();
        for (Element segment : segmentElements) {
            Set<String> speakers = new LinkedHashSet<>();
            NodeList speeches = segment.getElementsByTagNameNS("*", "sp");
            for (int i = 0; i < speeches.getLength(); i++) {
                String who = ((Element) speeches.item(i)).getAttribute("who").replace("#", "").trim();
                if (who.isEmpty()) continue;
                for (String alias : who.split("\\s+")) {
                    String name = aliasMap.get(alias);
                    if (name == null) {
                        throw new CorpusFormatException("Unknown speaker '" + alias + "' in " + filename);
                    }
                    speakers.add(name);
                }
            }
            segments.add(speakers);
        }
        return segments;
    }

    /**
     * "scenes" when any segment heading ends like "Szene" or "Auftritt", "acts" otherwise.
     */
    static String countType(List<Element> segmentElements) {
        for (Element segment : segmentElements) {
            List<Element> children = childElements(segment, null);
            if (children.isEmpty()) continue;
            String head = directText(children.get(0));
            for (String suffix : SCENE_SUFFIXES) {
                if (head.endsWith(suffix)) {
                    return "scenes";
                }
            }
        }
        return "acts";
    }

    private Integer date(Element header, String type) {
        for (Element date : childElements(header, "date")) {
            if (type.equals(date.getAttribute("type"))) {
                String when = date.getAttribute("when").trim();
                try {
                    return Integer.parseInt(when);
                } catch (NumberFormatException e) {
                    logger.debug("Ignoring non-numeric {} date '{}'", type, when);
                    return null;
                }
            }
        }
        return null;
    }

    private static Element requireChild(Element parent, String localName, String filename) {
        List<Element> children = childElements(parent, localName);
        if (children.isEmpty()) {
            throw new CorpusFormatException("Missing <" + localName + "> in " + filename);
        }
        return children.get(0);
    }

    private static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element) {
                Element element = (Element) child;
                if (localName == null || localName.equals(localName(element))) {
                    result.add(element);
                }
            }
        }
        return result;
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    private static String childText(Element parent, String localName) {
        List<Element> children = childElements(parent, localName);
        return children.isEmpty() ? null : children.get(0).getTextContent().trim();
    }

    private static String directText(Element element) {
        StringBuilder sb = new StringBuilder();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                sb.append(child.getNodeValue());
            }
        }
        return sb.toString().trim();
    }

    private static String orEmpty(String s) {
        return s != null ? s : "";
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
