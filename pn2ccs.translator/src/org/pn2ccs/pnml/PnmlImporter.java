package org.pn2ccs.pnml;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.log4j.Logger;
import org.pn2ccs.exceptions.PetriNetException;
import org.pn2ccs.model.Node;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Transition;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads P/T nets from PNML.
 *
 * Only the structure is imported: places, transitions and arcs that are direct
 * children of a {@code net} or {@code page} element. Graphics are ignored.
 * - place: {@code initialMarking/text} gives the tokens (0 when absent or not a number),
 *   a {@code name/text} of the form {@code pN} is kept as display name when N does not
 *   exceed {@link #MAX_NAME_INDEX} (or the place count of larger documents)
 * - transition: {@code name/text} lower-cased and stripped to {@code [a-zA-Z0-9τ]}
 *   gives the label, τ when nothing is left
 * - arc: {@code inscription/text} gives the weight (1 when absent)
 *
 * Arcs may only reference ids declared by places or transitions of the document.
 */
public class PnmlImporter {

    private static final Logger logger = Logger.getLogger(PnmlImporter.class);

    private static final Pattern PLACE_NAME = Pattern.compile("^p([1-9][0-9]{0,8})$");

    static final int MAX_NAME_INDEX = 1 << 16;

    public PetriNet importNet(File file) throws PnmlImportException {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(file);
        } catch (SAXException | IOException e) {
            throw new PnmlImportException("Invalid XML in " + file + ": " + e.getMessage(), null, e);
        }
        PetriNet net = new PetriNet();
        importDocument(net, doc);
        logger.info("Imported " + net + " from " + file);
        return net;
    }

    public PetriNet importNet(String xml) throws PnmlImportException {
        PetriNet net = new PetriNet();
        importInto(net, xml);
        return net;
    }

    /**
     * Replaces the content of {@code net} with the parsed document. On failure the
     * net is left empty.
     */
    public void importInto(PetriNet net, String xml) throws PnmlImportException {
        net.clear();
        Document doc;
        try {
            doc = newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (SAXException | IOException e) {
            throw new PnmlImportException("Invalid XML: " + e.getMessage(), null, e);
        }
        importDocument(net, doc);
    }

    private void importDocument(PetriNet net, Document doc) throws PnmlImportException {
        try {
            Map<String, Node> nodes = new HashMap<>();

            List<Element> places = structuralChildren(doc, "place");
            for (Element element : places) {
                String id = requireId(element, "Place", nodes);
                int tokens = parseInt(childText(element, "initialMarking"), 0);
                int nameHint = placeNameHint(childText(element, "name"), Math.max(places.size(), MAX_NAME_INDEX));
                nodes.put(id, net.addPlace(nameHint, tokens));
            }

            for (Element element : structuralChildren(doc, "transition")) {
                String id = requireId(element, "Transition", nodes);
                nodes.put(id, net.addTransition(PetriNet.AUTO_NAME, toLabel(childText(element, "name"))));
            }

            for (Element element : structuralChildren(doc, "arc")) {
                String sourceId = element.getAttribute("source");
                String targetId = element.getAttribute("target");
                Node source = nodes.get(sourceId);
                Node target = nodes.get(targetId);
                if (source == null) {
                    throw new PnmlImportException("Edge with unknown source id.", sourceId);
                }
                if (target == null) {
                    throw new PnmlImportException("Edge with unknown target id.", targetId);
                }
                int weight = parseInt(childText(element, "inscription"), 1);
                try {
                    net.addEdge(source, target, weight);
                } catch (PetriNetException e) {
                    throw new PnmlImportException(e.getMessage(), element.getAttribute("id"), e);
                }
            }
        } catch (PnmlImportException e) {
            net.clear();
            throw e;
        } catch (PetriNetException e) {
            net.clear();
            throw new PnmlImportException(e.getMessage(), e.getElementName(), e);
        }
        logger.debug("PNML document yielded " + net);
    }

    // === HELPER METHODS ===

    private static DocumentBuilder newDocumentBuilder() throws PnmlImportException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        try {
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new PnmlImportException("XML parser unavailable: " + e.getMessage(), null, e);
        }
    }

    /**
     * Elements named {@code localName} whose parent is a {@code net} or {@code page}, in document order.
     */
    private static List<Element> structuralChildren(Document doc, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList candidates = doc.getElementsByTagNameNS("*", localName);
        for (int i = 0; i < candidates.getLength(); i++) {
            Element element = (Element) candidates.item(i);
            org.w3c.dom.Node parent = element.getParentNode();
            if (parent instanceof Element) {
                String parentName = localNameOf((Element) parent);
                if ("net".equals(parentName) || "page".equals(parentName)) {
                    result.add(element);
                }
            }
        }
        return result;
    }

    private static String requireId(Element element, String kind, Map<String, Node> nodes) throws PnmlImportException {
        String id = element.getAttribute("id");
        if (id.isEmpty()) {
            throw new PnmlImportException(kind + " without id.");
        }
        if (nodes.containsKey(id)) {
            throw new PnmlImportException("Duplicate id.", id);
        }
        return id;
    }

    /**
     * Text of {@code <label><text>..</text></label>} directly below {@code element}, or null.
     */
    private static String childText(Element element, String label) {
        Element labelElement = firstChild(element, label);
        if (labelElement == null) {
            return null;
        }
        Element text = firstChild(labelElement, "text");
        return text == null ? null : text.getTextContent();
    }

    private static Element firstChild(Element element, String localName) {
        for (org.w3c.dom.Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element && localName.equals(localNameOf((Element) child))) {
                return (Element) child;
            }
        }
        return null;
    }

    private static String localNameOf(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    private static int parseInt(String text, int fallback) {
        if (text == null || text.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-integer value '" + text.trim() + "', using " + fallback);
            return fallback;
        }
    }

    /** Name indices above {@code limit} fall back to automatic naming. */
    private static int placeNameHint(String name, int limit) {
        if (name == null) {
            return PetriNet.AUTO_NAME;
        }
        Matcher matcher = PLACE_NAME.matcher(name.trim());
        if (!matcher.matches()) {
            return PetriNet.AUTO_NAME;
        }
        int index = Integer.parseInt(matcher.group(1));
        if (index > limit) {
            logger.warn("Place name " + name.trim() + " exceeds name index " + limit + ", renaming");
            return PetriNet.AUTO_NAME;
        }
        return index;
    }

    static String toLabel(String name) {
        if (name == null) {
            return Transition.TAU;
        }
        String label = name.toLowerCase(Locale.ROOT).replaceAll("[^a-zA-Z0-9τ]+", "");
        return label.isEmpty() ? Transition.TAU : label;
    }
}
