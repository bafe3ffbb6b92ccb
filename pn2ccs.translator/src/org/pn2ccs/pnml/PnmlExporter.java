package org.pn2ccs.pnml;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.apache.log4j.Logger;
import org.pn2ccs.model.Edge;
import org.pn2ccs.model.NodeKind;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Place;
import org.pn2ccs.model.Transition;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes P/T nets as PNML 2009.
 *
 * Element ids are {@code cId1} for the net, {@code cId2} for its page, then places,
 * transitions and arcs numbered consecutively from {@code cId3}.
 */
public class PnmlExporter {

    private static final Logger logger = Logger.getLogger(PnmlExporter.class);

    public static final String NS = "http://www.pnml.org/version-2009/grammar/pnml";
    public static final String PTNET_TYPE = "http://www.pnml.org/version-2009/grammar/ptnet";

    private static final int FIRST_NODE_ID = 3;

    public String export(PetriNet net, String name) {
        Document doc = newDocument();
        Element pnml = doc.createElementNS(NS, "pnml");
        doc.appendChild(pnml);
        Element netElement = doc.createElementNS(NS, "net");
        netElement.setAttribute("id", "cId1");
        netElement.setAttribute("type", PTNET_TYPE);
        netElement.appendChild(label(doc, "name", name));
        pnml.appendChild(netElement);
        Element page = doc.createElementNS(NS, "page");
        page.setAttribute("id", "cId2");
        netElement.appendChild(page);

        int placeCount = net.getPlaces().size();
        for (Place place : net.getPlaces()) {
            Element element = doc.createElementNS(NS, "place");
            element.setAttribute("id", "cId" + (FIRST_NODE_ID + place.getId()));
            element.appendChild(label(doc, "name", place.getName()));
            element.appendChild(label(doc, "initialMarking", Integer.toString(place.getTokens())));
            page.appendChild(element);
        }
        for (Transition transition : net.getTransitions()) {
            Element element = doc.createElementNS(NS, "transition");
            element.setAttribute("id", "cId" + (FIRST_NODE_ID + placeCount + transition.getId()));
            element.appendChild(label(doc, "name", transition.getLabel()));
            page.appendChild(element);
        }
        int arcBase = FIRST_NODE_ID + placeCount + net.getTransitions().size();
        for (Edge edge : net.getEdges()) {
            Element element = doc.createElementNS(NS, "arc");
            element.setAttribute("id", "cId" + (arcBase + edge.getId()));
            element.setAttribute("source", xmlId(net, edge, true));
            element.setAttribute("target", xmlId(net, edge, false));
            if (edge.getWeight() > 1) {
                element.appendChild(label(doc, "inscription", Integer.toString(edge.getWeight())));
            }
            page.appendChild(element);
        }

        StringWriter writer = new StringWriter();
        try {
            Transformer tr = TransformerFactory.newInstance().newTransformer();
            tr.setOutputProperty(OutputKeys.INDENT, "yes");
            tr.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            tr.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            tr.transform(new DOMSource(doc), new StreamResult(writer));
        } catch (TransformerException e) {
            throw new IllegalStateException("PNML serialisation failed", e);
        }
        logger.debug("Exported " + net + " as PNML net '" + name + "'");
        return writer.toString();
    }

    public void export(PetriNet net, String name, File out) throws IOException {
        Files.writeString(out.toPath(), export(net, name), StandardCharsets.UTF_8);
        logger.info("Wrote PNML to " + out);
    }

    // === HELPER METHODS ===

    private static String xmlId(PetriNet net, Edge edge, boolean source) {
        boolean transition = (source ? net.sourceOf(edge) : net.targetOf(edge)).getKind() == NodeKind.TRANSITION;
        int slot = transition ? edge.getTransition() : edge.getPlace();
        return "cId" + (FIRST_NODE_ID + (transition ? net.getPlaces().size() : 0) + slot);
    }

    private static Element label(Document doc, String labelName, String value) {
        Element label = doc.createElementNS(NS, labelName);
        Element text = doc.createElementNS(NS, "text");
        text.setTextContent(value);
        label.appendChild(text);
        return label;
    }

    private static Document newDocument() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        try {
            return dbf.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder unavailable", e);
        }
    }
}
