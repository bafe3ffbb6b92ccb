package org.pn2ccs.pnml;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThat;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.pn2ccs.model.Edge;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.model.Place;
import org.pn2ccs.model.Transition;

public class PnmlExporterTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private PetriNet net;

    @Before
    public void setUp() {
        net = new PetriNet();
        Place p1 = net.addPlace(PetriNet.AUTO_NAME, 1);
        Place p3 = net.addPlace(3, 0);
        Transition t1 = net.addTransition(PetriNet.AUTO_NAME, "go");
        Transition t2 = net.addTransition(PetriNet.AUTO_NAME, Transition.TAU);
        net.addEdge(p1, t1, 1);
        net.addEdge(t1, p3, 2);
        net.addEdge(p3, t2, 1);
        net.addEdge(t2, p1, 1);
    }

    @Test
    public void writesPtNetWithNumberedIds() {
        String xml = new PnmlExporter().export(net, "loop");

        assertThat(xml, containsString(PnmlExporter.NS));
        assertThat(xml, containsString(PnmlExporter.PTNET_TYPE));
        assertThat(xml, containsString("id=\"cId1\""));
        assertThat(xml, containsString("id=\"cId2\""));
        assertThat(xml, containsString("<text>loop</text>"));
        assertThat(xml, containsString("<text>p3</text>"));
        assertThat(xml, containsString("source=\"cId5\""));
        assertThat(xml, containsString("<text>2</text>"));
        assertThat(xml, containsString("id=\"cId10\""));
        assertThat(xml, not(containsString("cId11")));
    }

    @Test
    public void onlyWeightedArcsCarryInscriptions() {
        String xml = new PnmlExporter().export(net, "loop");

        assertEquals(1, xml.split("<inscription", -1).length - 1);
    }

    @Test
    public void exportedNetImportsToTheSameStructure() throws Exception {
        File file = folder.newFile("loop.pnml");
        new PnmlExporter().export(net, "loop", file);

        PetriNet imported = new PnmlImporter().importNet(file);

        assertEquals(net.getPlaces().size(), imported.getPlaces().size());
        assertEquals(net.getTransitions().size(), imported.getTransitions().size());
        for (Place place : net.getPlaces()) {
            Place copy = imported.getPlace(place.getId());
            assertEquals(place.getName(), copy.getName());
            assertEquals(place.getTokens(), copy.getTokens());
        }
        for (Transition transition : net.getTransitions()) {
            assertEquals(transition.getLabel(), imported.getTransition(transition.getId()).getLabel());
        }
        assertEquals(net.getEdges().size(), imported.getEdges().size());
        for (Edge edge : net.getEdges()) {
            Edge copy = imported.getEdge(edge.getId());
            assertEquals(net.sourceOf(edge).getName(), imported.sourceOf(copy).getName());
            assertEquals(net.targetOf(edge).getName(), imported.targetOf(copy).getName());
            assertEquals(edge.getWeight(), copy.getWeight());
        }
        assertThat(new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8), containsString("τ"));
    }
}
