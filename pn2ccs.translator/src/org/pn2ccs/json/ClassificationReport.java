package org.pn2ccs.json;

import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.pn2ccs.analysis.NetClass;
import org.pn2ccs.ccs.CcsSpecification;
import org.pn2ccs.ccs.PlainTextRenderer;
import org.pn2ccs.ccs.Process;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.translator.TranslationResult;

/**
 * JSON summary of a translation.
 *
 * Report Format:
 * ==============
 * {
 *   "net": "example",
 *   "places": 3, "transitions": 1, "edges": 4,
 *   "classes": ["Petri net", "Group-choice net", ...],
 *   "encodable": true,
 *   "synchronised": true,
 *   "definitions": { "X_p1": "s_t2!.0", ... },
 *   "process": "(νs_t2)(X_p1 | X_p2)"
 * }
 *
 * {@code definitions} and {@code process} are only present for encodable nets.
 */
public class ClassificationReport {

    private String netName = "net";
    private PetriNet net;
    private TranslationResult result;

    public ClassificationReport setNetName(String netName) {
        this.netName = netName;
        return this;
    }

    public ClassificationReport setNet(PetriNet net) {
        this.net = net;
        return this;
    }

    public ClassificationReport setResult(TranslationResult result) {
        this.result = result;
        return this;
    }

    @SuppressWarnings("unchecked")
    public JSONObject build() {
        if (net == null || result == null) {
            throw new IllegalStateException("Report needs both the net and the translation result");
        }
        JSONObject report = new JSONObject();
        report.put("net", netName);
        report.put("places", net.getPlaces().size());
        report.put("transitions", net.getTransitions().size());
        report.put("edges", net.getEdges().size());

        JSONArray classes = new JSONArray();
        for (NetClass netClass : result.getClassification().getClasses()) {
            classes.add(netClass.getDisplayName());
        }
        report.put("classes", classes);
        report.put("encodable", result.isEncoded());
        report.put("synchronised", result.isSynchronised());

        if (result.isEncoded()) {
            CcsSpecification specification = result.getSpecification();
            JSONObject definitions = new JSONObject();
            for (Map.Entry<String, Process> entry : specification.getDefinitions().entrySet()) {
                definitions.put(entry.getKey(), PlainTextRenderer.render(entry.getValue()));
            }
            report.put("definitions", definitions);
            report.put("process", PlainTextRenderer.render(specification.getProcess()));
        }
        return report;
    }

    public String toJSONString() {
        return build().toJSONString();
    }
}
