package org.pn2ccs.translator;

import org.pn2ccs.analysis.Classification;
import org.pn2ccs.ccs.CcsSpecification;
import org.pn2ccs.model.PetriNet;

/**
 * Outcome of {@link NetTranslator#translate(PetriNet)}.
 */
public class TranslationResult {

    private final Classification classification;
    private final PetriNet encodedNet;
    private final CcsSpecification specification;
    private final boolean synchronised;

    TranslationResult(Classification classification, PetriNet encodedNet,
                      CcsSpecification specification, boolean synchronised) {
        this.classification = classification;
        this.encodedNet = encodedNet;
        this.specification = specification;
        this.synchronised = synchronised;
    }

    static TranslationResult notEncodable(Classification classification) {
        return new TranslationResult(classification, null, null, false);
    }

    public Classification getClassification() {
        return classification;
    }

    public boolean isEncoded() {
        return specification != null;
    }

    /**
     * The net that was handed to the encoder: the synchronised copy when
     * synchronisation ran, the input net otherwise; null when not encodable.
     */
    public PetriNet getEncodedNet() {
        return encodedNet;
    }

    public CcsSpecification getSpecification() {
        return specification;
    }

    public boolean isSynchronised() {
        return synchronised;
    }

    @Override
    public String toString() {
        return String.format("TranslationResult{classes=%s, encoded=%s, synchronised=%s}",
                classification.getClasses(), isEncoded(), synchronised);
    }
}
