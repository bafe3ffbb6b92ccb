package org.pn2ccs.translator;

import java.util.Objects;
import java.util.Random;

import org.apache.log4j.Logger;
import org.pn2ccs.analysis.Classification;
import org.pn2ccs.analysis.NetClass;
import org.pn2ccs.analysis.PetriNetClassifier;
import org.pn2ccs.ccs.CcsSpecification;
import org.pn2ccs.encoder.CcsEncoder;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.synchronizer.TwoTauSynchronizer;

/**
 * Classification → (synchronisation) → encoding pipeline.
 *
 * Group-choice nets go through the synchroniser first; other 2-τ-synchronisation
 * nets are encoded as they are; everything else is reported as not encodable.
 * The input net is never modified.
 */
public class NetTranslator {

    private static final Logger logger = Logger.getLogger(NetTranslator.class);

    private final TwoTauSynchronizer synchronizer;
    private final CcsEncoder encoder;

    public NetTranslator(Random random) {
        this(new TwoTauSynchronizer(random), new CcsEncoder());
    }

    public NetTranslator(TwoTauSynchronizer synchronizer, CcsEncoder encoder) {
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer cannot be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder cannot be null");
    }

    public TranslationResult translate(PetriNet net) {
        Classification classification = PetriNetClassifier.classify(net);
        logger.info("Net " + net + " classified as " + classification.getClasses());

        PetriNet encodable;
        boolean synchronised;
        if (classification.is(NetClass.GROUP_CHOICE)) {
            encodable = synchronizer.synchronize(net);
            synchronised = true;
            logger.info("Synchronised into " + encodable);
        } else if (classification.is(NetClass.TWO_TAU_SYNCHRONISATION)) {
            encodable = net;
            synchronised = false;
        } else {
            logger.warn("Petri net cannot be encoded: it is neither group-choice nor 2-τ-synchronisation");
            return TranslationResult.notEncodable(classification);
        }

        CcsSpecification specification = encoder.encode(encodable);
        logger.info("Encoded net into " + specification.getDefinitions().size() + " CCS definitions");
        return new TranslationResult(classification, encodable, specification, synchronised);
    }
}
