package org.pn2ccs.translator;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.apache.log4j.Logger;
import org.pn2ccs.ccs.CcsSpecification;
import org.pn2ccs.exceptions.PetriNetException;
import org.pn2ccs.json.ClassificationReport;
import org.pn2ccs.model.PetriNet;
import org.pn2ccs.pnml.PnmlImportException;
import org.pn2ccs.pnml.PnmlImporter;

/**
 * Command line front end: reads a PNML net, classifies it and writes its CCS encoding.
 */
public class Pn2Ccs {

    private static final Logger logger = Logger.getLogger(Pn2Ccs.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_NOT_ENCODABLE = 2;
    public static final int EXIT_FAILURE = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        TranslatorConfig config = TranslatorConfig.load();
        String input = null;
        String ccsOutput = null;
        String reportOutput = null;

        for (int i = 0; i < args.length; i++) {
            if ("-i".equals(args[i]) && i + 1 < args.length) {
                input = args[++i];
            } else if ("-o".equals(args[i]) && i + 1 < args.length) {
                ccsOutput = args[++i];
            } else if ("-r".equals(args[i]) && i + 1 < args.length) {
                reportOutput = args[++i];
            } else if ("-n".equals(args[i]) && i + 1 < args.length) {
                config.setNetName(args[++i]);
            } else if ("-s".equals(args[i]) && i + 1 < args.length) {
                try {
                    config.setSeed(Long.parseLong(args[++i]));
                } catch (NumberFormatException e) {
                    logger.error("Seed must be an integer: " + args[i]);
                    printUsage(out);
                    return EXIT_USAGE;
                }
            } else if ("-html".equals(args[i])) {
                config.setOutputFormat(TranslatorConfig.OutputFormat.HTML);
            } else {
                logger.warn("Ignoring unknown argument: " + args[i]);
            }
        }

        if (input == null) {
            logger.error("No input file specified.");
            printUsage(out);
            return EXIT_USAGE;
        }
        logger.info("Translating " + input + " with " + config);

        try {
            PetriNet net = new PnmlImporter().importNet(new File(input));
            TranslationResult result = new NetTranslator(config.newRandom()).translate(net);

            if (reportOutput != null) {
                String json = new ClassificationReport()
                        .setNetName(config.getNetName())
                        .setNet(net)
                        .setResult(result)
                        .toJSONString();
                write(Path.of(reportOutput), json);
                logger.info("Wrote report to " + reportOutput);
            }

            if (!result.isEncoded()) {
                out.println("Petri net cannot be encoded");
                return EXIT_NOT_ENCODABLE;
            }

            String ccs = render(result.getSpecification(), config.getOutputFormat());
            if (ccsOutput != null) {
                write(Path.of(ccsOutput), ccs + "\n");
                logger.info("Wrote CCS to " + ccsOutput);
            } else {
                out.println(ccs);
            }
            return EXIT_OK;
        } catch (PnmlImportException e) {
            logger.error("Import of " + input + " failed: " + e);
            return EXIT_FAILURE;
        } catch (PetriNetException e) {
            logger.error("Translation of " + input + " failed: " + e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("Could not write output: " + e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while translating " + input + ": " + e, e);
            return EXIT_FAILURE;
        }
    }

    private static String render(CcsSpecification specification, TranslatorConfig.OutputFormat format) {
        return format == TranslatorConfig.OutputFormat.HTML ? specification.toHtml() : specification.toString();
    }

    private static void write(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -jar <jarfile> -i <net.pnml> [-o <out.ccs>] [-r <report.json>] [-s <seed>] [-n <name>] [-html]");
        out.println("  -i: Input P/T net in PNML.");
        out.println("  -o: (Optional) Output file for the CCS specification; stdout when omitted.");
        out.println("  -r: (Optional) Output file for the JSON classification report.");
        out.println("  -s: (Optional) Seed for the synchronisation pairing order.");
        out.println("  -n: (Optional) Net name used in the report.");
        out.println("  -html: (Optional) Render the CCS specification as HTML.");
    }
}
