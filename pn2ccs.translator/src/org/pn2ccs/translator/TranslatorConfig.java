package org.pn2ccs.translator;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.Random;

import org.apache.log4j.Logger;

/**
 * Settings of the translation pipeline.
 *
 * Defaults come from {@code pn2ccs.properties} on the classpath; a JVM system
 * property with the same key overrides the file. Command line flags override both
 * through the setters.
 */
public class TranslatorConfig {

    private static final Logger logger = Logger.getLogger(TranslatorConfig.class);

    public static final String RESOURCE = "pn2ccs.properties";

    public static final String KEY_SEED = "pn2ccs.random.seed";
    public static final String KEY_FORMAT = "pn2ccs.output.format";
    public static final String KEY_NET_NAME = "pn2ccs.net.name";

    public enum OutputFormat {
        TEXT,
        HTML
    }

    private Long seed;
    private OutputFormat outputFormat = OutputFormat.TEXT;
    private String netName = "net";

    public static TranslatorConfig load() {
        Properties properties = new Properties();
        try (InputStream in = TranslatorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug(RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            logger.warn("Could not read " + RESOURCE + ", using defaults: " + e.getMessage());
        }
        return fromProperties(properties);
    }

    static TranslatorConfig fromProperties(Properties properties) {
        TranslatorConfig config = new TranslatorConfig();

        String seed = lookup(properties, KEY_SEED);
        if (seed != null && !seed.isEmpty()) {
            try {
                config.seed = Long.parseLong(seed);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid " + KEY_SEED + "=" + seed);
            }
        }

        String format = lookup(properties, KEY_FORMAT);
        if (format != null && !format.isEmpty()) {
            try {
                config.outputFormat = OutputFormat.valueOf(format.toUpperCase());
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring unknown " + KEY_FORMAT + "=" + format);
            }
        }

        String netName = lookup(properties, KEY_NET_NAME);
        if (netName != null && !netName.isEmpty()) {
            config.netName = netName;
        }
        return config;
    }

    private static String lookup(Properties properties, String key) {
        String value = System.getProperty(key);
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value == null ? null : value.trim();
    }

    /**
     * Random source for the synchroniser: seeded when a seed is configured.
     */
    public Random newRandom() {
        return seed != null ? new Random(seed) : new Random();
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    public String getNetName() {
        return netName;
    }

    public void setNetName(String netName) {
        this.netName = netName;
    }

    @Override
    public String toString() {
        return String.format("TranslatorConfig{seed=%s, format=%s, netName=%s}", seed, outputFormat, netName);
    }
}
