package dumb.ribbon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dumb.ribbon.RibbonException.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Sizes and colors shared by every ribbon. Defaults come from the classpath
 * resource {@code ribbon.json}; the {@code ribbon.config} system property may
 * name a file whose values replace them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RibbonConfig {
    public static final String RESOURCE = "/ribbon.json";
    public static final String OVERRIDE_PROPERTY = "ribbon.config";
    private static final Logger logger = LoggerFactory.getLogger(RibbonConfig.class);
    public static final ObjectMapper json = createObjectMapper();

    private static volatile RibbonConfig defaults;

    @JsonMerge
    public RibbonSettings ribbon = new RibbonSettings();
    @JsonMerge
    public PanelSettings panel = new PanelSettings();
    /** Contextual category tints as {@code #rrggbb}, handed out round-robin. */
    public List<String> contextualColors = List.of("#c9599c", "#f2cb1d", "#ff9d00", "#0e51a7", "#e40045", "#439400");

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /** The shared configuration, loaded on first use. */
    public static RibbonConfig get() {
        var d = defaults;
        if (d == null) {
            synchronized (RibbonConfig.class) {
                d = defaults;
                if (d == null) defaults = d = load();
            }
        }
        return d;
    }

    static RibbonConfig load() {
        var cfg = new RibbonConfig();
        try (InputStream in = RibbonConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) json.readerForUpdating(cfg).readValue(in);
            else logger.debug("No {} on classpath, using built-in defaults", RESOURCE);
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable " + RESOURCE, e);
        }
        cfg.validate();

        var override = System.getProperty(OVERRIDE_PROPERTY);
        if (override != null && !override.isBlank()) {
            var path = Path.of(override);
            if (Files.isReadable(path)) {
                try {
                    cfg = load(path, cfg);
                } catch (ConfigurationException e) {
                    logger.warn("Ignoring ribbon config override {}: {}", path, e.getMessage());
                }
            } else {
                logger.warn("Ribbon config override {} not readable, using defaults", path);
            }
        }
        return cfg;
    }

    /** Reads {@code file} on top of a copy of {@code base}. */
    public static RibbonConfig load(Path file, RibbonConfig base) {
        try {
            var copy = json.readValue(json.writeValueAsBytes(base), RibbonConfig.class);
            json.readerForUpdating(copy).readValue(file.toFile());
            logger.info("Loaded ribbon config from {}", file);
            return copy.validate();
        } catch (IOException e) {
            throw new ConfigurationException("Unreadable ribbon config " + file, e);
        }
    }

    RibbonConfig validate() {
        if (panel.maxRows < 1) throw new ConfigurationException("panel.maxRows must be positive");
        if (ribbon.height < 1) throw new ConfigurationException("ribbon.height must be positive");
        if (contextualColors == null || contextualColors.isEmpty())
            throw new ConfigurationException("contextualColors must not be empty");
        contextualColors.forEach(RibbonConfig::color);
        return this;
    }

    public Color contextualColor(int index) {
        return color(contextualColors.get(Math.floorMod(index, contextualColors.size())));
    }

    static Color color(String hex) {
        try {
            return Color.decode(hex);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid color " + hex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RibbonSettings {
        public int height = 270;
        public int tabFontSize = 10;
        public int largeIconSize = 32;
        public String fileTitle = "File";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PanelSettings {
        public int maxRows = 6;
        public int titleHeight = 20;
        public int spacing = 5;
        public int smallIconSize = 16;
        public int mediumIconSize = 24;
        public int largeIconSize = 32;
    }
}
