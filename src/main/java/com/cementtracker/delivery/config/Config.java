package com.cementtracker.delivery.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration: built-in defaults, classpath {@code config.properties},
 * then a {@code config.properties} in the working directory.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("Failed to read classpath config.properties: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("Failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a config from explicit key/value pairs only. Keys not given fall back to the defaults.
     */
    public static Config fromMap(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : entry.getValue();
                config.overrideProps.setProperty(entry.getKey().trim(), value);
                config.props.setProperty(entry.getKey().trim(), value);
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "");

        defaults.put("db.url", "jdbc:sqlite:outputs/cement_delivery.db");
        defaults.put("db.user", "");
        defaults.put("db.pass", "");
        defaults.put("db.schema", "cement");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("sync.expected_sender", "scale.sscil@sevenringscement.com");
        defaults.put("sync.sender_aliases", "scale.sscil,sevenringscement");
        defaults.put("sync.subject.topic_keywords", "weigh bridge,weighbridge");
        defaults.put("sync.subject.kind_keywords", "report,repot");
        defaults.put("sync.nominal_bag_weight", "50.0");
        defaults.put("sync.default_window_days", "7");

        defaults.put("source.type", "imap");
        defaults.put("source.eml_dir", "inbox");
        defaults.put("imap.host", "");
        defaults.put("imap.port", "993");
        defaults.put("imap.ssl", "true");
        defaults.put("imap.user", "");
        defaults.put("imap.pass", "");
        defaults.put("imap.folder", "INBOX");
        defaults.put("imap.timeout_ms", "20000");

        defaults.put("export.path", "outputs/cement_delivery_data.csv");

        return Collections.unmodifiableMap(defaults);
    }
}
