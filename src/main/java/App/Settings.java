package App;

import Model.Fingerprinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public record Settings(String databaseUrl, String databaseUser, String databasePassword,
                       int similarityThreshold, String logLevel) {

    public static final String ENV_PREFIX = "DUPFINDER_";

    static final String DEFAULT_DATABASE_URL = "jdbc:h2:file:./dupfinder_db;AUTO_SERVER=TRUE";
    static final int DEFAULT_SIMILARITY_THRESHOLD = 5;
    static final String DEFAULT_LOG_LEVEL = "info";

    private static final TomlMapper TOML = new TomlMapper();

    public Settings {
        if (similarityThreshold < 0 || similarityThreshold > Fingerprinter.FINGERPRINT_BITS) {
            throw new SettingsException("similarity_threshold must be within 0.." + Fingerprinter.FINGERPRINT_BITS
                    + ", got " + similarityThreshold);
        }
    }

    public static Settings load(Path configFile) {
        return load(configFile, System.getenv());
    }

    public static Settings load(Path configFile, Map<String, String> env) {
        JsonNode root = TOML.createObjectNode();
        if (configFile != null && Files.isRegularFile(configFile)) {
            try {
                root = TOML.readTree(configFile.toFile());
            } catch (IOException e) {
                throw new SettingsException("Failed to read configuration " + configFile, e);
            }
        }

        JsonNode db = root.path("database");
        String url = pick(env, "DATABASE_URL", db.path("url").asText(DEFAULT_DATABASE_URL));
        String user = pick(env, "DATABASE_USER", db.path("user").asText("sa"));
        String password = pick(env, "DATABASE_PASSWORD", db.path("password").asText(""));
        String logLevel = pick(env, "LOG_LEVEL", root.path("log_level").asText(DEFAULT_LOG_LEVEL));

        String threshold = pick(env, "SIMILARITY_THRESHOLD",
                root.path("similarity_threshold").asText(String.valueOf(DEFAULT_SIMILARITY_THRESHOLD)));
        int similarityThreshold;
        try {
            similarityThreshold = Integer.parseInt(threshold.trim());
        } catch (NumberFormatException e) {
            throw new SettingsException("similarity_threshold is not an integer: " + threshold, e);
        }

        return new Settings(url, user, password, similarityThreshold, logLevel);
    }

    private static String pick(Map<String, String> env, String key, String fallback) {
        String v = env.get(ENV_PREFIX + key);
        return v == null || v.isBlank() ? fallback : v;
    }
}
