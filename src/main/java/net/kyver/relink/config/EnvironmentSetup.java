package net.kyver.relink.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Copies settings from an optional {@code .env} file and the environment into system
 * properties before Spring starts. Real environment variables win over the file.
 */
public class EnvironmentSetup {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentSetup.class);

    private static final Map<String, String> PROPERTY_KEYS = Map.of(
            "SERVER_PORT", "server.port",
            "RELINK_CHUNK_SIZE", "relink.chunk-size",
            "RELINK_TEMP_DIR", "relink.temp-dir",
            "RELINK_WORK_ROOT", "relink.work-root",
            "MAX_FILE_SIZE", "spring.servlet.multipart.max-file-size",
            "MAX_REQUEST_SIZE", "spring.servlet.multipart.max-request-size"
    );

    private static volatile boolean initialized = false;
    private static volatile boolean debugEnabled = false;

    public static synchronized void loadDotEnv() {
        loadDotEnv(Paths.get(".env"));
    }

    public static synchronized void loadDotEnv(Path path) {
        if (initialized) {
            return;
        }

        if (Files.exists(path)) {
            loadFromEnvFile(path);
        }

        loadSystemConfigurations();

        initialized = true;
    }

    static void loadFromEnvFile(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path);
        } catch (IOException e) {
            logger.warn("Could not read {}, continuing with the environment only: {}", path, e.getMessage());
            return;
        }

        for (String rawLine : lines) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int eq = line.indexOf('=');
            if (eq <= 0) continue;

            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();

            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }

            if (System.getenv(key) == null && System.getProperty(key) == null) {
                System.setProperty(key, value);
            }
        }
    }

    private static void loadSystemConfigurations() {
        PROPERTY_KEYS.forEach((key, property) -> {
            String value = getConfigValue(key, null);
            if (value != null && !value.isBlank()) {
                System.setProperty(property, value.trim());
            }
        });

        String secretKey = getConfigValue("SECRET_KEY", "");
        if (!secretKey.isBlank()) {
            System.setProperty("SECRET_KEY", secretKey);
        }

        String debugMode = getConfigValue("DEBUG_MODE", "false");
        debugEnabled = "true".equalsIgnoreCase(debugMode) || "1".equals(debugMode);
        if (debugEnabled) {
            System.setProperty("logging.level.net.kyver.relink", "DEBUG");
        }
    }

    static String getConfigValue(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value != null ? value : defaultValue;
    }

    public static boolean isDebugEnabled() {
        return debugEnabled;
    }

    public static boolean isInitialized() {
        return initialized;
    }
}
