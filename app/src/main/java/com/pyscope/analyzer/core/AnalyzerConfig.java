package com.pyscope.analyzer.core;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Files;
import java.util.*;

/**
 * Configuration for PyScope analysis.
 * Loaded from pyscope.yaml in project root or uses sensible defaults.
 */
public class AnalyzerConfig {

    public static final String CONFIG_FILE = "pyscope.yaml";

    // Exclusion patterns, matched against paths relative to the project root
    private Set<String> exclusions = Set.of();

    // Directory names pruned while walking
    private Set<String> ignoreDirs = Set.of(
            ".git", "__pycache__", "venv", ".venv", "node_modules",
            "dist", "build", ".pytest_cache", ".mypy_cache", ".tox");

    // Findings
    private PrivateNamePolicy privateNamePolicy = PrivateNamePolicy.UNDERSCORE;
    private WildcardPolicy wildcardPolicy = WildcardPolicy.FLAG;
    private Set<String> extraBuiltins = Set.of();

    // Cycles
    private CycleMode cycleMode = CycleMode.REPRESENTATIVE;
    private int maxElementaryCycles = 1000;

    // Parser front-end
    private String pythonExecutable = "python3";
    private int parserTimeoutSeconds = 30;

    // 0 = available processors
    private int workers = 0;

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static AnalyzerConfig load(Path projectRoot) {
        AnalyzerConfig config = new AnalyzerConfig();
        Path configFile = projectRoot.resolve(CONFIG_FILE);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Object data = yaml.load(is);
                if (data instanceof Map) {
                    config.parseYaml(asMap(data));
                } else if (data != null) {
                    System.err.println("Warning: " + configFile + " is not a mapping, using defaults");
                }
                System.out.println("Loaded configuration from: " + configFile);
            } catch (IOException | YAMLException e) {
                System.err.println("Warning: Could not read config file, using defaults: " + e.getMessage());
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        // Parse exclusions
        if (data.containsKey("exclusions")) {
            List<String> excList = getStrings(data, "exclusions");
            if (!excList.isEmpty()) {
                exclusions = new HashSet<>(excList);
            }
        }

        if (data.containsKey("ignore_dirs")) {
            List<String> dirs = getStrings(data, "ignore_dirs");
            if (!dirs.isEmpty()) {
                ignoreDirs = new HashSet<>(dirs);
            }
        }

        if (data.containsKey("unused")) {
            Map<String, Object> unused = asMap(data.get("unused"));
            privateNamePolicy = getEnum(unused, "private_prefix_policy", PrivateNamePolicy.class, privateNamePolicy);
        }

        wildcardPolicy = getEnum(data, "wildcard_imports", WildcardPolicy.class, wildcardPolicy);

        if (data.containsKey("builtins")) {
            Map<String, Object> builtins = asMap(data.get("builtins"));
            extraBuiltins = new HashSet<>(getStrings(builtins, "extra"));
        }

        if (data.containsKey("cycles")) {
            Map<String, Object> cycles = asMap(data.get("cycles"));
            cycleMode = getEnum(cycles, "mode", CycleMode.class, cycleMode);
            maxElementaryCycles = getPositiveInt(cycles, "max_elementary", maxElementaryCycles);
        }

        if (data.containsKey("parser")) {
            Map<String, Object> parser = asMap(data.get("parser"));
            Object python = parser.get("python");
            if (python instanceof String && !((String) python).isBlank()) {
                pythonExecutable = (String) python;
            }
            parserTimeoutSeconds = getPositiveInt(parser, "timeout_seconds", parserTimeoutSeconds);
        }

        int configuredWorkers = getInt(data, "workers", workers);
        if (configuredWorkers >= 0) {
            workers = configuredWorkers;
        } else {
            System.err.println("Warning: workers must not be negative, using " + workers);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static List<String> getStrings(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (!(val instanceof List)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) val) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private static int getPositiveInt(Map<String, Object> map, String key, int defaultVal) {
        int val = getInt(map, key, defaultVal);
        if (val <= 0) {
            System.err.println("Warning: " + key + " must be positive, using " + defaultVal);
            return defaultVal;
        }
        return val;
    }

    private static <E extends Enum<E>> E getEnum(Map<String, Object> map, String key, Class<E> type, E defaultVal) {
        Object val = map.get(key);
        if (val == null) {
            return defaultVal;
        }
        try {
            return Enum.valueOf(type, val.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Warning: unknown " + key + " '" + val + "', using "
                    + defaultVal.name().toLowerCase(Locale.ROOT));
            return defaultVal;
        }
    }

    // === Getters ===

    public Set<String> getExclusions() {
        return exclusions;
    }

    public Set<String> getIgnoreDirs() {
        return ignoreDirs;
    }

    public PrivateNamePolicy getPrivateNamePolicy() {
        return privateNamePolicy;
    }

    public WildcardPolicy getWildcardPolicy() {
        return wildcardPolicy;
    }

    public Set<String> getExtraBuiltins() {
        return extraBuiltins;
    }

    public CycleMode getCycleMode() {
        return cycleMode;
    }

    public int getMaxElementaryCycles() {
        return maxElementaryCycles;
    }

    public String getPythonExecutable() {
        return pythonExecutable;
    }

    public int getParserTimeoutSeconds() {
        return parserTimeoutSeconds;
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Worker count with 0 mapped to the number of available processors.
     */
    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public boolean shouldExclude(Path relativePath) {
        String pathStr = relativePath.toString().replace('\\', '/');
        for (String pattern : exclusions) {
            if (matchesGlob(pathStr, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesGlob(String path, String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("**/", "<<<DOUBLESTARDIR>>>")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("?", "[^/]")
                .replace("<<<DOUBLESTARDIR>>>", "(.*/)?")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(regex);
    }

    public AnalyzerConfig withWorkers(int workers) {
        if (workers < 0) {
            throw new IllegalArgumentException("workers must not be negative: " + workers);
        }
        this.workers = workers;
        return this;
    }

    public AnalyzerConfig withCycleMode(CycleMode cycleMode) {
        this.cycleMode = Objects.requireNonNull(cycleMode);
        return this;
    }

    public AnalyzerConfig withPrivateNamePolicy(PrivateNamePolicy policy) {
        this.privateNamePolicy = Objects.requireNonNull(policy);
        return this;
    }

    public AnalyzerConfig withWildcardPolicy(WildcardPolicy policy) {
        this.wildcardPolicy = Objects.requireNonNull(policy);
        return this;
    }
}
