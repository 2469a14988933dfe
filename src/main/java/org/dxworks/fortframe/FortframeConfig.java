package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class FortframeConfig {

    private static final String CONFIG_FILE_NAME = "fortframe-config.yml";

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String DEFAULT_DOCMARK = "!";
    private static final String DEFAULT_PREDOCMARK = ">";
    private static final String DEFAULT_SORT = "src";
    private static final List<String> DEFAULT_DISPLAY = List.of("public", "protected");
    private static final List<String> DEFAULT_EXTENSIONS = List.of("f90", "f95", "f03", "f08", "f18", "F90");
    private static final List<String> DEFAULT_FIXED_EXTENSIONS = List.of("f", "for", "F", "FOR", "ftn");
    private static final List<String> SORT_ORDERS = List.of("src", "alpha", "permission", "permission-alpha", "type", "type-alpha");

    private final int maxFileLines;
    private final String docmark;
    private final String predocmark;
    private final List<String> extraVartypes;
    private final boolean lowercase;
    private final boolean permissive;
    private final boolean force;
    private final boolean warnUndocumented;
    private final List<String> display;
    private final boolean hideUndocumented;
    private final boolean procInternals;
    private final String sort;
    private final List<String> extensions;
    private final List<String> fixedExtensions;
    private final boolean fixedLengthLimit;
    private final Map<String, String> extraModules;

    private FortframeConfig(Builder b) {
        this.maxFileLines = b.maxFileLines > 0 ? b.maxFileLines : DEFAULT_MAX_FILE_LINES;
        this.docmark = b.docmark == null || b.docmark.isEmpty() ? DEFAULT_DOCMARK : b.docmark;
        this.predocmark = b.predocmark == null || b.predocmark.isEmpty() ? DEFAULT_PREDOCMARK : b.predocmark;
        this.extraVartypes = List.copyOf(b.extraVartypes);
        this.lowercase = b.lowercase;
        this.permissive = b.permissive;
        this.force = b.force;
        this.warnUndocumented = b.warnUndocumented;
        this.display = normalizeDisplay(b.display);
        this.hideUndocumented = b.hideUndocumented;
        this.procInternals = b.procInternals;
        this.sort = normalizeSort(b.sort);
        this.extensions = List.copyOf(b.extensions);
        this.fixedExtensions = List.copyOf(b.fixedExtensions);
        this.fixedLengthLimit = b.fixedLengthLimit;
        this.extraModules = Collections.unmodifiableMap(new LinkedHashMap<>(b.extraModules));
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getDocmark() {
        return docmark;
    }

    public String getPredocmark() {
        return predocmark;
    }

    public List<String> getExtraVartypes() {
        return extraVartypes;
    }

    public boolean isLowercase() {
        return lowercase;
    }

    public boolean isPermissive() {
        return permissive;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isWarnUndocumented() {
        return warnUndocumented;
    }

    public List<String> getDisplay() {
        return display;
    }

    public boolean isHideUndocumented() {
        return hideUndocumented;
    }

    public boolean isProcInternals() {
        return procInternals;
    }

    public String getSort() {
        return sort;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public List<String> getFixedExtensions() {
        return fixedExtensions;
    }

    public boolean isFixedLengthLimit() {
        return fixedLengthLimit;
    }

    public Map<String, String> getExtraModules() {
        return extraModules;
    }

    public static FortframeConfig defaults() {
        return new Builder().build();
    }

    public static FortframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FortframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            System.err.println("Warning: Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxFileLines = maxFileLines;
        b.docmark = docmark;
        b.predocmark = predocmark;
        b.extraVartypes = new ArrayList<>(extraVartypes);
        b.lowercase = lowercase;
        b.permissive = permissive;
        b.force = force;
        b.warnUndocumented = warnUndocumented;
        b.display = new ArrayList<>(display);
        b.hideUndocumented = hideUndocumented;
        b.procInternals = procInternals;
        b.sort = sort;
        b.extensions = new ArrayList<>(extensions);
        b.fixedExtensions = new ArrayList<>(fixedExtensions);
        b.fixedLengthLimit = fixedLengthLimit;
        b.extraModules = new LinkedHashMap<>(extraModules);
        return b;
    }

    public static FortframeConfig with(boolean permissive, boolean force) {
        return new Builder().permissive(permissive).force(force).build();
    }

    private static FortframeConfig fromYaml(YamlConfig y) {
        Builder b = new Builder();
        if (y.maxFileLines != null) b.maxFileLines = y.maxFileLines;
        if (y.docmark != null) b.docmark = y.docmark;
        if (y.predocmark != null) b.predocmark = y.predocmark;
        if (y.extraVartypes != null) b.extraVartypes = new ArrayList<>(y.extraVartypes);
        if (y.lowercase != null) b.lowercase = y.lowercase;
        if (y.permissive != null) b.permissive = y.permissive;
        if (y.force != null) b.force = y.force;
        if (y.warnUndocumented != null) b.warnUndocumented = y.warnUndocumented;
        if (y.display != null) b.display = new ArrayList<>(y.display);
        if (y.hideUndocumented != null) b.hideUndocumented = y.hideUndocumented;
        if (y.procInternals != null) b.procInternals = y.procInternals;
        if (y.sort != null) b.sort = y.sort;
        if (y.extensions != null) b.extensions = new ArrayList<>(y.extensions);
        if (y.fixedExtensions != null) b.fixedExtensions = new ArrayList<>(y.fixedExtensions);
        if (y.fixedLengthLimit != null) b.fixedLengthLimit = y.fixedLengthLimit;
        if (y.extraModules != null) b.extraModules = new LinkedHashMap<>(y.extraModules);
        return b.build();
    }

    private static List<String> normalizeDisplay(List<String> raw) {
        List<String> result = new ArrayList<>();
        for (String entry : raw) {
            String value = entry.trim().toLowerCase(Locale.ROOT);
            if (!value.isEmpty() && !result.contains(value)) {
                result.add(value);
            }
        }
        return List.copyOf(result);
    }

    private static String normalizeSort(String raw) {
        String value = raw == null ? DEFAULT_SORT : raw.trim().toLowerCase(Locale.ROOT);
        if (!SORT_ORDERS.contains(value)) {
            System.err.println("Warning: Unknown sort order '" + raw + "', falling back to '" + DEFAULT_SORT + "'");
            return DEFAULT_SORT;
        }
        return value;
    }

    public static class Builder {
        private int maxFileLines = DEFAULT_MAX_FILE_LINES;
        private String docmark = DEFAULT_DOCMARK;
        private String predocmark = DEFAULT_PREDOCMARK;
        private List<String> extraVartypes = new ArrayList<>();
        private boolean lowercase;
        private boolean permissive;
        private boolean force;
        private boolean warnUndocumented;
        private List<String> display = new ArrayList<>(DEFAULT_DISPLAY);
        private boolean hideUndocumented;
        private boolean procInternals;
        private String sort = DEFAULT_SORT;
        private List<String> extensions = new ArrayList<>(DEFAULT_EXTENSIONS);
        private List<String> fixedExtensions = new ArrayList<>(DEFAULT_FIXED_EXTENSIONS);
        private boolean fixedLengthLimit = true;
        private Map<String, String> extraModules = new LinkedHashMap<>();

        public Builder permissive(boolean value) {
            this.permissive = value;
            return this;
        }

        public Builder force(boolean value) {
            this.force = value;
            return this;
        }

        public Builder lowercase(boolean value) {
            this.lowercase = value;
            return this;
        }

        public Builder warnUndocumented(boolean value) {
            this.warnUndocumented = value;
            return this;
        }

        public Builder display(List<String> value) {
            this.display = new ArrayList<>(value);
            return this;
        }

        public Builder hideUndocumented(boolean value) {
            this.hideUndocumented = value;
            return this;
        }

        public Builder procInternals(boolean value) {
            this.procInternals = value;
            return this;
        }

        public Builder sort(String value) {
            this.sort = value;
            return this;
        }

        public Builder extraVartypes(List<String> value) {
            this.extraVartypes = new ArrayList<>(value);
            return this;
        }

        public Builder extraModule(String name, String url) {
            this.extraModules.put(name, url);
            return this;
        }

        public Builder docmark(String value) {
            this.docmark = value;
            return this;
        }

        public Builder predocmark(String value) {
            this.predocmark = value;
            return this;
        }

        public Builder fixedLengthLimit(boolean value) {
            this.fixedLengthLimit = value;
            return this;
        }

        public Builder maxFileLines(int value) {
            this.maxFileLines = value;
            return this;
        }

        public FortframeConfig build() {
            return new FortframeConfig(this);
        }
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String docmark;
        public String predocmark;
        public List<String> extraVartypes;
        public Boolean lowercase;
        public Boolean permissive;
        public Boolean force;
        public Boolean warnUndocumented;
        public List<String> display;
        public Boolean hideUndocumented;
        public Boolean procInternals;
        public String sort;
        public List<String> extensions;
        public List<String> fixedExtensions;
        public Boolean fixedLengthLimit;
        public Map<String, String> extraModules;
    }
}
