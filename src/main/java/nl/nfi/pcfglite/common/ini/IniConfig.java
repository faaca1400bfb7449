package nl.nfi.pcfglite.common.ini;

import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.nio.file.Files.readAllLines;

// minimal INI reader:
//      [SECTION]
//      KEY = value
// blank lines and lines starting with ';' or '#' are ignored
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static IniConfig empty() {
        return new IniConfig(Map.of());
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public String getString(final String section, final String key, final String defaultValue) {
        return hasKey(section, key) ? getString(section, key) : defaultValue;
    }

    public boolean getBoolean(final String section, final String key, final boolean defaultValue) {
        return hasKey(section, key) ? Boolean.parseBoolean(getString(section, key)) : defaultValue;
    }

    public int getInt(final String section, final String key, final int defaultValue) {
        return hasKey(section, key) ? parse(section, key, Integer::parseInt) : defaultValue;
    }

    public long getLong(final String section, final String key, final long defaultValue) {
        return hasKey(section, key) ? parse(section, key, Long::parseLong) : defaultValue;
    }

    public double getDouble(final String section, final String key, final double defaultValue) {
        return hasKey(section, key) ? parse(section, key, Double::parseDouble) : defaultValue;
    }

    public JSONObject getJsonObject(final String section, final String key) {
        try {
            return new JSONObject(getString(section, key));
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI value is not a JSON object: %s -> %s".formatted(section, key), e);
        }
    }

    private <T> T parse(final String section, final String key, final Parser<T> parser) {
        final String value = getString(section, key);
        try {
            return parser.parse(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI value is not a number: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }

        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        for (final String rawLine : readAllLines(path)) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).strip(), s -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI entry outside of a section: %s".formatted(line));
            }
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
            }
        }
        return new IniConfig(sections);
    }

    @FunctionalInterface
    private interface Parser<T> {
        T parse(String value);
    }
}
