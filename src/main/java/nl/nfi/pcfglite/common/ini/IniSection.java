package nl.nfi.pcfglite.common.ini;

import org.json.JSONObject;

// view on a single section, missing keys fall back to the given defaults
public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public boolean hasKey(final String key) {
        return iniConfig.hasKey(section, key);
    }

    public String getString(final String key, final String defaultValue) {
        return iniConfig.getString(section, key, defaultValue);
    }

    public boolean getBoolean(final String key, final boolean defaultValue) {
        return iniConfig.getBoolean(section, key, defaultValue);
    }

    public int getInt(final String key, final int defaultValue) {
        return iniConfig.getInt(section, key, defaultValue);
    }

    public long getLong(final String key, final long defaultValue) {
        return iniConfig.getLong(section, key, defaultValue);
    }

    public double getDouble(final String key, final double defaultValue) {
        return iniConfig.getDouble(section, key, defaultValue);
    }

    public JSONObject getJsonObject(final String key) {
        return iniConfig.getJsonObject(section, key);
    }
}
