package com.bookshelf.core.config;

import java.util.HashMap;
import java.util.Map;

public class Configuration {
    // --- Library ---
    public String libraryDir = "books";
    public String catalogTitle = "My Library";
    public int pageSize = 25;
    public int maxPage = 10000;
    public int recentLimit = 25;
    public long recentCacheTtlSeconds = 300;

    // --- Web server ---
    public int port = 8080;
    public int serverThreads = 10;
    // Empty = admin routes are open
    public String adminToken = "";

    // --- Plugins ---
    public String pluginDir = "plugins";

    // Key = plugin name, value = enabled
    public Map<String, Boolean> plugins = new HashMap<>();

    // Key = plugin name, value = plugin specific settings
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public Configuration() {
        plugins.put("OpdsCatalog", true);
    }

    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (!pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }
}
