package com.bookshelf.core.plugin;

import com.bookshelf.api.LibraryPlugin;
import com.bookshelf.core.Kernel;
import com.bookshelf.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final Kernel kernel;

    // Loaded plugins and the ClassLoaders of jar plugins, for unloading
    private final Map<String, LibraryPlugin> activePlugins = new ConcurrentHashMap<>();
    private final Map<String, URLClassLoader> pluginClassLoaders = new ConcurrentHashMap<>();

    public PluginLoader(Kernel kernel) {
        this.kernel = kernel;
    }

    public void loadPlugins() {
        Configuration config = kernel.getConfigManager().getConfig();

        // 1. Plugins on the application classpath
        for (LibraryPlugin plugin : ServiceLoader.load(LibraryPlugin.class, getClass().getClassLoader())) {
            if (activePlugins.containsKey(plugin.getName())) {
                logger.warn("Plugin {} is already loaded. Skipping duplicate.", plugin.getName());
                continue;
            }
            loadPluginSafe(plugin, config);
        }

        // 2. Plugin jars dropped into the plugin directory
        File pluginDir = new File(config.pluginDir);
        if (!pluginDir.exists())
            pluginDir.mkdirs();

        File[] jars = pluginDir.listFiles((dir, name) -> name.endsWith(".jar"));
        if (jars != null && jars.length > 0) {
            Arrays.sort(jars, Comparator.comparing(File::getName));

            for (File jar : jars) {
                try {
                    loadPluginFromFile(jar, config);
                } catch (IOException | RuntimeException e) {
                    logger.error("Failed to load plugin jar: " + jar.getName(), e);
                }
            }
        }

        kernel.getConfigManager().saveConfig();
    }

    public boolean loadPluginFromFile(File jarFile, Configuration config) throws IOException {
        URL[] urls = new URL[] { jarFile.toURI().toURL() };
        URLClassLoader ucl = new URLClassLoader(urls, this.getClass().getClassLoader());

        ServiceLoader<LibraryPlugin> loader = ServiceLoader.load(LibraryPlugin.class, ucl);
        boolean anyLoaded = false;

        for (LibraryPlugin plugin : loader) {
            if (activePlugins.containsKey(plugin.getName())) {
                logger.warn("Plugin {} is already loaded. Skipping duplicate.", plugin.getName());
                continue;
            }

            if (loadPluginSafe(plugin, config)) {
                pluginClassLoaders.put(plugin.getName(), ucl);
                anyLoaded = true;
            }
        }

        if (!anyLoaded) {
            ucl.close();
        }
        return anyLoaded;
    }

    public void unloadPlugin(String name) {
        LibraryPlugin plugin = activePlugins.remove(name);
        if (plugin == null) {
            logger.warn("Cannot unload unknown plugin: {}", name);
            return;
        }

        try {
            logger.info("🔌 Disabling plugin: {}", name);
            plugin.onDisable();
        } catch (RuntimeException e) {
            logger.error("Error during onDisable for " + name, e);
        }

        URLClassLoader ucl = pluginClassLoaders.remove(name);
        if (ucl != null) {
            try {
                ucl.close();
            } catch (IOException e) {
                logger.warn("Failed to close ClassLoader for " + name, e);
            }
        }

        logger.info("🗑️ Plugin {} unloaded.", name);
    }

    private boolean loadPluginSafe(LibraryPlugin plugin, Configuration config) {
        String name = plugin.getName();

        if (!config.plugins.containsKey(name)) {
            logger.info("✨ New Plugin discovered: {}", name);
            config.plugins.put(name, true);
        }

        if (config.plugins.get(name)) {
            try {
                logger.info("Loading Plugin: {} v{}", name, plugin.getVersion());
                plugin.onEnable(kernel);
                activePlugins.put(name, plugin);
                return true;
            } catch (RuntimeException e) {
                logger.error("Failed to enable plugin: " + name, e);
            }
        } else {
            logger.info("Plugin {} is disabled in config.", name);
        }
        return false;
    }

    public void disableAll() {
        for (String name : new ArrayList<>(activePlugins.keySet())) {
            unloadPlugin(name);
        }
    }

    public Collection<LibraryPlugin> getPlugins() {
        return activePlugins.values();
    }
}
