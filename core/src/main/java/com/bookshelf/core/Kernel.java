package com.bookshelf.core;

import com.bookshelf.api.WebServer;
import com.bookshelf.common.security.ContentGuard;
import com.bookshelf.core.config.ConfigManager;
import com.bookshelf.core.config.ConfigValidator;
import com.bookshelf.core.config.Configuration;
import com.bookshelf.core.library.LibraryIndex;
import com.bookshelf.core.library.metadata.EpubMetadataExtractor;
import com.bookshelf.core.library.metadata.MetadataExtractor;
import com.bookshelf.core.plugin.PluginLoader;
import com.bookshelf.services.web.LibraryWebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the long-lived server components. One Kernel per process, created by
 * {@code Main} and handed to plugins, which reach shared services through it.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final ConfigManager configManager;
    private final ContentGuard contentGuard;
    private final MetadataExtractor metadataExtractor;
    private final LibraryIndex libraryIndex;
    private final LibraryWebServer webServer;
    private final PluginLoader pluginLoader;

    private final AtomicBoolean running = new AtomicBoolean(false);

    // Service registry: plugins publish and look up shared instances here
    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    public Kernel(ConfigManager configManager) {
        this(configManager, Clock.systemUTC());
    }

    public Kernel(ConfigManager configManager, Clock clock) {
        this.configManager = configManager;
        Configuration config = configManager.getConfig();

        this.contentGuard = new ContentGuard();
        this.metadataExtractor = new EpubMetadataExtractor();
        this.libraryIndex = new LibraryIndex(
                Path.of(config.libraryDir),
                metadataExtractor,
                contentGuard,
                Duration.ofSeconds(config.recentCacheTtlSeconds),
                clock);
        this.webServer = new LibraryWebServer(config);
        this.pluginLoader = new PluginLoader(this);

        registerService(LibraryIndex.class, libraryIndex);
        registerService(ContentGuard.class, contentGuard);
        registerService(MetadataExtractor.class, metadataExtractor);
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Kernel booting...");

        new ConfigValidator().validateAndReport(configManager.getConfig());

        try {
            webServer.start();
        } catch (IOException e) {
            running.set(false);
            throw new UncheckedIOException("Failed to start web server", e);
        }
        registerService(WebServer.class, webServer);

        pluginLoader.loadPlugins();

        logger.info("✅ Kernel active. Library: {}", libraryIndex.getContentRoot());
    }

    public void stop() {
        if (!running.getAndSet(false))
            return;
        logger.info("Kernel shutting down...");
        pluginLoader.disableAll();
        unregisterService(WebServer.class);
        webServer.stop();
    }

    // --- SERVICE API ---

    public <T> void registerService(Class<T> clazz, T service) {
        services.put(clazz, service);
        logger.debug("Service registered: {}", clazz.getSimpleName());
    }

    public <T> void unregisterService(Class<T> clazz) {
        services.remove(clazz);
        logger.debug("Service deregistered: {}", clazz.getSimpleName());
    }

    public <T> T getService(Class<T> clazz) {
        return clazz.cast(services.get(clazz));
    }

    // --- Getters ---

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public ContentGuard getContentGuard() {
        return contentGuard;
    }

    public MetadataExtractor getMetadataExtractor() {
        return metadataExtractor;
    }

    public LibraryIndex getLibraryIndex() {
        return libraryIndex;
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }

    public int getPort() {
        return webServer.getPort();
    }
}
