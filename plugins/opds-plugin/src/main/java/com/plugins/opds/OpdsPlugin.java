package com.plugins.opds;

import com.bookshelf.api.LibraryPlugin;
import com.bookshelf.api.WebServer;
import com.bookshelf.core.Kernel;
import com.bookshelf.core.config.Configuration;
import com.bookshelf.core.library.LibraryIndex;
import com.plugins.opds.internal.BookFileHandler;
import com.plugins.opds.internal.OpdsCatalogHandler;
import com.plugins.opds.internal.OpdsFeedWriter;
import com.plugins.opds.internal.OpdsRouteRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * OPDS catalog plugin: publishes the library as Atom/OPDS feeds and serves
 * book downloads and cover images.
 */
public class OpdsPlugin implements LibraryPlugin {
    private static final Logger logger = LoggerFactory.getLogger(OpdsPlugin.class);

    static final String COVER_CACHE_SECONDS = "cover_cache_seconds";
    static final String DEFAULT_COVER_CACHE_SECONDS = "86400";

    private OpdsRouteRegistrar routeRegistrar;

    @Override
    public String getName() {
        return "OpdsCatalog";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        logger.info("📖 OPDS catalog plugin starting...");

        Configuration config = kernel.getConfigManager().getConfig();
        if (config.getPluginSetting(getName(), COVER_CACHE_SECONDS, null) == null) {
            config.setPluginSetting(getName(), COVER_CACHE_SECONDS, DEFAULT_COVER_CACHE_SECONDS);
            kernel.getConfigManager().saveConfig();
        }

        WebServer webServer = kernel.getService(WebServer.class);
        if (webServer == null) {
            logger.warn("⚠️ WebServer not available, OPDS routes not registered");
            return;
        }

        LibraryIndex index = kernel.getLibraryIndex();
        OpdsFeedWriter writer = new OpdsFeedWriter(Clock.systemUTC());
        OpdsCatalogHandler catalogHandler = new OpdsCatalogHandler(index, config, writer);
        BookFileHandler fileHandler = new BookFileHandler(index.getContentRoot(), kernel.getContentGuard(),
                kernel.getMetadataExtractor(), writer, coverCacheSeconds(config));

        routeRegistrar = new OpdsRouteRegistrar(webServer, index, catalogHandler, fileHandler, writer);
        routeRegistrar.registerRoutes();

        logger.info("✅ OPDS catalog enabled (v{}) at http://localhost:{}/opds", getVersion(), webServer.getPort());
    }

    @Override
    public void onDisable() {
        if (routeRegistrar != null) {
            routeRegistrar.unregisterRoutes();
            routeRegistrar = null;
        }
        logger.info("📖 OPDS catalog plugin disabled");
    }

    private long coverCacheSeconds(Configuration config) {
        String value = config.getPluginSetting(getName(), COVER_CACHE_SECONDS, DEFAULT_COVER_CACHE_SECONDS);
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} '{}', using {}", COVER_CACHE_SECONDS, value, DEFAULT_COVER_CACHE_SECONDS);
            return Long.parseLong(DEFAULT_COVER_CACHE_SECONDS);
        }
    }
}
