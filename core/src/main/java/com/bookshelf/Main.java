package com.bookshelf;

import com.bookshelf.core.Kernel;
import com.bookshelf.core.config.ConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.info("🚀 Starting BookShelf server...");
        logger.info("📄 Log File: logs/latest.log");

        File configFile = new File(args.length > 0 ? args[0] : "config/config.json");

        try {
            Kernel kernel = new Kernel(new ConfigManager(configFile));
            Runtime.getRuntime().addShutdownHook(new Thread(kernel::stop, "kernel-shutdown"));
            kernel.start();

            logger.info("Access the root catalog at http://127.0.0.1:{}/opds", kernel.getPort());
            logger.info("Service running. Joining main thread.");
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.warn("Main thread interrupted. Exiting...");
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.exit(1);
        }
    }
}
