package com.bookshelf.api;

import com.bookshelf.core.Kernel;

public interface LibraryPlugin {
    // Plugin name, also the key of its enable flag in the config (e.g. "OpdsCatalog")
    String getName();

    String getVersion();

    // Called on startup. Register routes and services here.
    void onEnable(Kernel kernel);

    // Called on shutdown or unload.
    void onDisable();
}
