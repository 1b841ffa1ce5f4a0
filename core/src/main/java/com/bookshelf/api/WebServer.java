package com.bookshelf.api;

import com.sun.net.httpserver.HttpHandler;

/**
 * Interface for the WebServer to allow plugins to register routes
 * without depending on the concrete LibraryWebServer implementation.
 */
public interface WebServer {
    /**
     * Register a public or protected route.
     *
     * @param path        The context path (e.g. "/opds"). Matches the path and everything below it.
     * @param handler     The HttpHandler to handle requests
     * @param isProtected If true, requires the admin token
     */
    void registerRoute(String path, HttpHandler handler, boolean isProtected);

    /**
     * Unregister a route (useful for plugin unloading).
     *
     * @param path The context path to remove
     */
    void unregisterRoute(String path);

    /**
     * The port the server is bound to (resolved when configured as 0).
     */
    int getPort();
}
