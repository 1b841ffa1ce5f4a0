package com.plugins.opds;

import com.bookshelf.core.Kernel;
import com.bookshelf.core.config.ConfigManager;
import com.bookshelf.core.config.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the OPDS routes over real HTTP against a kernel on an ephemeral port.
 */
class OpdsServerTest {
    private static final Logger logger = LoggerFactory.getLogger(OpdsServerTest.class);
    private static final String TOKEN = "s3cret";

    @TempDir
    Path tempDir;

    private Path library;
    private Kernel kernel;
    private HttpClient client;

    @BeforeEach
    void startServer(TestInfo testInfo) throws IOException {
        logger.info("🧪 Starting test: {}", testInfo.getDisplayName());

        library = Files.createDirectories(tempDir.resolve("library"));
        Instant now = Instant.now();
        EpubFixtures.book(library.resolve("alpha.epub"), "Alpha Title", "Ann", "2001-02-03", null,
                now.minusSeconds(200));
        EpubFixtures.book(library.resolve("Subfolder/beta.epub"), "Beta Title", "Bob", null,
                EpubFixtures.PNG_BYTES, now.minusSeconds(50));
        Files.writeString(library.resolve("notes.txt"), "not a book");
        Files.writeString(tempDir.resolve("secret.epub"), "outside the library");

        ConfigManager configManager = new ConfigManager(tempDir.resolve("config.json").toFile(), Map.of());
        Configuration config = configManager.getConfig();
        config.libraryDir = library.toString();
        config.pluginDir = tempDir.resolve("plugins").toString();
        config.port = 0;
        config.pageSize = 1;
        config.serverThreads = 4;
        config.adminToken = TOKEN;

        kernel = new Kernel(configManager);
        kernel.start();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void stopServer(TestInfo testInfo) {
        kernel.stop();
        logger.info("✅ Finished test: {}", testInfo.getDisplayName());
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(request(path).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + kernel.getPort() + path));
    }

    @Test
    void testPluginIsLoaded() {
        assertTrue(kernel.getPluginLoader().getPlugins().stream()
                .anyMatch(p -> p.getName().equals("OpdsCatalog")));
        assertEquals("86400", kernel.getConfigManager().getConfig()
                .getPluginSetting("OpdsCatalog", "cover_cache_seconds", null));
    }

    @Test
    void testRootRedirectsToCatalog() throws Exception {
        HttpResponse<String> response = get("/");
        assertEquals(302, response.statusCode());
        assertEquals("/opds", response.headers().firstValue("Location").orElse(""));

        assertEquals(404, get("/nothing-here").statusCode());
    }

    @Test
    void testRootNavigationFeed() throws Exception {
        HttpResponse<String> response = get("/opds");

        assertEquals(200, response.statusCode());
        assertEquals("application/xml;profile=opds-catalog;kind=navigation",
                response.headers().firstValue("Content-Type").orElse(""));
        String body = response.body();
        assertTrue(body.contains("<title>All Books</title>"));
        assertTrue(body.contains("<title>Recent Books</title>"));
        assertTrue(body.contains("<title>By Year</title>"));
        assertTrue(body.contains("<title>By Author</title>"));
        assertTrue(body.contains("<title>Subfolder</title>"));
        assertTrue(body.contains("href=\"/opds/folder/Subfolder?page=1\""));
        assertTrue(body.contains("/opds/search?q={searchTerms}"));
        assertTrue(body.indexOf("By Author") < body.indexOf("<title>Subfolder</title>"));
    }

    @Test
    void testBrowserStylesheet() throws Exception {
        assertTrue(get("/opds").body().contains("<?xml-stylesheet type=\"text/xsl\" href=\"/opds_to_html.xslt\"?>"));

        HttpResponse<String> response = get("/opds_to_html.xslt");
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/xml"));

        Document stylesheet = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new ByteArrayInputStream(response.body().getBytes(StandardCharsets.UTF_8)));
        assertEquals("xsl:stylesheet", stylesheet.getDocumentElement().getTagName());

        assertEquals(404, get("/opds_to_html.xslt/extra").statusCode());
    }

    @Test
    void testAllBooksPagination() throws Exception {
        String first = get("/opds/books?page=1").body();
        assertTrue(first.contains("All Books (Page 1 of 2)"));
        assertTrue(first.contains("Alpha Title"));
        assertFalse(first.contains("Beta Title"));
        assertTrue(first.contains("rel=\"next\""));
        assertFalse(first.contains("rel=\"previous\""));
        assertTrue(first.contains("href=\"/download/alpha.epub\""));
        assertTrue(first.contains("http://opds-spec.org/acquisition/open-access"));
        assertTrue(first.contains("<dc:issued>2001</dc:issued>"));

        String second = get("/opds/books?page=2").body();
        assertTrue(second.contains("All Books (Page 2 of 2)"));
        assertTrue(second.contains("Beta Title"));
        assertTrue(second.contains("href=\"/cover/Subfolder/beta.epub\""));
        assertFalse(second.contains("rel=\"next\""));
        assertTrue(second.contains("rel=\"previous\""));

        assertTrue(get("/opds/books?page=junk").body().contains("All Books (Page 1 of 2)"));
    }

    @Test
    void testRecentFeed() throws Exception {
        HttpResponse<String> response = get("/opds/recent");
        assertEquals("application/xml;profile=opds-catalog;kind=acquisition",
                response.headers().firstValue("Content-Type").orElse(""));
        String body = response.body();
        assertTrue(body.indexOf("Beta Title") < body.indexOf("Alpha Title"));
        assertTrue(body.indexOf("Beta Title") > 0);
    }

    @Test
    void testFolderFeed() throws Exception {
        HttpResponse<String> folder = get("/opds/folder/Subfolder");
        assertEquals(200, folder.statusCode());
        assertTrue(folder.body().contains("<title>Subfolder</title>"));
        assertTrue(folder.body().contains("Beta Title"));

        HttpResponse<String> missing = get("/opds/folder/Nope");
        assertEquals(404, missing.statusCode());
        assertTrue(missing.body().contains("<code>404</code>"));

        assertEquals(404, get("/opds/folder/%2E%2E/").statusCode());
    }

    @Test
    void testFacetFeeds() throws Exception {
        String years = get("/opds/years").body();
        assertTrue(years.contains("<title>2001</title>"));
        assertTrue(years.indexOf("<title>2001</title>") < years.indexOf("<title>Unknown</title>"));

        String year = get("/opds/years/2001").body();
        assertTrue(year.contains("Alpha Title"));
        assertFalse(year.contains("Beta Title"));

        String letters = get("/opds/authors").body();
        assertTrue(letters.contains("<title>A</title>"));
        assertTrue(letters.contains("<title>B</title>"));

        String byLetter = get("/opds/authors/letter/B").body();
        assertTrue(byLetter.contains("<title>Bob</title>"));
        assertTrue(byLetter.contains("href=\"/opds/authors/name/Bob?page=1\""));

        assertTrue(get("/opds/authors/name/Ann").body().contains("Alpha Title"));
    }

    @Test
    void testSearch() throws Exception {
        String body = get("/opds/search?q=beta").body();
        assertTrue(body.contains("Beta Title"));
        assertFalse(body.contains("Alpha Title"));

        assertTrue(get("/opds/search?q=").body().contains("Alpha Title"));
        assertEquals(404, get("/opds/unknown").statusCode());
    }

    @Test
    void testDownload() throws Exception {
        HttpResponse<byte[]> response = client.send(request("/download/Subfolder/beta.epub").GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());

        assertEquals(200, response.statusCode());
        assertEquals("application/epub+zip", response.headers().firstValue("Content-Type").orElse(""));
        assertEquals("attachment; filename=\"beta.epub\"",
                response.headers().firstValue("Content-Disposition").orElse(""));
        assertArrayEquals(Files.readAllBytes(library.resolve("Subfolder/beta.epub")), response.body());
    }

    @Test
    void testDownloadGuards() throws Exception {
        assertEquals(403, get("/download/%2E%2E/secret.epub").statusCode());
        assertEquals(403, get("/download/~/secret.epub").statusCode());
        assertEquals(404, get("/download/missing.epub").statusCode());
        assertEquals(404, get("/download/notes.txt").statusCode());
        assertEquals(404, get("/download/Subfolder").statusCode());
    }

    @Test
    void testCover() throws Exception {
        HttpResponse<byte[]> response = client.send(request("/cover/Subfolder/beta.epub").GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());

        assertEquals(200, response.statusCode());
        assertEquals("image/png", response.headers().firstValue("Content-Type").orElse(""));
        assertEquals("public, max-age=86400", response.headers().firstValue("Cache-Control").orElse(""));
        assertArrayEquals(EpubFixtures.PNG_BYTES, response.body());

        assertEquals(404, get("/cover/alpha.epub").statusCode());
        assertEquals(403, get("/cover/%2E%2E/secret.epub").statusCode());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");
        assertEquals(200, response.statusCode());
        assertEquals("{\"status\":\"ok\"}", response.body());
    }

    @Test
    void testAdminRefresh() throws Exception {
        assertTrue(get("/opds/books").body().contains("Page 1 of 2"));
        EpubFixtures.book(library.resolve("gamma.epub"), "Gamma Title", "Gus", "2010", null, Instant.now());
        assertTrue(get("/opds/books").body().contains("Page 1 of 2"), "Served from cache until refreshed");

        HttpResponse<String> denied = client.send(request("/api/admin/refresh")
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, denied.statusCode());

        HttpResponse<String> wrongMethod = client.send(request("/api/admin/refresh")
                .header("Authorization", "Bearer " + TOKEN).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(405, wrongMethod.statusCode());

        HttpResponse<String> refreshed = client.send(request("/api/admin/refresh")
                .header("X-Auth-Token", TOKEN)
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, refreshed.statusCode());
        assertTrue(refreshed.body().contains("\"status\":\"ok\""));

        assertTrue(get("/opds/books").body().contains("Page 1 of 3"));
    }
}
