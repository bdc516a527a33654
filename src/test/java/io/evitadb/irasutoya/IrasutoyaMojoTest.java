package io.evitadb.irasutoya;

import com.sun.net.httpserver.HttpServer;
import io.evitadb.irasutoya.model.Illustration;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrasutoyaMojoTest {

    @Test
    public void testShowConfigDisplaysDefaultsAndWarnsForMissingLLM() throws MojoExecutionException {
        IrasutoyaMojo mojo = new IrasutoyaMojo();
        StringBuilder out = new StringBuilder();
        mojo.setLog(capturingLog(out));

        mojo.setAction("show-config");
        mojo.setLlmToken("sk-secret-1234");
        mojo.execute();

        String log = out.toString();
        assertTrue(log.contains("Irasutoya Plugin Configuration:"), "Should contain header");
        assertTrue(log.contains(" - inputFile: output/irasutoya.json"), "Should show default input");
        assertTrue(log.contains(" - outputFile: output/irasutoya_with_en.json"), "Should show default output");
        assertTrue(log.contains(" - limit: 2147483647"), "Should show default limit");
        assertTrue(log.contains(" - dryRun: false"), "Should show dryRun default false");
        assertTrue(log.contains(" - llmToken: ****1234"), "Should mask the token");
        assertFalse(log.contains("sk-secret"), "Should never print the token");
        assertTrue(log.contains("LLM url is not set"), "Should warn about missing LLM url");
    }

    @Test
    public void shouldRejectUnknownAction() {
        IrasutoyaMojo mojo = new IrasutoyaMojo();
        mojo.setLog(capturingLog(new StringBuilder()));
        mojo.setAction("publish");

        MojoExecutionException exception = assertThrows(MojoExecutionException.class, mojo::execute);
        assertTrue(exception.getMessage().contains("Unknown action: publish"));
    }

    @Test
    public void shouldRequireLlmUrlForTranslation() throws Exception {
        Path root = Files.createTempDirectory("mojo-translate-");
        try {
            IrasutoyaMojo mojo = new IrasutoyaMojo();
            mojo.setLog(capturingLog(new StringBuilder()));
            mojo.setAction("translate");
            mojo.setInputFile(root.resolve("irasutoya.json").toString());
            mojo.setOutputFile(root.resolve("irasutoya_with_en.json").toString());

            MojoExecutionException exception = assertThrows(MojoExecutionException.class, mojo::execute);
            assertTrue(exception.getMessage().contains("LLM URL must be specified"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    public void shouldReportInvalidConfiguration() throws Exception {
        Path root = Files.createTempDirectory("mojo-invalid-");
        try {
            IrasutoyaMojo mojo = new IrasutoyaMojo();
            mojo.setLog(capturingLog(new StringBuilder()));
            mojo.setAction("download");
            mojo.setParallelism(0);
            mojo.setInputFile(root.resolve("irasutoya.json").toString());
            mojo.setOutputFile(root.resolve("irasutoya_with_en.json").toString());

            MojoExecutionException exception = assertThrows(MojoExecutionException.class, mojo::execute);
            assertTrue(exception.getMessage().contains("parallelism"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    public void shouldReportNegativeRetriesAsInvalidConfiguration() throws Exception {
        Path root = Files.createTempDirectory("mojo-retries-");
        try {
            IrasutoyaMojo mojo = new IrasutoyaMojo();
            mojo.setLog(capturingLog(new StringBuilder()));
            mojo.setAction("download");
            mojo.setMaxRetries(-1);
            mojo.setInputFile(root.resolve("irasutoya.json").toString());
            mojo.setOutputFile(root.resolve("irasutoya_with_en.json").toString());

            MojoExecutionException exception = assertThrows(MojoExecutionException.class, mojo::execute);
            assertTrue(exception.getMessage().startsWith("Invalid configuration"));
            assertTrue(exception.getMessage().contains("maxRetries"));
            assertFalse(Files.exists(root.resolve("irasutoya_with_en.json")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    public void shouldDownloadImagesFromLocalServer() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/img/", exchange -> {
            byte[] body = "PNG".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        Path root = Files.createTempDirectory("mojo-download-");
        try {
            String base = "http://127.0.0.1:" + server.getAddress().getPort();
            Path input = root.resolve("irasutoya.json");
            Path output = root.resolve("out/irasutoya_with_en.json");
            RecordStore store = new RecordStore();
            store.save(List.of(
                Illustration.of("たいまつ", null, List.of("スポーツ用品"), base + "/entry/1.html", base + "/img/taimatsu_olympic.png", null, "2016-10-12"),
                Illustration.of("花火", null, List.of(), base + "/entry/2.html", base + "/img/hanabi.png", null, "2015-08-01")
            ), input);

            StringBuilder out = new StringBuilder();
            IrasutoyaMojo mojo = new IrasutoyaMojo();
            mojo.setLog(capturingLog(out));
            mojo.setAction("download");
            mojo.setInputFile(input.toString());
            mojo.setOutputFile(output.toString());
            mojo.setCatalogueUrl("");
            mojo.setRetryBackoffMillis(1);
            mojo.execute();

            String log = out.toString();
            assertTrue(log.contains("--- Enrichment Summary ---"), "Should print summary");
            assertTrue(log.contains("Downloaded: 2"), "Should download both images");
            assertTrue(log.contains("Failed: 0"));
            assertArrayEquals("PNG".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(root.resolve("out/images/2016/10/taimatsu_olympic.png")));
            assertTrue(Files.exists(root.resolve("out/images/2015/08/hanabi.png")));

            List<Illustration> saved = store.load(output);
            assertEquals("./images/2016/10/taimatsu_olympic.png", saved.get(0).getDirectoryPath());
            assertNull(saved.get(0).getTitleEn(), "Download action does not translate");
        } finally {
            server.stop(0);
            TestFiles.deleteRecursively(root);
        }
    }

    private static Log capturingLog(StringBuilder out) {
        return new Log() {
            @Override public boolean isDebugEnabled() { return true; }
            @Override public void debug(CharSequence content) { append(content); }
            @Override public void debug(CharSequence content, Throwable error) { append(content); }
            @Override public void debug(Throwable error) { append(String.valueOf(error)); }
            @Override public boolean isInfoEnabled() { return true; }
            @Override public void info(CharSequence content) { append(content); }
            @Override public void info(CharSequence content, Throwable error) { append(content); }
            @Override public void info(Throwable error) { append(String.valueOf(error)); }
            @Override public boolean isWarnEnabled() { return true; }
            @Override public void warn(CharSequence content) { append(content); }
            @Override public void warn(CharSequence content, Throwable error) { append(content); }
            @Override public void warn(Throwable error) { append(String.valueOf(error)); }
            @Override public boolean isErrorEnabled() { return true; }
            @Override public void error(CharSequence content) { append(content); }
            @Override public void error(CharSequence content, Throwable error) { append(content); }
            @Override public void error(Throwable error) { append(String.valueOf(error)); }

            private void append(CharSequence content) {
                synchronized (out) {
                    out.append(content).append('\n');
                }
            }
        };
    }
}
