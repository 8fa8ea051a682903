package nl.bytesoflife.sequent.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import nl.bytesoflife.sequent.BuiltinExamples;
import nl.bytesoflife.sequent.model.Sequent;
import nl.bytesoflife.sequent.parser.ParseOutcome;
import nl.bytesoflife.sequent.parser.SequentParser;
import nl.bytesoflife.sequent.prover.Derivation;
import nl.bytesoflife.sequent.prover.SequentProver;
import nl.bytesoflife.sequent.render.DerivationHtmlRenderer;
import nl.bytesoflife.sequent.render.DerivationTextRenderer;
import nl.bytesoflife.sequent.render.SyntaxErrorHighlighter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Simple HTTP server for the sequent prover web page.
 */
public class SequentProverServer {

    private static final Logger log = LoggerFactory.getLogger(SequentProverServer.class);

    private final int port;
    private HttpServer server;

    public SequentProverServer(int port) {
        this.port = port;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/", new StaticHandler());
        server.createContext("/api/examples", new ExamplesHandler());
        server.createContext("/api/prove", new ProveHandler());
        server.setExecutor(null);
        server.start();
        log.info("Sequent Prover Server started at http://localhost:{}", getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
    }

    /**
     * The bound port; differs from the configured one when started on port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Serves the static HTML page.
     */
    static class StaticHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (path.equals("/") || path.equals("/index.html")) {
                sendResponse(exchange, 200, "text/html", getIndexHtml());
            } else {
                sendResponse(exchange, 404, "text/plain", "Not Found");
            }
        }
    }

    /**
     * Lists the bundled sample sequents.
     */
    static class ExamplesHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }
            try {
                List<String> examples = BuiltinExamples.all();
                StringBuilder json = new StringBuilder("{\"examples\":[");
                for (int i = 0; i < examples.size(); i++) {
                    if (i > 0) json.append(",");
                    json.append(escapeJson(examples.get(i)));
                }
                json.append("]}");
                sendResponse(exchange, 200, "application/json", json.toString());
            } catch (Exception e) {
                log.error("Error loading examples", e);
                sendResponse(exchange, 500, "application/json",
                        "{\"error\":" + escapeJson(e.getMessage()) + "}");
            }
        }
    }

    /**
     * Parses the sequent in the request body and returns its derivation.
     */
    static class ProveHandler implements HttpHandler {
        private static final Logger log = LoggerFactory.getLogger(ProveHandler.class);

        private final SequentParser parser = new SequentParser();
        private final SequentProver prover = new SequentProver();
        private final DerivationHtmlRenderer htmlRenderer = new DerivationHtmlRenderer();
        private final DerivationTextRenderer textRenderer = new DerivationTextRenderer();
        private final SyntaxErrorHighlighter highlighter = new SyntaxErrorHighlighter();

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }

            String input = stripLineTerminator(
                    new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            log.info("Received prove request: {}", input);
            Response response = prove(input);
            sendResponse(exchange, response.status(), "application/json", response.body());
        }

        Response prove(String input) {
            try {
                long startTime = System.currentTimeMillis();
                ParseOutcome outcome = parser.tryParse(input);
                if (outcome instanceof ParseOutcome.Failed failed) {
                    log.debug("Syntax error at {}: {}", failed.position(), failed.message());
                    String json = "{\"error\":" + escapeJson(failed.message())
                            + ",\"position\":" + failed.position()
                            + ",\"highlight\":" + escapeJson(highlighter.highlight(input, failed.position()))
                            + "}";
                    return new Response(400, json);
                }
                Sequent sequent = ((ParseOutcome.Parsed) outcome).sequent();
                Derivation.Step proof = prover.prove(sequent);

                StringBuilder json = new StringBuilder();
                json.append("{\"proved\":").append(proof.isProved());
                json.append(",\"sequent\":").append(escapeJson(sequent.toString()));
                json.append(",\"nodes\":").append(proof.size());
                json.append(",\"depth\":").append(proof.depth());
                json.append(",\"html\":").append(escapeJson(htmlRenderer.render(proof)));
                json.append(",\"text\":").append(escapeJson(textRenderer.render(proof)));
                json.append("}");

                long elapsed = System.currentTimeMillis() - startTime;
                log.info("Prove complete: {} -> {} ({} nodes) in {}ms",
                        sequent, proof.isProved() ? "proved" : "not provable", proof.size(), elapsed);
                return new Response(200, json.toString());
            } catch (Exception e) {
                log.error("Error proving sequent", e);
                return new Response(500, "{\"error\":" + escapeJson(e.getMessage()) + "}");
            }
        }
    }

    record Response(int status, String body) {
    }

    // Only a trailing line break is dropped; error positions refer to the text as sent.
    static String stripLineTerminator(String body) {
        if (body.endsWith("\r\n")) return body.substring(0, body.length() - 2);
        if (body.endsWith("\n") || body.endsWith("\r")) return body.substring(0, body.length() - 1);
        return body;
    }

    private static void sendResponse(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType + "; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static String escapeJson(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append("\"");
        return sb.toString();
    }

    private static String getIndexHtml() {
        return """
<!DOCTYPE html>
<html lang="en">
<head>
    <meta charset="UTF-8">
    <meta name="viewport" content="width=device-width, initial-scale=1.0">
    <title>Propositional Sequent Calculus Prover</title>
    <style>
        body {
            font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif;
            background: #1a1a2e;
            color: #eee;
            margin: 0;
            padding: 20px;
        }
        h1 { font-size: 1.3rem; font-weight: 500; color: #e94560; }
        input[type=text] {
            width: 30em;
            font-size: 1.1rem;
            padding: 4px 8px;
            background: #16213e;
            color: #eee;
            border: 1px solid #0f3460;
        }
        button {
            font-size: 1.1rem;
            padding: 4px 14px;
            background: #e94560;
            color: #fff;
            border: none;
            cursor: pointer;
        }
        #examples a { color: #9ecbff; margin-right: 1em; cursor: pointer; }
        #codeOutput u { text-decoration-color: #e94560; text-decoration-thickness: 2px; }
        #proof ul { list-style: none; padding-left: 1.5em; border-left: 1px dotted #0f3460; }
        #proof li { margin: 3px 0; font-family: monospace; font-size: 1.05rem; }
        #proof li.fail { color: #e94560; font-weight: bold; }
        .turnstile { padding: 0 0.4em; color: #e9c46a; }
        .comma { padding-right: 0.3em; }
    </style>
</head>
<body>
    <h1>Propositional Sequent Calculus Prover</h1>
    <p>
        <input type="text" id="inputSequent" value="⊦ A ∨ ¬A">
        <button id="proveButton">Prove</button>
    </p>
    <p>Operators: ¬ (or !), ∧ (or &amp;), ∨ (or |), ⊦ (or &gt;), ∅ for an empty side.</p>
    <p id="examples">Examples: </p>
    <p id="message"></p>
    <pre id="codeOutput"></pre>
    <div id="proof"></div>
    <script>
        const input = document.getElementById('inputSequent');
        const message = document.getElementById('message');
        const codeOutput = document.getElementById('codeOutput');
        const proof = document.getElementById('proof');

        async function doProve(text) {
            input.value = text;
            message.textContent = '';
            codeOutput.innerHTML = '';
            proof.innerHTML = '';
            try {
                const response = await fetch('/api/prove', { method: 'POST', body: text });
                const result = await response.json();
                if (response.status === 400) {
                    message.textContent = 'Syntax error: ' + result.error;
                    codeOutput.innerHTML = result.highlight;
                } else if (!response.ok) {
                    message.textContent = 'Error: ' + result.error;
                } else {
                    message.textContent = result.proved ? 'Proof:' : 'Not provable:';
                    proof.innerHTML = result.html;
                }
            } catch (e) {
                message.textContent = 'Error: ' + e;
            }
        }

        document.getElementById('proveButton').addEventListener('click', () => doProve(input.value));
        input.addEventListener('keydown', e => { if (e.key === 'Enter') doProve(input.value); });

        fetch('/api/examples').then(r => r.json()).then(result => {
            const examples = document.getElementById('examples');
            result.examples.forEach(example => {
                const link = document.createElement('a');
                link.textContent = example;
                link.addEventListener('click', () => doProve(example));
                examples.appendChild(link);
            });
        });
    </script>
</body>
</html>
""";
    }

    public static void main(String[] args) throws IOException {
        int port = 8080;
        if (args.length > 0) {
            port = Integer.parseInt(args[0]);
        }

        SequentProverServer server = new SequentProverServer(port);
        server.start();

        // Keep running until interrupted
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }
}
