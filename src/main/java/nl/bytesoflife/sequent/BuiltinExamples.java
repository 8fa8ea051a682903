package nl.bytesoflife.sequent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Provides the sample sequents bundled as a classpath resource.
 */
public class BuiltinExamples {

    private static final String RESOURCE = "/examples/sequents.txt";

    private static volatile List<String> cached;

    public static List<String> all() {
        if (cached == null) {
            synchronized (BuiltinExamples.class) {
                if (cached == null) {
                    cached = load();
                }
            }
        }
        return cached;
    }

    private static List<String> load() {
        try (InputStream is = BuiltinExamples.class.getResourceAsStream(RESOURCE)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + RESOURCE);
            return parseLines(new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load example sequents", e);
        }
    }

    static List<String> parseLines(BufferedReader reader) throws IOException {
        List<String> examples = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            examples.add(line);
        }
        return List.copyOf(examples);
    }
}
