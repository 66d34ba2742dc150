package kiln.engine.handler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code analyze_code}: line counts and rough declaration counts for a source file.
 * The counts are regex heuristics, not a parse.
 */
public class AnalyzeCodeHandler implements TaskHandler<String, AnalyzeCodeHandler.CodeAnalysis> {

    public static final String TYPE = "analyze_code";

    private static final Pattern FUNCTION = Pattern.compile("function\\s+\\w+");
    private static final Pattern CLASS = Pattern.compile("class\\s+\\w+");
    private static final Pattern IMPORT = Pattern.compile("import\\s+.*from");
    private static final Pattern EXPORT = Pattern.compile("export\\s+");

    public record CodeAnalysis(
            String file,
            int lines,
            int nonEmptyLines,
            int functions,
            int classes,
            int imports,
            int exports) {
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<String> payloadType() {
        return String.class;
    }

    @Override
    public CodeAnalysis handle(String filePath) throws Exception {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("file path is required");
        }
        String content = Files.readString(Path.of(filePath), StandardCharsets.UTF_8);
        String[] lines = content.split("\n", -1);

        int nonEmpty = 0;
        for (String line : lines) {
            if (!line.isBlank()) {
                nonEmpty++;
            }
        }

        return new CodeAnalysis(
                filePath,
                lines.length,
                nonEmpty,
                count(FUNCTION, content),
                count(CLASS, content),
                count(IMPORT, content),
                count(EXPORT, content));
    }

    private static int count(Pattern pattern, String content) {
        Matcher m = pattern.matcher(content);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
