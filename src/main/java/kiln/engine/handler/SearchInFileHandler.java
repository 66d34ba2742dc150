package kiln.engine.handler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code search_in_file}: every regex match in a file, line by line.
 * Lines are 1-based, columns 0-based. Matching ignores case unless
 * {@code options.caseSensitive} is set.
 */
public class SearchInFileHandler implements TaskHandler<SearchInFileHandler.Request, SearchInFileHandler.FileSearchResult> {

    public static final String TYPE = "search_in_file";

    public record Options(boolean caseSensitive) {
    }

    public record Request(String filePath, String pattern, Options options) {
        boolean caseSensitive() {
            return options != null && options.caseSensitive();
        }
    }

    public record Match(int line, int column, String text, String context) {
    }

    public record FileSearchResult(String file, List<Match> matches) {
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<Request> payloadType() {
        return Request.class;
    }

    @Override
    public FileSearchResult handle(Request request) throws Exception {
        if (request == null || request.filePath() == null || request.pattern() == null) {
            throw new IllegalArgumentException("filePath and pattern are required");
        }
        Pattern regex = request.caseSensitive()
                ? Pattern.compile(request.pattern())
                : Pattern.compile(request.pattern(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

        String content = Files.readString(Path.of(request.filePath()), StandardCharsets.UTF_8);
        String[] lines = content.split("\n", -1);

        List<Match> matches = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            Matcher m = regex.matcher(line);
            while (m.find()) {
                matches.add(new Match(i + 1, m.start(), m.group(), line.trim()));
            }
        }
        return new FileSearchResult(request.filePath(), matches);
    }
}
