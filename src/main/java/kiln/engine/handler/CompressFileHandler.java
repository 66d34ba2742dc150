package kiln.engine.handler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * {@code compress_file}: gzip a file into {@code outputDir/<name>.gz}.
 * The ratio is original size over compressed size.
 */
public class CompressFileHandler implements TaskHandler<CompressFileHandler.Request, CompressFileHandler.CompressionResult> {

    public static final String TYPE = "compress_file";

    public static final int DEFAULT_LEVEL = 6;

    public record Request(String filePath, String outputDir, Integer compressionLevel) {
        public int level() {
            return compressionLevel != null ? compressionLevel : DEFAULT_LEVEL;
        }
    }

    public record CompressionResult(String input, String output, double ratio) {
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
    public CompressionResult handle(Request request) throws IOException {
        if (request == null || request.filePath() == null || request.outputDir() == null) {
            throw new IllegalArgumentException("filePath and outputDir are required");
        }
        int level = request.level();
        if (level < 0 || level > 9) {
            throw new IllegalArgumentException("compressionLevel must be between 0 and 9, got " + level);
        }

        Path input = Path.of(request.filePath());
        byte[] content = Files.readAllBytes(input);

        Path output = Path.of(request.outputDir()).resolve(input.getFileName() + ".gz");
        Files.createDirectories(output.getParent());
        try (OutputStream out = new LeveledGzipOutputStream(Files.newOutputStream(output), level)) {
            out.write(content);
        }

        long compressed = Files.size(output);
        double ratio = compressed == 0 ? 0.0 : (double) content.length / compressed;
        return new CompressionResult(input.toString(), output.toString(), ratio);
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
