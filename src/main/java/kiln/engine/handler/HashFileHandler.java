package kiln.engine.handler;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * {@code hash_file}: SHA-256 of a file's contents, hex encoded.
 * Payload is the file path.
 */
public class HashFileHandler implements TaskHandler<String, HashFileHandler.FileHash> {

    public static final String TYPE = "hash_file";

    private static final int BUFFER_SIZE = 64 * 1024;

    public record FileHash(String path, String hash) {
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
    public FileHash handle(String filePath) throws Exception {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("file path is required");
        }
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(Path.of(filePath))) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return new FileHash(filePath, HexFormat.of().formatHex(digest.digest()));
    }
}
