package io.github.yok.prismlink.http;

import java.nio.file.Path;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A file part of a multipart upload, backed either by bytes in memory or by a file streamed from
 * disk.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class UploadFile {

    // File name sent in the Content-Disposition header
    private final String fileName;

    // In-memory content; null when the part is streamed from path
    private final byte[] content;

    // Source file; null when the part is in memory
    private final Path path;

    /**
     * Creates an in-memory part.
     *
     * @param fileName uploaded file name
     * @param content file content
     * @return upload part
     */
    public static UploadFile ofBytes(String fileName, byte[] content) {
        return new UploadFile(Objects.requireNonNull(fileName, "fileName"),
                Objects.requireNonNull(content, "content"), null);
    }

    /**
     * Creates a part streamed from disk, named after the file.
     *
     * @param path source file
     * @return upload part
     */
    public static UploadFile ofPath(Path path) {
        Objects.requireNonNull(path, "path");
        return new UploadFile(path.getFileName().toString(), null, path);
    }

    /**
     * Returns whether the content is streamed from a file.
     *
     * @return {@code true} if backed by a path
     */
    public boolean isStreamed() {
        return path != null;
    }
}
