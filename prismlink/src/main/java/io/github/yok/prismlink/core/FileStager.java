package io.github.yok.prismlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.http.UploadFile;
import io.github.yok.prismlink.model.UploadReceipt;
import io.github.yok.prismlink.util.LogPathUtil;
import io.github.yok.prismlink.util.WireConstants;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Uploads files to a bucket or a file container.
 *
 * <p>
 * Staging is best effort across a batch. Files are uploaded in the given order:
 * </p>
 * <ul>
 * <li>{@code .csv.gz} files are streamed as they are.</li>
 * <li>{@code .csv} files are compressed in memory and uploaded as {@code <name>.csv.gz}.</li>
 * <li>Missing, unreadable or otherwise named files are skipped with a warning.</li>
 * </ul>
 * <p>
 * A {@code null} file list uploads a single empty compressed payload, which is how a table is
 * truncated.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileStager {

    private final PrismHttpClient http;
    private final ObjectMapper mapper;
    private final PrismEndpoints endpoints;
    private final FileContainerService containers;

    /**
     * Stages files.
     *
     * @param target bucket or file container; a container without ID is created on the first
     *        upload and reused for the rest of the batch
     * @param files files in upload order, or {@code null} for the empty payload
     * @return receipts of the files the service accepted, with the bucket or container ID
     * @throws io.github.yok.prismlink.util.PrismException if a file container has to be created
     *         and cannot be
     */
    public StagingResult stage(StagingTarget target, List<Path> files) {
        List<UploadReceipt> receipts = new ArrayList<>();
        String targetId = target.getId();

        if (files == null) {
            targetId = ensureTarget(target, targetId);
            upload(target.getKind(), targetId, UploadFile.ofBytes(WireConstants.EMPTY_UPLOAD_NAME,
                    gzip(new byte[0])), "empty payload").ifPresent(receipts::add);
            return new StagingResult(receipts, targetId);
        }

        if (files.isEmpty()) {
            log.warn("No files given to stage.");
        }
        for (Path file : files) {
            Optional<UploadFile> upload = prepare(file);
            if (upload.isEmpty()) {
                continue;
            }
            targetId = ensureTarget(target, targetId);
            upload(target.getKind(), targetId, upload.get(), LogPathUtil.renderPathForLog(file))
                    .ifPresent(receipts::add);
        }
        log.info("Staged {} of {} file(s) to {} {}", receipts.size(), files.size(),
                target.getKind(), targetId);
        return new StagingResult(receipts, targetId);
    }

    /**
     * Classifies a file and builds its upload part.
     *
     * @param file input file
     * @return the upload part, or empty if the file is skipped
     */
    Optional<UploadFile> prepare(Path file) {
        String shown = LogPathUtil.renderPathForLog(file);
        if (!Files.isRegularFile(file)) {
            log.warn("File {} not found - skipping.", shown);
            return Optional.empty();
        }
        String name = file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(WireConstants.CSV_GZIP_SUFFIX)) {
            return Optional.of(UploadFile.ofPath(file));
        }
        if (lower.endsWith(WireConstants.CSV_SUFFIX)) {
            try {
                byte[] compressed = gzip(Files.readAllBytes(file));
                return Optional.of(UploadFile.ofBytes(name + WireConstants.GZIP_SUFFIX,
                        compressed));
            } catch (IOException | UncheckedIOException e) {
                log.warn("File {} cannot be read - skipping: {}", shown, e.getMessage());
                return Optional.empty();
            }
        }
        log.warn("File {} is not a .csv.gz or .csv file - skipping.", shown);
        return Optional.empty();
    }

    private String ensureTarget(StagingTarget target, String targetId) {
        if (targetId != null) {
            return targetId;
        }
        String created = containers.create().getId();
        log.debug("Staging into new file container {}", created);
        return created;
    }

    private Optional<UploadReceipt> upload(StagingTarget.Kind kind, String targetId,
            UploadFile file, String shown) {
        HttpResult result = http.postFile(endpoints.prism(kind.filesPath(targetId)), file);
        if (!result.is(201)) {
            log.warn("Upload of {} to {} {} failed (status {}).", shown, kind, targetId,
                    result.getStatusCode());
            return Optional.empty();
        }
        log.debug("Uploaded {} to {} {}", shown, kind, targetId);
        try {
            return Optional.of(mapper.readValue(result.getBody(), UploadReceipt.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable upload receipt for {}: {}", shown, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Compresses bytes with gzip.
     *
     * @param content raw bytes
     * @return gzip stream bytes
     */
    static byte[] gzip(byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, content.length / 2));
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
