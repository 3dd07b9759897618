package io.github.yok.prismlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.FileContainer;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.UploadReceipt;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * File container operations. Files are loaded into containers through {@link FileStager}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileContainerService {

    private final PrismHttpClient http;
    private final ObjectMapper mapper;
    private final PrismEndpoints endpoints;

    /**
     * Creates an empty file container (POST, 201).
     *
     * @return the new container
     * @throws PrismException {@link ErrorKind#CONTAINER_CREATE_FAILED} if the service refuses
     */
    public FileContainer create() {
        HttpResult result = http.post(endpoints.prism("/fileContainers"), null);
        if (!result.is(201)) {
            log.error("Unable to create a file container: {} {}", result.getStatusCode(),
                    result.getBody());
            throw new PrismException(ErrorKind.CONTAINER_CREATE_FAILED,
                    "Unable to create a file container (status " + result.getStatusCode() + ").");
        }
        try {
            FileContainer container = mapper.readValue(result.getBody(), FileContainer.class);
            log.debug("Created file container {}", container.getId());
            return container;
        } catch (JsonProcessingException e) {
            throw new PrismException(ErrorKind.CONTAINER_CREATE_FAILED, null,
                    "Unreadable file container response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Lists the files of a container.
     *
     * @param containerId container ID
     * @return files, empty if the container does not exist or cannot be read
     */
    public PagedResult<UploadReceipt> files(String containerId) {
        HttpResult result = http.get(endpoints.prism("/fileContainers/" + containerId + "/files"));
        if (result.is(404)) {
            log.warn("File container {} not found; verify the Self-Service: Prism File Container"
                    + " domain in the Prism Analytics functional area.", containerId);
            return PagedResult.empty();
        }
        if (!result.is(200)) {
            return PagedResult.empty();
        }
        try {
            List<UploadReceipt> files =
                    mapper.readValue(result.getBody(), new TypeReference<List<UploadReceipt>>() {});
            return new PagedResult<>(files);
        } catch (JsonProcessingException e) {
            log.error("Unreadable file list of container {}: {}", containerId,
                    e.getOriginalMessage());
            return PagedResult.empty();
        }
    }
}
