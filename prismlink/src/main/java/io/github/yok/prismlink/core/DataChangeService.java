package io.github.yok.prismlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.prismlink.config.PagingConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.DataChange;
import io.github.yok.prismlink.model.DataChangeActivity;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.util.ErrorKind;
import io.github.yok.prismlink.util.PrismException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Data change tasks and their activities.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Service
public class DataChangeService {

    private static final String DEFAULT_OUTPUT_TYPE = "summary";

    // Statuses whose validation body is returned to the caller
    private static final ImmutableSet<Integer> VALIDATION_STATUSES = ImmutableSet.of(200, 400, 404);

    private final PrismHttpClient http;
    private final ObjectMapper mapper;
    private final PrismEndpoints endpoints;
    private final FileStager stager;
    private final ResourcePager<DataChange> pager;

    /**
     * Creates the service.
     *
     * @param http HTTP collaborator
     * @param mapper JSON mapper
     * @param endpoints endpoint set
     * @param paging paging settings
     * @param stager stager used by {@link #run}
     */
    public DataChangeService(PrismHttpClient http, ObjectMapper mapper, PrismEndpoints endpoints,
            PagingConfig paging, FileStager stager) {
        this.http = http;
        this.mapper = mapper;
        this.endpoints = endpoints;
        this.stager = stager;
        this.pager = new ResourcePager<>(http, mapper, () -> endpoints.prism("/dataChanges"),
                DataChange.class, dc -> ImmutableList.of(StringUtils.defaultString(dc.getName()),
                        StringUtils.defaultString(dc.getDisplayName())),
                paging.getDataChangePageSize(), paging.getDefaultLimit());
    }

    /**
     * Reads a data change by ID.
     *
     * @param id data change ID
     * @param outputType {@code summary} or {@code full}
     * @return the data change, or empty if it does not exist
     */
    public Optional<DataChange> get(String id, String outputType) {
        return pager.byId(id, Map.of("type", outputType(outputType)));
    }

    /**
     * Lists or searches data changes.
     *
     * @param query paging criteria
     * @param outputType level of detail of each item
     * @return matching data changes, possibly empty
     */
    public PagedResult<DataChange> find(PageQuery<DataChange> query, String outputType) {
        return pager.fetch(query.toBuilder().param("type", outputType(outputType)).build());
    }

    /**
     * Reads a data change by exact API name.
     *
     * @param name API name
     * @return the data change, or empty if none has that name
     */
    public Optional<DataChange> findByName(String name) {
        return Optional.ofNullable(pager.fetch(PageQuery.<DataChange>builder().name(name)
                .param("type", DEFAULT_OUTPUT_TYPE).build()).first());
    }

    /**
     * Reads one activity of a data change.
     *
     * @param dataChangeId data change ID
     * @param activityId activity ID
     * @return the activity, or empty if it does not exist
     */
    public Optional<DataChangeActivity> activity(String dataChangeId, String activityId) {
        HttpResult result = http.get(
                endpoints.prism("/dataChanges/" + dataChangeId + "/activities/" + activityId));
        if (!result.is(200)) {
            log.debug("No activity {} for data change {} (status {})", activityId, dataChangeId,
                    result.getStatusCode());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(result.getBody(), DataChangeActivity.class));
        } catch (JsonProcessingException e) {
            log.error("Unreadable activity {}: {}", activityId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Starts an activity of a data change.
     *
     * @param dataChangeId data change ID
     * @param containerId file container holding the input files, may be null
     * @return the activity (201) or the service's error body (400)
     * @throws PrismException {@link ErrorKind#TRANSPORT_ERROR} for any other status
     */
    public ActivityStart start(String dataChangeId, String containerId) {
        String body = null;
        if (containerId != null) {
            ObjectNode payload = mapper.createObjectNode();
            payload.put("fileContainerWid", containerId);
            body = payload.toString();
        }
        HttpResult result =
                http.post(endpoints.prism("/dataChanges/" + dataChangeId + "/activities"), body);
        if (result.is(201)) {
            ActivityStart started = new ActivityStart(201, body(result));
            log.info("Started activity {} of data change {}", started.getActivityId(),
                    dataChangeId);
            return started;
        }
        if (result.is(400)) {
            log.error("Data change {} could not be started: {}", dataChangeId, result.getBody());
            return new ActivityStart(400, body(result));
        }
        log.error("Unable to start data change {}: {} {}", dataChangeId, result.getStatusCode(),
                result.getBody());
        throw new PrismException(ErrorKind.TRANSPORT_ERROR, dataChangeId,
                "Unable to start data change " + dataChangeId + " (status "
                        + result.getStatusCode() + " " + result.getReason() + ").");
    }

    /**
     * Validates a data change.
     *
     * @param dataChangeId data change ID
     * @return the validation body for a 200, 400 or 404 answer, otherwise empty
     */
    public Optional<JsonNode> validate(String dataChangeId) {
        HttpResult result =
                http.get(endpoints.prism("/dataChanges/" + dataChangeId + "/validate"));
        if (!VALIDATION_STATUSES.contains(result.getStatusCode())) {
            return Optional.empty();
        }
        return Optional.of(body(result));
    }

    /**
     * Returns whether a data change exists and is valid.
     *
     * @param dataChangeId data change ID
     * @return {@code true} only for a 200 validation answer that reports no error
     */
    public boolean isValid(String dataChangeId) {
        HttpResult result =
                http.get(endpoints.prism("/dataChanges/" + dataChangeId + "/validate"));
        if (!result.is(200)) {
            log.error("Data change {} is not valid (status {}): {}", dataChangeId,
                    result.getStatusCode(), result.getBody());
            return false;
        }
        JsonNode validation = body(result);
        if (validation.has("error") || validation.has("errors")) {
            log.error("Data change {} is not valid: {}", dataChangeId, validation);
            return false;
        }
        return true;
    }

    /**
     * Runs a data change, first staging its input files into a new file container.
     *
     * @param dataChangeId data change ID
     * @param files input files, or {@code null} to run without a container
     * @return staging receipts and the activity start answer
     * @throws PrismException if the container cannot be created or the start is refused
     */
    public DataChangeRun run(String dataChangeId, List<Path> files) {
        if (files == null) {
            return new DataChangeRun(null, start(dataChangeId, null));
        }
        StagingResult staged = stager.stage(StagingTarget.fileContainer(null), files);
        if (staged.isEmpty()) {
            log.warn("No file staged for data change {}; the activity was not started.",
                    dataChangeId);
            return new DataChangeRun(staged, null);
        }
        return new DataChangeRun(staged, start(dataChangeId, staged.getId()));
    }

    private JsonNode body(HttpResult result) {
        if (result.getBody() == null) {
            return NullNode.getInstance();
        }
        try {
            return mapper.readTree(result.getBody());
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON body returned: {}", e.getOriginalMessage());
            return mapper.getNodeFactory().textNode(result.getBody());
        }
    }

    private static String outputType(String requested) {
        if (requested != null && requested.equalsIgnoreCase("full")) {
            return "full";
        }
        return DEFAULT_OUTPUT_TYPE;
    }
}
