package io.github.yok.prismlink.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.github.yok.prismlink.http.HttpResult;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.PagedResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Paginated lookup of one resource collection (tables, buckets, data changes, data sources).
 *
 * <p>
 * Lookups never fail: a non-success response or an unreadable page ends the scan and whatever has
 * been accumulated so far is returned. The result's total is always the number of items it holds,
 * independent of the count the server reports.
 * </p>
 *
 * @param <T> resource type
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ResourcePager<T> {

    private final PrismHttpClient http;

    private final ObjectMapper mapper;

    // Collection URL, resolved per request so that endpoint settings are read lazily
    private final Supplier<String> collectionUrl;

    private final Class<T> type;

    // Values matched by substring searches, typically name and display name
    private final Function<T, List<String>> searchKeys;

    // Page size forced during full scans
    private final int maxPageSize;

    // Page size used when a caller's limit is missing or out of range
    private final int defaultLimit;

    /**
     * Creates a pager.
     *
     * @param http HTTP collaborator
     * @param mapper JSON mapper
     * @param collectionUrl supplier of the collection URL
     * @param type resource type
     * @param searchKeys values matched by substring searches
     * @param maxPageSize page size forced during full scans
     * @param defaultLimit page size used for an invalid caller limit
     */
    public ResourcePager(PrismHttpClient http, ObjectMapper mapper, Supplier<String> collectionUrl,
            Class<T> type, Function<T, List<String>> searchKeys, int maxPageSize,
            int defaultLimit) {
        Preconditions.checkArgument(maxPageSize > 0, "maxPageSize must be positive");
        Preconditions.checkArgument(defaultLimit > 0, "defaultLimit must be positive");
        this.http = http;
        this.mapper = mapper;
        this.collectionUrl = collectionUrl;
        this.type = type;
        this.searchKeys = searchKeys;
        this.maxPageSize = maxPageSize;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Reads one resource by ID, bypassing paging.
     *
     * @param id resource ID
     * @param params query parameters, e.g. {@code format=full}
     * @return the resource, or empty if the service did not return it
     */
    public Optional<T> byId(String id, Map<String, String> params) {
        return rawById(id, params).flatMap(node -> convert(node, id));
    }

    /**
     * Reads one resource by ID as an untyped JSON tree.
     *
     * @param id resource ID
     * @param params query parameters
     * @return the JSON object, or empty if the service did not return it
     */
    public Optional<JsonNode> rawById(String id, Map<String, String> params) {
        Preconditions.checkArgument(StringUtils.isNotBlank(id), "id is required");
        String url = collectionUrl.get() + "/" + id;
        HttpResult result = http.get(url, params);
        if (!result.is(200)) {
            log.debug("No {} for id={} (status={})", type.getSimpleName(), id,
                    result.getStatusCode());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(result.getBody()));
        } catch (JsonProcessingException e) {
            log.error("Unreadable {} response for id={}: {}", type.getSimpleName(), id,
                    e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Lists or searches the collection.
     *
     * @param query criteria
     * @return matching items, possibly empty, never an error
     */
    public PagedResult<T> fetch(PageQuery<T> query) {
        return scan(query).toResult();
    }

    /**
     * Lists or searches the collection, keeping track of how the scan ended.
     *
     * @param query criteria
     * @return scan outcome
     */
    public PageScan<T> scan(PageQuery<T> query) {
        Map<String, String> params = new LinkedHashMap<>(query.getParams());
        int limit;
        int offset;
        if (query.isExactName()) {
            params.put("name", query.getName());
            limit = 1;
            offset = 0;
        } else if (query.isFullScan()) {
            limit = maxPageSize;
            offset = 0;
        } else {
            Integer requested = query.getLimit();
            limit = requested != null && requested > 0 && requested <= maxPageSize ? requested
                    : defaultLimit;
            offset = query.getOffset() != null && query.getOffset() > 0 ? query.getOffset() : 0;
        }

        String url = collectionUrl.get();
        List<T> found = new ArrayList<>();
        int pages = 0;
        while (true) {
            params.put("limit", String.valueOf(limit));
            params.put("offset", String.valueOf(offset));
            HttpResult result = http.get(url, params);
            pages++;
            if (!result.is(200)) {
                log.debug("Paging {} stopped at offset={} (status={})", type.getSimpleName(),
                        offset, result.getStatusCode());
                return PageScan.interrupted(found, pages, result.getStatusCode());
            }

            JsonNode page;
            List<T> items;
            try {
                page = mapper.readTree(result.getBody());
                items = readItems(page.path("data"));
            } catch (JsonProcessingException e) {
                log.error("Unreadable {} page at offset={}: {}", type.getSimpleName(), offset,
                        e.getOriginalMessage());
                return PageScan.interrupted(found, pages, HttpResult.TRANSPORT_FAILURE);
            }

            if (query.isExactName()) {
                if (page.path("total").asInt(0) > 1) {
                    log.debug("Service reports {} {} named {}; returning the first",
                            page.path("total").asInt(), type.getSimpleName(), query.getName());
                }
                if (!items.isEmpty()) {
                    found.add(items.get(0));
                }
                return PageScan.completed(found, pages);
            }

            int matches = 0;
            for (T item : items) {
                if (matches(query, item)) {
                    found.add(item);
                    matches++;
                }
            }
            log.debug("Paging {}: offset={}, pageSize={}, items={}, matches={}",
                    type.getSimpleName(), offset, limit, items.size(), matches);

            if (!query.isFullScan() || items.size() < limit) {
                break;
            }
            offset += limit;
            int serverTotal = page.path("total").asInt(-1);
            if (serverTotal >= 0 && offset >= serverTotal) {
                break;
            }
        }
        return PageScan.completed(found, pages);
    }

    private boolean matches(PageQuery<T> query, T item) {
        if (query.isSearching() && query.getName() != null) {
            String fragment = query.getName().toLowerCase(Locale.ROOT);
            boolean hit = false;
            for (String key : searchKeys.apply(item)) {
                if (key != null && key.toLowerCase(Locale.ROOT).contains(fragment)) {
                    hit = true;
                    break;
                }
            }
            if (!hit) {
                return false;
            }
        }
        return query.getFilter() == null || query.getFilter().test(item);
    }

    private List<T> readItems(JsonNode data) throws JsonProcessingException {
        List<T> items = new ArrayList<>();
        if (!data.isArray()) {
            return items;
        }
        for (JsonNode node : data) {
            items.add(mapper.treeToValue(node, type));
        }
        return items;
    }

    private Optional<T> convert(JsonNode node, String id) {
        try {
            return Optional.of(mapper.treeToValue(node, type));
        } catch (JsonProcessingException e) {
            log.error("Unreadable {} response for id={}: {}", type.getSimpleName(), id,
                    e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
