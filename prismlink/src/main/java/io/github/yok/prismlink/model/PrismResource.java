package io.github.yok.prismlink.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Common attributes of Prism catalog resources.
 *
 * <p>
 * Attributes the typed subclasses do not model are kept in {@link #getAdditional()} so that a
 * resource read from the service can be written back out unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class PrismResource {

    // Opaque, stable identifier assigned by the service
    private String id;

    // API name
    private String name;

    private String displayName;

    private final Map<String, JsonNode> additional = new LinkedHashMap<>();

    /**
     * Collects an attribute not modeled by the subclass.
     *
     * @param key attribute name
     * @param value attribute value
     */
    @JsonAnySetter
    public void putAdditional(String key, JsonNode value) {
        additional.put(key, value);
    }

    /**
     * Returns the attributes not modeled by the subclass.
     *
     * @return attribute map, in arrival order
     */
    @JsonAnyGetter
    public Map<String, JsonNode> getAdditional() {
        return additional;
    }
}
