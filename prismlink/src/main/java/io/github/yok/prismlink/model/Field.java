package io.github.yok.prismlink.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One column of a table schema.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Field {

    // Server-assigned identifiers, invalid on write
    private String id;
    private String fieldId;

    private String name;

    private String displayName;

    private String description;

    // 1-based position
    private Integer ordinal;

    private TypeRef type;

    // Numeric/Decimal only
    private Integer precision;
    private Integer scale;

    // Date only
    private String parseFormat;

    // Instance only
    private JsonNode businessObject;

    private Boolean externalId;

    private Boolean required;
}
