package io.github.yok.prismlink.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A Prism table (dataset) and, for {@code full} reads, its schema fields.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Table extends PrismResource {

    private String description;

    private String documentation;

    private Boolean enableForAnalysis;

    // Present for full reads only
    private List<Field> fields;

    private JsonNode tags;

    private JsonNode categories;
}
