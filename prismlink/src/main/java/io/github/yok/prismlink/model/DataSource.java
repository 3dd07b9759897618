package io.github.yok.prismlink.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A WQL data source, used to resolve the business object of {@code Instance} fields.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataSource {

    private String id;

    private String alias;

    private TypeRef businessObject;
}
