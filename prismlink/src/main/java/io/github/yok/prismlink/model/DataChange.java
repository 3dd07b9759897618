package io.github.yok.prismlink.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A data change task: a named, server-defined load job.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DataChange extends PrismResource {

    private String description;

    private TypeRef target;
}
