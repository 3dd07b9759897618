package io.github.yok.prismlink.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A file container: a staging area not bound to a table, consumed by a data change activity.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class FileContainer extends PrismResource {
}
