package io.github.yok.prismlink.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One execution of a data change task.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DataChangeActivity extends PrismResource {

    private TypeRef state;

    private TypeRef fileContainer;
}
