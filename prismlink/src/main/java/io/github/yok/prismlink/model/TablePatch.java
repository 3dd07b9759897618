package io.github.yok.prismlink.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attribute-only update of a table.
 *
 * <p>
 * Attributes left {@code null} are not sent and keep their current value; an empty string clears
 * the attribute.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TablePatch {

    private String displayName;

    private String description;

    private String documentation;

    private Boolean enableForAnalysis;

    /**
     * Returns whether no attribute is set.
     *
     * @return {@code true} if the patch would change nothing
     */
    @JsonIgnore
    public boolean isEmpty() {
        return displayName == null && description == null && documentation == null
                && enableForAnalysis == null;
    }
}
