package io.github.yok.prismlink.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.yok.prismlink.util.WireConstants;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to another Prism object: an {@code id} and an optional human readable
 * {@code descriptor}.
 *
 * <p>
 * Type references use the {@code <Category>=<Value>} form as their ID, e.g.
 * {@code Schema_Field_Type=Text}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TypeRef {

    private String id;

    private String descriptor;

    /**
     * Creates a reference by ID only.
     *
     * @param id referenced ID
     * @return reference
     */
    public static TypeRef of(String id) {
        return new TypeRef(id, null);
    }

    /**
     * Creates a type reference in {@code <Category>=<Value>} form.
     *
     * @param category reference category, e.g. {@code Operation_Type}
     * @param value reference value, e.g. {@code Insert}
     * @return reference
     */
    public static TypeRef typed(String category, String value) {
        return of(WireConstants.typeRef(category, value));
    }
}
