package io.github.yok.prismlink.core;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.yok.prismlink.model.PagedResult;
import io.github.yok.prismlink.model.UploadReceipt;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Receipts of one staging batch, with the ID of the bucket or container that received them.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@JsonPropertyOrder({"id", "total", "data"})
public class StagingResult extends PagedResult<UploadReceipt> {

    // Bucket or container ID; null if no container was created
    private final String id;

    /**
     * Creates a result.
     *
     * @param receipts receipts of the uploaded files
     * @param id bucket or container ID
     */
    public StagingResult(List<UploadReceipt> receipts, String id) {
        super(receipts);
        this.id = id;
    }
}
