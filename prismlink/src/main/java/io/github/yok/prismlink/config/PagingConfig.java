package io.github.yok.prismlink.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Holds the page sizes used by list and search operations.
 *
 * <p>
 * Specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code paging.table-page-size}: maximum page size when scanning tables</li>
 * <li>{@code paging.bucket-page-size}: maximum page size when scanning buckets</li>
 * <li>{@code paging.data-change-page-size}: maximum page size when scanning data changes</li>
 * <li>{@code paging.data-source-page-size}: page size when listing WQL data sources</li>
 * <li>{@code paging.default-limit}: page size used when a caller's limit is out of
 * range</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "paging")
@Getter
@Setter
@NoArgsConstructor
public class PagingConfig {

    private int tablePageSize = 100;

    private int bucketPageSize = 100;

    private int dataChangePageSize = 500;

    private int dataSourcePageSize = 100;

    private int defaultLimit = 20;
}
