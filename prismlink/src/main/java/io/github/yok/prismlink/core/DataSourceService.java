package io.github.yok.prismlink.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import io.github.yok.prismlink.config.PagingConfig;
import io.github.yok.prismlink.config.PrismEndpoints;
import io.github.yok.prismlink.http.PrismHttpClient;
import io.github.yok.prismlink.model.DataSource;
import io.github.yok.prismlink.model.PagedResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Lists WQL data sources.
 *
 * @author Yasuharu.Okawauchi
 */
@Service
public class DataSourceService {

    private final ResourcePager<DataSource> pager;

    /**
     * Creates the service.
     *
     * @param http HTTP collaborator
     * @param mapper JSON mapper
     * @param endpoints endpoint set
     * @param paging paging settings
     */
    public DataSourceService(PrismHttpClient http, ObjectMapper mapper, PrismEndpoints endpoints,
            PagingConfig paging) {
        this.pager = new ResourcePager<>(http, mapper, () -> endpoints.wql() + "/dataSources",
                DataSource.class, ds -> ImmutableList.of(StringUtils.defaultString(ds.getAlias())),
                paging.getDataSourcePageSize(), paging.getDefaultLimit());
    }

    /**
     * Scans every data source.
     *
     * @return scan outcome, incomplete if a page could not be fetched
     */
    public PageScan<DataSource> scan() {
        return pager.scan(PageQuery.all());
    }

    /**
     * Lists every data source.
     *
     * @return data sources, possibly empty
     */
    public PagedResult<DataSource> list() {
        return scan().toResult();
    }
}
