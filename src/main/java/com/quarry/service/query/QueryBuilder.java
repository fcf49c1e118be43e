package com.quarry.service.query;

import com.quarry.config.QuarryProperties;
import com.quarry.model.QueryContext;
import com.quarry.model.QueryTarget;
import com.quarry.model.SearchQuery;
import com.quarry.model.SearchRequest;
import com.quarry.model.StreamFieldSet;
import com.quarry.model.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds backend search payloads from query targets.
 *
 * Never throws: a target that cannot be translated yields an unfiltered query over the same range.
 */
@Slf4j
@Service
public class QueryBuilder {

    static final String SQL_TEMPLATE = "select * from \"[INDEX_NAME]\" [WHERE_CLAUSE]";

    private final QuarryProperties properties;

    public QueryBuilder(QuarryProperties properties) {
        this.properties = properties;
    }

    /**
     * Build the search payload for one target.
     *
     * @param target query target (already template-interpolated)
     * @param range time range in microseconds
     * @param streamFields known fields of the target stream
     * @param context screen the batch came from; only explore asks for sample rows
     * @return search payload, never null
     */
    public SearchRequest build(QueryTarget target, TimeRange range, StreamFieldSet streamFields,
                               QueryContext context) {
        try {
            SearchQuery.SearchQueryBuilder query = SearchQuery.builder()
                    .startTime(range.getStartMicros())
                    .endTime(range.getEndMicros())
                    .size(context == QueryContext.EXPLORE ? properties.getQuery().getSampleSize() : 0);

            if (target.isSqlMode()) {
                query.sql(target.getQuery() != null ? target.getQuery() : "")
                        .sqlMode(SearchQuery.SQL_MODE_FULL);
            } else {
                query.sql(expand(target.getStream(), FilterRewriter.rewrite(target.getQuery(), streamFields)));
            }

            return SearchRequest.builder().query(query.build()).build();
        } catch (RuntimeException e) {
            log.error("Error building query for target {}, sending unfiltered query", target.getRefId(), e);
            return degraded(target, range);
        }
    }

    private static String expand(String stream, String whereClause) {
        String sql = SQL_TEMPLATE.replace("[INDEX_NAME]", stream != null ? stream : "");
        if (whereClause.isEmpty()) {
            return sql.replace(" [WHERE_CLAUSE]", "");
        }
        return sql.replace("[WHERE_CLAUSE]", "WHERE " + whereClause);
    }

    private SearchRequest degraded(QueryTarget target, TimeRange range) {
        String stream = target != null && target.getStream() != null ? target.getStream() : "";
        long start = range != null ? range.getStartMicros() : 0L;
        long end = range != null ? range.getEndMicros() : 0L;
        return SearchRequest.builder()
                .query(SearchQuery.builder()
                        .sql(expand(stream, ""))
                        .startTime(start)
                        .endTime(end)
                        .size(0)
                        .build())
                .build();
    }
}
