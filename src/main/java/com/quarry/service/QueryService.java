package com.quarry.service;

import com.quarry.api.QueryBatchRequest;
import com.quarry.config.QuarryProperties;
import com.quarry.model.QueryContext;
import com.quarry.model.QueryTarget;
import com.quarry.model.ResultFrame;
import com.quarry.model.StreamFieldSet;
import com.quarry.model.TimeRange;
import com.quarry.service.cache.DispatchCache;
import com.quarry.service.query.QueryModifier;
import com.quarry.service.query.TemplateVariableResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves batches of targets through the dispatch cache.
 * Targets resolve concurrently; frames come back in target order.
 */
@Slf4j
@Service
public class QueryService {

    private final DispatchCache dispatchCache;
    private final StreamFieldRegistry streamFieldRegistry;
    private final TemplateVariableResolver templateVariableResolver;
    private final QueryModifier queryModifier;
    private final QuarryProperties properties;

    public QueryService(DispatchCache dispatchCache,
                        StreamFieldRegistry streamFieldRegistry,
                        TemplateVariableResolver templateVariableResolver,
                        QueryModifier queryModifier,
                        QuarryProperties properties) {
        this.dispatchCache = dispatchCache;
        this.streamFieldRegistry = streamFieldRegistry;
        this.templateVariableResolver = templateVariableResolver;
        this.queryModifier = queryModifier;
        this.properties = properties;
    }

    /**
     * Resolve every target of a batch. Fails if any direct logs search fails.
     */
    public Mono<List<ResultFrame>> query(QueryBatchRequest batch) {
        TimeRange range = batch.getRange().toTimeRange();
        StreamFieldSet streamFields = streamFieldRegistry.current();
        QueryContext context = batch.getApp() != null ? batch.getApp() : QueryContext.UNKNOWN;

        List<QueryTarget> targets = batch.getTargets().stream()
                .map(target -> interpolate(target, batch.getScopedVars()))
                .toList();

        Map<String, QueryTarget> companions = new HashMap<>();
        for (QueryTarget target : targets) {
            if (!dispatchCache.isVolumeTarget(target) && target.getRefId() != null) {
                companions.putIfAbsent(target.getRefId(), target);
            }
        }

        log.info("Resolving {} targets for app={} range=[{}, {}]",
                targets.size(), context.getValue(), range.getStartMicros(), range.getEndMicros());

        return Flux.fromIterable(targets)
                .flatMapSequential(target -> dispatchCache.resolve(
                        target, range, streamFields, context, companionOf(target, companions)))
                .collectList();
    }

    /**
     * Resolve the log-volume histogram for each target of a batch.
     * Each derived target carries its source target as companion.
     */
    public Mono<List<ResultFrame>> logsVolume(QueryBatchRequest batch) {
        if (batch.getTargets().isEmpty()) {
            return Mono.just(List.of());
        }

        TimeRange range = batch.getRange().toTimeRange();
        StreamFieldSet streamFields = streamFieldRegistry.current();
        QueryContext context = batch.getApp() != null ? batch.getApp() : QueryContext.UNKNOWN;
        String prefix = properties.getQuery().getLogVolumeRefIdPrefix();

        return Flux.fromIterable(batch.getTargets())
                .map(target -> interpolate(target, batch.getScopedVars()))
                .flatMapSequential(source -> {
                    QueryTarget volume = source.toBuilder().refId(prefix + source.getRefId()).build();
                    return dispatchCache.resolve(volume, range, streamFields, context, source);
                })
                .collectList();
    }

    public QueryTarget modify(QueryTarget target, QueryModifier.Action action, String key, String value) {
        return queryModifier.modify(target, action, key, value);
    }

    private QueryTarget companionOf(QueryTarget target, Map<String, QueryTarget> companions) {
        if (!dispatchCache.isVolumeTarget(target)) {
            return null;
        }
        String sourceRefId = target.getRefId().substring(properties.getQuery().getLogVolumeRefIdPrefix().length());
        return companions.get(sourceRefId);
    }

    private QueryTarget interpolate(QueryTarget target, Map<String, String> scopedVars) {
        return target.toBuilder()
                .query(templateVariableResolver.resolve(target.getQuery(), scopedVars))
                .build();
    }
}
