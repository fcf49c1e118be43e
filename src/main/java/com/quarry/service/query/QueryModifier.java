package com.quarry.service.query;

import com.quarry.model.QueryTarget;
import org.springframework.stereotype.Component;

/**
 * Adds equality and inequality clauses to a target's filter expression.
 */
@Component
public class QueryModifier {

    public enum Action {
        ADD_FILTER,
        ADD_FILTER_OUT
    }

    /**
     * Append {@code key='value'} or {@code key!='value'}, joined with {@code and}.
     * A null key leaves the target unchanged.
     */
    public QueryTarget modify(QueryTarget target, Action action, String key, String value) {
        if (action == null || key == null) {
            return target;
        }

        StringBuilder expression = new StringBuilder(target.getQuery() != null ? target.getQuery() : "");
        if (expression.length() > 0) {
            expression.append(" and ");
        }
        String operator = action == Action.ADD_FILTER ? "=" : "!=";
        expression.append(key).append(operator).append('\'').append(value != null ? value : "").append('\'');

        return target.toBuilder().query(expression.toString()).build();
    }
}
