package com.vuong.pgconnect.core.domain.specification;

import com.vuong.pgconnect.exception.QueryException;
import org.hibernate.query.CommonQueryContract;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A caller supplied predicate with positional arguments, e.g. {@code "status = ? and age > ?"}.
 * <p>
 * The expression is an HQL condition over the entity's attribute names. Plain {@code ?} placeholders
 * are numbered ({@code ?1}, {@code ?2}, ...) because HQL only accepts ordinal parameters;
 * placeholders that are already numbered and question marks inside quoted literals are kept as they are.
 * Collection and array arguments are bound as parameter lists, so {@code "status in ?"} takes a list.
 * An array passed as the only argument must be cast to {@code Object}, otherwise varargs spreads it
 * into separate arguments.
 */
public final class WhereClause {

    private static final WhereClause NONE = new WhereClause(null, List.of(), 0);

    private final String expression;
    private final List<Object> arguments;
    private final int placeholderCount;

    private WhereClause(String expression, List<Object> arguments, int placeholderCount) {
        this.expression = expression;
        this.arguments = arguments;
        this.placeholderCount = placeholderCount;
    }

    /**
     * Parses an expression and its arguments.
     * @param expression the predicate, or null/blank for no filtering
     * @param args positional arguments, in placeholder order; copied, may contain nulls
     * @return the clause
     * @throws QueryException if the number of placeholders differs from the number of arguments
     */
    public static WhereClause of(String expression, Object... args) {
        List<Object> arguments = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
        if (!StringUtils.hasText(expression)) {
            if (!arguments.isEmpty()) {
                throw new QueryException("Got " + arguments.size() + " argument(s) but no filter expression");
            }
            return NONE;
        }

        StringBuilder hql = new StringBuilder(expression.length() + 8);
        int highest = 0;
        int next = 0;
        char quote = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                hql.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                hql.append(c);
            } else if (c == '?') {
                int digitsEnd = i + 1;
                while (digitsEnd < expression.length() && Character.isDigit(expression.charAt(digitsEnd))) {
                    digitsEnd++;
                }
                if (digitsEnd > i + 1) {
                    int position = Integer.parseInt(expression.substring(i + 1, digitsEnd));
                    highest = Math.max(highest, position);
                    hql.append(expression, i, digitsEnd);
                    i = digitsEnd - 1;
                } else {
                    next++;
                    hql.append('?').append(next);
                }
            } else {
                hql.append(c);
            }
        }

        if (next > 0 && highest > 0) {
            throw new QueryException("Cannot mix '?' and '?N' placeholders in: " + expression);
        }
        int placeholders = Math.max(next, highest);
        if (placeholders != arguments.size()) {
            throw new QueryException("Filter expression '" + expression + "' expects " + placeholders
                    + " argument(s) but got " + arguments.size());
        }
        return new WhereClause(hql.toString(), arguments, placeholders);
    }

    public static WhereClause none() {
        return NONE;
    }

    public boolean isEmpty() {
        return expression == null;
    }

    /**
     * @return the HQL condition with numbered placeholders, or null when empty
     */
    public String getExpression() {
        return expression;
    }

    public List<Object> getArguments() {
        return arguments;
    }

    public int getPlaceholderCount() {
        return placeholderCount;
    }

    /**
     * Appends {@code " where <expression>"} to the given statement unless the clause is empty.
     * @param statement an HQL statement such as {@code "from Account"}
     * @return the statement with the condition applied
     */
    public String appendTo(String statement) {
        return isEmpty() ? statement : statement + " where " + expression;
    }

    /**
     * Binds the arguments to their ordinal parameters.
     * @param query the query created from {@link #appendTo(String)}
     * @param <Q> the query type
     * @return the same query
     */
    public <Q extends CommonQueryContract> Q bind(Q query) {
        for (int i = 0; i < arguments.size(); i++) {
            Object argument = arguments.get(i);
            int position = i + 1;
            if (argument instanceof Collection<?> values) {
                query.setParameterList(position, values);
            } else if (argument instanceof Object[] values) {
                query.setParameterList(position, values);
            } else {
                query.setParameter(position, argument);
            }
        }
        return query;
    }

    @Override
    public String toString() {
        return isEmpty() ? "<none>" : expression + " " + arguments;
    }
}
