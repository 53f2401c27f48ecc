package com.myorg.blockquota.jdbc.update;

import com.myorg.blockquota.contracts.core.exception.ProgrammingErrorException;
import com.myorg.blockquota.ledger.update.CaseValue;
import com.myorg.blockquota.ledger.update.Condition;
import com.myorg.blockquota.ledger.update.ConditionalUpdate;
import com.myorg.blockquota.ledger.update.EntityType;
import com.myorg.blockquota.ledger.update.Field;
import com.myorg.blockquota.ledger.update.SqlPredicate;
import com.myorg.blockquota.ledger.update.UpdateValue;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a {@link ConditionalUpdate} as one {@code UPDATE ... SET ... WHERE ...} statement.
 *
 * <p>Engines disagree on whether a SET item sees the old or the already assigned value of another
 * column (MySQL assigns left to right, PostgreSQL and H2 always read the old row). Assignments are
 * therefore emitted as: the caller's explicit order, then column references and expressions, then CASE
 * values, then literals. {@code previous_status = status, status = 'retyping'} then gives the same row on
 * every engine.
 */
public final class ConditionalUpdateSql {

    public static final String UPDATED_AT = "updated_at";
    public static final String DELETED = "deleted";
    public static final String PROJECT_ID = "project_id";

    private ConditionalUpdateSql() {}

    public static SqlStatement render(ConditionalUpdate update, Instant now) {
        EntityType entity = update.entity();
        checkIsNotMultiTable(update);

        List<Object> args = new ArrayList<>();
        StringJoiner set = new StringJoiner(", ");
        for (Map.Entry<String, UpdateValue> e : orderedValues(update, now).entrySet()) {
            set.add(e.getKey() + " = " + valueSql(entity, e.getValue(), args));
        }

        StringJoiner where = new StringJoiner(" AND ");
        for (Map.Entry<String, Condition> e : update.expected().entrySet()) {
            where.add(conditionSql(entity.requireColumn(e.getKey()), e.getValue(), args));
        }
        for (SqlPredicate p : update.filters()) {
            checkPredicate(p);
            where.add("(" + p.clause() + ")");
            for (Object a : p.args()) args.add(toJdbc(a));
        }
        if (update.projectId() != null) {
            where.add(entity.requireColumn(PROJECT_ID) + " = ?");
            args.add(update.projectId());
        }
        String deleted = deletedSql(update);
        if (deleted != null) where.add(deleted);

        String sql = "UPDATE " + entity.table() + " SET " + set
                + (where.length() == 0 ? "" : " WHERE " + where);
        return new SqlStatement(sql, args);
    }

    static void checkIsNotMultiTable(ConditionalUpdate update) {
        EntityType entity = update.entity();
        for (Field f : update.values().keySet()) {
            if (!f.entity().equals(entity)) {
                throw new ProgrammingErrorException("Conditional update on " + entity
                        + " cannot write " + f + ": multi-table updates are not supported");
            }
            entity.requireColumn(f.column());
        }
    }

    static String deletedSql(ConditionalUpdate update) {
        boolean softDeletes = update.entity().columns().contains(DELETED);
        switch (update.deletedRows()) {
            case EXCLUDE:
                return softDeletes ? DELETED + " = FALSE" : null;
            case ONLY:
                if (!softDeletes) {
                    throw new ProgrammingErrorException("Entity " + update.entity() + " has no deleted rows to select");
                }
                return DELETED + " = TRUE";
            default:
                return null;
        }
    }

    static Map<String, UpdateValue> orderedValues(ConditionalUpdate update, Instant now) {
        Map<String, UpdateValue> byColumn = new LinkedHashMap<>();
        update.values().forEach((f, v) -> byColumn.put(f.column(), v));

        Map<String, UpdateValue> ordered = new LinkedHashMap<>();
        for (String column : update.order()) {
            UpdateValue v = byColumn.get(column);
            if (v == null) {
                throw new ProgrammingErrorException("Ordered field " + column + " is not one of the updated fields");
            }
            ordered.put(column, v);
        }

        List<Map.Entry<String, UpdateValue>> fieldRefs = new ArrayList<>();
        List<Map.Entry<String, UpdateValue>> cases = new ArrayList<>();
        List<Map.Entry<String, UpdateValue>> literals = new ArrayList<>();
        for (Map.Entry<String, UpdateValue> e : byColumn.entrySet()) {
            if (ordered.containsKey(e.getKey())) continue;
            // CASE first: it reads the row too but belongs after plain references
            if (e.getValue() instanceof CaseValue) cases.add(e);
            else if (e.getValue().readsRow()) fieldRefs.add(e);
            else literals.add(e);
        }
        fieldRefs.forEach(e -> ordered.put(e.getKey(), e.getValue()));
        cases.forEach(e -> ordered.put(e.getKey(), e.getValue()));
        literals.forEach(e -> ordered.put(e.getKey(), e.getValue()));

        if (update.entity().columns().contains(UPDATED_AT) && !ordered.containsKey(UPDATED_AT)) {
            ordered.put(UPDATED_AT, UpdateValue.literal(now));
        }
        return ordered;
    }

    private static String valueSql(EntityType entity, UpdateValue value, List<Object> args) {
        if (value instanceof UpdateValue.Literal l) {
            args.add(toJdbc(l.value()));
            return "?";
        }
        if (value instanceof UpdateValue.FieldRef r) {
            return entity.requireColumn(r.column());
        }
        if (value instanceof UpdateValue.Expression x) {
            args.add(toJdbc(x.operand()));
            return "(" + entity.requireColumn(x.column()) + " " + x.operator() + " ?)";
        }
        if (value instanceof CaseValue c) {
            StringBuilder sb = new StringBuilder("CASE");
            for (CaseValue.When w : c.whens()) {
                sb.append(" WHEN ").append(conditionSql(entity.requireColumn(w.column()), w.condition(), args));
                sb.append(" THEN ").append(valueSql(entity, w.then(), args));
            }
            sb.append(" ELSE ").append(valueSql(entity, c.otherwise(), args)).append(" END");
            return sb.toString();
        }
        throw new ProgrammingErrorException("Unknown value type " + value.getClass().getName()
                + ", must be a literal, field reference, expression or CASE");
    }

    static String conditionSql(String column, Condition condition, List<Object> args) {
        String match = matchSql(column, condition.values(), args);
        if (condition.kind() == Condition.Kind.MATCH) return match;

        String result = "NOT " + match;
        if (condition.autoNone() && !condition.containsNull()) {
            result = "(" + result + " OR " + column + " IS NULL)";
        }
        return result;
    }

    private static String matchSql(String column, List<Object> values, List<Object> args) {
        List<Object> nonNull = new ArrayList<>();
        boolean hasNull = false;
        for (Object v : values) {
            if (v == null) hasNull = true;
            else nonNull.add(v);
        }

        StringJoiner or = new StringJoiner(" OR ", "(", ")");
        if (nonNull.size() == 1) {
            or.add(column + " = ?");
        } else if (!nonNull.isEmpty()) {
            StringJoiner in = new StringJoiner(", ", column + " IN (", ")");
            nonNull.forEach(x -> in.add("?"));
            or.add(in.toString());
        }
        for (Object v : nonNull) args.add(toJdbc(v));
        if (hasNull) or.add(column + " IS NULL");
        return or.toString();
    }

    private static void checkPredicate(SqlPredicate p) {
        if (p.clause() == null || p.clause().isBlank()) {
            throw new ProgrammingErrorException("Conditional update filter must not be blank");
        }
        if (p.placeholderCount() != p.args().size()) {
            throw new ProgrammingErrorException("Conditional update filter '" + p.clause() + "' has "
                    + p.placeholderCount() + " placeholders but " + p.args().size() + " arguments");
        }
    }

    static Object toJdbc(Object value) {
        if (value instanceof Instant i) return Timestamp.from(i);
        if (value instanceof Enum<?> e) return e.name();
        return value;
    }
}
