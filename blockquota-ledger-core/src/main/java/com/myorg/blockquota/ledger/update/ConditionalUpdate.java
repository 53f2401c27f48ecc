package com.myorg.blockquota.ledger.update;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compare-and-swap over one entity type: write {@link #values()} to every row whose columns match
 * {@link #expected()} and every {@link #filters()} predicate.
 *
 * <p>Values are keyed by {@link Field} so a write aimed at another entity type is detectable; the
 * updater refuses it instead of issuing a multi-table update.
 *
 * <p>Soft-deleted rows are skipped unless {@link Builder#includeDeleted()} or {@link Builder#onlyDeleted()}
 * says otherwise; entities without a {@code deleted} column are not filtered.
 */
public final class ConditionalUpdate {

    public enum DeletedRows { EXCLUDE, INCLUDE, ONLY }

    private final EntityType entity;
    private final Map<Field, UpdateValue> values;
    private final Map<String, Condition> expected;
    private final List<SqlPredicate> filters;
    private final List<String> order;
    private final DeletedRows deletedRows;
    private final String projectId;

    private ConditionalUpdate(Builder b) {
        this.entity = Objects.requireNonNull(b.entity, "entity");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(b.values));
        this.expected = Collections.unmodifiableMap(new LinkedHashMap<>(b.expected));
        this.filters = List.copyOf(b.filters);
        this.order = List.copyOf(b.order);
        this.deletedRows = b.deletedRows;
        this.projectId = b.projectId;
    }

    public static Builder on(EntityType entity) {
        return new Builder(entity);
    }

    public EntityType entity() { return entity; }
    public Map<Field, UpdateValue> values() { return values; }
    public Map<String, Condition> expected() { return expected; }
    public List<SqlPredicate> filters() { return filters; }
    public List<String> order() { return order; }
    public DeletedRows deletedRows() { return deletedRows; }
    /** Restricts the update to this project's rows; null = any project. */
    public String projectId() { return projectId; }

    @Override
    public String toString() {
        return "ConditionalUpdate{" + entity + " set=" + values.keySet() + " expected=" + expected.keySet() + "}";
    }

    public static final class Builder {
        private final EntityType entity;
        private final Map<Field, UpdateValue> values = new LinkedHashMap<>();
        private final Map<String, Condition> expected = new LinkedHashMap<>();
        private final List<SqlPredicate> filters = new ArrayList<>();
        private final List<String> order = new ArrayList<>();
        private DeletedRows deletedRows = DeletedRows.EXCLUDE;
        private String projectId;

        private Builder(EntityType entity) {
            this.entity = entity;
        }

        /** Column of the target entity. Plain objects are literals. */
        public Builder set(String column, Object value) {
            values.put(new Field(entity, column), UpdateValue.of(value));
            return this;
        }

        public Builder set(Field field, Object value) {
            values.put(field, UpdateValue.of(value));
            return this;
        }

        /** Plain object = equality, collection = IN, or an explicit {@link Condition}. */
        public Builder expect(String column, Object condition) {
            expected.put(column, Condition.of(condition));
            return this;
        }

        public Builder filter(SqlPredicate predicate) {
            filters.add(predicate);
            return this;
        }

        public Builder filter(String clause, Object... args) {
            return filter(SqlPredicate.of(clause, args));
        }

        /** Columns to assign first, in this order. */
        public Builder order(String... columns) {
            Collections.addAll(order, columns);
            return this;
        }

        public Builder includeDeleted() {
            deletedRows = DeletedRows.INCLUDE;
            return this;
        }

        public Builder onlyDeleted() {
            deletedRows = DeletedRows.ONLY;
            return this;
        }

        public Builder projectOnly(String projectId) {
            this.projectId = Objects.requireNonNull(projectId, "projectId");
            return this;
        }

        public ConditionalUpdate build() {
            if (values.isEmpty()) throw new IllegalArgumentException("conditional update needs at least one value");
            return new ConditionalUpdate(this);
        }
    }
}
