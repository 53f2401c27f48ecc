package com.myorg.blockquota.ledger.update;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Extra WHERE fragment with positional {@code ?} parameters, for conditions the expected values cannot
 * express (sub-selects, comparisons against other columns).
 */
public record SqlPredicate(String clause, List<Object> args) {

    public SqlPredicate {
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static SqlPredicate of(String clause, Object... args) {
        return new SqlPredicate(clause, Arrays.asList(args));
    }

    public int placeholderCount() {
        if (clause == null) return 0;
        int n = 0;
        boolean quoted = false;
        for (int i = 0; i < clause.length(); i++) {
            char c = clause.charAt(i);
            if (c == '\'') quoted = !quoted;
            else if (c == '?' && !quoted) n++;
        }
        return n;
    }
}
