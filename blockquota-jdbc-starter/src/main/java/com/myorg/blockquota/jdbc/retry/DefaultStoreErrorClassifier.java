package com.myorg.blockquota.jdbc.retry;

import com.myorg.blockquota.contracts.core.exception.BlockQuotaNonRetryableException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;

import java.sql.SQLException;
import java.util.Set;

// Spring's exception translation covers most drivers; the SQLState / vendor code fallback catches
// what ends up as an uncategorized SQL exception.
public class DefaultStoreErrorClassifier implements StoreErrorClassifier {

    private static final Set<String> DEADLOCK_STATES = Set.of("40001", "40P01");
    private static final Set<Integer> MYSQL_DEADLOCK_CODES = Set.of(1205, 1213);
    private static final int MYSQL_DUPLICATE_CODE = 1062;
    // lock timeout, concurrent update of the same row
    private static final Set<Integer> H2_CONFLICT_CODES = Set.of(50200, 90131);

    @Override
    public StoreErrorKind classify(Throwable ex) {
        if (ex == null || ex instanceof BlockQuotaNonRetryableException) {
            return StoreErrorKind.NON_TRANSIENT;
        }

        // 1) translated Spring exceptions
        if (ex instanceof DuplicateKeyException) return StoreErrorKind.DUPLICATE_KEY;
        if (ex instanceof PessimisticLockingFailureException) return StoreErrorKind.DEADLOCK;

        // 2) raw driver exception
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        if (root instanceof SQLException sql) {
            String state = sql.getSQLState();
            if (state != null && DEADLOCK_STATES.contains(state)) return StoreErrorKind.DEADLOCK;
            if (MYSQL_DEADLOCK_CODES.contains(sql.getErrorCode()) || H2_CONFLICT_CODES.contains(sql.getErrorCode())) {
                return StoreErrorKind.DEADLOCK;
            }
            if ("23505".equals(state) || sql.getErrorCode() == MYSQL_DUPLICATE_CODE) {
                return StoreErrorKind.DUPLICATE_KEY;
            }
        }

        return StoreErrorKind.NON_TRANSIENT;
    }
}
