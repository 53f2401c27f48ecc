package com.myorg.blockquota.jdbc.retry;

public interface StoreErrorClassifier {

    StoreErrorKind classify(Throwable ex);
}
