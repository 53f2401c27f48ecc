package com.myorg.blockquota.jdbc.update;

import java.util.List;

public record SqlStatement(String sql, List<Object> args) {

    public Object[] argArray() {
        return args.toArray();
    }
}
