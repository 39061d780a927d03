package com.eventdocs.render.modules.event.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum FieldDatatype {
    STRING(1),
    BOOLEAN(2),
    INTEGER(3),
    FLOAT(4),
    DATE(5),
    DATETIME(6);

    private static final Map<Integer, FieldDatatype> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FieldDatatype::getCode, Function.identity()));

    private final int code;

    FieldDatatype(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static FieldDatatype fromCode(int code) {
        return BY_CODE.get(code);
    }
}
