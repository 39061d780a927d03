package com.eventdocs.render.modules.event.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum FieldAssociation {
    REGISTRATION(1),
    COURSE(2),
    LODGEMENT(3);

    private static final Map<Integer, FieldAssociation> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FieldAssociation::getCode, Function.identity()));

    private final int code;

    FieldAssociation(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static FieldAssociation fromCode(int code) {
        return BY_CODE.get(code);
    }
}
