package com.eventdocs.render.modules.event.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Gender of a persona as coded by the exporter: 0 not specified, 1 male, 2 female, 3 other.
 */
public enum Gender {
    NOT_SPECIFIED(0),
    MALE(1),
    FEMALE(2),
    OTHER(3);

    private static final Map<Integer, Gender> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Gender::getCode, Function.identity()));

    private final int code;

    Gender(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return the gender for the exporter's code, or {@code null} if the code is unknown
     */
    public static Gender fromCode(int code) {
        return BY_CODE.get(code);
    }
}
