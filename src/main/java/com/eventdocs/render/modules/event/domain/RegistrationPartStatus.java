package com.eventdocs.render.modules.event.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Participation status of a registration in one event part, decoded from the exporter's integer codes.
 */
public enum RegistrationPartStatus {
    NOT_APPLIED(-1),
    APPLIED(1),
    PARTICIPANT(2),
    WAITLIST(3),
    GUEST(4),
    CANCELLED(5),
    REJECTED(6);

    private static final Map<Integer, RegistrationPartStatus> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RegistrationPartStatus::getCode, Function.identity()));

    private final int code;

    RegistrationPartStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isPresent() {
        return this == PARTICIPANT || this == GUEST;
    }

    public boolean isParticipant() {
        return this == PARTICIPANT;
    }

    public boolean isInvolved() {
        return this == APPLIED || this == PARTICIPANT || this == WAITLIST || this == GUEST;
    }

    public static RegistrationPartStatus fromCode(int code) {
        return BY_CODE.get(code);
    }
}
