package com.eventdocs.render.modules.event.domain;

import java.time.LocalDate;

/**
 * Account data of the person behind a registration, as exported with the registration.
 */
public record Persona(
    int id,
    Name name,
    Gender gender,
    LocalDate birthday,
    String email,
    String telephone,
    String mobile,
    Address address,
    boolean orga
) {
}
