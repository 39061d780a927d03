package com.eventdocs.render.modules.event.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Registration {

    private final int id;
    private final Persona persona;
    private final Integer age;
    private final boolean listConsent;
    private final Map<String, Object> fields;
    private Map<Integer, RegistrationPart> parts = new LinkedHashMap<>();
    private Map<Integer, RegistrationTrack> tracks = new LinkedHashMap<>();

    /**
     * @param age age at the begin of the event, {@code null} if the birthday is unknown
     */
    public Registration(int id, Persona persona, Integer age, boolean listConsent, Map<String, Object> fields) {
        this.id = id;
        this.persona = persona;
        this.age = age;
        this.listConsent = listConsent;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public int getId() {
        return id;
    }

    public Persona getPersona() {
        return persona;
    }

    public int getPersonaId() {
        return persona.id();
    }

    public Name getName() {
        return persona.name();
    }

    public Gender getGender() {
        return persona.gender();
    }

    public LocalDate getBirthday() {
        return persona.birthday();
    }

    public String getEmail() {
        return persona.email();
    }

    public String getTelephone() {
        return persona.telephone();
    }

    public String getMobile() {
        return persona.mobile();
    }

    public Address getAddress() {
        return persona.address();
    }

    public boolean isOrga() {
        return persona.orga();
    }

    public Integer getAge() {
        return age;
    }

    // Unknown birthdays count as adult.
    public AgeClass getAgeClass() {
        return age == null ? AgeClass.FULL : AgeClass.of(age);
    }

    public boolean isMinor() {
        return getAgeClass().isMinor();
    }

    public boolean isListConsent() {
        return listConsent;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Object getField(String name) {
        return fields.get(name);
    }

    /**
     * @return registration parts keyed by event part id, in event part order
     */
    public Map<Integer, RegistrationPart> getParts() {
        return Collections.unmodifiableMap(parts);
    }

    public RegistrationPart getPart(EventPart part) {
        return parts.get(part.getId());
    }

    // Called while loading only; the graph is not changed once built.
    public void setParts(Map<Integer, RegistrationPart> parts) {
        this.parts = new LinkedHashMap<>(parts);
    }

    /**
     * @return registration tracks keyed by event track id, in event track order
     */
    public Map<Integer, RegistrationTrack> getTracks() {
        return Collections.unmodifiableMap(tracks);
    }

    public RegistrationTrack getTrack(EventTrack track) {
        return tracks.get(track.getId());
    }

    // Called while loading only; the graph is not changed once built.
    public void setTracks(Map<Integer, RegistrationTrack> tracks) {
        this.tracks = new LinkedHashMap<>(tracks);
    }

    public boolean isPresent() {
        return parts.values().stream().anyMatch(part -> part.getStatus().isPresent());
    }

    public boolean isParticipant() {
        return parts.values().stream().anyMatch(part -> part.getStatus().isParticipant());
    }

    public boolean isInvolved() {
        return parts.values().stream().anyMatch(part -> part.getStatus().isInvolved());
    }

    @Override
    public String toString() {
        return "Registration(" + id + ", " + persona.name().common() + ")";
    }
}
