package com.eventdocs.render.modules.event.domain;

public class RegistrationPart {

    private final Registration registration;
    private final EventPart part;
    private final RegistrationPartStatus status;
    private final Lodgement lodgement;
    private final boolean campingMat;

    public RegistrationPart(Registration registration, EventPart part, RegistrationPartStatus status,
                            Lodgement lodgement, boolean campingMat) {
        this.registration = registration;
        this.part = part;
        this.status = status;
        this.lodgement = lodgement;
        this.campingMat = campingMat;
    }

    public static RegistrationPart notApplied(Registration registration, EventPart part) {
        return new RegistrationPart(registration, part, RegistrationPartStatus.NOT_APPLIED, null, false);
    }

    public Registration getRegistration() {
        return registration;
    }

    public EventPart getPart() {
        return part;
    }

    public RegistrationPartStatus getStatus() {
        return status;
    }

    /**
     * @return the assigned lodgement, or {@code null}
     */
    public Lodgement getLodgement() {
        return lodgement;
    }

    public boolean isCampingMat() {
        return campingMat;
    }
}
