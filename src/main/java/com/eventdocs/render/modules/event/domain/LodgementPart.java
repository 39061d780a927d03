package com.eventdocs.render.modules.event.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Occupancy of a lodgement during one event part.
 */
public class LodgementPart {

    private final Lodgement lodgement;
    private final EventPart part;
    private final List<Inhabitant> inhabitants = new ArrayList<>();

    public LodgementPart(Lodgement lodgement, EventPart part) {
        this.lodgement = lodgement;
        this.part = part;
    }

    public Lodgement getLodgement() {
        return lodgement;
    }

    public EventPart getPart() {
        return part;
    }

    public List<Inhabitant> getInhabitants() {
        return Collections.unmodifiableList(inhabitants);
    }

    // Called while loading only; the graph is not changed once built.
    public void addInhabitant(Registration registration, boolean campingMat) {
        inhabitants.add(new Inhabitant(registration, campingMat));
    }
}
