package com.eventdocs.render.modules.event.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LodgementGroup {

    private final int id;
    private final String title;
    private final List<Lodgement> lodgements = new ArrayList<>();

    public LodgementGroup(int id, String title) {
        this.id = id;
        this.title = title;
    }

    public int getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public List<Lodgement> getLodgements() {
        return Collections.unmodifiableList(lodgements);
    }

    // Called while loading only; the graph is not changed once built.
    public void addLodgement(Lodgement lodgement) {
        lodgements.add(lodgement);
    }

    @Override
    public String toString() {
        return "LodgementGroup(" + id + ", " + title + ")";
    }
}
