package com.eventdocs.render.modules.event.application;

import java.util.Collection;
import java.util.Comparator;

import com.eventdocs.render.modules.event.domain.Course;
import com.eventdocs.render.modules.event.domain.EventPart;
import com.eventdocs.render.modules.event.domain.EventTrack;
import com.eventdocs.render.modules.event.domain.Lodgement;
import com.eventdocs.render.modules.event.domain.LodgementGroup;
import com.eventdocs.render.modules.event.domain.Registration;

/**
 * Sort orders of the entity graph. Every order ends with the id, so no two entities compare equal.
 */
public final class EventOrdering {

    public static final Comparator<EventPart> PARTS = Comparator
            .comparing(EventPart::getBegin)
            .thenComparingInt(EventPart::getId);

    public static final Comparator<EventTrack> TRACKS = Comparator
            .comparingInt(EventTrack::getSortkey)
            .thenComparingInt(EventTrack::getId);

    public static final Comparator<LodgementGroup> LODGEMENT_GROUPS = Comparator
            .comparing(LodgementGroup::getTitle, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(LodgementGroup::getId);

    public static final Comparator<Lodgement> LODGEMENTS = Comparator
            .comparing(Lodgement::getTitle, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Lodgement::getId);

    public static final Comparator<Registration> REGISTRATIONS = Comparator
            .comparing((Registration registration) -> registration.getName().givenNames())
            .thenComparing(registration -> registration.getName().familyName())
            .thenComparingInt(Registration::getId);

    private static final char PADDING = '\0';

    private EventOrdering() {
    }

    /**
     * Orders courses by number, left-padded with a character below every printable one to the given width, so
     * shorter numbers come first and courses without number lead.
     */
    public static Comparator<Course> courses(int numberWidth) {
        return Comparator
                .comparing((Course course) -> courseSortKey(course.getNr(), numberWidth))
                .thenComparingInt(Course::getId);
    }

    public static Comparator<Course> courses(Collection<Course> courses) {
        return courses(maxNumberWidth(courses.stream().map(Course::getNr).toList()));
    }

    public static String courseSortKey(String nr, int width) {
        String value = nr != null ? nr : "";
        StringBuilder sb = new StringBuilder(width);
        for (int i = value.length(); i < width; i++) {
            sb.append(PADDING);
        }
        return sb.append(value).toString();
    }

    public static int maxNumberWidth(Collection<String> numbers) {
        return numbers.stream().mapToInt(nr -> nr != null ? nr.length() : 0).max().orElse(0);
    }
}
