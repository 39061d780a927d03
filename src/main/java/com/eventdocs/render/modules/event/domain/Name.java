package com.eventdocs.render.modules.event.domain;

/**
 * Naming attributes of a persona. Each view serves a different kind of document and they are not interchangeable.
 */
public record Name(
    String title,
    String givenNames,
    String familyName,
    String nameSupplement,
    String displayName
) {
    public Name {
        title = title != null ? title : "";
        givenNames = givenNames != null ? givenNames : "";
        familyName = familyName != null ? familyName : "";
        nameSupplement = nameSupplement != null ? nameSupplement : "";
        displayName = displayName != null ? displayName : "";
    }

    /**
     * Forename for running text: the display name if it is part of the given names, the given names otherwise.
     */
    public String commonForename() {
        if (!displayName.isBlank() && givenNames.contains(displayName)) {
            return displayName;
        }
        return givenNames;
    }

    public String common() {
        return join(commonForename(), familyName);
    }

    /**
     * Direct address, e.g. in the opening line of a letter.
     */
    public String salutation() {
        return displayName.isBlank() ? givenNames : displayName;
    }

    public String legal() {
        StringBuilder sb = new StringBuilder();
        if (!title.isBlank()) {
            sb.append(title).append(' ');
        }
        sb.append(join(givenNames, familyName));
        if (!nameSupplement.isBlank()) {
            sb.append(' ').append(nameSupplement);
        }
        return sb.toString();
    }

    public String nametagForename() {
        return salutation();
    }

    // The given names move to the surname line whenever the printed forename differs from them.
    public String nametagSurname() {
        if (hasDistinctDisplayName()) {
            return join(givenNames, familyName);
        }
        return familyName;
    }

    public String nametag() {
        return join(nametagForename(), nametagSurname());
    }

    public String organizational() {
        if (hasDistinctDisplayName()) {
            return join(givenNames + " (" + displayName + ")", familyName);
        }
        return join(givenNames, familyName);
    }

    public boolean hasDistinctDisplayName() {
        return !displayName.isBlank() && !displayName.equals(givenNames);
    }

    private static String join(String first, String second) {
        if (first.isBlank()) {
            return second;
        }
        if (second.isBlank()) {
            return first;
        }
        return first + " " + second;
    }
}
