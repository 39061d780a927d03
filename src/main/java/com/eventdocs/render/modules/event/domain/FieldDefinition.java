package com.eventdocs.render.modules.event.domain;

/**
 * Declared custom field of the event.
 *
 * @param id the exporter's field id, {@code null} for exports that key fields by name only
 * @param association the entity kind the field belongs to, {@code null} if the export does not say
 */
public record FieldDefinition(Integer id, String name, FieldDatatype datatype, FieldAssociation association) {

    public boolean appliesTo(FieldAssociation target) {
        return association == null || association == target;
    }
}
