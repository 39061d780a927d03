package com.eventdocs.render.modules.event.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import com.eventdocs.render.global.error.ProblemException;
import com.eventdocs.render.modules.event.domain.FieldAssociation;
import com.eventdocs.render.modules.event.domain.FieldDatatype;
import com.eventdocs.render.modules.event.domain.FieldDefinition;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pure conversions from exported JSON values to typed values.
 */
public final class ExportValueParser {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private static final DateTimeFormatter DATETIME_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .appendOffset("+HHMM", "Z")
            .toFormatter();

    private static final Pattern OFFSET_COLON = Pattern.compile("([+-]\\d{2}):(\\d{2})$");

    private ExportValueParser() {
    }

    public static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value, DATE_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new ProblemException("MALFORMED_DATE", "Invalid date '" + value + "'", ex);
        }
    }

    /**
     * Parses an ISO-8601 timestamp with numeric offset. Colons inside the offset are dropped first, so
     * {@code +02:00} and {@code +0200} are both accepted.
     */
    public static OffsetDateTime parseDateTime(String value) {
        if (value == null) {
            return null;
        }
        String normalized = OFFSET_COLON.matcher(value.trim()).replaceFirst("$1$2");
        try {
            return OffsetDateTime.parse(normalized, DATETIME_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new ProblemException("MALFORMED_DATETIME", "Invalid timestamp '" + value + "'", ex);
        }
    }

    /**
     * Full years between {@code birthday} and {@code reference}; the year counts once the birthday's month and day
     * have been reached.
     */
    public static int age(LocalDate reference, LocalDate birthday) {
        int years = reference.getYear() - birthday.getYear();
        if (reference.getMonthValue() < birthday.getMonthValue()
                || (reference.getMonthValue() == birthday.getMonthValue()
                    && reference.getDayOfMonth() < birthday.getDayOfMonth())) {
            years--;
        }
        return years;
    }

    /**
     * Decodes the custom field values of one entity. Fields without a declaration for the entity's association are
     * dropped, JSON nulls stay {@code null}.
     */
    public static Map<String, Object> decodeFields(JsonNode fieldsNode, Map<String, FieldDefinition> definitions,
                                                   FieldAssociation association) {
        if (fieldsNode == null || !fieldsNode.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, Object> decoded = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = fieldsNode.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> entry = iterator.next();
            FieldDefinition definition = definitions.get(entry.getKey());
            if (definition == null || !definition.appliesTo(association)) {
                continue;
            }
            decoded.put(entry.getKey(), coerce(entry.getValue(), definition.datatype()));
        }
        return decoded;
    }

    public static Object coerce(JsonNode value, FieldDatatype datatype) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return switch (datatype) {
            case STRING -> value.asText();
            case BOOLEAN -> value.isBoolean() ? value.booleanValue() : Boolean.parseBoolean(value.asText());
            case INTEGER -> value.isNumber() ? Integer.valueOf(value.intValue()) : parseInteger(value.asText());
            case FLOAT -> value.isNumber() ? Double.valueOf(value.doubleValue()) : parseDouble(value.asText());
            case DATE -> parseDate(value.asText());
            case DATETIME -> parseDateTime(value.asText());
        };
    }

    private static Integer parseInteger(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new ProblemException("MALFORMED_VALUE", "Invalid integer '" + value + "'", ex);
        }
    }

    private static Double parseDouble(String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new ProblemException("MALFORMED_VALUE", "Invalid number '" + value + "'", ex);
        }
    }
}
