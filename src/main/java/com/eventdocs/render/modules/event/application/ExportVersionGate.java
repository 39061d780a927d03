package com.eventdocs.render.modules.event.application;

import org.springframework.stereotype.Component;

import com.eventdocs.render.global.error.UnsupportedExportException;
import com.eventdocs.render.modules.event.domain.SchemaVersion;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rejects exports this tool cannot read before any entity is built.
 */
@Component
public class ExportVersionGate {

    public static final String EXPECTED_KIND = "partial";
    public static final SchemaVersion MINIMUM_VERSION = SchemaVersion.of(12, 0);
    public static final SchemaVersion MAXIMUM_VERSION = SchemaVersion.of(15, Integer.MAX_VALUE);

    static final String KIND_KEY = "kind";
    static final String VERSION_KEY = "EVENT_SCHEMA_VERSION";

    private final SchemaVersion minimumVersion;
    private final SchemaVersion maximumVersion;

    public ExportVersionGate() {
        this(MINIMUM_VERSION, MAXIMUM_VERSION);
    }

    public ExportVersionGate(SchemaVersion minimumVersion, SchemaVersion maximumVersion) {
        this.minimumVersion = minimumVersion;
        this.maximumVersion = maximumVersion;
    }

    /**
     * @return the schema version of the accepted export
     * @throws UnsupportedExportException if the format marker or the schema version does not fit
     */
    public SchemaVersion check(JsonNode root) {
        JsonNode kind = root.path(KIND_KEY);
        if (!kind.isTextual() || !EXPECTED_KIND.equals(kind.textValue())) {
            throw new UnsupportedExportException("WRONG_EXPORT_KIND",
                    "Expected a '" + EXPECTED_KIND + "' export but found '" + kind.asText("") + "'");
        }

        SchemaVersion version = readVersion(root.path(VERSION_KEY));
        if (!version.isWithin(minimumVersion, maximumVersion)) {
            throw new UnsupportedExportException("UNSUPPORTED_SCHEMA_VERSION",
                    "Export schema version " + version + " is not within " + minimumVersion + " and " + maximumVersion,
                    version, minimumVersion, maximumVersion);
        }
        return version;
    }

    private SchemaVersion readVersion(JsonNode node) {
        if (node.isIntegralNumber()) {
            return SchemaVersion.of(versionNumber(node), 0);
        }
        if (node.isArray() && node.size() == 2 && node.get(0).isIntegralNumber() && node.get(1).isIntegralNumber()) {
            return SchemaVersion.of(versionNumber(node.get(0)), versionNumber(node.get(1)));
        }
        throw new UnsupportedExportException("MISSING_SCHEMA_VERSION",
                "Export does not declare a readable " + VERSION_KEY);
    }

    // Numbers beyond the int range would wrap around into the supported range.
    private int versionNumber(JsonNode node) {
        if (!node.canConvertToInt()) {
            throw new UnsupportedExportException("UNSUPPORTED_SCHEMA_VERSION",
                    "Export schema version number " + node.asText() + " is not within " + minimumVersion + " and "
                            + maximumVersion);
        }
        return node.intValue();
    }
}
