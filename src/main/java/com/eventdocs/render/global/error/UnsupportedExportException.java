package com.eventdocs.render.global.error;

import com.eventdocs.render.modules.event.domain.SchemaVersion;

public class UnsupportedExportException extends ProblemException {

    private final SchemaVersion foundVersion;
    private final SchemaVersion minimumVersion;
    private final SchemaVersion maximumVersion;

    public UnsupportedExportException(String code, String detail) {
        this(code, detail, null, null, null);
    }

    public UnsupportedExportException(String code, String detail, SchemaVersion foundVersion,
                                      SchemaVersion minimumVersion, SchemaVersion maximumVersion) {
        super(code, detail);
        this.foundVersion = foundVersion;
        this.minimumVersion = minimumVersion;
        this.maximumVersion = maximumVersion;
    }

    public SchemaVersion getFoundVersion() {
        return foundVersion;
    }

    public SchemaVersion getMinimumVersion() {
        return minimumVersion;
    }

    public SchemaVersion getMaximumVersion() {
        return maximumVersion;
    }
}
