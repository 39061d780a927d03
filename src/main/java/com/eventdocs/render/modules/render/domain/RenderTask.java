package com.eventdocs.render.modules.render.domain;

import java.util.Map;

/**
 * One document to render: template, job name of the output files, template arguments and whether the document
 * compiler has to run twice (references, tables of contents, long tables).
 */
public record RenderTask(
    String templateName,
    String jobName,
    Map<String, Object> arguments,
    boolean compileTwice
) {
    public RenderTask {
        if (templateName == null || templateName.isBlank()) {
            throw new IllegalArgumentException("templateName must not be blank");
        }
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("jobName must not be blank");
        }
        arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
    }
}
