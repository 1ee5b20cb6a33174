package com.bulwark.core.store;

import com.bulwark.core.model.SecurityReport;

import java.io.IOException;

/**
 * Destination for finished review reports.
 * Implementations: JSON file (CLI, scheduled reviews). Others can be plugged in by the host application.
 */
public interface ReportSink {

    /**
     * Persist a report.
     *
     * @return Where the report ended up, recorded in the report's {@code reportPath}
     */
    String save(SecurityReport report) throws IOException;
}
