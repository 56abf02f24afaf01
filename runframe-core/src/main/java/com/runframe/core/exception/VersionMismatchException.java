package com.runframe.core.exception;

import com.runframe.api.exception.RunFrameException;

/**
 * 数据存储版本与期望版本不一致
 */
public class VersionMismatchException extends RunFrameException {

    private final String expectedVersion;
    private final String reportedVersion;

    public VersionMismatchException(String expectedVersion, String reportedVersion) {
        super(String.format("Datastore reports a version number \"%s\" which doesn't match supplied version \"%s\"",
                reportedVersion, expectedVersion));
        this.expectedVersion = expectedVersion;
        this.reportedVersion = reportedVersion;
    }

    public String getExpectedVersion() {
        return expectedVersion;
    }

    public String getReportedVersion() {
        return reportedVersion;
    }
}
