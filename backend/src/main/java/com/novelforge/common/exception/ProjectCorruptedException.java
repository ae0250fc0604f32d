package com.novelforge.common.exception;

/**
 * 项目级存储损坏，需运维介入，不做重试
 */
public class ProjectCorruptedException extends NovelMemoryException {

    private final String projectId;

    public ProjectCorruptedException(String projectId, String message, Throwable cause) {
        super("项目存储损坏[" + projectId + "]: " + message, "PROJECT_CORRUPTED", cause);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
