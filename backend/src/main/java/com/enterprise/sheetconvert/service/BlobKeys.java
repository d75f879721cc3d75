package com.enterprise.sheetconvert.service;

/**
 * Object keys for a job's uploaded PDF and generated workbook. Both live under the
 * owner and job id, so keys never collide across jobs with the same file name.
 */
public final class BlobKeys {

    public static final String DEFAULT_FILE_NAME = "document.pdf";

    private static final int MAX_NAME_LENGTH = 200;

    private BlobKeys() {
    }

    public static String sourceKey(String uploadPrefix, String ownerId, String jobId, String fileName) {
        return uploadPrefix + "/" + segment(ownerId) + "/" + jobId + "/" + safeName(fileName);
    }

    public static String resultKey(String resultPrefix, String ownerId, String jobId, String fileName) {
        String name = safeName(fileName);
        String baseName = name.replaceAll("\\.[^.]+$", "");
        if (baseName.isEmpty()) {
            baseName = "document";
        }
        return resultPrefix + "/" + segment(ownerId) + "/" + jobId + "/" + baseName + ".xlsx";
    }

    /**
     * The client's file name reduced to a single safe key segment. Blank names become
     * {@value #DEFAULT_FILE_NAME}.
     */
    public static String safeName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return DEFAULT_FILE_NAME;
        }
        String name = fileName.strip();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        name = segment(name.substring(slash + 1));
        if (name.isEmpty() || name.chars().allMatch(c -> c == '.' || c == '_')) {
            return DEFAULT_FILE_NAME;
        }
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(name.length() - MAX_NAME_LENGTH);
        }
        return name;
    }

    /**
     * Normalises a file name given by the client: blank becomes {@value #DEFAULT_FILE_NAME}.
     */
    public static String displayName(String fileName) {
        return fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName.strip();
    }

    private static String segment(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_").replaceAll("_{2,}", "_");
    }
}
