package com.examparse.common.util;

import com.examparse.common.constants.FileTypes;

public final class FileUtils {

    private FileUtils() {}

    public static String getFileExtension(String filename) {
        if (filename == null || filename.isEmpty()) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot == -1 || lastDot == filename.length() - 1) {
            return "";
        }
        return filename.substring(lastDot + 1).toLowerCase();
    }

    /**
     * Accepts a file when either its extension or its declared content type says PDF.
     */
    public static boolean isPdf(String filename, String contentType) {
        if (contentType != null && FileTypes.PDF_MIME_TYPE.equalsIgnoreCase(contentType)) {
            return true;
        }
        return FileTypes.PDF_EXTENSION.equals(getFileExtension(filename));
    }

    public static String sanitizeFileName(String filename) {
        if (filename == null) {
            return "unnamed";
        }
        return filename.replaceAll("[^\\p{L}\\p{N}._-]", "_");
    }
}
