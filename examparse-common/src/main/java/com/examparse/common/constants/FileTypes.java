package com.examparse.common.constants;

public final class FileTypes {
    public static final String PDF_EXTENSION = "pdf";
    public static final String PDF_MIME_TYPE = "application/pdf";
    public static final String PNG_MIME_TYPE = "image/png";

    public static final long MAX_FILE_SIZE_BYTES = 50L * 1024 * 1024; // 50MB

    private FileTypes() {}
}
