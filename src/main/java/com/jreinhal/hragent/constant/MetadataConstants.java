package com.jreinhal.hragent.constant;

/**
 * Metadata keys written by the ingestion side and read when turning store documents into passages.
 */
public final class MetadataConstants {
    public static final String SOURCE_KEY = "source";
    public static final String TITLE_KEY = "title";
    public static final String DOCUMENT_TITLE_KEY = "document_title";
    public static final String DOCUMENT_FILENAME_KEY = "document_filename";
    public static final String ORIGINAL_FILE_KEY = "original_file";
    public static final String PROVINCE_KEY = "province";
    public static final String TIMESTAMP_KEY = "timestamp";
    public static final String CREATED_AT_KEY = "created_at";
    public static final String DISTANCE_KEY = "distance";

    private MetadataConstants() {
    }
}
