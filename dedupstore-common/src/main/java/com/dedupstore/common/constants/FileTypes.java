package com.dedupstore.common.constants;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public final class FileTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "bmp", "webp", "ico", "svg", "tif", "tiff");
    public static final Set<String> DOCUMENT_EXTENSIONS = Set.of("pdf", "doc", "docx", "txt", "rtf", "odt");
    public static final Set<String> SPREADSHEET_EXTENSIONS = Set.of("xls", "xlsx", "csv", "ods");
    public static final Set<String> PRESENTATION_EXTENSIONS = Set.of("ppt", "pptx", "odp");
    public static final Set<String> ARCHIVE_EXTENSIONS = Set.of("zip", "rar", "7z", "tar", "gz", "bz2");
    public static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "avi", "mov", "wmv", "flv", "mkv", "webm");
    public static final Set<String> AUDIO_EXTENSIONS = Set.of("mp3", "wav", "flac", "aac", "ogg", "m4a");
    public static final Set<String> DATA_EXTENSIONS = Set.of("json", "xml", "yaml", "yml");
    public static final Set<String> TEXT_EXTENSIONS = Set.of("md", "log");

    /**
     * Accepted mime types per extension. The first entry is the type assumed when the
     * client did not declare one.
     */
    private static final Map<String, List<String>> EXPECTED_MIME_TYPES = Map.ofEntries(
        Map.entry("jpg", List.of("image/jpeg")),
        Map.entry("jpeg", List.of("image/jpeg")),
        Map.entry("png", List.of("image/png")),
        Map.entry("gif", List.of("image/gif")),
        Map.entry("bmp", List.of("image/bmp", "image/x-ms-bmp")),
        Map.entry("webp", List.of("image/webp")),
        Map.entry("ico", List.of("image/x-icon", "image/vnd.microsoft.icon")),
        Map.entry("svg", List.of("image/svg+xml")),
        Map.entry("tif", List.of("image/tiff")),
        Map.entry("tiff", List.of("image/tiff")),
        Map.entry("pdf", List.of("application/pdf")),
        Map.entry("doc", List.of("application/msword")),
        Map.entry("docx", List.of("application/vnd.openxmlformats-officedocument.wordprocessingml.document")),
        Map.entry("txt", List.of("text/plain")),
        Map.entry("rtf", List.of("application/rtf", "text/rtf")),
        Map.entry("odt", List.of("application/vnd.oasis.opendocument.text")),
        Map.entry("xls", List.of("application/vnd.ms-excel")),
        Map.entry("xlsx", List.of("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")),
        Map.entry("csv", List.of("text/csv", "text/plain", "application/csv")),
        Map.entry("ods", List.of("application/vnd.oasis.opendocument.spreadsheet")),
        Map.entry("ppt", List.of("application/vnd.ms-powerpoint")),
        Map.entry("pptx", List.of("application/vnd.openxmlformats-officedocument.presentationml.presentation")),
        Map.entry("odp", List.of("application/vnd.oasis.opendocument.presentation")),
        Map.entry("zip", List.of("application/zip", "application/x-zip-compressed")),
        Map.entry("rar", List.of("application/vnd.rar", "application/x-rar-compressed")),
        Map.entry("7z", List.of("application/x-7z-compressed")),
        Map.entry("tar", List.of("application/x-tar")),
        Map.entry("gz", List.of("application/gzip", "application/x-gzip")),
        Map.entry("bz2", List.of("application/x-bzip2")),
        Map.entry("mp4", List.of("video/mp4")),
        Map.entry("avi", List.of("video/x-msvideo")),
        Map.entry("mov", List.of("video/quicktime")),
        Map.entry("wmv", List.of("video/x-ms-wmv")),
        Map.entry("flv", List.of("video/x-flv")),
        Map.entry("mkv", List.of("video/x-matroska")),
        Map.entry("webm", List.of("video/webm")),
        Map.entry("mp3", List.of("audio/mpeg")),
        Map.entry("wav", List.of("audio/wav", "audio/x-wav")),
        Map.entry("flac", List.of("audio/flac")),
        Map.entry("aac", List.of("audio/aac")),
        Map.entry("ogg", List.of("audio/ogg")),
        Map.entry("m4a", List.of("audio/mp4", "audio/x-m4a")),
        Map.entry("json", List.of("application/json", "text/plain")),
        Map.entry("xml", List.of("application/xml", "text/xml")),
        Map.entry("yaml", List.of("application/yaml", "application/x-yaml", "text/yaml", "text/x-yaml", "text/plain")),
        Map.entry("yml", List.of("application/yaml", "application/x-yaml", "text/yaml", "text/x-yaml", "text/plain")),
        Map.entry("md", List.of("text/markdown", "text/plain")),
        Map.entry("log", List.of("text/plain"))
    );

    private FileTypes() {}

    public static boolean isAllowedExtension(String extension) {
        return extension != null && EXPECTED_MIME_TYPES.containsKey(extension.toLowerCase(Locale.ROOT));
    }

    public static Set<String> allowedExtensions() {
        return new TreeSet<>(EXPECTED_MIME_TYPES.keySet());
    }

    public static List<String> expectedMimeTypes(String extension) {
        if (extension == null) {
            return List.of();
        }
        return EXPECTED_MIME_TYPES.getOrDefault(extension.toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * Type assumed for an extension when the upload carries no usable declared type.
     */
    public static String primaryMimeType(String extension) {
        List<String> expected = expectedMimeTypes(extension);
        return expected.isEmpty() ? OCTET_STREAM : expected.get(0);
    }

    /**
     * Lower-cases a mime type and strips parameters such as {@code ; charset=utf-8}.
     * Returns an empty string for null or blank input.
     */
    public static String normalizeMimeType(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        int semicolon = mimeType.indexOf(';');
        String base = semicolon >= 0 ? mimeType.substring(0, semicolon) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
