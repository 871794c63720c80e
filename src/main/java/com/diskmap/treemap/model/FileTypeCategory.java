package com.diskmap.treemap.model;

import org.apache.commons.io.FilenameUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of file categories used to color treemap blocks.
 *
 * The extension lookup table is built once when the enum is initialized and
 * never changes afterwards. Category order matters: when an extension appears
 * in more than one set, the earlier category wins.
 */
public enum FileTypeCategory {

    IMAGES("Images", Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "webp", "heic", "ico", "svg")),
    VIDEOS("Videos", Set.of("mp4", "mov", "avi", "mkv", "flv", "wmv", "webm", "m4v")),
    AUDIO("Audio", Set.of("mp3", "m4a", "wav", "flac", "aac", "ogg", "wma")),
    DOCUMENTS("Documents", Set.of("pdf", "doc", "docx", "txt", "rtf", "pages", "xls", "xlsx", "ppt", "pptx")),
    CODE("Code", Set.of("swift", "m", "h", "cpp", "c", "js", "jsx", "ts", "tsx", "py", "go", "rs",
            "java", "kt", "json", "xml", "yaml", "yml")),
    ARCHIVES("Archives", Set.of("zip", "rar", "7z", "tar", "gz", "bz2", "dmg", "pkg")),
    SYSTEM("System", Set.of()),
    OTHER("Other", Set.of());

    private static final Map<String, FileTypeCategory> BY_EXTENSION = buildLookup();

    private final String displayName;
    private final Set<String> extensions;

    FileTypeCategory(String displayName, Set<String> extensions) {
        this.displayName = displayName;
        this.extensions = extensions;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Known extensions for this category, lower case and without the dot.
     */
    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * Classify a file extension. Matching ignores case and a leading dot.
     * Never fails: anything unknown, empty or null maps to {@link #OTHER}.
     *
     * @param extension - extension such as "jpg", "JPG" or ".jpg"
     * @return the matching category
     */
    public static FileTypeCategory fromExtension(String extension) {
        if (extension == null) {
            return OTHER;
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return BY_EXTENSION.getOrDefault(normalized, OTHER);
    }

    /**
     * Classify a file by its name, e.g. "holiday.JPG" maps to {@link #IMAGES}.
     */
    public static FileTypeCategory fromFileName(String fileName) {
        if (fileName == null) {
            return OTHER;
        }
        try {
            return fromExtension(FilenameUtils.getExtension(fileName));
        } catch (IllegalArgumentException e) {
            // Windows rejects names holding an alternate data stream marker
            return OTHER;
        }
    }

    private static Map<String, FileTypeCategory> buildLookup() {
        Map<String, FileTypeCategory> lookup = new LinkedHashMap<>();
        for (FileTypeCategory category : values()) {
            for (String ext : category.extensions) {
                lookup.putIfAbsent(ext, category);
            }
        }
        return Collections.unmodifiableMap(lookup);
    }
}
