package com.jreinhal.hragent.citation;

import com.jreinhal.hragent.constant.MetadataConstants;
import com.jreinhal.hragent.model.ContextPassage;
import java.util.Locale;

/**
 * Readable document names for citations.
 *
 * <p>Order of preference: the document title or filename; the chunk title without its
 * {@code " (chunk n/m)"} suffix; the source type plus a short id fragment. A title that is blank,
 * or that cleans down to nothing, counts as missing. File names lose their
 * extension, underscores become spaces and each word is capitalised. Names of temporary upload
 * files ({@code tmp...}) are replaced by the {@code original_file} metadata or a generic label.</p>
 */
public final class SourceDisplayNames {

    static final String UPLOADED_DOCUMENT = "Uploaded Document";
    private static final String CHUNK_SUFFIX = " (chunk";
    private static final int ID_FRAGMENT = 8;

    private SourceDisplayNames() {
    }

    public static String of(ContextPassage passage) {
        String documentTitle = firstNonBlank(passage.documentTitle(), passage.documentFilename());
        if (documentTitle == null && passage.title() != null) {
            int suffix = passage.title().indexOf(CHUNK_SUFFIX);
            documentTitle = blankToNull(suffix >= 0 ? passage.title().substring(0, suffix) : passage.title());
        }

        if (documentTitle != null) {
            String displayName = cleanFileName(documentTitle);
            if (displayName.toLowerCase(Locale.ROOT).startsWith("tmp")) {
                Object originalFile = passage.metadata().get(MetadataConstants.ORIGINAL_FILE_KEY);
                displayName = originalFile != null && !originalFile.toString().isBlank()
                        ? cleanFileName(originalFile.toString())
                        : UPLOADED_DOCUMENT;
            }
            String name = capitalizeWords(displayName);
            if (!name.isEmpty()) {
                return name;
            }
        }

        String sourceType = passage.source() == null ? "unknown" : passage.source();
        String displayName = capitalizeWords(sourceType.replace('_', ' '));
        String id = passage.id();
        if (id != null && !id.isEmpty()) {
            displayName = displayName + " (" + id.substring(0, Math.min(ID_FRAGMENT, id.length())) + ")";
        }
        return displayName;
    }

    static String cleanFileName(String name) {
        int dot = name.lastIndexOf('.');
        String base = dot >= 0 ? name.substring(0, dot) : name;
        return base.replace('_', ' ');
    }

    static String capitalizeWords(String text) {
        StringBuilder sb = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String firstNonBlank(String first, String second) {
        String value = blankToNull(first);
        return value != null ? value : blankToNull(second);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
