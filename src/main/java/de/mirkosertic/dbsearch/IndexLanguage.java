package de.mirkosertic.dbsearch;

import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages the index can be configured for, by short code and by the full name
 * that engines without native code support expect.
 */
public enum IndexLanguage {

    DANISH("da", "danish"),
    DUTCH("nl", "dutch"),
    ENGLISH("en", "english"),
    FINNISH("fi", "finnish"),
    FRENCH("fr", "french"),
    GERMAN("de", "german"),
    HUNGARIAN("hu", "hungarian"),
    ITALIAN("it", "italian"),
    NORWEGIAN("nb", "norwegian"),
    PORTUGUESE("pt", "portuguese"),
    ROMANIAN("ro", "romanian"),
    RUSSIAN("ru", "russian"),
    SPANISH("es", "spanish"),
    SWEDISH("sv", "swedish"),
    TURKISH("tr", "turkish"),
    CHINESE("zh", "chinese");

    private final String code;
    private final String languageName;

    IndexLanguage(final String code, final String languageName) {
        this.code = code;
        this.languageName = languageName;
    }

    public String code() {
        return code;
    }

    public String languageName() {
        return languageName;
    }

    public static Optional<IndexLanguage> fromCode(final @Nullable String code) {
        if (code == null) {
            return Optional.empty();
        }
        final String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (final IndexLanguage language : values()) {
            if (language.code.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    public static Optional<IndexLanguage> fromName(final @Nullable String languageName) {
        if (languageName == null) {
            return Optional.empty();
        }
        final String normalized = languageName.trim().toLowerCase(Locale.ROOT);
        for (final IndexLanguage language : values()) {
            if (language.languageName.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a short code to the identifier the given engine expects: the code itself for
     * engines that accept codes natively, otherwise the full name, with English standing
     * in for unsupported codes.
     */
    public static String engineIdentifier(final String code, final boolean engineAcceptsCodes) {
        if (engineAcceptsCodes) {
            return code;
        }
        return fromCode(code).orElse(ENGLISH).languageName();
    }
}
