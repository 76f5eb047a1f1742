package org.codesonify.analysis;

import com.google.gson.annotations.SerializedName;
import org.codesonify.api.SonificationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The source languages the analyzer can tell apart.
 * <p>
 * Each constant carries the regular-expression signatures used by {@link LanguageDetector}.
 * The declaration order is the tie-break order of detection.
 */
public enum Language {
    @SerializedName("typescript")
    TYPESCRIPT("typescript",
            ":\\s*(string|number|boolean|any|void|never)", "interface\\s+\\w+", "import\\s+.*from\\s+['\"]",
            "\\?\\.\\w+", "<\\w+>"),
    @SerializedName("javascript")
    JAVASCRIPT("javascript",
            "const\\s+\\w+\\s*=", "let\\s+\\w+", "=>\\s*\\{?", "require\\(", "module\\.exports"),
    @SerializedName("python")
    PYTHON("python",
            "def\\s+\\w+\\(", "import\\s+\\w+", "class\\s+\\w+:", "if\\s+.*:$", "print\\("),
    @SerializedName("java")
    JAVA("java",
            "public\\s+(static\\s+)?class", "System\\.out", "void\\s+main", "private\\s+\\w+", "import\\s+java\\."),
    @SerializedName("csharp")
    CSHARP("csharp",
            "using\\s+System", "namespace\\s+\\w+", "public\\s+class", "Console\\.Write", "\\[.*\\]\\s*$"),
    @SerializedName("go")
    GO("go",
            "func\\s+\\w+\\(", "package\\s+\\w+", "import\\s+\\(", "fmt\\.Print", ":=\\s*"),
    @SerializedName("rust")
    RUST("rust",
            "fn\\s+\\w+\\(", "let\\s+mut\\s+", "impl\\s+\\w+", "pub\\s+fn", "use\\s+\\w+::"),
    @SerializedName("unknown")
    UNKNOWN("unknown");

    private final String id;
    private final List<Pattern> signatures;

    Language(String id, String... signatures) {
        this.id = id;
        this.signatures = Arrays.stream(signatures).map(Pattern::compile).toList();
    }

    /**
     * Returns the lowercase identifier used in titles, metadata and the command line.
     * @return The language id, e.g. {@code "javascript"}.
     */
    public String id() {
        return id;
    }

    List<Pattern> signatures() {
        return signatures;
    }

    /**
     * Resolves a language by its id, ignoring case.
     *
     * @param name The language id.
     * @return The matching language.
     * @throws SonificationException if no language has that id.
     */
    public static Language fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Language language : values()) {
                if (language.id.equals(normalized)) {
                    return language;
                }
            }
        }
        throw new SonificationException("Unknown language '" + name + "'. Expected one of: "
                + Arrays.stream(values()).map(Language::id).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return id;
    }
}
