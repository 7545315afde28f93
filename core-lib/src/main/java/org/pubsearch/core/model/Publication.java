package org.pubsearch.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A publication record as delivered by the crawler or a static import.
 *
 * <p>Missing values are normalized to empty strings and empty collections so that callers never
 * see {@code null}. {@code year} is kept as text because sources deliver both numbers and
 * placeholders such as {@code "N/A"}.</p>
 */
public record Publication(
        String title,
        List<String> authors,
        String year,
        String abstractText,
        List<String> keywords,
        String publicationLink,
        Map<String, String> authorProfiles
) implements Serializable {

    public Publication {
        title = title == null ? "" : title;
        authors = authors == null ? List.of() : authors.stream().filter(Objects::nonNull).toList();
        year = year == null ? "" : year;
        abstractText = abstractText == null ? "" : abstractText;
        keywords = keywords == null ? List.of() : keywords.stream().filter(Objects::nonNull).toList();
        publicationLink = publicationLink == null ? "" : publicationLink;
        authorProfiles = authorProfiles == null ? Map.of() : Map.copyOf(authorProfiles);
    }

    public static Publication of(String title, List<String> authors, String year, String abstractText, List<String> keywords) {
        return new Publication(title, authors, year, abstractText, keywords, "", Map.of());
    }

    /**
     * Publication year as a number, or {@code 0} when the year is missing or not numeric.
     */
    public int numericYear() {
        try {
            return Integer.parseInt(year.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("Publication{title='%s', authors=%s, year='%s'}", title, authors, year);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
