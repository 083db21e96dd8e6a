package Common;

import java.util.Objects;

/**
 * Coppia (id, titolo) restituita da LIST.
 */
public class DocumentSummary {
    private final int id;
    private final String title;

    public DocumentSummary(int id, String title) {
        this.id = id;
        this.title = title;
    }

    public int getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentSummary)) return false;
        DocumentSummary other = (DocumentSummary) o;
        return id == other.id && title.equals(other.title);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title);
    }

    @Override
    public String toString() {
        return id + " " + title;
    }
}
