package im.arun.booksplit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a table of contents.
 *
 * <p>{@code contentStartPage} is only meaningful for manually authored trees whose
 * pages are counted from the first content page. A value of 1 means the pages are
 * already absolute PDF pages.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TocTree {

    @JsonProperty("chapters")
    private List<TocNode> chapters = new ArrayList<>();

    @JsonProperty("content_start_page")
    private Integer contentStartPage = 1;

    public TocTree(List<TocNode> chapters) {
        this(chapters, 1);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return chapters == null || chapters.isEmpty();
    }

    public int effectiveContentStartPage() {
        return contentStartPage == null ? 1 : contentStartPage;
    }

    public TocTree copy() {
        List<TocNode> copied = new ArrayList<>();
        if (chapters != null) {
            for (TocNode chapter : chapters) {
                copied.add(chapter.copy());
            }
        }
        return new TocTree(copied, contentStartPage);
    }
}
