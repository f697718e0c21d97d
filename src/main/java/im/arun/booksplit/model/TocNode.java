package im.arun.booksplit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single section of a table of contents.
 * Pages are absolute, 1-based and inclusive. A {@code null} end page means the
 * boundary has not been resolved yet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TocNode {

    @JsonProperty("title")
    private String title;

    @JsonProperty("number")
    private String number;

    @JsonProperty("page")
    private Integer startPage;

    @JsonProperty("end_page")
    private Integer endPage;

    @JsonProperty("subtopics")
    private List<TocNode> children = new ArrayList<>();

    public TocNode(String title, String number, Integer startPage, Integer endPage) {
        this(title, number, startPage, endPage, new ArrayList<>());
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    /**
     * Deep copy; the copy shares no mutable state with this node.
     */
    public TocNode copy() {
        List<TocNode> copiedChildren = new ArrayList<>();
        if (children != null) {
            for (TocNode child : children) {
                copiedChildren.add(child.copy());
            }
        }
        return new TocNode(title, number, startPage, endPage, copiedChildren);
    }
}
