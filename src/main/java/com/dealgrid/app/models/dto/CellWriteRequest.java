package com.dealgrid.app.models.dto;

/**
 * Body of a literal cell write: the value plus optional enrichment attributes.
 */
public class CellWriteRequest {
    private Object value;
    private String source;
    private String link;

    // Default constructor needed for JSON deserialization
    public CellWriteRequest() {
    }

    public CellWriteRequest(Object value, String source, String link) {
        this.value = value;
        this.source = source;
        this.link = link;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getLink() {
        return link;
    }

    public void setLink(String link) {
        this.link = link;
    }
}
