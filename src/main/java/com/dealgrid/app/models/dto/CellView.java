package com.dealgrid.app.models.dto;

import com.dealgrid.app.models.CellType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read model of one cell. The style is the effective style, conditional formats included.
 */
public class CellView {
    private String address;
    private Object value;
    private String display;
    private String formula;
    private CellType type;
    private Map<String, Object> style = new LinkedHashMap<>();
    private String source;
    private String link;
    private String comment;

    // Default constructor needed for JSON deserialization
    public CellView() {
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getDisplay() {
        return display;
    }

    public void setDisplay(String display) {
        this.display = display;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public CellType getType() {
        return type;
    }

    public void setType(CellType type) {
        this.type = type;
    }

    public Map<String, Object> getStyle() {
        return style;
    }

    public void setStyle(Map<String, Object> style) {
        this.style = style;
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

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }
}
