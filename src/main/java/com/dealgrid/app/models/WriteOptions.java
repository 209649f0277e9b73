package com.dealgrid.app.models;

/**
 * Optional attributes attached to a literal write by external enrichment.
 */
public class WriteOptions {
    private final String source;
    private final String link;

    public WriteOptions(String source, String link) {
        this.source = source;
        this.link = link;
    }

    public static WriteOptions none() {
        return new WriteOptions(null, null);
    }

    public String getSource() {
        return source;
    }

    public String getLink() {
        return link;
    }
}
