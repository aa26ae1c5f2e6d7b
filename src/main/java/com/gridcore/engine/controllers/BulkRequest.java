package com.gridcore.engine.controllers;

import java.util.HashMap;
import java.util.Map;

/**
 * Body of the bulk endpoints, e.g.
 * { "kind": "findReplace", "selection": "A1:C10", "options": { "findPattern": "x", "replaceWith": "y" } }
 */
public class BulkRequest {
    private String kind;
    private String selection;
    private Map<String, Object> options = new HashMap<>();
    private Integer limit;

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSelection() {
        return selection;
    }

    public void setSelection(String selection) {
        this.selection = selection;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public void setOptions(Map<String, Object> options) {
        this.options = options;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }
}
