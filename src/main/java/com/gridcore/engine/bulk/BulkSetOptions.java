package com.gridcore.engine.bulk;

public class BulkSetOptions {

    private String value;
    private boolean overwriteExisting = true;
    private boolean preserveFormulas;
    private boolean skipEmpty;

    public BulkSetOptions() {
    }

    public BulkSetOptions(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public boolean isOverwriteExisting() {
        return overwriteExisting;
    }

    public void setOverwriteExisting(boolean overwriteExisting) {
        this.overwriteExisting = overwriteExisting;
    }

    public boolean isPreserveFormulas() {
        return preserveFormulas;
    }

    public void setPreserveFormulas(boolean preserveFormulas) {
        this.preserveFormulas = preserveFormulas;
    }

    public boolean isSkipEmpty() {
        return skipEmpty;
    }

    public void setSkipEmpty(boolean skipEmpty) {
        this.skipEmpty = skipEmpty;
    }
}
