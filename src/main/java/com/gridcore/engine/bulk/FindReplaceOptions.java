package com.gridcore.engine.bulk;

import com.fasterxml.jackson.annotation.JsonCreator;

public class FindReplaceOptions {

    public enum Scope {
        SELECTION,
        SHEET;

        @JsonCreator
        public static Scope fromValue(String value) {
            return OptionValues.require(Scope.class, value);
        }
    }

    private String findPattern = "";
    private String replaceWith = "";
    private boolean useRegex;
    private boolean caseSensitive = true;
    private boolean global = true;
    private Scope scope = Scope.SELECTION;
    private boolean searchInFormulas;
    private boolean searchInValues = true;
    private boolean wholeCellMatch;

    public FindReplaceOptions() {
    }

    public FindReplaceOptions(String findPattern, String replaceWith) {
        this.findPattern = findPattern;
        this.replaceWith = replaceWith;
    }

    public String getFindPattern() {
        return findPattern;
    }

    public void setFindPattern(String findPattern) {
        this.findPattern = findPattern;
    }

    public String getReplaceWith() {
        return replaceWith;
    }

    public void setReplaceWith(String replaceWith) {
        this.replaceWith = replaceWith;
    }

    public boolean isUseRegex() {
        return useRegex;
    }

    public void setUseRegex(boolean useRegex) {
        this.useRegex = useRegex;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public boolean isGlobal() {
        return global;
    }

    public void setGlobal(boolean global) {
        this.global = global;
    }

    public Scope getScope() {
        return scope;
    }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    public boolean isSearchInFormulas() {
        return searchInFormulas;
    }

    public void setSearchInFormulas(boolean searchInFormulas) {
        this.searchInFormulas = searchInFormulas;
    }

    public boolean isSearchInValues() {
        return searchInValues;
    }

    public void setSearchInValues(boolean searchInValues) {
        this.searchInValues = searchInValues;
    }

    public boolean isWholeCellMatch() {
        return wholeCellMatch;
    }

    public void setWholeCellMatch(boolean wholeCellMatch) {
        this.wholeCellMatch = wholeCellMatch;
    }
}
