package com.gridcore.engine.bulk;

/**
 * Display formatting. The format type is kept as text so that an unknown
 * name is reported by validation instead of failing option conversion.
 */
public class FormatOptions {

    private String formatType;
    private String locale = "en-US";
    private String currency = "USD";
    private int decimals = 2;
    private boolean useThousandsSeparator = true;
    private String dateFormat = "MM/dd/yyyy";

    public FormatOptions() {
    }

    public FormatOptions(String formatType) {
        this.formatType = formatType;
    }

    public String getFormatType() {
        return formatType;
    }

    public void setFormatType(String formatType) {
        this.formatType = formatType;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public int getDecimals() {
        return decimals;
    }

    public void setDecimals(int decimals) {
        this.decimals = decimals;
    }

    public boolean isUseThousandsSeparator() {
        return useThousandsSeparator;
    }

    public void setUseThousandsSeparator(boolean useThousandsSeparator) {
        this.useThousandsSeparator = useThousandsSeparator;
    }

    public String getDateFormat() {
        return dateFormat;
    }

    public void setDateFormat(String dateFormat) {
        this.dateFormat = dateFormat;
    }
}
