package com.gridcore.engine.bulk;

public class MathOptions {

    private MathOperationType operation;
    private Double value;
    private int decimalPlaces;
    private boolean convertStrings = true;

    public MathOptions() {
    }

    public MathOptions(MathOperationType operation, Double value) {
        this.operation = operation;
        this.value = value;
    }

    public MathOperationType getOperation() {
        return operation;
    }

    public void setOperation(MathOperationType operation) {
        this.operation = operation;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }

    public void setDecimalPlaces(int decimalPlaces) {
        this.decimalPlaces = decimalPlaces;
    }

    public boolean isConvertStrings() {
        return convertStrings;
    }

    public void setConvertStrings(boolean convertStrings) {
        this.convertStrings = convertStrings;
    }
}
