package com.gridcore.engine.bulk;

public class TransformOptions {

    private TransformType transformType;
    private boolean skipNonText = true;

    public TransformOptions() {
    }

    public TransformOptions(TransformType transformType) {
        this.transformType = transformType;
    }

    public TransformType getTransformType() {
        return transformType;
    }

    public void setTransformType(TransformType transformType) {
        this.transformType = transformType;
    }

    public boolean isSkipNonText() {
        return skipNonText;
    }

    public void setSkipNonText(boolean skipNonText) {
        this.skipNonText = skipNonText;
    }
}
