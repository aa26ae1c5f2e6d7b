package com.gridcore.engine.bulk;

import com.fasterxml.jackson.annotation.JsonCreator;

public class FillOptions {

    public enum Direction {
        DOWN,
        UP,
        RIGHT,
        LEFT;

        @JsonCreator
        public static Direction fromValue(String value) {
            return OptionValues.require(Direction.class, value);
        }
    }

    public enum Pattern {
        AUTO,
        COPY,
        LINEAR,
        EXPONENTIAL,
        DATE,
        TEXT;

        @JsonCreator
        public static Pattern fromValue(String value) {
            return OptionValues.require(Pattern.class, value);
        }
    }

    private Direction direction = Direction.DOWN;
    private Pattern pattern = Pattern.AUTO;
    // null: use the leading run of non-empty cells
    private Integer sourceCount;

    public FillOptions() {
    }

    public FillOptions(Direction direction) {
        this.direction = direction;
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public void setPattern(Pattern pattern) {
        this.pattern = pattern;
    }

    public Integer getSourceCount() {
        return sourceCount;
    }

    public void setSourceCount(Integer sourceCount) {
        this.sourceCount = sourceCount;
    }
}
