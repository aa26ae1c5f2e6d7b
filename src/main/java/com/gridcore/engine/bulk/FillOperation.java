package com.gridcore.engine.bulk;

import com.gridcore.engine.formula.FormulaPrinter;
import com.gridcore.engine.formula.ReferenceAdjuster;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.CellFactory;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Extends the leading cells of each line of a range into the rest of the line.
 *
 * A line is a column for DOWN/UP and a row for RIGHT/LEFT. The source cells are
 * the first cells of the line in fill direction; AUTO detects a linear series
 * (constant step), then a geometric one (constant ratio), then a series of text
 * dates a fixed number of days apart, then text around a number counting up by
 * one ("Item 1", "Item 2"), and otherwise repeats the sources. Repeated formulas have their relative references moved by the
 * distance copied.
 */
public class FillOperation extends AbstractBulkOperation<FillOptions> {

    private static final double TOLERANCE = 1e-10;

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-MM-dd"),
            strict("MM/dd/uuuu"),
            strict("dd/MM/uuuu"),
            strict("uuuu/MM/dd"));

    private static final Pattern NUMBERED_TEXT =
            Pattern.compile("^(.*?)(\\d{1,18})(.*)$", Pattern.DOTALL);

    private enum Series {
        COPY,
        LINEAR,
        EXPONENTIAL,
        DATE,
        TEXT
    }

    public FillOperation(SpreadsheetEngine engine, Selection selection, FillOptions options) {
        super(engine, selection, options);
    }

    @Override
    public BulkOperationKind getKind() {
        return BulkOperationKind.FILL;
    }

    @Override
    protected String validateOptions() {
        if (!selection.isBounded()) {
            return "Fill requires a cell or range selection";
        }
        if (options.getDirection() == null || options.getPattern() == null) {
            return "Fill direction and pattern are required";
        }
        if (options.getSourceCount() != null && options.getSourceCount() < 1) {
            return "Source count must be at least 1";
        }
        return null;
    }

    @Override
    protected Stream<CellChange> changes() {
        boolean vertical = options.getDirection() == FillOptions.Direction.DOWN
                || options.getDirection() == FillOptions.Direction.UP;
        IntStream lines = vertical
                ? IntStream.rangeClosed(selection.getMinCol(), selection.getMaxCol())
                : IntStream.rangeClosed(selection.getMinRow(), selection.getMaxRow());
        return lines.boxed().flatMap(line -> fillLine(lineAddresses(line, vertical)).stream());
    }

    private List<CellAddress> lineAddresses(int line, boolean vertical) {
        List<CellAddress> addresses = new ArrayList<>();
        if (vertical) {
            for (int row = selection.getMinRow(); row <= selection.getMaxRow(); row++) {
                addresses.add(CellAddress.of(line, row));
            }
        } else {
            for (int col = selection.getMinCol(); col <= selection.getMaxCol(); col++) {
                addresses.add(CellAddress.of(col, line));
            }
        }
        if (options.getDirection() == FillOptions.Direction.UP || options.getDirection() == FillOptions.Direction.LEFT) {
            Collections.reverse(addresses);
        }
        return addresses;
    }

    private List<CellChange> fillLine(List<CellAddress> line) {
        List<Cell> cells = new ArrayList<>(line.size());
        for (CellAddress address : line) {
            cells.add(engine.getCell(address));
        }
        int sourceCount = options.getSourceCount() != null ? options.getSourceCount() : leadingRun(cells);
        if (sourceCount == 0 || sourceCount >= line.size()) {
            return Collections.emptyList();
        }
        List<Cell> sources = cells.subList(0, sourceCount);
        double[] numbers = numericSources(sources);
        List<String> texts = numbers == null ? textSources(sources) : null;
        DateSeries dates = texts != null ? DateSeries.detect(texts) : null;
        NumberedText numbered = texts != null ? NumberedText.detect(texts) : null;
        Series series = chooseSeries(numbers, dates, numbered);
        double step = 0;
        double ratio = 1;
        if (series == Series.LINEAR) {
            step = numbers.length == 1 ? 1 : (numbers[numbers.length - 1] - numbers[0]) / (numbers.length - 1);
        } else if (series == Series.EXPONENTIAL) {
            ratio = Math.pow(numbers[numbers.length - 1] / numbers[0], 1.0 / (numbers.length - 1));
            if (!Double.isFinite(ratio)) {
                series = Series.COPY;
            }
        }

        List<CellChange> changes = new ArrayList<>();
        for (int k = sourceCount; k < line.size(); k++) {
            String raw;
            if (series == Series.COPY) {
                int sourceIndex = (k - sourceCount) % sourceCount;
                raw = copied(sources.get(sourceIndex), k - sourceIndex);
            } else if (series == Series.DATE) {
                raw = CellFactory.textRaw(dates.next(k - sourceCount + 1));
            } else if (series == Series.TEXT) {
                raw = CellFactory.textRaw(numbered.next(k - sourceCount + 1));
            } else {
                double last = numbers[numbers.length - 1];
                int distance = k - sourceCount + 1;
                double value = series == Series.LINEAR ? last + step * distance : last * Math.pow(ratio, distance);
                raw = Double.isFinite(value) ? CellValue.formatNumber(clean(value)) : null;
            }
            CellChange change = CellwiseBulkOperation.change(line.get(k), cells.get(k), raw);
            if (change != null) {
                changes.add(change);
            }
        }
        return changes;
    }

    private Series chooseSeries(double[] numbers, DateSeries dates, NumberedText numbered) {
        switch (options.getPattern()) {
            case COPY:
                return Series.COPY;
            case LINEAR:
                return numbers != null ? Series.LINEAR : Series.COPY;
            case EXPONENTIAL:
                return numbers != null && numbers.length >= 2 && numbers[0] != 0 ? Series.EXPONENTIAL : Series.COPY;
            case DATE:
                return dates != null ? Series.DATE : Series.COPY;
            case TEXT:
                return numbered != null ? Series.TEXT : Series.COPY;
            default:
                if (numbers != null) {
                    if (numbers.length < 2) {
                        return Series.COPY;
                    }
                    if (isLinear(numbers)) {
                        return Series.LINEAR;
                    }
                    return isExponential(numbers) ? Series.EXPONENTIAL : Series.COPY;
                }
                if (dates != null && dates.sourceCount >= 2) {
                    return Series.DATE;
                }
                if (numbered != null && numbered.sourceCount >= 2 && numbered.step == 1) {
                    return Series.TEXT;
                }
                return Series.COPY;
        }
    }

    // Raw value of 'source' as it reads after being moved 'distance' cells along the line.
    private String copied(Cell source, int distance) {
        if (source == null) {
            return null;
        }
        if (!source.hasFormula()) {
            return source.getRawValue();
        }
        int deltaRow = 0;
        int deltaCol = 0;
        switch (options.getDirection()) {
            case DOWN:
                deltaRow = distance;
                break;
            case UP:
                deltaRow = -distance;
                break;
            case RIGHT:
                deltaCol = distance;
                break;
            default:
                deltaCol = -distance;
                break;
        }
        Expr moved = ReferenceAdjuster.translate(source.getFormula(), deltaRow, deltaCol,
                engine.getSettings().getMaxRows(), engine.getSettings().getMaxColumns());
        return "=" + FormulaPrinter.print(moved);
    }

    private static int leadingRun(List<Cell> cells) {
        int count = 0;
        while (count < cells.size() && cells.get(count) != null) {
            count++;
        }
        return count;
    }

    // Null unless every source is a plain number.
    private static double[] numericSources(List<Cell> sources) {
        double[] numbers = new double[sources.size()];
        for (int i = 0; i < sources.size(); i++) {
            Cell cell = sources.get(i);
            if (cell == null || cell.hasFormula() || !cell.getValue().isNumber()) {
                return null;
            }
            numbers[i] = cell.getValue().asNumber();
        }
        return numbers;
    }

    // Null unless every source is a plain text value.
    private static List<String> textSources(List<Cell> sources) {
        List<String> texts = new ArrayList<>(sources.size());
        for (Cell cell : sources) {
            if (cell == null || cell.hasFormula() || !cell.getValue().isString()) {
                return null;
            }
            texts.add(cell.getValue().asString());
        }
        return texts;
    }

    private static boolean isLinear(double[] numbers) {
        double step = numbers[1] - numbers[0];
        for (int i = 2; i < numbers.length; i++) {
            if (Math.abs((numbers[i] - numbers[i - 1]) - step) > TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    private static boolean isExponential(double[] numbers) {
        for (double n : numbers) {
            if (n == 0) {
                return false;
            }
        }
        double ratio = numbers[1] / numbers[0];
        for (int i = 2; i < numbers.length; i++) {
            if (Math.abs(numbers[i] / numbers[i - 1] - ratio) > TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    // Drops floating point noise such as 0.30000000000000004.
    private static double clean(double value) {
        if (Math.abs(value) >= 1e15) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(10, RoundingMode.HALF_UP).doubleValue();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Text dates in one of the DATE_FORMATS, a constant number of days apart.
     * A single source steps one day.
     */
    private static final class DateSeries {

        private final DateTimeFormatter format;
        private final LocalDate last;
        private final long stepDays;
        private final int sourceCount;

        private DateSeries(DateTimeFormatter format, LocalDate last, long stepDays, int sourceCount) {
            this.format = format;
            this.last = last;
            this.stepDays = stepDays;
            this.sourceCount = sourceCount;
        }

        static DateSeries detect(List<String> texts) {
            for (DateTimeFormatter format : DATE_FORMATS) {
                List<LocalDate> dates = parseAll(texts, format);
                if (dates == null) {
                    continue;
                }
                if (dates.size() == 1) {
                    return new DateSeries(format, dates.get(0), 1, 1);
                }
                long step = ChronoUnit.DAYS.between(dates.get(0), dates.get(1));
                if (step == 0) {
                    return null;
                }
                for (int i = 2; i < dates.size(); i++) {
                    if (ChronoUnit.DAYS.between(dates.get(i - 1), dates.get(i)) != step) {
                        return null;
                    }
                }
                return new DateSeries(format, dates.get(dates.size() - 1), step, dates.size());
            }
            return null;
        }

        private static List<LocalDate> parseAll(List<String> texts, DateTimeFormatter format) {
            List<LocalDate> dates = new ArrayList<>(texts.size());
            try {
                for (String text : texts) {
                    dates.add(LocalDate.parse(text.trim(), format));
                }
            } catch (DateTimeParseException e) {
                return null;
            }
            return dates;
        }

        String next(int distance) {
            return last.plusDays(stepDays * distance).format(format);
        }
    }

    /**
     * Text around one run of digits, such as "Item 1" or "Product-007", with the same
     * text on both sides in every source and the number rising by a constant step.
     * Zero padding of the last source is kept.
     */
    private static final class NumberedText {

        private final String prefix;
        private final String suffix;
        private final long last;
        private final int width;
        private final long step;
        private final int sourceCount;

        private NumberedText(String prefix, String suffix, long last, int width, long step, int sourceCount) {
            this.prefix = prefix;
            this.suffix = suffix;
            this.last = last;
            this.width = width;
            this.step = step;
            this.sourceCount = sourceCount;
        }

        static NumberedText detect(List<String> texts) {
            String prefix = null;
            String suffix = null;
            String digits = null;
            long[] numbers = new long[texts.size()];
            for (int i = 0; i < texts.size(); i++) {
                Matcher matcher = NUMBERED_TEXT.matcher(texts.get(i));
                if (!matcher.matches()) {
                    return null;
                }
                if (prefix == null) {
                    prefix = matcher.group(1);
                    suffix = matcher.group(3);
                } else if (!prefix.equals(matcher.group(1)) || !suffix.equals(matcher.group(3))) {
                    return null;
                }
                digits = matcher.group(2);
                numbers[i] = Long.parseLong(digits);
            }
            if (digits == null) {
                return null;
            }
            long step = numbers.length == 1 ? 1 : numbers[1] - numbers[0];
            if (step <= 0) {
                return null;
            }
            for (int i = 2; i < numbers.length; i++) {
                if (numbers[i] - numbers[i - 1] != step) {
                    return null;
                }
            }
            int width = digits.startsWith("0") ? digits.length() : 1;
            return new NumberedText(prefix, suffix, numbers[numbers.length - 1], width, step, numbers.length);
        }

        String next(int distance) {
            String number = Long.toString(last + step * distance);
            StringBuilder text = new StringBuilder(prefix);
            for (int i = number.length(); i < width; i++) {
                text.append('0');
            }
            return text.append(number).append(suffix).toString();
        }
    }

    @Override
    protected double cellsPerSecond() {
        return 20_000;
    }

    @Override
    public String getDescription() {
        return "Fill " + selection + " " + options.getDirection().name().toLowerCase();
    }
}
