package com.gridcore.engine.bulk;

import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.CellFactory;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Finds text in cell values (and optionally formula source) and replaces it,
 * literally or by regular expression.
 */
public class FindReplaceOperation extends CellwiseBulkOperation<FindReplaceOptions> {

    private static final double CELLS_PER_SECOND = 15_000;

    private final Set<CellAddress> restrictTo;
    private Set<CellAddress> lastChanged = Collections.emptySet();
    private int matchCount;

    public FindReplaceOperation(SpreadsheetEngine engine, Selection selection, FindReplaceOptions options) {
        this(engine, selection, options, null);
    }

    private FindReplaceOperation(SpreadsheetEngine engine, Selection selection, FindReplaceOptions options,
                                 Set<CellAddress> restrictTo) {
        super(engine, selection, options);
        this.restrictTo = restrictTo;
    }

    @Override
    public BulkOperationKind getKind() {
        return BulkOperationKind.FIND_REPLACE;
    }

    @Override
    protected String validateOptions() {
        if (options.getFindPattern() == null || options.getFindPattern().isEmpty()) {
            return "Find pattern cannot be empty";
        }
        if (options.isUseRegex()) {
            try {
                Pattern.compile(options.getFindPattern());
            } catch (PatternSyntaxException e) {
                return "Invalid regular expression: " + e.getDescription();
            }
        }
        return null;
    }

    @Override
    protected Selection targetSelection() {
        return options.getScope() == FindReplaceOptions.Scope.SHEET ? Selection.all() : selection;
    }

    @Override
    protected Stream<CellChange> changes() {
        matchCount = 0;
        Stream<CellChange> changes = super.changes();
        return restrictTo == null ? changes : changes.filter(c -> restrictTo.contains(c.getAddress()));
    }

    @Override
    protected CellChange computeChange(CellAddress address, Cell cell) {
        if (cell == null || (restrictTo != null && !restrictTo.contains(address))) {
            return null;
        }
        if (cell.hasFormula()) {
            if (!options.isSearchInFormulas()) {
                return null;
            }
            String replaced = replace(cell.getFormulaSource());
            return replaced == null ? null : change(address, cell, "=" + replaced);
        }
        if (!options.isSearchInValues()) {
            return null;
        }
        String text = cell.getValue().toDisplayString();
        String replaced = replace(text);
        if (replaced == null) {
            return null;
        }
        boolean forcedText = cell.getRawValue().startsWith("'");
        String raw = forcedText ? CellFactory.textRaw(replaced) : replaced;
        return change(address, cell, raw);
    }

    // Returns null when the pattern does not match.
    private String replace(String text) {
        Matcher matcher = pattern().matcher(text);
        String replacement = options.isUseRegex()
                ? options.getReplaceWith()
                : Matcher.quoteReplacement(options.getReplaceWith());
        if (options.isWholeCellMatch()) {
            if (!matcher.matches()) {
                return null;
            }
            matchCount++;
            return matcher.replaceFirst(replacement);
        }
        int found = 0;
        while (matcher.find()) {
            found++;
            if (!options.isGlobal()) {
                break;
            }
        }
        if (found == 0) {
            return null;
        }
        matchCount += found;
        matcher.reset();
        return options.isGlobal() ? matcher.replaceAll(replacement) : matcher.replaceFirst(replacement);
    }

    private Pattern pattern() {
        String regex = options.isUseRegex() ? options.getFindPattern() : Pattern.quote(options.getFindPattern());
        int flags = options.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return Pattern.compile(regex, flags);
    }

    @Override
    protected void afterExecute(Set<CellAddress> changed) {
        lastChanged = new LinkedHashSet<>(changed);
    }

    /**
     * Regex replacements and formula rewrites cannot be reversed by a plain
     * substitution, and neither can replacing with the empty string.
     */
    public boolean canUndo() {
        return !options.isUseRegex() && !options.isSearchInFormulas() && !options.getReplaceWith().isEmpty();
    }

    /**
     * Literal reverse substitution limited to the cells changed by the last execute.
     * Returns null when {@link #canUndo()} is false or nothing was executed yet.
     */
    public FindReplaceOperation createUndoOperation() {
        if (!canUndo() || lastChanged.isEmpty()) {
            return null;
        }
        FindReplaceOptions reverse = new FindReplaceOptions(options.getReplaceWith(), options.getFindPattern());
        reverse.setUseRegex(false);
        reverse.setCaseSensitive(true);
        reverse.setGlobal(options.isGlobal());
        reverse.setScope(options.getScope());
        reverse.setSearchInFormulas(false);
        reverse.setSearchInValues(true);
        return new FindReplaceOperation(engine, selection, reverse, lastChanged);
    }

    public Set<CellAddress> getLastChanged() {
        return Collections.unmodifiableSet(lastChanged);
    }

    @Override
    protected double cellsPerSecond() {
        double rate = CELLS_PER_SECOND;
        if (options.isUseRegex()) {
            rate *= 0.7;
        }
        if (options.isSearchInFormulas()) {
            rate *= 0.8;
        }
        return rate;
    }

    @Override
    protected long minimumTime() {
        return 200;
    }

    @Override
    protected String summarize(List<CellChange> changes, boolean truncated) {
        return (truncated ? "More than " : "") + changes.size() + " cell(s) will change, "
                + matchCount + " match(es) found in previewed cells";
    }

    @Override
    public String getDescription() {
        return "Replace '" + options.getFindPattern() + "' with '" + options.getReplaceWith() + "'";
    }
}
