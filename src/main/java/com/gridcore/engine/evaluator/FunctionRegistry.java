package com.gridcore.engine.evaluator;

import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.ErrorType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * Name to implementation table for builtin functions. Lookups are case-insensitive.
 * IF is evaluated lazily by the {@link Evaluator} itself and is not in this table.
 */
public class FunctionRegistry {

    private static final CellValue VALUE_ERROR = CellValue.error(ErrorType.VALUE);

    private final Map<String, SpreadsheetFunction> functions = new ConcurrentHashMap<>();

    public FunctionRegistry() {
        register("SUM", FunctionRegistry::sum);
        register("AVERAGE", FunctionRegistry::average);
        register("MIN", args -> extreme(args, true));
        register("MAX", args -> extreme(args, false));
        register("COUNT", FunctionRegistry::count);
        register("AND", args -> logical(args, true));
        register("OR", args -> logical(args, false));
        register("NOT", FunctionRegistry::not);
        register("CONCATENATE", FunctionRegistry::concatenate);
        register("LEN", args -> text(args, s -> CellValue.number(s.length())));
        register("UPPER", args -> text(args, s -> CellValue.string(s.toUpperCase(Locale.ROOT))));
        register("LOWER", args -> text(args, s -> CellValue.string(s.toLowerCase(Locale.ROOT))));
        register("TRIM", args -> text(args, s -> CellValue.string(s.trim().replaceAll(" {2,}", " "))));
        register("ROUND", FunctionRegistry::round);
        register("ABS", args -> unaryMath(args, Math::abs));
        register("SQRT", args -> unaryMath(args, Math::sqrt));
        register("MOD", FunctionRegistry::mod);
    }

    public void register(String name, SpreadsheetFunction function) {
        functions.put(name.toUpperCase(Locale.ROOT), function);
    }

    /**
     * Returns the function, or null when no function has that name.
     */
    public SpreadsheetFunction lookup(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    // ----------------------------------------------------------------
    // Aggregates
    // ----------------------------------------------------------------

    private static CellValue sum(List<FunctionArgument> args) {
        Numbers numbers = collectNumbers(args);
        if (numbers.error != null) {
            return numbers.error;
        }
        double total = 0;
        for (double d : numbers.values) {
            total += d;
        }
        return Coercion.numberResult(total);
    }

    private static CellValue average(List<FunctionArgument> args) {
        Numbers numbers = collectNumbers(args);
        if (numbers.error != null) {
            return numbers.error;
        }
        if (numbers.values.isEmpty()) {
            return CellValue.error(ErrorType.DIV_ZERO);
        }
        double total = 0;
        for (double d : numbers.values) {
            total += d;
        }
        return Coercion.numberResult(total / numbers.values.size());
    }

    private static CellValue extreme(List<FunctionArgument> args, boolean min) {
        Numbers numbers = collectNumbers(args);
        if (numbers.error != null) {
            return numbers.error;
        }
        if (numbers.values.isEmpty()) {
            return CellValue.number(0);
        }
        double result = numbers.values.get(0);
        for (double d : numbers.values) {
            result = min ? Math.min(result, d) : Math.max(result, d);
        }
        return CellValue.number(result);
    }

    // Errors are not counted and do not propagate.
    private static CellValue count(List<FunctionArgument> args) {
        int total = 0;
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (CellValue v : arg.getRangeValues()) {
                    if (v.isNumber()) {
                        total++;
                    }
                }
            } else {
                CellValue v = arg.getValue();
                if (!v.isError() && !v.isEmpty() && Coercion.toNumber(v) != null) {
                    total++;
                }
            }
        }
        return CellValue.number(total);
    }

    // ----------------------------------------------------------------
    // Logical
    // ----------------------------------------------------------------

    private static CellValue logical(List<FunctionArgument> args, boolean and) {
        if (args.isEmpty()) {
            return VALUE_ERROR;
        }
        CellValue error = firstError(args);
        if (error != null) {
            return error;
        }
        boolean seen = false;
        boolean result = and;
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (CellValue v : arg.getRangeValues()) {
                    if (v.isBoolean() || v.isNumber()) {
                        boolean b = Coercion.toBoolean(v);
                        result = and ? result && b : result || b;
                        seen = true;
                    }
                }
            } else {
                Boolean b = Coercion.toBoolean(arg.getValue());
                if (b == null) {
                    return VALUE_ERROR;
                }
                result = and ? result && b : result || b;
                seen = true;
            }
        }
        return seen ? CellValue.bool(result) : VALUE_ERROR;
    }

    private static CellValue not(List<FunctionArgument> args) {
        if (args.size() != 1 || args.get(0).isRange()) {
            return VALUE_ERROR;
        }
        CellValue v = args.get(0).getValue();
        if (v.isError()) {
            return v;
        }
        Boolean b = Coercion.toBoolean(v);
        return b == null ? VALUE_ERROR : CellValue.bool(!b);
    }

    // ----------------------------------------------------------------
    // Text
    // ----------------------------------------------------------------

    private static CellValue concatenate(List<FunctionArgument> args) {
        if (args.isEmpty()) {
            return VALUE_ERROR;
        }
        CellValue error = firstError(args);
        if (error != null) {
            return error;
        }
        StringBuilder sb = new StringBuilder();
        for (FunctionArgument arg : args) {
            for (CellValue v : arg.values()) {
                sb.append(v.toDisplayString());
            }
        }
        return CellValue.string(sb.toString());
    }

    private static CellValue text(List<FunctionArgument> args, Function<String, CellValue> op) {
        if (args.size() != 1 || args.get(0).isRange()) {
            return VALUE_ERROR;
        }
        CellValue v = args.get(0).getValue();
        if (v.isError()) {
            return v;
        }
        return op.apply(v.toDisplayString());
    }

    // ----------------------------------------------------------------
    // Math
    // ----------------------------------------------------------------

    private static CellValue round(List<FunctionArgument> args) {
        if (args.isEmpty() || args.size() > 2) {
            return VALUE_ERROR;
        }
        List<Double> nums = scalarNumbers(args);
        if (nums == null) {
            CellValue error = firstError(args);
            return error != null ? error : VALUE_ERROR;
        }
        int digits = args.size() == 2 ? (int) (double) nums.get(1) : 0;
        double value = BigDecimal.valueOf(nums.get(0)).setScale(digits, RoundingMode.HALF_UP).doubleValue();
        return CellValue.number(value);
    }

    private static CellValue unaryMath(List<FunctionArgument> args, DoubleUnaryOperator op) {
        if (args.size() != 1) {
            return VALUE_ERROR;
        }
        List<Double> nums = scalarNumbers(args);
        if (nums == null) {
            CellValue error = firstError(args);
            return error != null ? error : VALUE_ERROR;
        }
        return Coercion.numberResult(op.applyAsDouble(nums.get(0)));
    }

    private static CellValue mod(List<FunctionArgument> args) {
        if (args.size() != 2) {
            return VALUE_ERROR;
        }
        List<Double> nums = scalarNumbers(args);
        if (nums == null) {
            CellValue error = firstError(args);
            return error != null ? error : VALUE_ERROR;
        }
        double n = nums.get(0);
        double d = nums.get(1);
        if (d == 0) {
            return CellValue.error(ErrorType.DIV_ZERO);
        }
        // result takes the sign of the divisor
        return Coercion.numberResult(n - d * Math.floor(n / d));
    }

    // ----------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------

    private static CellValue firstError(List<FunctionArgument> args) {
        for (FunctionArgument arg : args) {
            for (CellValue v : arg.values()) {
                if (v.isError()) {
                    return v;
                }
            }
        }
        return null;
    }

    // Scalars must coerce to numbers; ranges contribute only their numeric cells.
    private static Numbers collectNumbers(List<FunctionArgument> args) {
        Numbers numbers = new Numbers();
        CellValue error = firstError(args);
        if (error != null) {
            numbers.error = error;
            return numbers;
        }
        for (FunctionArgument arg : args) {
            if (arg.isRange()) {
                for (CellValue v : arg.getRangeValues()) {
                    if (v.isNumber()) {
                        numbers.values.add(v.asNumber());
                    }
                }
            } else {
                Double d = Coercion.toNumber(arg.getValue());
                if (d == null) {
                    numbers.error = VALUE_ERROR;
                    return numbers;
                }
                numbers.values.add(d);
            }
        }
        return numbers;
    }

    // All arguments as numbers, or null if any is a range, an error or non-numeric.
    private static List<Double> scalarNumbers(List<FunctionArgument> args) {
        List<Double> result = new ArrayList<>(args.size());
        for (FunctionArgument arg : args) {
            if (arg.isRange() || arg.getValue().isError()) {
                return null;
            }
            Double d = Coercion.toNumber(arg.getValue());
            if (d == null) {
                return null;
            }
            result.add(d);
        }
        return result;
    }

    private static final class Numbers {
        private final List<Double> values = new ArrayList<>();
        private CellValue error;
    }
}
