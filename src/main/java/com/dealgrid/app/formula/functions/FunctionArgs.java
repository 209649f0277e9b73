package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.EvaluationContext;
import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.formula.FormulaNode;
import com.dealgrid.app.formula.RangeValue;
import com.dealgrid.app.formula.Values;
import com.dealgrid.app.models.CellError;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Lazily evaluated, memoized arguments of one function call, with the coercions
 * function bodies need. Coercions rethrow error arguments as FormulaException.
 */
public class FunctionArgs {

    private final List<FormulaNode> nodes;
    private final Function<FormulaNode, Object> evaluator;
    private final EvaluationContext context;
    private final Object[] values;
    private final boolean[] evaluated;

    public FunctionArgs(List<FormulaNode> nodes, Function<FormulaNode, Object> evaluator, EvaluationContext context) {
        this.nodes = nodes;
        this.evaluator = evaluator;
        this.context = context;
        this.values = new Object[nodes.size()];
        this.evaluated = new boolean[nodes.size()];
    }

    public int size() {
        return nodes.size();
    }

    public boolean has(int index) {
        return index < nodes.size();
    }

    public EvaluationContext getContext() {
        return context;
    }

    /**
     * Raw value: may be a CellError, a RangeValue or null.
     */
    public Object get(int index) {
        if (!evaluated[index]) {
            values[index] = evaluator.apply(nodes.get(index));
            evaluated[index] = true;
        }
        return values[index];
    }

    public Object scalar(int index) {
        Object value = Values.scalar(get(index));
        if (value instanceof CellError) {
            throw new FormulaException((CellError) value);
        }
        return value;
    }

    public double number(int index) {
        return Values.toNumber(get(index));
    }

    public double number(int index, double defaultValue) {
        if (!has(index) || get(index) == null) {
            return defaultValue;
        }
        return number(index);
    }

    public int integer(int index) {
        return (int) number(index);
    }

    public String text(int index) {
        return Values.toText(get(index));
    }

    public boolean bool(int index) {
        return Values.toBoolean(get(index));
    }

    public boolean bool(int index, boolean defaultValue) {
        if (!has(index) || get(index) == null) {
            return defaultValue;
        }
        return bool(index);
    }

    /**
     * The argument as a range; a scalar becomes a 1x1 range. Error scalars propagate.
     */
    public RangeValue range(int index) {
        Object value = get(index);
        if (value instanceof RangeValue) {
            return (RangeValue) value;
        }
        if (value instanceof CellError) {
            throw new FormulaException((CellError) value);
        }
        return RangeValue.single(value);
    }

    /**
     * Aggregate numbers of all arguments from the given index on, ranges flattened.
     */
    public List<Double> numbersFrom(int fromIndex) {
        List<Double> result = new ArrayList<>();
        for (int i = fromIndex; i < size(); i++) {
            collectNumbers(get(i), result);
        }
        return result;
    }

    public List<Double> numbers() {
        return numbersFrom(0);
    }

    public List<Double> numbers(int index) {
        List<Double> result = new ArrayList<>();
        collectNumbers(get(index), result);
        return result;
    }

    /**
     * All values of all arguments, ranges flattened row-major, blanks included.
     */
    public List<Object> flatten() {
        List<Object> result = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            Object value = get(i);
            if (value instanceof RangeValue) {
                result.addAll(((RangeValue) value).values());
            } else {
                result.add(value);
            }
        }
        return result;
    }

    private static void collectNumbers(Object value, List<Double> into) {
        if (value instanceof RangeValue) {
            for (Object member : ((RangeValue) value).values()) {
                Double number = Values.aggregateNumber(member);
                if (number != null) {
                    into.add(number);
                }
            }
        } else {
            Double number = Values.aggregateNumber(value);
            if (number != null) {
                into.add(number);
            }
        }
    }
}
