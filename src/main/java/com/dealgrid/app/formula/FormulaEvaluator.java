package com.dealgrid.app.formula;

import com.dealgrid.app.exceptions.InvalidAddressException;
import com.dealgrid.app.formula.functions.FunctionArgs;
import com.dealgrid.app.formula.functions.FunctionLibrary;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.CellRange;
import com.dealgrid.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates formula text to a materialized value. Errors come back as CellError values;
 * the only exception that escapes is CircularReferenceException from the resolver.
 */
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private static final int CACHE_LIMIT = 4096;

    private final FunctionLibrary library;
    private final Map<String, FormulaNode> parseCache = new ConcurrentHashMap<>();

    public FormulaEvaluator(FunctionLibrary library) {
        this.library = library;
    }

    /**
     * Parses (and caches) the formula tree.
     *
     * @throws FormulaParseException when the text is malformed
     */
    public FormulaNode parse(String formula) {
        FormulaNode cached = parseCache.get(formula);
        if (cached != null) {
            return cached;
        }
        FormulaNode node;
        try {
            node = FormulaParser.parse(formula);
        } catch (InvalidAddressException e) {
            throw new FormulaParseException(e.getMessage());
        }
        if (parseCache.size() >= CACHE_LIMIT) {
            parseCache.clear();
        }
        parseCache.put(formula, node);
        return node;
    }

    /**
     * Full evaluation of a cell formula: a bare range result is #ERROR!,
     * a blank result becomes 0, non-finite numbers become #ERROR!.
     */
    public Object evaluate(String formula, EvaluationContext context) {
        FormulaNode node;
        try {
            node = parse(formula);
        } catch (FormulaParseException e) {
            log.debug("Cannot parse formula {}: {}", formula, e.getMessage());
            return CellError.ERROR;
        }
        Object result = evaluate(node, context);
        if (result instanceof RangeValue) {
            return CellError.ERROR;
        }
        if (result == null) {
            return 0.0;
        }
        if (result instanceof Double && !Double.isFinite((Double) result)) {
            return CellError.ERROR;
        }
        return result;
    }

    /**
     * Evaluates a subtree. Ranges are returned as RangeValue.
     */
    public Object evaluate(FormulaNode node, EvaluationContext context) {
        return new Evaluation(context).evaluateArgument(node);
    }

    private final class Evaluation implements FormulaVisitor<Object> {

        private final EvaluationContext context;

        Evaluation(EvaluationContext context) {
            this.context = context;
        }

        Object evaluateArgument(FormulaNode node) {
            try {
                return node.accept(this);
            } catch (FormulaException e) {
                return e.getError();
            }
        }

        @Override
        public Object visitNumber(FormulaNode.NumberLiteral node) {
            return node.getValue();
        }

        @Override
        public Object visitText(FormulaNode.TextLiteral node) {
            return node.getValue();
        }

        @Override
        public Object visitBoolean(FormulaNode.BooleanLiteral node) {
            return node.getValue();
        }

        @Override
        public Object visitCellRef(FormulaNode.CellRef node) {
            Sheet sheet = sheetFor(node.getSheet());
            if (sheet == null) {
                return CellError.REF;
            }
            return context.getResolver().resolve(sheet, node.getAddress());
        }

        @Override
        public Object visitRangeRef(FormulaNode.RangeRef node) {
            Sheet sheet = sheetFor(node.getSheet());
            if (sheet == null) {
                return CellError.REF;
            }
            return rangeValue(sheet, node.getRange());
        }

        @Override
        public Object visitSheetSpan(FormulaNode.SheetSpanRef node) {
            List<Sheet> sheets = context.getDirectory().sheetSpan(node.getFirstSheet(), node.getLastSheet());
            if (sheets == null) {
                return CellError.REF;
            }
            List<Object> values = new ArrayList<>();
            for (Sheet sheet : sheets) {
                values.addAll(rangeValue(sheet, node.getRange()).values());
            }
            return RangeValue.column(values);
        }

        @Override
        public Object visitName(FormulaNode.NameRef node) {
            String target = context.getSheet().getNamedRange(node.getName());
            if (target == null) {
                return CellError.REF;
            }
            FormulaNode reference;
            try {
                reference = parse(target);
            } catch (FormulaParseException e) {
                return CellError.REF;
            }
            if (!(reference instanceof FormulaNode.CellRef || reference instanceof FormulaNode.RangeRef
                    || reference instanceof FormulaNode.SheetSpanRef)) {
                return CellError.REF;
            }
            return reference.accept(this);
        }

        @Override
        public Object visitUnary(FormulaNode.Unary node) {
            Object operand = node.getOperand().accept(this);
            if (operand instanceof CellError) {
                return operand;
            }
            double value = Values.toNumber(operand);
            switch (node.getOperator()) {
                case MINUS:
                    return Values.finite(-value);
                case PERCENT:
                    return Values.finite(value / 100.0);
                default:
                    return Values.finite(value);
            }
        }

        @Override
        public Object visitBinary(FormulaNode.Binary node) {
            Object left = node.getLeft().accept(this);
            if (left instanceof CellError) {
                return left;
            }
            Object right = node.getRight().accept(this);
            if (right instanceof CellError) {
                return right;
            }
            switch (node.getOperator()) {
                case PLUS:
                    return Values.finite(Values.toNumber(left) + Values.toNumber(right));
                case MINUS:
                    return Values.finite(Values.toNumber(left) - Values.toNumber(right));
                case STAR:
                    return Values.finite(Values.toNumber(left) * Values.toNumber(right));
                case SLASH:
                    return Values.finite(Values.toNumber(left) / Values.toNumber(right));
                case CARET:
                    return Values.finite(Math.pow(Values.toNumber(left), Values.toNumber(right)));
                case AMPERSAND:
                    return Values.toText(left) + Values.toText(right);
                case EQ:
                    return Values.compare(left, right) == 0;
                case NE:
                    return Values.compare(left, right) != 0;
                case LT:
                    return Values.compare(left, right) < 0;
                case LE:
                    return Values.compare(left, right) <= 0;
                case GT:
                    return Values.compare(left, right) > 0;
                case GE:
                    return Values.compare(left, right) >= 0;
                default:
                    throw new FormulaException(CellError.ERROR, "Unknown operator " + node.getOperator());
            }
        }

        @Override
        public Object visitCall(FormulaNode.FunctionCall node) {
            FunctionLibrary.Definition definition = library.find(node.getName());
            if (definition == null) {
                log.debug("Unknown function {}", node.getName());
                return CellError.ERROR;
            }
            int count = node.getArguments().size();
            if (count < definition.getMinArgs() || count > definition.getMaxArgs()) {
                return CellError.ERROR;
            }
            FunctionArgs args = new FunctionArgs(node.getArguments(), this::evaluateArgument, context);
            try {
                Object result = definition.getBody().apply(args);
                if (result instanceof Double && !Double.isFinite((Double) result)) {
                    return CellError.ERROR;
                }
                return result;
            } catch (FormulaException e) {
                return e.getError();
            }
        }

        private Sheet sheetFor(String name) {
            if (name == null) {
                return context.getSheet();
            }
            return context.getDirectory().findSheet(name);
        }

        // Only populated cells are read; the stored block stops at the last populated row/column
        private RangeValue rangeValue(Sheet sheet, CellRange range) {
            List<CellAddress> populated = new ArrayList<>();
            int rows = 0;
            int columns = 0;
            for (Cell cell : sheet.getCells().cells()) {
                CellAddress address = cell.getAddress();
                if (range.contains(address)) {
                    populated.add(address);
                    rows = Math.max(rows, address.getRow() - range.getStart().getRow() + 1);
                    columns = Math.max(columns, address.getColumn() - range.getStart().getColumn() + 1);
                }
            }
            Object[][] data = new Object[rows][columns];
            for (CellAddress address : populated) {
                data[address.getRow() - range.getStart().getRow()][address.getColumn() - range.getStart().getColumn()] =
                        context.getResolver().resolve(sheet, address);
            }
            return new RangeValue(range.getRowCount(), range.getColumnCount(), data);
        }
    }
}
