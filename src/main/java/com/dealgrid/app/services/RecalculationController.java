package com.dealgrid.app.services;

import com.dealgrid.app.exceptions.CircularReferenceException;
import com.dealgrid.app.formula.CellValueResolver;
import com.dealgrid.app.formula.EvaluationContext;
import com.dealgrid.app.formula.FormulaEvaluator;
import com.dealgrid.app.formula.FormulaParseException;
import com.dealgrid.app.formula.Reference;
import com.dealgrid.app.formula.ReferenceCollector;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellAddress;
import com.dealgrid.app.models.CellError;
import com.dealgrid.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Re-evaluates formula cells after a write and materializes their values.
 *
 * <p>Dependents are found by scanning every formula cell of every sheet; there is no
 * persisted dependency index. During a pass, referenced formula cells are evaluated on
 * demand through {@link #resolve}, so evaluation order follows the references. Re-entering
 * a cell that is still being evaluated aborts the evaluation with a
 * {@link CircularReferenceException}, and every cell on the evaluation path becomes
 * {@code #CIRCULAR!}.</p>
 */
public class RecalculationController implements CellValueResolver {

    private static final Logger log = LoggerFactory.getLogger(RecalculationController.class);

    private final MultiSheetManager sheets;
    private final FormulaEvaluator evaluator;
    private final Clock clock;

    // Cells currently being evaluated, outermost first
    private final Set<CellKey> evaluating = new LinkedHashSet<>();
    // Cells already evaluated in the current pass
    private final Set<CellKey> settled = new HashSet<>();
    private List<CellKey> cyclePath = Collections.emptyList();
    private boolean passRunning;

    public RecalculationController(MultiSheetManager sheets, FormulaEvaluator evaluator, Clock clock) {
        this.sheets = sheets;
        this.evaluator = evaluator;
        this.clock = clock;
    }

    /**
     * Re-evaluates the written cells that hold formulas, then everything that depends on
     * any written address, transitively.
     */
    public void recalculateAfterWrite(Sheet sheet, Collection<CellAddress> written) {
        Set<CellKey> changed = new LinkedHashSet<>();
        for (CellAddress address : written) {
            changed.add(new CellKey(sheet, address));
        }
        Set<CellKey> targets = new LinkedHashSet<>();
        for (CellKey key : changed) {
            Cell cell = sheet.getCells().read(key.getAddress());
            if (cell != null && cell.hasFormula()) {
                targets.add(key);
            }
        }
        targets.addAll(dependentsOf(changed));
        log.debug("Recalculating {} cell(s) after writing {} address(es) on {}",
                targets.size(), written.size(), sheet.getName());
        runPass(targets);
    }

    /**
     * Re-evaluates every formula cell in the workbook.
     */
    public void recalculateAll() {
        Set<CellKey> targets = new LinkedHashSet<>();
        for (Sheet sheet : sheets.getSheets()) {
            for (Cell cell : sheet.getCells().formulaCells()) {
                targets.add(new CellKey(sheet, cell.getAddress()));
            }
        }
        log.debug("Full recalculation of {} formula cell(s)", targets.size());
        runPass(targets);
    }

    /**
     * Value of a referenced cell. Inside a pass an unsettled formula cell is evaluated
     * first; outside a pass the materialized value is returned.
     */
    @Override
    public Object resolve(Sheet sheet, CellAddress address) {
        if (!passRunning) {
            return sheet.getCells().readValue(address);
        }
        return evaluateCell(new CellKey(sheet, address));
    }

    private void runPass(Collection<CellKey> targets) {
        passRunning = true;
        settled.clear();
        evaluating.clear();
        try {
            for (CellKey key : targets) {
                if (!settled.contains(key)) {
                    evaluateTopLevel(key);
                }
            }
        } finally {
            passRunning = false;
            settled.clear();
            evaluating.clear();
        }
    }

    private void evaluateTopLevel(CellKey key) {
        try {
            evaluateCell(key);
        } catch (CircularReferenceException e) {
            log.debug("Circular reference: {}", e.getPath());
            for (CellKey member : cyclePath) {
                member.getSheet().getCells().materialize(member.getAddress(), CellError.CIRCULAR);
                settled.add(member);
            }
            cyclePath = Collections.emptyList();
            evaluating.clear();
        }
    }

    private Object evaluateCell(CellKey key) {
        Cell cell = key.getSheet().getCells().read(key.getAddress());
        if (cell == null || !cell.hasFormula() || settled.contains(key)) {
            return cell == null ? null : cell.getValue();
        }
        if (evaluating.contains(key)) {
            cyclePath = new ArrayList<>(evaluating);
            List<String> path = new ArrayList<>();
            for (CellKey member : cyclePath) {
                path.add(member.toString());
            }
            path.add(key.toString());
            throw new CircularReferenceException("Circular reference at " + key, path);
        }
        evaluating.add(key);
        Object result;
        try {
            EvaluationContext context = new EvaluationContext(key.getSheet(), this, sheets, clock);
            result = evaluator.evaluate(cell.getFormula(), context);
        } finally {
            evaluating.remove(key);
        }
        key.getSheet().getCells().materialize(key.getAddress(), result);
        settled.add(key);
        return result;
    }

    /**
     * Transitive closure of formula cells whose references cover any changed cell.
     */
    Set<CellKey> dependentsOf(Collection<CellKey> changed) {
        Map<CellKey, List<Reference>> referenceCache = new HashMap<>();
        Set<CellKey> result = new LinkedHashSet<>();
        Set<CellKey> visited = new HashSet<>(changed);
        Queue<CellKey> queue = new LinkedList<>(changed);

        while (!queue.isEmpty()) {
            CellKey current = queue.poll();
            for (Sheet sheet : sheets.getSheets()) {
                for (Cell cell : sheet.getCells().formulaCells()) {
                    CellKey candidate = new CellKey(sheet, cell.getAddress());
                    if (visited.contains(candidate)) {
                        continue;
                    }
                    List<Reference> references = referenceCache.computeIfAbsent(candidate,
                            k -> referencesOf(cell.getFormula()));
                    if (covers(sheet, references, current)) {
                        visited.add(candidate);
                        result.add(candidate);
                        queue.add(candidate);
                    }
                }
            }
        }
        return result;
    }

    private List<Reference> referencesOf(String formula) {
        try {
            return ReferenceCollector.collect(evaluator.parse(formula));
        } catch (FormulaParseException e) {
            return Collections.emptyList();
        }
    }

    private boolean covers(Sheet owner, List<Reference> references, CellKey target) {
        return covers(owner, references, target, false);
    }

    // A named range resolves to plain references only, names inside it are ignored
    private boolean coversNamedRange(Sheet owner, String name, CellKey target) {
        String text = owner.getNamedRange(name);
        return text != null && covers(owner, referencesOf(text), target, true);
    }

    private boolean covers(Sheet owner, List<Reference> references, CellKey target, boolean nested) {
        for (Reference reference : references) {
            if (reference.isName()) {
                if (!nested && coversNamedRange(owner, reference.getName(), target)) {
                    return true;
                }
            } else if (reference.isSpan()) {
                List<Sheet> span = sheets.sheetSpan(reference.getSheet(), reference.getLastSheet());
                if (span != null && containsSheet(span, target.getSheet())
                        && reference.getRange().contains(target.getAddress())) {
                    return true;
                }
            } else {
                Sheet referenced = reference.getSheet() == null ? owner : sheets.findSheet(reference.getSheet());
                if (referenced != null && referenced.getId() == target.getSheet().getId()
                        && reference.getRange().contains(target.getAddress())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsSheet(List<Sheet> span, Sheet sheet) {
        for (Sheet member : span) {
            if (member.getId() == sheet.getId()) {
                return true;
            }
        }
        return false;
    }
}
