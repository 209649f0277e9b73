package com.dealgrid.app.services;

import com.dealgrid.app.config.GridProperties;
import com.dealgrid.app.exceptions.WorkbookNotFoundException;
import com.dealgrid.app.formula.FormulaEvaluator;
import com.dealgrid.app.models.Cell;
import com.dealgrid.app.models.CellValues;
import com.dealgrid.app.models.ConditionalFormat;
import com.dealgrid.app.models.WriteOptions;
import com.dealgrid.app.models.dto.CellView;
import com.dealgrid.app.models.dto.CellWriteRequest;
import com.dealgrid.app.models.state.WorkbookState;
import com.dealgrid.app.references.AddressCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * In-memory registry of workbooks. Each call takes the workbook's lock: the write
 * lock for anything that mutates, the read lock for reads. The engine itself does
 * no locking.
 */
@Service
public class WorkbookService {

    private static final Logger log = LoggerFactory.getLogger(WorkbookService.class);

    // All workbooks live here in memory; persistence is out of scope
    private final Map<Long, GridSession> sessions = new ConcurrentHashMap<>();

    private final GridProperties properties;
    private final FormulaEvaluator evaluator;
    private final Clock clock;

    public WorkbookService(GridProperties properties, FormulaEvaluator evaluator, Clock clock) {
        this.properties = properties;
        this.evaluator = evaluator;
        this.clock = clock;
    }

    /**
     * Creates a workbook with one empty sheet and returns its ID.
     */
    public long createWorkbook() {
        GridSession session = new GridSession(properties, evaluator, clock);
        long id = session.getWorkbook().getId();
        sessions.put(id, session);
        log.info("Created workbook {}", id);
        return id;
    }

    /**
     * Retrieves a workbook session by ID. Throws if not found.
     */
    public GridSession getSession(long workbookId) {
        GridSession session = sessions.get(workbookId);
        if (session == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return session;
    }

    /**
     * Display text of every populated cell of the active sheet, keyed by address,
     * in row-major order.
     */
    public Map<String, Object> getActiveSheetValues(long workbookId) {
        return read(workbookId, session -> {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Cell cell : session.getActiveSheet().getCells().cells()) {
                if (cell.getValue() != null) {
                    data.put(cell.getAddress().toString(), CellValues.display(cell.getValue()));
                }
            }
            return data;
        });
    }

    public void writeCell(long workbookId, String address, CellWriteRequest request) {
        Object value = request == null ? null : request.getValue();
        WriteOptions options = request == null
                ? WriteOptions.none() : new WriteOptions(request.getSource(), request.getLink());
        mutate(workbookId, session -> {
            session.write(address, value, options);
            return null;
        });
    }

    public void setFormula(long workbookId, String address, String formula) {
        mutate(workbookId, session -> {
            session.setFormula(address, formula);
            return null;
        });
    }

    public void styleCell(long workbookId, String address, Map<String, Object> style) {
        mutate(workbookId, session -> {
            session.styleCell(address, style);
            return null;
        });
    }

    public CellView readCell(long workbookId, String address) {
        return read(workbookId, session -> {
            CellView view = new CellView();
            view.setAddress(addressLabel(address));
            Cell cell = session.readCell(address);
            if (cell != null) {
                view.setValue(cell.getValue());
                view.setFormula(cell.getFormula());
                view.setType(cell.getType());
                view.setSource(cell.getSourceAnnotation());
                view.setLink(cell.getLink());
                view.setComment(cell.getComment());
            }
            view.setDisplay(CellValues.display(view.getValue()));
            view.setStyle(session.effectiveStyle(address));
            return view;
        });
    }

    public void clearRange(long workbookId, String start, String end) {
        mutate(workbookId, session -> {
            session.clearRange(start, end);
            return null;
        });
    }

    public void writeRange(long workbookId, String start, String end, List<List<Object>> matrix) {
        mutate(workbookId, session -> {
            session.writeRange(start, end, matrix);
            return null;
        });
    }

    public boolean undo(long workbookId) {
        return mutate(workbookId, GridSession::undo);
    }

    public boolean redo(long workbookId) {
        return mutate(workbookId, GridSession::redo);
    }

    public WorkbookState exportState(long workbookId) {
        return read(workbookId, GridSession::exportState);
    }

    public void importState(long workbookId, WorkbookState state) {
        mutate(workbookId, session -> {
            session.importState(state);
            return null;
        });
    }

    public String exportCsv(long workbookId) {
        return read(workbookId, GridSession::exportCsv);
    }

    public void importCsv(long workbookId, String csv) {
        mutate(workbookId, session -> {
            session.importCsv(csv);
            return null;
        });
    }

    public long createSheet(long workbookId, String name) {
        return mutate(workbookId, session -> session.createSheet(name));
    }

    public void switchSheet(long workbookId, String sheet) {
        mutate(workbookId, session -> {
            session.switchSheet(sheet);
            return null;
        });
    }

    public void renameSheet(long workbookId, String sheet, String newName) {
        mutate(workbookId, session -> {
            session.renameSheet(sheet, newName);
            return null;
        });
    }

    public long copySheet(long workbookId, String sheet, String newName) {
        return mutate(workbookId, session -> session.copySheet(sheet, newName));
    }

    public void deleteSheet(long workbookId, String sheet) {
        mutate(workbookId, session -> {
            session.deleteSheet(sheet);
            return null;
        });
    }

    public String addConditionalFormat(long workbookId, ConditionalFormat rule) {
        return mutate(workbookId, session -> session.addConditionalFormat(rule));
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private <T> T read(long workbookId, Function<GridSession, T> action) {
        GridSession session = getSession(workbookId);
        return locked(session.getWorkbook().getLock().readLock(), session, action);
    }

    private <T> T mutate(long workbookId, Function<GridSession, T> action) {
        GridSession session = getSession(workbookId);
        return locked(session.getWorkbook().getLock().writeLock(), session, action);
    }

    private static <T> T locked(Lock lock, GridSession session, Function<GridSession, T> action) {
        lock.lock();
        try {
            return action.apply(session);
        } finally {
            lock.unlock();
        }
    }

    // Upper-cases the cell part and keeps any sheet qualifier as given
    private static String addressLabel(String address) {
        int bang = address.lastIndexOf('!');
        if (bang < 0) {
            return AddressCodec.normalize(address);
        }
        return address.substring(0, bang + 1) + AddressCodec.normalize(address.substring(bang + 1));
    }
}
