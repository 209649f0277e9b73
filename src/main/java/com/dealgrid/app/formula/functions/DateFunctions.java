package com.dealgrid.app.formula.functions;

import com.dealgrid.app.formula.FormulaException;
import com.dealgrid.app.models.CellError;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Dates are ISO text ("yyyy-MM-dd"). Numbers are read as spreadsheet serial days
 * counted from 1899-12-30. TODAY and NOW read the injected clock.
 */
final class DateFunctions {

    private static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);
    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private DateFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("TODAY", 0, 0, args -> LocalDate.now(args.getContext().getClock()).toString());
        library.register("NOW", 0, 0, args -> LocalDateTime.now(args.getContext().getClock()).format(NOW_FORMAT));
        // Month and day overflow roll into the following months, as in DATE(2024, 14, 1) = 2025-02-01
        library.register("DATE", 3, 3, args -> {
            int year = (int) args.number(0);
            int month = (int) args.number(1);
            int day = (int) args.number(2);
            try {
                return LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L).toString();
            } catch (RuntimeException e) {
                throw new FormulaException(CellError.ERROR, "Bad date");
            }
        });
        library.register("YEAR", 1, 1, args -> (double) toDate(args.scalar(0)).getYear());
        library.register("MONTH", 1, 1, args -> (double) toDate(args.scalar(0)).getMonthValue());
        library.register("DAY", 1, 1, args -> (double) toDate(args.scalar(0)).getDayOfMonth());
        library.register("DATEDIF", 3, 3, args -> {
            LocalDate start = toDate(args.scalar(0));
            LocalDate end = toDate(args.scalar(1));
            if (start.isAfter(end)) {
                throw new FormulaException(CellError.ERROR, "Start after end");
            }
            switch (args.text(2).trim().toUpperCase(Locale.ROOT)) {
                case "D":
                    return (double) ChronoUnit.DAYS.between(start, end);
                case "M":
                    return (double) ChronoUnit.MONTHS.between(start, end);
                case "Y":
                    return (double) ChronoUnit.YEARS.between(start, end);
                default:
                    throw new FormulaException(CellError.ERROR, "Unknown unit");
            }
        });
    }

    static LocalDate toDate(Object value) {
        if (value instanceof Double) {
            return SERIAL_EPOCH.plusDays((long) Math.floor((Double) value));
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.length() >= 10) {
                try {
                    return LocalDate.parse(text.substring(0, 10));
                } catch (DateTimeParseException e) {
                    throw new FormulaException(CellError.ERROR, "Not a date: " + text);
                }
            }
        }
        throw new FormulaException(CellError.ERROR, "Not a date: " + value);
    }

    static double daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}
