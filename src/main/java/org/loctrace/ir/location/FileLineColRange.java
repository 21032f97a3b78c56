package org.loctrace.ir.location;

import org.loctrace.api.LocationErrorCode;
import org.loctrace.api.LocationException;
import org.loctrace.ir.context.LocationContext;
import org.loctrace.ir.context.LocationKey;

/**
 * A position or range in a source file.
 * <p>
 * Every form is stored as the canonical tuple {@code (startLine, startColumn, endLine, endColumn)}.
 * A column that is not known is {@link #UNSET}, which is distinct from column zero. The narrower
 * builders fill the tuple as follows:
 * <ul>
 *   <li>{@code (line)} becomes {@code (line, UNSET, line, UNSET)}</li>
 *   <li>{@code (line, column)} becomes {@code (line, column, line, column)}</li>
 *   <li>{@code (line, startColumn, endColumn)} becomes {@code (line, startColumn, line, endColumn)}</li>
 * </ul>
 * In the canonical builder an {@code UNSET} end line is taken from the start line, and an
 * {@code UNSET} end column on a single line is taken from the start column.
 */
public final class FileLineColRange extends Location {

    /** Marks a column (or, in the canonical builder, an end line) that is not known. */
    public static final int UNSET = -1;

    private record Key(String filename, int startLine, int startColumn, int endLine, int endColumn)
            implements LocationKey {}

    private final String filename;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    private FileLineColRange(LocationContext context, int id, Key key) {
        super(context, id);
        this.filename = key.filename();
        this.startLine = key.startLine();
        this.startColumn = key.startColumn();
        this.endLine = key.endLine();
        this.endColumn = key.endColumn();
    }

    /**
     * Returns the location of a whole line.
     */
    public static FileLineColRange get(LocationContext context, String filename, int line) {
        return get(context, filename, line, UNSET, line, UNSET);
    }

    /**
     * Returns the location of a single line and column.
     */
    public static FileLineColRange get(LocationContext context, String filename, int line, int column) {
        return get(context, filename, line, column, line, column);
    }

    /**
     * Returns the location of a column range within one line.
     */
    public static FileLineColRange get(LocationContext context, String filename, int line,
                                       int startColumn, int endColumn) {
        return get(context, filename, line, startColumn, line, endColumn);
    }

    /**
     * Returns the location of an arbitrary range. This is the canonical builder; all other
     * forms delegate to it.
     *
     * @param context     The owning context.
     * @param filename    The file name, must not be null.
     * @param startLine   The first line.
     * @param startColumn The first column, or {@link #UNSET}.
     * @param endLine     The last line, or {@link #UNSET} for {@code startLine}.
     * @param endColumn   The last column, or {@link #UNSET}.
     * @return The canonical location.
     * @throws LocationException with {@link LocationErrorCode#MISSING_REQUIRED_FIELD} if the file name
     *         is missing, or {@link LocationErrorCode#INVALID_RANGE} if the range is malformed.
     */
    public static FileLineColRange get(LocationContext context, String filename, int startLine,
                                       int startColumn, int endLine, int endColumn) {
        if (filename == null) {
            throw new LocationException(LocationErrorCode.MISSING_REQUIRED_FIELD,
                    "A file location requires a filename.");
        }
        int normalizedEndLine = endLine == UNSET ? startLine : endLine;
        int normalizedEndColumn = endColumn == UNSET && normalizedEndLine == startLine ? startColumn : endColumn;
        validate(startLine, startColumn, normalizedEndLine, normalizedEndColumn);

        Key key = new Key(context.storage().internString(filename),
                startLine, startColumn, normalizedEndLine, normalizedEndColumn);
        return context.storage().intern(key, id -> new FileLineColRange(context, id, key));
    }

    private static void validate(int startLine, int startColumn, int endLine, int endColumn) {
        if (startLine < 0 || endLine < 0) {
            throw invalid("lines must not be negative", startLine, startColumn, endLine, endColumn);
        }
        if (startColumn < UNSET || endColumn < UNSET) {
            throw invalid("columns must not be negative", startLine, startColumn, endLine, endColumn);
        }
        if (startColumn == UNSET) {
            if (endLine != startLine || endColumn != UNSET) {
                throw invalid("a range without start column must cover exactly one line",
                        startLine, startColumn, endLine, endColumn);
            }
            return;
        }
        if (endColumn == UNSET) {
            throw invalid("a multi-line range requires an end column", startLine, startColumn, endLine, endColumn);
        }
        if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw invalid("end lies before start", startLine, startColumn, endLine, endColumn);
        }
    }

    private static LocationException invalid(String reason, int startLine, int startColumn, int endLine, int endColumn) {
        return new LocationException(LocationErrorCode.INVALID_RANGE, String.format(
                "Invalid range %d:%d to %d:%d: %s.", startLine, startColumn, endLine, endColumn, reason));
    }

    public String filename() {
        return filename;
    }

    public int startLine() {
        return startLine;
    }

    public int startColumn() {
        return startColumn;
    }

    public int endLine() {
        return endLine;
    }

    public int endColumn() {
        return endColumn;
    }

    /**
     * @return {@code true} if the column is known.
     */
    public boolean hasColumn() {
        return startColumn != UNSET;
    }

    /**
     * @return {@code true} if the range starts and ends on the same line.
     */
    public boolean isSingleLine() {
        return startLine == endLine;
    }

    /**
     * @return {@code true} if the range is a single line and column.
     */
    public boolean isPoint() {
        return hasColumn() && isSingleLine() && startColumn == endColumn;
    }

    @Override
    public LocationKind kind() {
        return LocationKind.FILE_LINE_COL_RANGE;
    }
}
