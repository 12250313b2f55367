package com.coxeter;

/** A Coxeter matrix entry that no Coxeter system can have. */
public class InvalidCoxeterEntryException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int row;
    private final int col;

    public InvalidCoxeterEntryException(int row, int col, String message) {
        super("Coxeter entry (" + row + "," + col + "): " + message);
        this.row = row;
        this.col = col;
    }

    public int getRow() { return row; }
    public int getCol() { return col; }
}
