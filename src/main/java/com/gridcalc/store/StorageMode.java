package com.gridcalc.store;

/** Cell storage layout. {@link #AUTO} decides from the sheet's dimensions. */
public enum StorageMode {
    AUTO,
    DENSE,
    SPARSE
}
