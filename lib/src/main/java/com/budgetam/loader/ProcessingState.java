package com.budgetam.loader;

/**
 * States of one workbook scan.
 *
 * <ul>
 *   <li>{@code INIT}: looking for the grand-total row
 *   <li>{@code READY}: grand total seen, hierarchy rows may follow
 *   <li>{@code STATE_BODY}, {@code PROGRAM}: inside the most recent header of that level
 *   <li>{@code SUBPROGRAM}: after the subprogram marker, subprogram headers are accepted
 * </ul>
 */
public enum ProcessingState {
    INIT,
    READY,
    STATE_BODY,
    PROGRAM,
    SUBPROGRAM
}
