package com.budgetam.loader;

import com.budgetam.workbook.CellText;
import java.util.Objects;

/** Parsed subprogram code, with the program part of a dash-joined code where one is kept. */
public final class SubprogramCode {
    private final Integer programCodeExt;
    private final int code;

    public SubprogramCode(Integer programCodeExt, int code) {
        this.programCodeExt = programCodeExt;
        this.code = code;
    }

    /**
     * Parses a 2019-2024 code: either a bare number ({@code "11001"}, {@code "11001.0"}) or a
     * {@code <program>-<subprogram>} pair whose second part is the code.
     *
     * @throws NumberFormatException if the code is not in either form
     */
    public static SubprogramCode parseLegacy(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.indexOf('-') >= 0) {
            String[] parts = raw.split("-", -1);
            if (parts.length < 2) {
                throw new NumberFormatException("Malformed subprogram code: " + raw);
            }
            return new SubprogramCode(null, Integer.parseInt(parts[1].trim()));
        }
        return new SubprogramCode(null, CellText.parseCode(raw));
    }

    /**
     * Parses a 2025 code {@code "1154 - 11001"} into program part 1154 and code 11001.
     *
     * @throws NumberFormatException unless the code is exactly two integers joined by a dash
     */
    public static SubprogramCode parseDashed(String raw) {
        Objects.requireNonNull(raw, "raw");
        String[] parts = raw.split("-", -1);
        if (parts.length != 2) {
            throw new NumberFormatException("Expected <program>-<subprogram> code: " + raw);
        }
        return new SubprogramCode(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
    }

    /** Program part of a 2025 code, otherwise {@code null}. */
    public Integer getProgramCodeExt() {
        return programCodeExt;
    }

    public int getCode() {
        return code;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SubprogramCode that
                && code == that.code
                && Objects.equals(programCodeExt, that.programCodeExt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(programCodeExt, code);
    }

    @Override
    public String toString() {
        return programCodeExt == null ? Integer.toString(code) : programCodeExt + "-" + code;
    }
}
