package com.yscompiler.print;

import java.util.Objects;

/**
 * Settings handed to the {@link CodeFormatter}.
 *
 * @param style          name of the formatter's style profile
 * @param parseStringAll whether the formatter treats its input as a whole
 *                       program (many top-level forms) rather than one form
 */
public record FormatOptions(String style, boolean parseStringAll) {

    public static final String COMMUNITY_STYLE = "community";

    public static final FormatOptions DEFAULT = new FormatOptions(COMMUNITY_STYLE, true);

    public FormatOptions {
        Objects.requireNonNull(style, "style");
    }
}
