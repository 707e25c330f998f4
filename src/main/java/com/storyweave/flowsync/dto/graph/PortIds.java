package com.storyweave.flowsync.dto.graph;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Port naming for branching nodes: {@code choice-<index>} on menus, {@code branch-<index>} on conditions.
 */
public final class PortIds {

    private static final Pattern CHOICE_PATTERN = Pattern.compile("^choice-(\\d+)$");
    private static final Pattern BRANCH_PATTERN = Pattern.compile("^branch-(\\d+)$");

    private PortIds() {
    }

    public static String choice(int index) {
        return "choice-" + index;
    }

    public static String branch(int index) {
        return "branch-" + index;
    }

    /**
     * Choice index encoded in a menu port id, or null if the handle is not a choice port.
     */
    public static Integer parseChoiceIndex(String handle) {
        return parse(CHOICE_PATTERN, handle);
    }

    public static Integer parseBranchIndex(String handle) {
        return parse(BRANCH_PATTERN, handle);
    }

    /**
     * Index of either port kind, or null.
     */
    public static Integer parsePortIndex(String handle) {
        Integer choice = parseChoiceIndex(handle);
        return choice != null ? choice : parseBranchIndex(handle);
    }

    private static Integer parse(Pattern pattern, String handle) {
        if (handle == null) return null;
        Matcher matcher = pattern.matcher(handle);
        if (!matcher.matches()) return null;
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
