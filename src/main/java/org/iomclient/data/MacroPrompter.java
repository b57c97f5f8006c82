package org.iomclient.data;

/**
 * Interactive source of macro variable values.
 */
@FunctionalInterface
public interface MacroPrompter {

    /**
     * Ask the user for a value.
     *
     * @param message text shown to the user
     * @param hide    true to hide the typed input
     * @return the entered value, empty if nothing was entered, or null if the
     * user cancelled
     */
    String prompt(String message, boolean hide);
}
