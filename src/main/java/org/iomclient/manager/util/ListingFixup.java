package org.iomclient.manager.util;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Literal text replacement applied to an HTML listing after it is read back
 * from the work directory.
 */
public final class ListingFixup {

    private final String find;
    private final String replace;

    public ListingFixup(String find, String replace) {
        if (find == null || find.isEmpty()) {
            throw new IllegalArgumentException("Listing fix-up needs a non-empty search text");
        }
        this.find = find;
        this.replace = replace == null ? "" : replace;
    }

    /**
     * Rules for the html5 destination: form feeds become new lines, the body
     * is left aligned and the base font size is enlarged.
     */
    public static List<ListingFixup> defaults() {
        return Arrays.asList(
                new ListingFixup("\f", "\n"),
                new ListingFixup("<body class=\"c body\">", "<body class=\"l body\">"),
                new ListingFixup("font-size: x-small;", "font-size: normal;"));
    }

    public static String applyAll(String listing, List<ListingFixup> fixups) {
        String result = listing;
        for (ListingFixup fixup : fixups) {
            result = fixup.apply(result);
        }
        return result;
    }

    public String apply(String listing) {
        return listing.replace(find, replace);
    }

    public String getFind() {
        return find;
    }

    public String getReplace() {
        return replace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListingFixup)) return false;
        ListingFixup that = (ListingFixup) o;
        return find.equals(that.find) && replace.equals(that.replace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(find, replace);
    }

    @Override
    public String toString() {
        return "ListingFixup{" +
                "find='" + find + '\'' +
                ", replace='" + replace + '\'' +
                '}';
    }
}
