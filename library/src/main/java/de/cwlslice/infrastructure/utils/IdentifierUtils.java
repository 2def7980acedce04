package de.cwlslice.infrastructure.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Slicing and joining of global identifiers of the form {@code <document-uri>#<path>}.
 */
public class IdentifierUtils {

    public static final String FRAGMENT_SEPARATOR = "#";
    public static final String PATH_SEPARATOR = "/";

    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:.*");

    public static Defragmented defrag(final String id) {
        int index = id.indexOf(FRAGMENT_SEPARATOR);
        if (index < 0) {
            return new Defragmented(id, "");
        }
        return new Defragmented(id.substring(0, index), id.substring(index + 1));
    }

    // e.g. 'file:///wf.cwl#step1/out' -> 'file:///wf.cwl#step1_out'
    public static String flatten(final String id) {
        var defragmented = defrag(id);
        return defragmented.base() + FRAGMENT_SEPARATOR + defragmented.fragment().replace(PATH_SEPARATOR, "_");
    }

    // e.g. 'file:///wf.cwl#step1/out' -> 'out'
    public static String shortname(final String id) {
        var fragment = StringUtils.substringAfterLast(FRAGMENT_SEPARATOR + id, FRAGMENT_SEPARATOR);
        return StringUtils.substringAfterLast(PATH_SEPARATOR + fragment, PATH_SEPARATOR);
    }

    public static String rebase(final String prefix, final String suffix) {
        var separator = prefix.contains(FRAGMENT_SEPARATOR) ? PATH_SEPARATOR : FRAGMENT_SEPARATOR;
        return prefix + separator + suffix;
    }

    public static String join(final String base, final String local) {
        if (isAbsolute(local)) {
            return local;
        }
        var name = StringUtils.removeStart(local, FRAGMENT_SEPARATOR);
        if (name.isEmpty()) {
            return base;
        }
        return rebase(base, name);
    }

    public static boolean isAbsolute(final String id) {
        return id.startsWith("_:") || SCHEME.matcher(id).matches();
    }

    public static boolean isNestedUnder(final String id, final String parentId) {
        if (id.length() <= parentId.length() + 1 || !id.startsWith(parentId)) {
            return false;
        }
        char separator = id.charAt(parentId.length());
        return separator == '/' || separator == '#';
    }

    public record Defragmented(String base, String fragment) {}

    private IdentifierUtils() {}
}
