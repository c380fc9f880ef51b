package org.loesak.pgmigrate.core.migration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses migration identity from class names of the form {@code _{identifier}_{name}}. The leading underscore is
 * optional, the identifier is a 12 digit timestamp and the name may itself contain underscores.
 */
public final class MigrationClassNameParser {

    private static final String MIGRATION_CLASS_NAME_REGEX = "^_?(\\d{12})_(.+)$";
    private static final Pattern MIGRATION_CLASS_NAME_PATTERN = Pattern.compile(MIGRATION_CLASS_NAME_REGEX);

    private MigrationClassNameParser() {
    }

    public static MigrationIdentity parse(final String className) {
        final Matcher matcher = MIGRATION_CLASS_NAME_PATTERN.matcher(className == null ? "" : className);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(String.format(
                    "migration class name [%s] does not match the expected format [_{identifier}_{name}] (e.g. [_202310191050_AddUsersTable])",
                    className));
        }

        return new MigrationIdentity(Long.parseLong(matcher.group(1)), matcher.group(2));
    }

    public static long parseIdentifier(final String className) {
        return parse(className).identifier();
    }

    public static String parseName(final String className) {
        return parse(className).name();
    }

    public static boolean isValidClassName(final String className) {
        return className != null && MIGRATION_CLASS_NAME_PATTERN.matcher(className).matches();
    }
}
