package id.go.kemenkeu.djpbn.sakti.wf.core.record;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowSecurityException;

import java.util.regex.Pattern;

/**
 * Table and column names are configuration, never user input, but they are
 * still concatenated into SQL. Only plain identifiers are accepted.
 */
final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

    private SqlIdentifiers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String require(String identifier, String what) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new WorkflowSecurityException("Illegal SQL identifier for " + what + ": " + identifier);
        }
        return identifier;
    }
}
