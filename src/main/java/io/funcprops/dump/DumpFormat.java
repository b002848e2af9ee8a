package io.funcprops.dump;

/**
 * Fixed tokens of the function properties dump format. See
 * {@code src/test/resources/props/README.txt} for a description of the format.
 */
final class DumpFormat {

    /** Every line of a dump starts with this. */
    static final String COMMENT = "// ";

    /** Ends the file preamble. */
    static final String PREAMBLE_DELIMITER = "<endfilepreamble>";

    /** Ends the human-readable rendering of one function's properties. */
    static final String PROPS_DELIMITER = "<endpropsdump>";

    /** Ends one function block. */
    static final String FN_DELIMITER = "<endfuncpreamble>";

    static final String[] PREAMBLE = {
            "DO NOT EDIT (use 'mvn test -Dfuncprops.updateExpected=true' instead.)",
            "See src/test/resources/props/README.txt",
            "for more information on the format of this file."
    };

    private DumpFormat() {
        // Constants only
    }
}
