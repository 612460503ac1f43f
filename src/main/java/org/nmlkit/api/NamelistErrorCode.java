package org.nmlkit.api;

/**
 * Defines unique, testable error codes for all errors raised by the namelist library.
 * This decouples test logic from the wording of error messages.
 */
public enum NamelistErrorCode {
    // region I/O Errors
    /** An I/O error occurred while reading or writing. */
    IO_ERROR(ErrorCategory.IO),
    /** The target file exists and overwriting was not requested. */
    FILE_ALREADY_EXISTS(ErrorCategory.IO),
    // endregion

    // region Lexical Errors
    /** A string literal was not closed before the end of the line. */
    UNTERMINATED_STRING(ErrorCategory.LEXICAL),
    /** An exponent marker was not followed by digits. */
    INVALID_EXPONENT(ErrorCategory.LEXICAL),
    /** A character that cannot start any token was found where the parser needed one. */
    INVALID_TOKEN(ErrorCategory.LEXICAL),
    // endregion

    // region Syntax Errors
    /** The input ended inside a group or assignment. */
    UNEXPECTED_EOF(ErrorCategory.SYNTAX),
    /** A group name, '=' or value was required but something else was found. */
    INVALID_SYNTAX(ErrorCategory.SYNTAX),
    // endregion

    // region Value Errors
    /** A value could not be converted to the requested type. */
    TYPE_CONVERSION(ErrorCategory.VALUE),
    /** A literal is not valid for the requested type. */
    INVALID_VALUE(ErrorCategory.VALUE),
    /** An array index expression is malformed or out of bounds. */
    INVALID_INDEX(ErrorCategory.VALUE),
    /** Array dimensions do not match the number of elements or coordinates. */
    DIMENSION_MISMATCH(ErrorCategory.VALUE),
    /** Document validation reported one or more errors. */
    VALIDATION_FAILED(ErrorCategory.VALUE),
    // endregion

    // region Structure Errors
    /** A group or variable with the same name already exists. */
    DUPLICATE_NAME(ErrorCategory.STRUCTURE),
    /** A variable was required but is not present in its group. */
    VARIABLE_NOT_FOUND(ErrorCategory.STRUCTURE),
    /** A group was required but is not present in the document. */
    GROUP_NOT_FOUND(ErrorCategory.STRUCTURE),
    // endregion

    // region Patch Errors
    /** A patch value cannot be written into the template position it targets. */
    INCOMPATIBLE_PATCH(ErrorCategory.PATCH),
    /** A patch operation was requested without the template it needs. */
    MISSING_TEMPLATE_INFO(ErrorCategory.PATCH);
    // endregion

    private final ErrorCategory category;

    NamelistErrorCode(ErrorCategory category) {
        this.category = category;
    }

    /**
     * Returns the category this code belongs to.
     * @return The error category.
     */
    public ErrorCategory category() {
        return category;
    }
}
