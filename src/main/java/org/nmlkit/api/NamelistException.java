package org.nmlkit.api;

/**
 * An exception that is thrown when reading, converting, merging, patching or writing a
 * namelist fails.
 * <p>
 * Errors raised while scanning or parsing carry a {@link SourceInfo}; errors raised by
 * document operations carry the group and variable they concern.
 */
public class NamelistException extends Exception {

    private final NamelistErrorCode code;
    private final SourceInfo sourceInfo;
    private final String groupName;
    private final String variableName;

    /**
     * Constructs a new exception with the specified code and detail message.
     * @param code The error code.
     * @param message The detail message.
     */
    public NamelistException(NamelistErrorCode code, String message) {
        this(code, message, null, null, null, null);
    }

    /**
     * Constructs a new exception with the specified code, detail message and cause.
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public NamelistException(NamelistErrorCode code, String message, Throwable cause) {
        this(code, message, null, null, null, cause);
    }

    /**
     * Constructs a new exception positioned in the input text.
     * @param code The error code.
     * @param message The detail message.
     * @param sourceInfo The position where the error was detected.
     */
    public NamelistException(NamelistErrorCode code, String message, SourceInfo sourceInfo) {
        this(code, message, sourceInfo, null, null, null);
    }

    /**
     * Constructs a new exception about a group or variable of a document.
     * @param code The error code.
     * @param message The detail message.
     * @param groupName The group concerned, may be {@code null}.
     * @param variableName The variable concerned, may be {@code null}.
     */
    public NamelistException(NamelistErrorCode code, String message, String groupName, String variableName) {
        this(code, message, null, groupName, variableName, null);
    }

    private NamelistException(NamelistErrorCode code, String message, SourceInfo sourceInfo,
                              String groupName, String variableName, Throwable cause) {
        super(describe(message, sourceInfo, groupName, variableName), cause);
        this.code = code;
        this.sourceInfo = sourceInfo;
        this.groupName = groupName;
        this.variableName = variableName;
    }

    private static String describe(String message, SourceInfo sourceInfo, String groupName, String variableName) {
        StringBuilder sb = new StringBuilder(message);
        if (groupName != null && variableName != null) {
            sb.append(" (variable '").append(groupName).append('%').append(variableName).append("')");
        } else if (groupName != null) {
            sb.append(" (group '").append(groupName).append("')");
        } else if (variableName != null) {
            sb.append(" (variable '").append(variableName).append("')");
        }
        if (sourceInfo != null) {
            sb.append(" at ").append(sourceInfo);
        }
        return sb.toString();
    }

    /**
     * Returns the error code.
     * @return The error code.
     */
    public NamelistErrorCode getCode() {
        return code;
    }

    /**
     * Returns the category of the error code.
     * @return The error category.
     */
    public ErrorCategory getCategory() {
        return code.category();
    }

    /**
     * Returns the position in the input text, if the error was raised while scanning or parsing.
     * @return The source position, or {@code null}.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * Returns the group the error concerns.
     * @return The group name, or {@code null}.
     */
    public String getGroupName() {
        return groupName;
    }

    /**
     * Returns the variable the error concerns.
     * @return The variable name, or {@code null}.
     */
    public String getVariableName() {
        return variableName;
    }

    /**
     * Returns whether the error aborts a whole parse rather than a single operation.
     * @return {@code true} for lexical and syntax errors.
     */
    public boolean isFatal() {
        ErrorCategory category = getCategory();
        return category == ErrorCategory.LEXICAL || category == ErrorCategory.SYNTAX;
    }
}
