package civiltime.datetime;

/**
 * What a template does with a directive it doesn't know.
 */
public enum UnknownDirectivePolicy {
    /** The directive is printed as is, and must be matched as is when parsing */
    LITERAL,
    /** The template is rejected with a {@link FormatDirectiveException} */
    FAIL,
}
