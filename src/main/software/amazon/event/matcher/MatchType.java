package software.amazon.event.matcher;

/**
 * The types of value matches that the matcher supports
 */
public enum MatchType {
    EXACT,               // exact string
    NUMERIC,             // number, compared as its literal text
    LITERAL,             // true, false or null
    ABSENT,              // absent key pattern
    EXISTS,              // existence pattern
    PREFIX,              // string prefix
    SHELL_STYLE,         // string match using non-consecutive '*' wildcards, no escapes
    WILDCARD,            // like SHELL_STYLE, but '\' escapes a literal '*' or '\'
    EQUALS_IGNORE_CASE,  // case-insensitive string match
    ANYTHING_BUT,        // deny list effect
    REGEXP,              // I-Regexp regular expression, anchored on the whole string
}
