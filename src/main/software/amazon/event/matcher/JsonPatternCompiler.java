package software.amazon.event.matcher;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import software.amazon.event.matcher.input.ParseException;
import software.amazon.event.matcher.input.RegexpParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static software.amazon.event.matcher.input.DefaultParser.getParser;

/**
 * Compiles a pattern described by a JSON document into the Map of field Patterns that GenericMachine.addPattern
 * accepts. Nested objects extend the dotted path, and every leaf is an array of allowed values, for example:
 *   {
 *     "source": [ "orders" ],
 *     "detail": {
 *       "state": [ "shipped", { "prefix": "return" } ],
 *       "carrier": [ { "exists": true } ]
 *     }
 *   }
 * compiles to
 *   {source=[VP:"orders"], detail.state=[VP:"shipped", VP:"return], detail.carrier=[T:EXISTS]}
 *
 * The values within one array are alternatives; the fields of a pattern must all match.
 */
public class JsonPatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern
     * @param source pattern, as a String
     * @return null if the pattern is valid, otherwise an error message
     */
    public static String check(final String source, final boolean withOverriding) {
        try {
            compile(source, withOverriding);
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final String source) {
        return check(source, true);
    }

    /**
     * Compile a pattern from its JSON form. String values come out in event encoding, surrounded by quotes.
     *
     * @param source pattern, as a String
     * @param withOverriding whether a path seen a second time replaces the values it was first given
     * @return the value shapes of each path
     * @throws IOException if the pattern isn't syntactically valid
     */
    public static Map<String, List<Patterns>> compile(final String source, final boolean withOverriding)
            throws IOException {
        try (JsonParser parser = JSON_FACTORY.createParser(source)) {
            final Map<String, List<Patterns>> pattern = new HashMap<>();
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                barf(parser, "Pattern is not an object");
            }
            parseObject(pattern, new Path(), parser, withOverriding);
            if (parser.nextToken() != null) {
                barf(parser, "Unexpected content after the pattern object");
            }
            return pattern;
        }
    }

    public static Map<String, List<Patterns>> compile(final String source) throws IOException {
        return compile(source, true);
    }

    private static void parseObject(final Map<String, List<Patterns>> pattern,
                                    final Path path,
                                    final JsonParser parser,
                                    final boolean withOverriding) throws IOException {

        boolean fieldsPresent = false;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            fieldsPresent = true;

            final String stepName = parser.getCurrentName();

            switch (parser.nextToken()) {
            case START_OBJECT:
                path.push(stepName);
                parseObject(pattern, path, parser, withOverriding);
                path.pop();
                break;

            case START_ARRAY:
                writeValues(pattern, path.extendedName(stepName), parser, withOverriding);
                break;

            default:
                barf(parser, String.format("\"%s\" must be an object or an array", stepName));
            }
        }
        if (!fieldsPresent) {
            barf(parser, "Empty objects are not allowed");
        }
    }

    private static void writeValues(final Map<String, List<Patterns>> pattern,
                                    final String name,
                                    final JsonParser parser,
                                    final boolean withOverriding) throws IOException {

        JsonToken token;
        final List<Patterns> values = new ArrayList<>();

        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            switch (token) {
            case START_OBJECT:
                values.add(processMatchExpression(parser));
                break;

            case VALUE_STRING:
                values.add(Patterns.exactMatch(parser.getText()));
                break;

            case VALUE_NUMBER_FLOAT:
            case VALUE_NUMBER_INT:
                values.add(Patterns.numericMatch(parser.getText()));
                break;

            case VALUE_NULL:
            case VALUE_TRUE:
            case VALUE_FALSE:
                values.add(Patterns.literalMatch(parser.getText()));
                break;

            default:
                barf(parser, "Match value must be String, number, true, false, or null");
            }
        }
        if (values.isEmpty()) {
            barf(parser, "Empty arrays are not allowed");
        }
        checkExclusiveShapes(parser, name, values);

        if (!withOverriding && pattern.containsKey(name)) {
            barf(parser, String.format("Path `%s` cannot be allowed multiple times", name));
        }
        pattern.put(name, values);
    }

    // exists, anything-but and regexp must be the only value of their path
    private static void checkExclusiveShapes(final JsonParser parser, final String name, final List<Patterns> values)
            throws JsonParseException {
        if (values.size() < 2) {
            return;
        }
        for (Patterns value : values) {
            switch (value.type()) {
                case EXISTS:
                case ABSENT:
                case ANYTHING_BUT:
                case REGEXP:
                    barf(parser, String.format("Path `%s`: %s must be the only value of its path",
                            name, value.type()));
                    break;
                default:
                    break;
            }
        }
    }

    private static Patterns processMatchExpression(final JsonParser parser) throws IOException {
        final JsonToken matchTypeToken = parser.nextToken();
        if (matchTypeToken != JsonToken.FIELD_NAME) {
            barf(parser, "Match expression name not found");
        }
        final String matchTypeName = parser.getCurrentName();
        final Patterns pattern;
        switch (matchTypeName) {
            case Constants.EXISTS_MATCH:
                pattern = processExistsExpression(parser);
                break;
            case Constants.PREFIX_MATCH:
                pattern = Patterns.prefixMatch(stringOperand(parser, matchTypeName));
                break;
            case Constants.EQUALS_IGNORE_CASE:
                pattern = Patterns.equalsIgnoreCaseMatch(stringOperand(parser, matchTypeName));
                break;
            case Constants.SHELLSTYLE_MATCH:
                pattern = parsedOrBarf(parser, Patterns.shellStyleMatch(stringOperand(parser, matchTypeName)));
                break;
            case Constants.WILDCARD:
                pattern = parsedOrBarf(parser, Patterns.wildcardMatch(stringOperand(parser, matchTypeName)));
                break;
            case Constants.REGEXP:
                pattern = parsedOrBarf(parser, Patterns.regexpMatch(stringOperand(parser, matchTypeName)));
                break;
            case Constants.ANYTHING_BUT_MATCH:
                pattern = processAnythingButExpression(parser);
                break;
            default:
                barf(parser, "Unrecognized match type " + matchTypeName);
                return null; // unreachable statement, but java can't see that?
        }
        if (parser.nextToken() != JsonToken.END_OBJECT) {
            barf(parser, "Only one key allowed in match expression");
        }
        return pattern;
    }

    private static String stringOperand(final JsonParser parser, final String matchTypeName) throws IOException {
        if (parser.nextToken() != JsonToken.VALUE_STRING) {
            barf(parser, matchTypeName + " match pattern must be a string");
        }
        return parser.getText();
    }

    // run the text parsers now, so that a bad pattern is reported with its location
    private static ValuePatterns parsedOrBarf(final JsonParser parser, final ValuePatterns pattern)
            throws JsonParseException {
        try {
            if (pattern.type() == MatchType.REGEXP) {
                RegexpParser.getParser().parse(pattern.pattern());
            } else {
                getParser().parse(pattern.type(), pattern.pattern());
            }
        } catch (ParseException e) {
            barf(parser, e.getLocalizedMessage());
        }
        return pattern;
    }

    private static Patterns processAnythingButExpression(final JsonParser parser) throws IOException {
        final JsonToken token = parser.nextToken();
        if (token == JsonToken.VALUE_STRING) {
            return Patterns.anythingButMatch(parser.getText());
        }
        if (token != JsonToken.START_ARRAY) {
            barf(parser, "Value of " + Constants.ANYTHING_BUT_MATCH + " must be an array or a single string.");
        }

        final Set<String> values = new LinkedHashSet<>();
        JsonToken element;
        while ((element = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (element != JsonToken.VALUE_STRING) {
                barf(parser, "Inside anything-but list, only strings are supported.");
            }
            values.add(parser.getText());
        }
        if (values.isEmpty()) {
            barf(parser, "Empty arrays are not allowed");
        }
        return Patterns.anythingButMatch(values);
    }

    private static Patterns processExistsExpression(final JsonParser parser) throws IOException {
        final JsonToken existsToken = parser.nextToken();

        if (existsToken == JsonToken.VALUE_TRUE) {
            return Patterns.existencePatterns();
        } else if (existsToken == JsonToken.VALUE_FALSE) {
            return Patterns.absencePatterns();
        }
        barf(parser, "exists match pattern must be either true or false.");
        return null;
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
