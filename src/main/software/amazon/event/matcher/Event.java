package software.amazon.event.matcher;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flattens a JSON object into Fields sorted by path, each carrying its array membership.
 *
 * A JSON string is streamed token by token with no intermediate tree. A JsonNode tree built elsewhere is walked
 *  directly.
 *
 * Subtrees whose step name no registered pattern uses are skipped without being flattened.
 */
@Immutable
class Event {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    // the fields of the event
    final List<Field> fields;

    // scratch state shared by the recursive walk
    private static class Progress {
        final ArrayMembership membership = new ArrayMembership();
        int arrayCount = 0;
        final Path path = new Path();
        final Snapshot snapshot;
        final TreeMap<String, List<Field>> fieldMap = new TreeMap<>();

        Progress(final Snapshot snapshot) {
            this.snapshot = snapshot;
        }

        void addField(final String val) {
            final String name = path.name();
            fieldMap.computeIfAbsent(name, k -> new ArrayList<>())
                    .add(new Field(name, val, new ArrayMembership(membership)));
        }

        void addNumberField(final String number) {
            final String name = path.name();
            fieldMap.computeIfAbsent(name, k -> new ArrayList<>())
                    .add(Field.numberField(name, number, new ArrayMembership(membership)));
        }

        List<Field> sortedFields() {
            final List<Field> sorted = new ArrayList<>();
            for (Map.Entry<String, List<Field>> entry : fieldMap.entrySet()) {
                sorted.addAll(entry.getValue());
            }
            return Collections.unmodifiableList(sorted);
        }
    }

    /**
     * @param json JSON representation of the event
     * @throws IOException if the JSON can't be parsed
     * @throws IllegalArgumentException if the top level of the Event is not a JSON object
     */
    Event(@Nonnull final String json, @Nonnull final Snapshot snapshot) throws IOException {
        final Progress progress = new Progress(snapshot);
        try (JsonParser parser = JSON_FACTORY.createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IllegalArgumentException("Event must be a JSON object");
            }
            traverseObject(parser, progress);
        }
        fields = progress.sortedFields();
    }

    // as above, only with the JSON already parsed into a tree
    Event(@Nonnull final JsonNode eventRoot, @Nonnull final Snapshot snapshot) {
        if (!eventRoot.isObject()) {
            throw new IllegalArgumentException("Event must be a JSON object");
        }
        final Progress progress = new Progress(snapshot);
        loadObject(eventRoot, progress);
        fields = progress.sortedFields();
    }

    private static void traverseObject(final JsonParser parser, final Progress progress) throws IOException {
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String stepName = parser.getCurrentName();
            final JsonToken valueToken = parser.nextToken();

            if (!progress.snapshot.isFieldStepUsed(stepName)) {
                parser.skipChildren();
                continue;
            }

            progress.path.push(stepName);
            traverseValue(parser, valueToken, progress);
            progress.path.pop();
        }
    }

    private static void traverseArray(final JsonParser parser, final Progress progress) throws IOException {
        final int arrayID = progress.arrayCount++;

        JsonToken token;
        int arrayIndex = 0;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            progress.membership.putMembership(arrayID, arrayIndex++);
            traverseValue(parser, token, progress);
        }
        progress.membership.deleteMembership(arrayID);
    }

    private static void traverseValue(final JsonParser parser, final JsonToken token, final Progress progress)
            throws IOException {
        switch (token) {
            case START_OBJECT:
                traverseObject(parser, progress);
                break;
            case START_ARRAY:
                traverseArray(parser, progress);
                break;
            case VALUE_STRING:
                progress.addField('"' + parser.getText() + '"');
                break;
            case VALUE_NUMBER_INT:
            case VALUE_NUMBER_FLOAT:
                progress.addNumberField(parser.getText());
                break;
            default:
                progress.addField(parser.getText());
                break;
        }
    }

    private static void loadObject(final JsonNode object, final Progress progress) {
        final Iterator<Map.Entry<String, JsonNode>> entries = object.fields();
        while (entries.hasNext()) {
            final Map.Entry<String, JsonNode> entry = entries.next();
            if (!progress.snapshot.isFieldStepUsed(entry.getKey())) {
                continue;
            }
            progress.path.push(entry.getKey());
            loadValue(entry.getValue(), progress);
            progress.path.pop();
        }
    }

    private static void loadArray(final JsonNode array, final Progress progress) {
        final int arrayID = progress.arrayCount++;
        final Iterator<JsonNode> elements = array.elements();

        int arrayIndex = 0;
        while (elements.hasNext()) {
            progress.membership.putMembership(arrayID, arrayIndex++);
            loadValue(elements.next(), progress);
        }
        progress.membership.deleteMembership(arrayID);
    }

    private static void loadValue(final JsonNode val, final Progress progress) {
        switch (val.getNodeType()) {
            case OBJECT:
                loadObject(val, progress);
                break;
            case ARRAY:
                loadArray(val, progress);
                break;
            case STRING:
                progress.addField('"' + val.asText() + '"');
                break;
            case NUMBER:
                // the tree keeps no source text, so this is the node's rendering; the canonical form evens that out
                progress.addNumberField(val.asText());
                break;
            case NULL:
            case BOOLEAN:
                progress.addField(val.asText());
                break;
            default:
                throw new IllegalArgumentException("Unknown JsonNode type for: " + val.asText());
        }
    }
}
