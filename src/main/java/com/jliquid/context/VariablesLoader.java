package com.jliquid.context;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jliquid.error.UnsupportedVariableKindException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Seeds the current scope of a {@link Context} from a flat JSON object.
 * Strings, numbers and booleans become variables; anything else is rejected.
 */
public class VariablesLoader {
    private final JsonFactory factory = new JsonFactory();

    public Context load(InputStream input) throws IOException {
        Context context = new Context();
        load(input, context);
        return context;
    }

    public void load(InputStream input, Context context) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected a JSON object of variables but found " + token);
            }

            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String key = parser.currentName();
                context.add(key, parseValue(key, parser));
            }
        }
    }

    private Variable parseValue(String key, JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();

        return switch (token) {
            case VALUE_STRING -> Variable.text(parser.getText());
            // JSON has a single number type; integers are read as doubles here.
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> Variable.number(parser.getDoubleValue());
            case VALUE_TRUE -> Variable.bool(true);
            case VALUE_FALSE -> Variable.bool(false);
            case START_OBJECT -> throw new UnsupportedVariableKindException(key, "object");
            case START_ARRAY -> throw new UnsupportedVariableKindException(key, "array");
            case VALUE_NULL -> throw new UnsupportedVariableKindException(key, "null");
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }
}
