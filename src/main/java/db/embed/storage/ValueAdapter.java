package db.embed.storage;

import java.io.IOException;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

/**
 * JSON form of a {@link Value}: INT as a JSON number, TEXT as a JSON string.
 */
public class ValueAdapter extends TypeAdapter<Value> {

    @Override
    public void write(JsonWriter out, Value value) throws IOException {
        if (value instanceof IntValue iv) {
            out.value(iv.value());
        } else if (value instanceof TextValue tv) {
            out.value(tv.value());
        } else {
            throw new IllegalArgumentException("Cannot serialize value: " + value);
        }
    }

    @Override
    public Value read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        switch (token) {
            case NUMBER -> {
                String raw = in.nextString();
                try {
                    return new IntValue(Long.parseLong(raw));
                } catch (NumberFormatException e) {
                    throw new JsonParseException("Not a 64-bit integer: " + raw, e);
                }
            }
            case STRING -> {
                return new TextValue(in.nextString());
            }
            default -> throw new JsonParseException("Expected number or string value but was " + token);
        }
    }
}
