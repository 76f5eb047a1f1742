package org.codesonify.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import org.codesonify.music.Pitch;

/**
 * Renders results as JSON. Pitches are written in scientific notation, e.g. {@code "C4"}.
 */
public final class JsonRenderer {

    private final Gson gson;

    /**
     * Creates a renderer.
     * @param prettyPrint Whether to indent the output.
     */
    public JsonRenderer(boolean prettyPrint) {
        GsonBuilder builder = new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapter(Pitch.class,
                        (JsonSerializer<Pitch>) (pitch, type, context) -> new JsonPrimitive(pitch.toString()));
        if (prettyPrint) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String render(Object value) {
        return gson.toJson(value);
    }
}
