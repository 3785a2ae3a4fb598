package com.ddpport.workflow;

import com.ddpport.core.table.Translatable;
import org.json.JSONObject;

/**
 * Asks the participant to choose their export file. Answered with {@link HostResponse.Kind#STRING} or skipped.
 *
 * @param extensions accepted MIME types / extensions, comma separated
 */
public record FilePrompt(Translatable description, String extensions) implements PromptBody {

    static FilePrompt forPlatform(String platform, String extensions) {
        return new FilePrompt(Translatable.of(
                "Please follow the download instructions and choose the file that you stored on your device. "
                        + "Click \"Skip\" at the right bottom, if you do not have a file from " + platform + ".",
                "Volg de download instructies en kies het bestand dat je opgeslagen hebt op je apparaat. "
                        + "Als je geen " + platform + " bestand hebt klik dan op \"Overslaan\" rechts onder."),
                extensions);
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("__type__", "PropsUIPromptFileInput")
                .put("description", description.toJson())
                .put("extensions", extensions);
    }
}
