package com.ddpport.workflow;

import com.ddpport.core.table.Translatable;
import org.json.JSONObject;

/**
 * Yes/no question. {@link HostResponse.Kind#TRUE} selects {@code ok}; anything else selects {@code cancel}.
 */
public record ConfirmPrompt(Translatable text, Translatable ok, Translatable cancel) implements PromptBody {

    static ConfirmPrompt retry(String platform) {
        return new ConfirmPrompt(
                Translatable.of(
                        "Unfortunately, we could not process your " + platform + " file. If you are sure that you selected "
                                + "the correct file, press Continue. To select a different file, press Try again.",
                        "Helaas, kunnen we je " + platform + " bestand niet verwerken. Weet je zeker dat je het juiste "
                                + "bestand hebt gekozen? Ga dan verder. Probeer opnieuw als je een ander bestand wilt kiezen."),
                Translatable.of("Try again", "Probeer opnieuw"),
                Translatable.of("Continue", "Verder"));
    }

    @Override
    public JSONObject toJson() {
        return new JSONObject()
                .put("__type__", "PropsUIPromptConfirm")
                .put("text", text.toJson())
                .put("ok", ok.toJson())
                .put("cancel", cancel.toJson());
    }
}
