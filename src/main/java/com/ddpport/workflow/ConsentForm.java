package com.ddpport.workflow;

import com.ddpport.core.table.ConsentTable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Tables offered for donation. Accepting answers with {@link HostResponse.Kind#JSON}; anything else declines.
 */
public record ConsentForm(List<ConsentTable> tables) implements PromptBody {

    public ConsentForm {
        tables = List.copyOf(tables);
    }

    /**
     * Rows of every table keyed by table name, the payload donated when the host sends no edited copy.
     */
    public String toDonationPayload() {
        JSONObject payload = new JSONObject();
        for (ConsentTable table : tables) {
            payload.put(table.name(), table.rows().toRecords());
        }
        return payload.toString();
    }

    @Override
    public JSONObject toJson() {
        JSONArray json = new JSONArray();
        for (ConsentTable table : tables) {
            json.put(table.toJson());
        }
        return new JSONObject()
                .put("__type__", "PropsUIPromptConsentForm")
                .put("tables", json);
    }
}
