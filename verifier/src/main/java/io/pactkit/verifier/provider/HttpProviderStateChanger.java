package io.pactkit.verifier.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.ProviderState;
import java.net.URI;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the provider's state-change endpoint.
 *
 * <pre>{@code
 * POST <state-change-url>
 * {"state": "a widget exists", "params": {"id": 1}, "action": "setup"}
 * }</pre>
 *
 * <p>
 * A JSON object in the reply is returned as provider-state values. Teardown
 * calls are only made when enabled.
 */
public final class HttpProviderStateChanger implements ProviderStateChanger {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProviderStateChanger.class);

    private final ProviderClient client;
    private final URI stateChangeUrl;
    private final boolean teardown;

    public HttpProviderStateChanger(ProviderClient client, URI stateChangeUrl, boolean teardown) {
        this.client = client;
        this.stateChangeUrl = stateChangeUrl;
        this.teardown = teardown;
    }

    @Override
    public Map<String, JsonNode> change(ProviderState state, StateChangeAction action)
            throws ProviderException, InterruptedException {
        if (action == StateChangeAction.TEARDOWN && !teardown) {
            return Map.of();
        }
        ObjectNode body = JsonValues.MAPPER.createObjectNode();
        body.put("state", state.name());
        ObjectNode params = body.putObject("params");
        state.params().forEach(params::set);
        body.put("action", action.wireName());

        LOG.debug("Provider state {} '{}' via {}", action.wireName(), state.name(), stateChangeUrl);
        HttpResponse response = client.postJson(stateChangeUrl, body.toString());
        if (response.status() < 200 || response.status() >= 300) {
            throw new StateChangeRejectedException(String.format(
                    "State change '%s' (%s) failed with status %d", state.name(), action.wireName(), response.status()),
                    response.status());
        }

        Map<String, JsonNode> values = new LinkedHashMap<>();
        JsonNode content = response.body().content();
        if (response.body().isJson() && content != null && content.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = content.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                values.put(field.getKey(), field.getValue());
            }
        }
        return values;
    }
}
