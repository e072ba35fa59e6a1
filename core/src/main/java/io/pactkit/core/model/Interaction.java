package io.pactkit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One recorded request/response expectation.
 *
 * @param description    unique description within the pact
 * @param providerStates states the provider must be in, in order
 * @param request        the expected request
 * @param response       the response to replay or expect
 * @param pending        whether a verification failure should be reported without failing the run
 */
public record Interaction(
        String description, List<ProviderState> providerStates, HttpRequest request, HttpResponse response, boolean pending) {

    public Interaction {
        Objects.requireNonNull(description, "description must not be null");
        providerStates = providerStates == null ? List.of() : List.copyOf(providerStates);
        request = request == null ? HttpRequest.defaults() : request;
        response = response == null ? HttpResponse.defaults() : response;
    }

    /** An interaction with the given description and default request/response. */
    public static Interaction named(String description) {
        return new Interaction(description, List.of(), HttpRequest.defaults(), HttpResponse.defaults(), false);
    }

    public Interaction withDescription(String newDescription) {
        return new Interaction(newDescription, providerStates, request, response, pending);
    }

    public Interaction withProviderStates(List<ProviderState> states) {
        return new Interaction(description, states, request, response, pending);
    }

    public Interaction withRequest(HttpRequest newRequest) {
        return new Interaction(description, providerStates, newRequest, response, pending);
    }

    public Interaction withResponse(HttpResponse newResponse) {
        return new Interaction(description, providerStates, request, newResponse, pending);
    }

    public Interaction withPending(boolean newPending) {
        return new Interaction(description, providerStates, request, response, newPending);
    }
}
