package com.adflux.services.adplatforms.adapter;

import java.util.Map;
import java.util.function.Function;

/**
 * One remote resource in a platform's creation graph.
 *
 * @param idKey    key under which the created id is reported, "id" for the final ad
 * @param endpoint endpoint, given the ids created so far
 * @param payload  request body, given the ids created so far; null skips the step
 * @param idPath   dotted path of the new id in the response, e.g. "data.campaign_id" or "results.0.resourceName"
 */
public record CreationStep(String idKey,
                           Function<Map<String, String>, String> endpoint,
                           Function<Map<String, String>, Object> payload,
                           String idPath) {

    public static CreationStep of(String idKey, String endpoint,
                                  Function<Map<String, String>, Object> payload, String idPath) {
        return new CreationStep(idKey, ids -> endpoint, payload, idPath);
    }
}
