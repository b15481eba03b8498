package com.kendb3.api.server;

import com.kendb3.api.exception.ApiException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handler of data manager requests: {@code GET <endpoint>/<model_name>?ids=...&fields=...}.
 *
 * <p>{@code ids} is {@code all} or a comma-separated list of integers;
 * {@code fields} names a declared field group.
 */
public class DataManagerEndpoint {

    private static final Logger log = LoggerFactory.getLogger(DataManagerEndpoint.class);

    private static final String IDS = "ids";
    private static final String FIELDS = "fields";
    private static final Set<String> PARAMETERS = Set.of(IDS, FIELDS);

    private final ModelRegistry registry;
    private final ModelQueryService queryService;

    public DataManagerEndpoint(ModelRegistry registry, ModelQueryService queryService) {
        this.registry = registry;
        this.queryService = queryService;
    }

    public ApiResponse serve(String modelName, Map<String, String> parameters) {
        Optional<ModelRegistration<?>> registration = registry.find(modelName);
        if (registration.isEmpty()) {
            return ApiResponse.failure("Unknown model", 404);
        }

        Set<String> unsupported = new HashSet<>(parameters.keySet());
        unsupported.removeAll(PARAMETERS);
        if (!unsupported.isEmpty()) {
            return reject(modelName, "Invalid request: unsupported parameters");
        }
        if (!parameters.keySet().containsAll(PARAMETERS)) {
            return reject(modelName, "Invalid request: 'ids' and 'fields' are required");
        }

        List<Long> ids;
        String rawIds = parameters.get(IDS);
        if ("all".equals(rawIds)) {
            ids = null;
        } else {
            try {
                ids = parseIds(rawIds);
            } catch (NumberFormatException e) {
                return reject(modelName, "Could not decode ids");
            }
        }

        String group = parameters.get(FIELDS);
        if (!registration.get().engine().hasGroup(group)) {
            return reject(modelName, "Unknown field group requested");
        }

        try {
            return ApiResponse.success(queryService.getModels(ids, group, registration.get().engine()));
        } catch (ApiException e) {
            return reject(modelName, e.getMessage());
        }
    }

    private static List<Long> parseIds(String rawIds) {
        List<Long> ids = new ArrayList<>();
        for (String part : rawIds.split(",", -1)) {
            ids.add(Long.parseLong(part.trim()));
        }
        return ids;
    }

    private static ApiResponse reject(String modelName, String message) {
        log.warn("Rejected data manager request for '{}': {}", modelName, message);
        return ApiResponse.failure(message);
    }
}
