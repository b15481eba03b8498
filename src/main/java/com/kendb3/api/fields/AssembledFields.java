package com.kendb3.api.fields;

import java.util.List;
import java.util.Map;

/**
 * Frozen result of assembling one model: fields per group, the union of field
 * names and the model's API name.
 */
record AssembledFields(
        Map<String, List<FieldMeta>> fieldGroups,
        List<String> allFields,
        String apiName
) {}
