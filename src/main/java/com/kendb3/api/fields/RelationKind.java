package com.kendb3.api.fields;

import com.kendb3.store.ForeignKey;
import com.kendb3.store.RelatedManager;
import com.kendb3.store.TagManager;

/**
 * Kind of attribute an API field was resolved against, as far as relations go.
 */
public enum RelationKind {
    NONE,
    FOREIGN_KEY,
    TO_MANY,
    TAGS;

    public static RelationKind of(Class<?> attributeType) {
        if (ForeignKey.class.isAssignableFrom(attributeType)) {
            return FOREIGN_KEY;
        }
        if (RelatedManager.class.isAssignableFrom(attributeType)) {
            return TO_MANY;
        }
        if (TagManager.class.isAssignableFrom(attributeType)) {
            return TAGS;
        }
        return NONE;
    }

    /**
     * True for kinds that reference other model instances by identifier.
     */
    public boolean referencesModels() {
        return this == FOREIGN_KEY || this == TO_MANY;
    }
}
