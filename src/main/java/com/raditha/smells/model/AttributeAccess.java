package com.raditha.smells.model;

/**
 * A member read, write or call inside a function body, classified once while
 * the model is built.
 *
 * @param base      Source text of the expression the member is selected from
 *                  ("this", "order", "this.restaurant"; empty for implicit receiver)
 * @param attribute Member name
 * @param origin    Self or foreign
 * @param target    Name of the foreign object for {@link AccessOrigin#FOREIGN},
 *                  null for self accesses
 * @param line      Source line
 */
public record AttributeAccess(
        String base,
        String attribute,
        AccessOrigin origin,
        String target,
        int line) {

    public static AttributeAccess self(String base, String attribute, int line) {
        return new AttributeAccess(base, attribute, AccessOrigin.SELF, null, line);
    }

    public static AttributeAccess foreign(String base, String attribute, String target, int line) {
        return new AttributeAccess(base, attribute, AccessOrigin.FOREIGN, target, line);
    }

    public boolean isSelf() {
        return origin == AccessOrigin.SELF;
    }

    public boolean isForeign() {
        return origin == AccessOrigin.FOREIGN;
    }
}
