package com.grokpm.backend.support;

import java.lang.reflect.Field;

/**
 * Assigns database ids to entities built in unit tests, where no persistence context generates them.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, Long id) {
        try {
            Field idField = entity.getClass().getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(entity, id);
            return entity;
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
