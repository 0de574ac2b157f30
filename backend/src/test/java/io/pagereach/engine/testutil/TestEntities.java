package io.pagereach.engine.testutil;

import java.lang.reflect.Field;
import java.util.UUID;

/** Sets fields that only the persistence layer writes, e.g. generated ids. */
public final class TestEntities {

  private TestEntities() {}

  public static <T> T withId(T entity, UUID id) {
    return withField(entity, "id", id);
  }

  public static <T> T withField(T entity, String name, Object value) {
    try {
      Field field = findField(entity.getClass(), name);
      field.setAccessible(true);
      field.set(entity, value);
      return entity;
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set " + name + " on " + entity.getClass(), e);
    }
  }

  private static Field findField(Class<?> type, String name) throws NoSuchFieldException {
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      try {
        return c.getDeclaredField(name);
      } catch (NoSuchFieldException e) {
        // keep looking in the superclass
      }
    }
    throw new NoSuchFieldException(name);
  }
}
