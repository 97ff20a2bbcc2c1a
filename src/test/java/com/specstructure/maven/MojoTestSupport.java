package com.specstructure.maven;

import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;

final class MojoTestSupport {

    private MojoTestSupport() {
    }

    static Path testBaseDir(Class<?> testClass) throws Exception {
        Path dir = Path.of("target/test-output", testClass.getSimpleName(),
                String.valueOf(System.currentTimeMillis()));
        Files.createDirectories(dir);
        return dir;
    }

    /**
     * Sets a private Mojo parameter, looking in superclasses for inherited ones.
     */
    static void setField(Object target, String fieldName, Object value) throws Exception {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException e) {
                type = type.getSuperclass();
            }
        }
        throw new NoSuchFieldException(fieldName);
    }
}
