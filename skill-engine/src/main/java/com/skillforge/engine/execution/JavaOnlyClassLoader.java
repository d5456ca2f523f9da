package com.skillforge.engine.execution;

/**
 * Parent loader for hot-loaded skill code. Resolves {@code java.*} classes
 * and nothing else, so name lookups from skill code ({@code Class.forName},
 * linking) cannot resolve engine, Spring or library classes through this
 * parent. It is a visibility boundary, not a sandbox: {@code java.*} APIs
 * that hand out other loaders, such as
 * {@code ClassLoader.getSystemClassLoader()}, remain callable.
 */
final class JavaOnlyClassLoader extends ClassLoader {

    private static final String JAVA_PACKAGE = "java.";

    private final ClassLoader platform = ClassLoader.getPlatformClassLoader();

    JavaOnlyClassLoader() {
        super("skill-parent", null);
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            if (!name.startsWith(JAVA_PACKAGE)) {
                throw new ClassNotFoundException("Access denied: " + name + " (skills may only use java.*)");
            }
            Class<?> c = platform.loadClass(name);
            if (resolve) resolveClass(c);
            return c;
        }
    }
}
