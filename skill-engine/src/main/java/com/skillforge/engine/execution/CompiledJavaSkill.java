package com.skillforge.engine.execution;

import com.skillforge.engine.spec.EntryPoint;
import com.skillforge.engine.spec.InputDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * One skill compiled into its own working directory and class loader.
 *
 * Single use: built for one invocation and closed right after it, which
 * closes the loader and deletes the directory. Nothing loaded here is shared
 * with any other invocation.
 */
final class CompiledJavaSkill implements SkillCallable {

    private static final Logger log = LoggerFactory.getLogger(CompiledJavaSkill.class);

    private final String                 skillId;
    private final EntryPoint             entryPoint;
    private final Method                 method;
    private final List<InputDeclaration> declarations;
    private final InputMapper            inputMapper;
    private final URLClassLoader         loader;
    private final Path                   workDir;

    CompiledJavaSkill(String skillId, EntryPoint entryPoint, Method method, List<InputDeclaration> declarations,
                      InputMapper inputMapper, URLClassLoader loader, Path workDir) {
        this.skillId      = skillId;
        this.entryPoint   = entryPoint;
        this.method       = method;
        this.declarations = declarations;
        this.inputMapper  = inputMapper;
        this.loader       = loader;
        this.workDir      = workDir;
    }

    @Override
    public String entryPointName() {
        return entryPoint.toString();
    }

    @Override
    public Object invoke(Map<String, Object> inputs) throws Exception {
        Object[] args = inputMapper.map(skillId, method, declarations, inputs);
        Object target = Modifier.isStatic(method.getModifiers()) ? null : newInstance();

        Thread current = Thread.currentThread();
        ClassLoader previous = current.getContextClassLoader();
        current.setContextClassLoader(loader);
        try {
            return method.invoke(target, args);
        } finally {
            current.setContextClassLoader(previous);
        }
    }

    private Object newInstance() throws ReflectiveOperationException {
        Constructor<?> ctor;
        try {
            ctor = method.getDeclaringClass().getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new SkillExecutionException(SkillExecutionException.Kind.ENTRY_POINT_NOT_FOUND, skillId,
                    entryPoint + " is an instance method but " + entryPoint.className()
                            + " has no no-arg constructor", e);
        }
        ctor.setAccessible(true);
        return ctor.newInstance();
    }

    @Override
    public void close() {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Could not close class loader for skill '{}': {}", skillId, e.getMessage());
        }
        deleteRecursively(workDir);
    }

    static void deleteRecursively(Path dir) {
        if (dir == null || !Files.exists(dir)) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up skill work dir {}: {}", dir, e.getMessage());
        }
    }
}
