package com.skillforge.engine.execution;

import com.skillforge.engine.model.SkillBundle;
import com.skillforge.engine.model.SkillFile;
import com.skillforge.engine.spec.EntryPoint;
import com.skillforge.engine.spec.SkillSpecification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a {@link SkillBundle} into a {@link SkillCallable}.
 *
 * <ol>
 *   <li>Materializes every file of the bundle under a fresh directory
 *       ({@code files/}, laid out by relative path).</li>
 *   <li>Compiles the {@code .java} sources in-process into {@code classes/},
 *       with {@code -parameters} so inputs can bind by name and with a class
 *       path holding nothing but the skill's own output.</li>
 *   <li>Loads them through a {@link URLClassLoader} over {@code classes/} and
 *       {@code files/} whose parent exposes only {@code java.*}; auxiliary
 *       files are therefore visible to the skill as class-path resources.</li>
 *   <li>Resolves the declared entry point to exactly one public method.</li>
 * </ol>
 */
final class SkillSourceCompiler {

    private static final Logger log = LoggerFactory.getLogger(SkillSourceCompiler.class);

    private final Path        workRoot;
    private final InputMapper inputMapper;

    SkillSourceCompiler(Path workRoot, InputMapper inputMapper) {
        this.workRoot    = workRoot;
        this.inputMapper = inputMapper;
    }

    CompiledJavaSkill load(SkillBundle bundle, SkillSpecification spec, EntryPoint entryPoint) {
        String skillId = bundle.skillId();
        Path workDir = null;
        URLClassLoader loader = null;
        try {
            Files.createDirectories(workRoot);
            workDir = Files.createTempDirectory(workRoot, "skill-" + sanitize(skillId) + "-");
            Path filesDir   = Files.createDirectories(workDir.resolve("files"));
            Path classesDir = Files.createDirectories(workDir.resolve("classes"));

            List<Path> sources = materialize(bundle, filesDir);
            if (sources.isEmpty()) {
                throw new SkillExecutionException(SkillExecutionException.Kind.ENTRY_POINT_NOT_FOUND, skillId,
                        "skill ships no .java sources to provide " + entryPoint);
            }
            compile(skillId, sources, classesDir);

            loader = new URLClassLoader("skill-" + skillId,
                    new URL[] { url(classesDir), url(filesDir) }, new JavaOnlyClassLoader());
            Method method = resolve(skillId, entryPoint, loader);
            log.debug("Loaded skill '{}' entry point {} from {}", skillId, entryPoint, workDir);
            return new CompiledJavaSkill(skillId, entryPoint, method, spec.inputs(), inputMapper, loader, workDir);
        } catch (IOException e) {
            cleanup(loader, workDir);
            throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId,
                    "could not materialize skill files: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            cleanup(loader, workDir);
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private static List<Path> materialize(SkillBundle bundle, Path filesDir) throws IOException {
        List<Path> sources = new ArrayList<>();
        for (SkillFile f : bundle.files()) {
            Path target = filesDir.resolve(f.filePath()).normalize();
            if (!target.startsWith(filesDir)) {
                throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, bundle.skillId(),
                        "file path '" + f.filePath() + "' escapes the skill directory");
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, f.fileContent(), StandardCharsets.UTF_8);
            if ("java".equals(f.fileType().toLowerCase(Locale.ROOT))) {
                sources.add(target);
            }
        }
        return sources;
    }

    private static void compile(String skillId, List<Path> sources, Path classesDir) throws IOException {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId,
                    "no Java compiler available; the engine must run on a JDK");
        }
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fm = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            List<String> options = List.of(
                    "-d", classesDir.toString(),
                    "-classpath", classesDir.toString(),
                    "-parameters",
                    "-proc:none",
                    "-nowarn",
                    "-encoding", "UTF-8");
            Iterable<? extends JavaFileObject> units = fm.getJavaFileObjectsFromPaths(sources);
            boolean ok = compiler.getTask(null, fm, diagnostics, options, null, units).call();
            if (!ok) {
                String errors = diagnostics.getDiagnostics().stream()
                        .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                        .map(d -> fileName(d) + ":" + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT))
                        .collect(Collectors.joining("; "));
                throw new SkillExecutionException(SkillExecutionException.Kind.RUNTIME_FAULT, skillId,
                        "skill sources failed to compile: " + errors);
            }
        }
    }

    private static Method resolve(String skillId, EntryPoint entryPoint, ClassLoader loader) {
        Class<?> type;
        try {
            type = Class.forName(entryPoint.className(), false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new SkillExecutionException(SkillExecutionException.Kind.ENTRY_POINT_NOT_FOUND, skillId,
                    "class '" + entryPoint.className() + "' not found in skill sources", e);
        }
        List<Method> candidates = Arrays.stream(type.getDeclaredMethods())
                .filter(m -> m.getName().equals(entryPoint.methodName()))
                .filter(m -> Modifier.isPublic(m.getModifiers()))
                .filter(m -> !m.isSynthetic() && !m.isBridge())
                .toList();
        if (candidates.isEmpty()) {
            throw new SkillExecutionException(SkillExecutionException.Kind.ENTRY_POINT_NOT_FOUND, skillId,
                    "no public method '" + entryPoint.methodName() + "' on " + entryPoint.className());
        }
        if (candidates.size() > 1) {
            throw new SkillExecutionException(SkillExecutionException.Kind.ENTRY_POINT_NOT_FOUND, skillId,
                    "entry point " + entryPoint + " is overloaded " + candidates.size() + " times");
        }
        Method method = candidates.get(0);
        method.setAccessible(true);
        return method;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void cleanup(URLClassLoader loader, Path workDir) {
        if (loader != null) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Could not close class loader: {}", e.getMessage());
            }
        }
        CompiledJavaSkill.deleteRecursively(workDir);
    }

    private static URL url(Path dir) {
        try {
            return dir.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new UncheckedIOException(new IOException("bad path " + dir, e));
        }
    }

    private static String fileName(Diagnostic<? extends JavaFileObject> d) {
        if (d.getSource() == null) return "?";
        String name = d.getSource().getName();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    private static String sanitize(String skillId) {
        return skillId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
