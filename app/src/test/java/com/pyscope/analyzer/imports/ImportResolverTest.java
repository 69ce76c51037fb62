package com.pyscope.analyzer.imports;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ImportResolverTest {

    @TempDir
    Path tempDir;

    private Path root;
    private ImportResolver resolver;

    @BeforeEach
    void setUp() {
        root = tempDir.toAbsolutePath().normalize();
        resolver = new ImportResolver(root);
    }

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        return file;
    }

    @Test
    void testAbsoluteModulePrefersFileOverPackage() throws IOException {
        Path main = touch("main.py");
        Path moduleFile = touch("shapes.py");
        touch("shapes/__init__.py");

        assertEquals(Optional.of(moduleFile), resolver.resolve("shapes", 0, main));
    }

    @Test
    void testAbsolutePackageFallsBackToInit() throws IOException {
        Path main = touch("main.py");
        Path init = touch("geometry/__init__.py");
        Path circle = touch("geometry/circle.py");

        assertEquals(Optional.of(init), resolver.resolve("geometry", 0, main));
        assertEquals(Optional.of(circle), resolver.resolve("geometry.circle", 0, main));
    }

    @Test
    void testExternalModuleIsEmpty() throws IOException {
        Path main = touch("main.py");

        assertTrue(resolver.resolve("requests", 0, main).isEmpty());
        assertTrue(resolver.resolve("", 0, main).isEmpty());
    }

    @Test
    void testRelativeSiblingImportPrefersFileForm() throws IOException {
        Path mod = touch("pkg/mod.py");
        Path sibling = touch("pkg/sibling.py");
        touch("pkg/__init__.py");

        List<Path> targets = resolver.resolveAll(ImportDeclaration.from("", 1, List.of("sibling"), 1), mod);

        assertEquals(List.of(sibling), targets);
    }

    @Test
    void testRelativeSiblingImportUsesPackageWhenNoFile() throws IOException {
        Path mod = touch("pkg/mod.py");
        Path siblingInit = touch("pkg/sibling/__init__.py");

        List<Path> targets = resolver.resolveAll(ImportDeclaration.from("", 1, List.of("sibling"), 1), mod);

        assertEquals(List.of(siblingInit), targets);
    }

    @Test
    void testRelativeLevelTwoAscendsOneDirectory() throws IOException {
        Path mod = touch("app/api/handlers.py");
        Path settings = touch("app/settings.py");

        assertEquals(Optional.of(settings), resolver.resolve("settings", 2, mod));
    }

    @Test
    void testRelativeImportAboveRootIsExternal() throws IOException {
        Path top = touch("top.py");

        assertTrue(resolver.resolve("elsewhere", 3, top).isEmpty());
    }

    @Test
    void testPlainImportUsesLongestExistingPrefix() throws IOException {
        Path main = touch("main.py");
        Path init = touch("db/__init__.py");
        Path models = touch("db/models.py");

        assertEquals(List.of(models), resolver.resolveAll(ImportDeclaration.plain("db.models", 1), main));
        assertEquals(List.of(init), resolver.resolveAll(ImportDeclaration.plain("db.missing.deep", 1), main));
    }

    @Test
    void testFromImportOfNamesDependsOnModule() throws IOException {
        Path main = touch("main.py");
        Path util = touch("util.py");

        List<Path> targets = resolver.resolveAll(ImportDeclaration.from("util", 0, List.of("helper"), 1), main);

        assertEquals(List.of(util), targets);
    }

    @Test
    void testSelfReferenceIsDropped() throws IOException {
        Path init = touch("pkg/__init__.py");
        touch("pkg/core.py");

        // from . import VERSION inside pkg/__init__.py
        List<Path> targets = resolver.resolveAll(ImportDeclaration.from("", 1, List.of("VERSION"), 1), init);

        assertTrue(targets.isEmpty(), "package must not depend on itself: " + targets);
    }

    @Test
    void testResolutionIsPureOverExistencePredicate() {
        Path fakeRoot = Path.of("/virtual/project");
        Path main = fakeRoot.resolve("main.py");
        ImportResolver virtual = new ImportResolver(fakeRoot, p -> p.equals(fakeRoot.resolve("lib/__init__.py")));

        assertEquals(Optional.of(fakeRoot.resolve("lib/__init__.py")), virtual.resolve("lib", 0, main));
        assertEquals(virtual.resolve("lib", 0, main), virtual.resolve("lib", 0, main));
    }
}
