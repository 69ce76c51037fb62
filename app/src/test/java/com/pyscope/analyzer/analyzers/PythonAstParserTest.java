package com.pyscope.analyzer.analyzers;

import com.pyscope.analyzer.core.SourceUnit;
import com.pyscope.analyzer.symbols.Definition;
import com.pyscope.analyzer.symbols.FileSymbols;
import com.pyscope.analyzer.symbols.SymbolCollector;
import com.pyscope.analyzer.symbols.Use;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonAstParserTest {

    @TempDir
    Path tempDir;

    private PythonAstParser parser;

    @BeforeEach
    void setUp() {
        parser = new PythonAstParser("python3", 30);
        assumeTrue(parser.isAvailable(), "python3 is not installed");
    }

    private Path write(String name, String source) throws IOException {
        Path file = tempDir.resolve(name).toAbsolutePath().normalize();
        Files.writeString(file, source);
        return file;
    }

    @Test
    void testParsesRealSourceIntoSymbols() throws IOException {
        Path file = write("shapes.py", """
                import math
                from .base import Shape as BaseShape

                RATIO = 2

                class Circle(BaseShape):
                    def __init__(self, radius, *args, scale=1, **kwargs):
                        self.radius = radius * scale

                    def area(self):
                        return math.pi * self.radius ** 2

                def largest(shapes):
                    best = max((s.area() for s in shapes), default=None)
                    try:
                        return best
                    except ValueError as err:
                        print(err, missing_name)
                """);

        SourceUnit unit = parser.parse(file);

        assertTrue(unit.isParsed(), () -> "parse failed: " + unit.error());
        assertEquals(file, unit.file());

        FileSymbols symbols = new SymbolCollector().collect(file, unit.tree());
        Set<String> defined = symbols.definitions().stream().map(Definition::name).collect(Collectors.toSet());
        assertTrue(defined.containsAll(Set.of("math", "BaseShape", "RATIO", "Circle", "__init__", "area",
                "largest", "shapes", "best", "s", "err", "radius", "args", "scale", "kwargs")), "got " + defined);

        Set<String> pending = symbols.pendingUses().stream().map(Use::name).collect(Collectors.toSet());
        assertEquals(Set.of("max", "ValueError", "print", "missing_name"), pending, "builtins are filtered later");

        assertEquals(2, symbols.imports().size());
        assertEquals(1, symbols.imports().get(1).level());
        assertEquals("base", symbols.imports().get(1).module());
    }

    @Test
    void testLongOperatorChainIsParsed() throws IOException {
        String chain = String.join(" + ", Collections.nCopies(700, "'s'"));
        Path file = write("long_chain.py", "joined = " + chain + "\nlength = len(joined)\n");

        SourceUnit unit = parser.parse(file);

        assertTrue(unit.isParsed(), () -> "parse failed: " + unit.error());
        FileSymbols symbols = new SymbolCollector().collect(file, unit.tree());
        Set<String> defined = symbols.definitions().stream().map(Definition::name).collect(Collectors.toSet());
        assertEquals(Set.of("joined", "length"), defined);
    }

    @Test
    void testTypeParametersAreBoundOnNewerPythons() throws IOException {
        Path file = write("generic.py", """
                def first[T](items: list[T]) -> T:
                    return items[0]

                class Box[V]:
                    def get(self) -> V: ...

                type Pairs[K] = dict[K, Box]
                """);

        SourceUnit unit = parser.parse(file);
        assumeTrue(unit.isParsed(), "type parameter syntax needs Python 3.12");

        FileSymbols symbols = new SymbolCollector().collect(file, unit.tree());
        Set<String> pending = symbols.pendingUses().stream().map(Use::name).collect(Collectors.toSet());
        assertEquals(Set.of("list", "dict"), pending);
    }

    @Test
    void testSyntaxErrorIsUnparseableWithLine() throws IOException {
        Path file = write("broken.py", "x = 1\n\ndef f(:\n    pass\n");

        SourceUnit unit = parser.parse(file);

        assertFalse(unit.isParsed());
        assertTrue(unit.error().startsWith("syntax error"), unit.error());
        assertEquals(3, unit.errorLine());
    }

    @Test
    void testUndecodableFileIsUnparseable() throws IOException {
        Path file = tempDir.resolve("latin1.py").toAbsolutePath().normalize();
        Files.write(file, new byte[] { 'x', ' ', '=', ' ', '"', (byte) 0xE9, '"', '\n' });

        SourceUnit unit = parser.parse(file);

        assertFalse(unit.isParsed());
        assertTrue(unit.error().startsWith("cannot read file"), unit.error());
    }

    @Test
    void testBatchKeepsInputOrder() throws IOException {
        Path first = write("first.py", "a = 1\n");
        Path bad = write("second.py", "def (\n");
        Path third = write("third.py", "import first\n");

        List<SourceUnit> units = parser.parseBatch(List.of(first, bad, third));

        assertEquals(List.of(first, bad, third), units.stream().map(SourceUnit::file).toList());
        assertTrue(units.get(0).isParsed());
        assertFalse(units.get(1).isParsed());
        assertTrue(units.get(2).isParsed());
    }

    @Test
    void testMissingInterpreterSkipsEveryFile() throws IOException {
        Path file = write("any.py", "pass\n");
        PythonAstParser missing = new PythonAstParser("definitely-not-a-python-binary", 5);

        assertFalse(missing.isAvailable());
        SourceUnit unit = missing.parse(file);
        assertFalse(unit.isParsed());
    }
}
