package com.pyscope.analyzer.analyzers;

import com.fasterxml.jackson.databind.JsonNode;
import com.pyscope.analyzer.core.AnalyzerConfig;
import com.pyscope.analyzer.core.SourceUnit;
import com.pyscope.analyzer.syntax.SyntaxTreeException;
import com.pyscope.analyzer.syntax.SyntaxTreeReader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Python parser that shells out to the bundled python_ast_dump.py script.
 *
 * <p>Files are sent to one interpreter process per batch. If a batch fails as
 * a whole (timeout, crash, missing output) its files are retried one by one so
 * a single bad file only skips itself.</p>
 */
public class PythonAstParser implements SourceParser {

    private static final Set<String> EXTENSIONS = Set.of(".py");
    private static final String SCRIPT_RESOURCE = "/analyzers/python_ast_dump.py";
    private static final int BATCH_SIZE = 50;

    private final String python;
    private final int timeoutSeconds;
    private final SyntaxTreeReader reader = new SyntaxTreeReader();

    private Path scriptPath;
    private Boolean pythonAvailable;

    public PythonAstParser(AnalyzerConfig config) {
        this(config.getPythonExecutable(), config.getParserTimeoutSeconds());
    }

    public PythonAstParser(String python, int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + timeoutSeconds);
        }
        this.python = python;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String getLanguageId() {
        return "python";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public synchronized boolean isAvailable() {
        if (pythonAvailable == null) {
            pythonAvailable = checkPythonAvailable() && script().isPresent();
        }
        return pythonAvailable;
    }

    @Override
    public SourceUnit parse(Path sourceFile) {
        return parseBatch(List.of(sourceFile)).get(0);
    }

    @Override
    public List<SourceUnit> parseBatch(List<Path> files) {
        if (!isAvailable()) {
            return files.stream()
                    .map(f -> SourceUnit.unparseable(f, python + " is not available", 0))
                    .toList();
        }

        List<SourceUnit> units = new ArrayList<>(files.size());
        for (int from = 0; from < files.size(); from += BATCH_SIZE) {
            List<Path> batch = files.subList(from, Math.min(files.size(), from + BATCH_SIZE));
            try {
                units.addAll(runBatch(batch));
            } catch (IOException e) {
                if (batch.size() == 1) {
                    units.add(skip(batch.get(0), e.getMessage(), 0));
                    continue;
                }
                System.err.println("Warning: parser batch failed (" + e.getMessage() + "), retrying files one by one");
                for (Path file : batch) {
                    units.add(parseAlone(file));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (Path file : batch) {
                    units.add(skip(file, "interrupted", 0));
                }
            }
        }
        return units;
    }

    private SourceUnit parseAlone(Path file) {
        try {
            return runBatch(List.of(file)).get(0);
        } catch (IOException e) {
            return skip(file, e.getMessage(), 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return skip(file, "interrupted", 0);
        }
    }

    private boolean checkPythonAvailable() {
        try {
            ProcessBuilder pb = new ProcessBuilder(python, "--version");
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();
            boolean finished = process.waitFor(5, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Copies the dump script out of the jar once per parser.
     */
    private synchronized Optional<Path> script() {
        if (scriptPath != null) {
            return Optional.of(scriptPath);
        }
        try (InputStream in = PythonAstParser.class.getResourceAsStream(SCRIPT_RESOURCE)) {
            if (in == null) {
                System.err.println("Warning: " + SCRIPT_RESOURCE + " missing from classpath");
                return Optional.empty();
            }
            Path tmp = Files.createTempFile("pyscope-ast-dump-", ".py");
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            tmp.toFile().deleteOnExit();
            scriptPath = tmp;
            return Optional.of(tmp);
        } catch (IOException e) {
            System.err.println("Warning: could not extract parser script: " + e.getMessage());
            return Optional.empty();
        }
    }

    private List<SourceUnit> runBatch(List<Path> batch) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add(python);
        command.add(script().orElseThrow(() -> new IOException("parser script unavailable")).toString());
        for (Path file : batch) {
            command.add(file.toAbsolutePath().toString());
        }

        Path out = Files.createTempFile("pyscope-ast-", ".jsonl");
        Path err = Files.createTempFile("pyscope-ast-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.environment().put("PYTHONIOENCODING", "utf-8");
            pb.redirectOutput(out.toFile());
            pb.redirectError(err.toFile());
            Process process = pb.start();

            long timeout = (long) timeoutSeconds * batch.size();
            boolean finished = process.waitFor(timeout, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("Python parser timed out after " + timeout + "s");
            }
            if (process.exitValue() != 0) {
                throw new IOException("Python parser exited with " + process.exitValue() + firstLine(err));
            }
            return collect(batch, Files.readAllLines(out, StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(out);
            Files.deleteIfExists(err);
        }
    }

    private List<SourceUnit> collect(List<Path> batch, List<String> lines) throws IOException {
        Map<String, SourceUnit> byPath = new HashMap<>();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode document = reader.parse(line);
            String path = document.path("path").asText(null);
            if (path == null) {
                throw new IOException("Parser output without a path");
            }
            Path file = Path.of(path);
            try {
                byPath.put(path, SourceUnit.parsed(file, reader.read(document)));
            } catch (SyntaxTreeException e) {
                byPath.put(path, skip(file, e.getMessage(), e.getLine()));
            }
        }

        List<SourceUnit> units = new ArrayList<>(batch.size());
        for (Path file : batch) {
            SourceUnit unit = byPath.get(file.toAbsolutePath().toString());
            if (unit == null) {
                throw new IOException("Parser produced no output for " + file);
            }
            // keep the caller's path identity
            units.add(unit.isParsed()
                    ? SourceUnit.parsed(file, unit.tree())
                    : SourceUnit.unparseable(file, unit.error(), unit.errorLine()));
        }
        return units;
    }

    private static SourceUnit skip(Path file, String reason, int line) {
        System.err.println("Warning: skipping " + file + ": " + reason);
        return SourceUnit.unparseable(file, reason, line);
    }

    private static String firstLine(Path err) {
        try {
            return Files.readAllLines(err, StandardCharsets.UTF_8).stream()
                    .filter(l -> !l.isBlank())
                    .findFirst()
                    .map(l -> ": " + l)
                    .orElse("");
        } catch (IOException e) {
            return "";
        }
    }
}
