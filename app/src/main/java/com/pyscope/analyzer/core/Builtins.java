package com.pyscope.analyzer.core;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Names that resolve without any project definition: the Python builtins
 * module plus the dunders every module, class and method body can read.
 */
public final class Builtins {

    public static final Set<String> PYTHON = Set.of(
            // constants
            "True", "False", "None", "NotImplemented", "Ellipsis", "__debug__",
            "copyright", "credits", "license", "exit", "quit",
            // functions
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "breakpoint", "callable", "chr",
            "compile", "delattr", "dir", "divmod", "eval", "exec", "format", "getattr", "globals",
            "hasattr", "hash", "help", "hex", "id", "input", "isinstance", "issubclass", "iter",
            "len", "locals", "max", "min", "next", "oct", "open", "ord", "pow", "print", "repr",
            "round", "setattr", "sorted", "sum", "vars", "__import__", "__build_class__",
            // types
            "bool", "bytearray", "bytes", "classmethod", "complex", "dict", "enumerate", "filter",
            "float", "frozenset", "int", "list", "map", "memoryview", "object", "property", "range",
            "reversed", "set", "slice", "staticmethod", "str", "super", "tuple", "type", "zip",
            // exceptions
            "BaseException", "BaseExceptionGroup", "Exception", "ExceptionGroup", "ArithmeticError",
            "AssertionError", "AttributeError", "BlockingIOError", "BrokenPipeError", "BufferError",
            "ChildProcessError", "ConnectionAbortedError", "ConnectionError", "ConnectionRefusedError",
            "ConnectionResetError", "EOFError", "EncodingWarning", "EnvironmentError", "FileExistsError",
            "FileNotFoundError", "FloatingPointError", "GeneratorExit", "IOError", "ImportError",
            "IndentationError", "IndexError", "InterruptedError", "IsADirectoryError", "KeyError",
            "KeyboardInterrupt", "LookupError", "MemoryError", "ModuleNotFoundError", "NameError",
            "NotADirectoryError", "NotImplementedError", "OSError", "OverflowError", "PermissionError",
            "ProcessLookupError", "RecursionError", "ReferenceError", "RuntimeError", "StopAsyncIteration",
            "StopIteration", "SyntaxError", "SystemError", "SystemExit", "TabError", "TimeoutError",
            "TypeError", "UnboundLocalError", "UnicodeDecodeError", "UnicodeEncodeError", "UnicodeError",
            "UnicodeTranslateError", "ValueError", "ZeroDivisionError",
            // warnings
            "Warning", "BytesWarning", "DeprecationWarning", "FutureWarning", "ImportWarning",
            "PendingDeprecationWarning", "ResourceWarning", "RuntimeWarning", "SyntaxWarning",
            "UnicodeWarning", "UserWarning",
            // module, class and method dunders
            "__name__", "__file__", "__doc__", "__package__", "__spec__", "__loader__", "__builtins__",
            "__path__", "__annotations__", "__dict__", "__cached__", "__module__", "__qualname__",
            "__class__");

    private final Set<String> names;

    private Builtins(Set<String> names) {
        this.names = Set.copyOf(names);
    }

    /**
     * The Python set plus project-specific extras from the configuration.
     */
    public static Builtins withExtras(Collection<String> extra) {
        Set<String> all = new HashSet<>(PYTHON);
        all.addAll(extra);
        return new Builtins(all);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }
}
