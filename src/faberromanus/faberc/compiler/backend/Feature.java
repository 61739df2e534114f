package faberromanus.faberc.compiler.backend;

/**
 * Something generated code depends on that must be imported or defined
 * at the top of the output. The declaration order is the order in which
 * the preamble renders them.
 */
public enum Feature {
    SYS,
    WARNINGS,
    ASYNCIO,
    FUNCTOOLS,
    ITERTOOLS,
    RANDOM,
    MATH,
    COLLECTIONS,
    RE,
    DECIMAL,
    ENUM,
    DATACLASS,
    SIMPLE_NAMESPACE,
    TYPING_ANY,
    TYPING_CALLABLE,
    TYPING_ITERATOR,
    TYPING_ASYNC_ITERATOR,
    TYPING_TYPEVAR,
    TYPING_PROTOCOL,
    PYTEST,
    FLUMINA,
    FLUMINA_ASYNC,
    PANIC,
    PRAEFIXUM
}
