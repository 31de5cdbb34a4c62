module io.github.cyfko.reverhttp.core {
    requires java.logging;
    requires com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;

    exports io.github.cyfko.reverhttp.core;
    exports io.github.cyfko.reverhttp.core.api;
    exports io.github.cyfko.reverhttp.core.ast;
    exports io.github.cyfko.reverhttp.core.config;
    exports io.github.cyfko.reverhttp.core.exception;
    exports io.github.cyfko.reverhttp.core.generation;
    exports io.github.cyfko.reverhttp.core.ir;
    exports io.github.cyfko.reverhttp.core.lexer;
    exports io.github.cyfko.reverhttp.core.parsing;
    exports io.github.cyfko.reverhttp.core.serialization;

    opens io.github.cyfko.reverhttp.core.ir to com.fasterxml.jackson.databind;
}
